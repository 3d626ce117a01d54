package org.muma.xredis.command;

import io.netty.util.concurrent.Future;
import org.muma.xredis.command.impl.key.DelCommand;
import org.muma.xredis.command.impl.key.ExistsCommand;
import org.muma.xredis.command.impl.list.LPushCommand;
import org.muma.xredis.command.impl.list.RPushCommand;
import org.muma.xredis.command.impl.server.EchoCommand;
import org.muma.xredis.command.impl.server.PingCommand;
import org.muma.xredis.command.impl.server.SaveCommand;
import org.muma.xredis.command.impl.string.DecrCommand;
import org.muma.xredis.command.impl.string.GetCommand;
import org.muma.xredis.command.impl.string.IncrCommand;
import org.muma.xredis.command.impl.string.SetCommand;
import org.muma.xredis.common.RedisError;
import org.muma.xredis.protocol.BulkString;
import org.muma.xredis.protocol.RedisArray;
import org.muma.xredis.protocol.RedisMessage;
import org.muma.xredis.protocol.RespCodec;
import org.muma.xredis.protocol.RespProtocolException;
import org.muma.xredis.server.KeyspaceEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 请求分发器：解码 -> 校验 -> 按命令名路由到 {@link RedisCommand}
 * <p>
 * 可以被任意多个 I/O 线程并发调用，自身没有可变状态；键空间的读写全部由 KeyspaceEngine 串行执行。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final Map<String, RedisCommand> commandMap = new HashMap<>();
    private final KeyspaceEngine engine;

    public CommandDispatcher(KeyspaceEngine engine) {
        this.engine = engine;
        this.initCommandRegistry();
    }

    /**
     * 初始化命令注册表，按数据结构分类注册
     */
    private void initCommandRegistry() {
        registerServerCommands();
        registerStringCommands();
        registerKeyCommands();
        registerListCommands();

        log.info("CommandDispatcher initialized. Total commands registered: {}", commandMap.size());
    }

    private void registerServerCommands() {
        commandMap.put("PING", new PingCommand());
        commandMap.put("ECHO", new EchoCommand());
        commandMap.put("SAVE", new SaveCommand());
    }

    private void registerStringCommands() {
        commandMap.put("GET", new GetCommand());
        commandMap.put("SET", new SetCommand());
        commandMap.put("INCR", new IncrCommand());
        commandMap.put("DECR", new DecrCommand());
    }

    private void registerKeyCommands() {
        commandMap.put("DEL", new DelCommand());
        commandMap.put("EXISTS", new ExistsCommand());
    }

    private void registerListCommands() {
        commandMap.put("LPUSH", new LPushCommand());
        commandMap.put("RPUSH", new RPushCommand());
    }

    /**
     * 同步形式：一个完整请求帧进，一个完整回复帧出。会阻塞到引擎执行完，不能在核心线程上调用。
     */
    public byte[] handleRequest(byte[] request) {
        Future<RedisMessage> reply = dispatch(request).awaitUninterruptibly();
        return RespCodec.encode(reply.getNow());
    }

    /**
     * 异步形式，Netty 的 I/O 线程用这个，不阻塞
     */
    public Future<RedisMessage> dispatch(byte[] request) {
        RespCodec.Decoded decoded;
        try {
            decoded = RespCodec.decode(request);
        } catch (RespProtocolException e) {
            log.warn("Failed to deserialize request ({}): {}", e.getReason(), e.getMessage());
            return engine.completed(RedisError.FAILED_DESERIALIZATION.toMessage());
        }
        // 一次只处理一个帧，不支持管道化
        if (decoded.bytesConsumed() < request.length) {
            log.warn("Ignoring {} trailing bytes after the first frame ({} bytes)",
                    request.length - decoded.bytesConsumed(), decoded.bytesConsumed());
        }
        return dispatch(decoded.message());
    }

    public Future<RedisMessage> dispatch(RedisMessage frame) {
        if (!isValidRequest(frame)) {
            log.debug("Rejected request with unexpected shape: {}", frame);
            return engine.completed(RedisError.UNEXPECTED_ARGUMENT_TYPE.toMessage());
        }

        RedisArray args = (RedisArray) frame;
        String commandName = ((BulkString) args.get(0)).asString().toUpperCase(Locale.ROOT);
        RedisCommand command = commandMap.get(commandName);
        if (command == null) {
            log.debug("Command not found: {}", commandName);
            return engine.completed(RedisError.INVALID_COMMAND.toMessage());
        }

        log.debug("Dispatch command: {} argc={}", commandName, args.size() - 1);
        try {
            return command.execute(engine, args);
        } catch (RuntimeException e) {
            log.error("Internal error dispatching command: {}", commandName, e);
            return engine.completed(RedisError.INTERNAL.toMessage());
        }
    }

    // 必须是非空数组，且每个元素都是字符串
    private static boolean isValidRequest(RedisMessage frame) {
        if (!(frame instanceof RedisArray array) || array.isEmpty()) {
            return false;
        }
        for (RedisMessage element : array.elements()) {
            if (!(element instanceof BulkString)) {
                return false;
            }
        }
        return true;
    }
}
