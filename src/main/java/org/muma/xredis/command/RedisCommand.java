package org.muma.xredis.command;

import io.netty.util.concurrent.Future;
import org.muma.xredis.common.RedisError;
import org.muma.xredis.protocol.BulkString;
import org.muma.xredis.protocol.RedisArray;
import org.muma.xredis.protocol.RedisMessage;
import org.muma.xredis.server.KeyspaceEngine;

/**
 * 单个命令的处理器
 * <p>
 * 分发器已保证 args 是非空的 BulkString 数组，args[0] 是命令名。
 * 实现只负责校验参数并把请求投递给引擎，不直接访问键空间。
 */
public interface RedisCommand {

    Future<RedisMessage> execute(KeyspaceEngine engine, RedisArray args);

    /**
     * 辅助工具：参数个数错误
     */
    default Future<RedisMessage> errorArgs(KeyspaceEngine engine) {
        return engine.completed(RedisError.INVALID_ARGUMENTS_COUNT.toMessage());
    }

    default BulkString arg(RedisArray args, int index) {
        return (BulkString) args.get(index);
    }

    default String key(RedisArray args) {
        return arg(args, 1).asString();
    }
}
