package org.muma.xredis.command.impl.server;

import io.netty.util.concurrent.Future;
import org.muma.xredis.command.RedisCommand;
import org.muma.xredis.protocol.RedisArray;
import org.muma.xredis.protocol.RedisMessage;
import org.muma.xredis.server.KeyspaceEngine;

/**
 * SAVE
 * <p>
 * 同步快照：在核心线程上序列化整个键空间并写盘，期间其他命令排队等待。
 */
public class SaveCommand implements RedisCommand {

    @Override
    public Future<RedisMessage> execute(KeyspaceEngine engine, RedisArray args) {
        if (args.size() != 1) return errorArgs(engine);
        return engine.save();
    }
}
