package org.muma.xredis.command.impl.string;

import io.netty.util.concurrent.Future;
import org.muma.xredis.command.RedisCommand;
import org.muma.xredis.protocol.RedisArray;
import org.muma.xredis.protocol.RedisMessage;
import org.muma.xredis.server.KeyspaceEngine;

/**
 * INCR key
 * <p>
 * 不存在的 key 当作 0。回复新值的十进制字符串 (bulk)，不是整数类型。
 */
public class IncrCommand implements RedisCommand {

    @Override
    public Future<RedisMessage> execute(KeyspaceEngine engine, RedisArray args) {
        if (args.size() != 2) return errorArgs(engine);
        return engine.increment(key(args));
    }
}
