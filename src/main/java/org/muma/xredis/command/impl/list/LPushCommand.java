package org.muma.xredis.command.impl.list;

import io.netty.util.concurrent.Future;
import org.muma.xredis.command.RedisCommand;
import org.muma.xredis.protocol.RedisArray;
import org.muma.xredis.protocol.RedisMessage;
import org.muma.xredis.server.KeyspaceEngine;

/**
 * LPUSH key element
 * <p>
 * 【时间复杂度】 O(N)
 * 列表是不可变数组，每次推入都会重建整个数组。
 */
public class LPushCommand implements RedisCommand {

    @Override
    public Future<RedisMessage> execute(KeyspaceEngine engine, RedisArray args) {
        if (args.size() != 3) return errorArgs(engine);
        return engine.lpush(key(args), arg(args, 2));
    }
}
