package org.muma.xredis.command.impl.list;

import io.netty.util.concurrent.Future;
import org.muma.xredis.command.RedisCommand;
import org.muma.xredis.protocol.RedisArray;
import org.muma.xredis.protocol.RedisMessage;
import org.muma.xredis.server.KeyspaceEngine;

/**
 * RPUSH key element
 */
public class RPushCommand implements RedisCommand {

    @Override
    public Future<RedisMessage> execute(KeyspaceEngine engine, RedisArray args) {
        if (args.size() != 3) return errorArgs(engine);
        return engine.rpush(key(args), arg(args, 2));
    }
}
