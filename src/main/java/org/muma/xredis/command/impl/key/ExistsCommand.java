package org.muma.xredis.command.impl.key;

import io.netty.util.concurrent.Future;
import org.muma.xredis.command.RedisCommand;
import org.muma.xredis.protocol.RedisArray;
import org.muma.xredis.protocol.RedisMessage;
import org.muma.xredis.server.KeyspaceEngine;

public class ExistsCommand implements RedisCommand {

    @Override
    public Future<RedisMessage> execute(KeyspaceEngine engine, RedisArray args) {
        if (args.size() != 2) return errorArgs(engine);
        return engine.exists(key(args));
    }
}
