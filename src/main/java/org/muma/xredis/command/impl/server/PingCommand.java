package org.muma.xredis.command.impl.server;

import io.netty.util.concurrent.Future;
import org.muma.xredis.command.RedisCommand;
import org.muma.xredis.protocol.BulkString;
import org.muma.xredis.protocol.RedisArray;
import org.muma.xredis.protocol.RedisMessage;
import org.muma.xredis.server.KeyspaceEngine;

public class PingCommand implements RedisCommand {

    private static final BulkString PONG = new BulkString("PONG");

    @Override
    public Future<RedisMessage> execute(KeyspaceEngine engine, RedisArray args) {
        if (args.size() != 1) return errorArgs(engine);
        return engine.completed(PONG);
    }
}
