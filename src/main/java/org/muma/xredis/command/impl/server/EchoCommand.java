package org.muma.xredis.command.impl.server;

import io.netty.util.concurrent.Future;
import org.muma.xredis.command.RedisCommand;
import org.muma.xredis.protocol.RedisArray;
import org.muma.xredis.protocol.RedisMessage;
import org.muma.xredis.server.KeyspaceEngine;

/**
 * ECHO message，原样返回
 */
public class EchoCommand implements RedisCommand {

    @Override
    public Future<RedisMessage> execute(KeyspaceEngine engine, RedisArray args) {
        if (args.size() != 2) return errorArgs(engine);
        return engine.completed(args.get(1));
    }
}
