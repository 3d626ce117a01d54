package org.muma.xredis.command.impl.key;

import io.netty.util.concurrent.Future;
import org.muma.xredis.command.RedisCommand;
import org.muma.xredis.protocol.RedisArray;
import org.muma.xredis.protocol.RedisMessage;
import org.muma.xredis.server.KeyspaceEngine;

public class DelCommand implements RedisCommand {

    @Override
    public Future<RedisMessage> execute(KeyspaceEngine engine, RedisArray args) {
        // 格式: DEL key，一次只删一个
        if (args.size() != 2) return errorArgs(engine);
        return engine.delete(key(args));
    }
}
