package org.muma.xredis.command.impl.string;

import io.netty.util.concurrent.Future;
import org.muma.xredis.command.RedisCommand;
import org.muma.xredis.common.RedisData;
import org.muma.xredis.common.RedisError;
import org.muma.xredis.protocol.RedisArray;
import org.muma.xredis.protocol.RedisMessage;
import org.muma.xredis.server.KeyspaceEngine;

import java.util.Locale;

/**
 * SET key value [EX seconds | PX milliseconds | EXAT unix-seconds | PXAT unix-milliseconds]
 * <p>
 * 过期参数在投递给引擎之前就换算成绝对毫秒时间戳。
 * 非正数的 TTL 照常写入，只是立即过期。
 */
public class SetCommand implements RedisCommand {

    enum ExpirationMode {
        EX, PX, EXAT, PXAT;

        static ExpirationMode parse(String mode) {
            try {
                return valueOf(mode.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return null;
            }
        }

        /**
         * @throws ArithmeticException 换算成毫秒时间戳时溢出
         */
        long toExpireAt(long amount, long nowMillis) {
            return switch (this) {
                case EX -> Math.addExact(nowMillis, Math.multiplyExact(amount, 1000L));
                case PX -> Math.addExact(nowMillis, amount);
                case EXAT -> Math.multiplyExact(amount, 1000L);
                case PXAT -> amount;
            };
        }
    }

    @Override
    public Future<RedisMessage> execute(KeyspaceEngine engine, RedisArray args) {
        int argc = args.size() - 1;
        if (argc != 2 && argc != 4) return errorArgs(engine);

        long expireAt = RedisData.NO_EXPIRE;
        if (argc == 4) {
            ExpirationMode mode = ExpirationMode.parse(arg(args, 3).asString());
            if (mode == null) {
                return engine.completed(RedisError.UNRECOGNIZED_TIMEOUT_MODE.toMessage());
            }
            try {
                long amount = Long.parseLong(arg(args, 4).asString());
                expireAt = mode.toExpireAt(amount, engine.currentTimeMillis());
            } catch (NumberFormatException | ArithmeticException e) {
                return engine.completed(RedisError.INVALID_TIMEOUT_VALUE.toMessage());
            }
            // 负数时间戳都已经过去了，统一成 0，避免和 NO_EXPIRE (-1) 撞上
            if (expireAt < 0) {
                expireAt = 0;
            }
        }
        return engine.set(key(args), arg(args, 2), expireAt);
    }
}
