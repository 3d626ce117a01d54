package org.muma.xredis.common;

import lombok.Getter;
import lombok.ToString;
import org.muma.xredis.protocol.RedisMessage;

/**
 * 键空间中的一条记录：值 + 过期时间 + 版本号
 * <p>
 * 不可变。写操作总是生成新的 RedisData 替换旧记录。
 * version 由引擎在 SET / 加载快照时分配，INCR、LPUSH 等改写值时沿用原版本，
 * 主动过期定时器凭它判断记录是否已被重新 SET。
 */
@Getter
@ToString
public class RedisData {

    public static final long NO_EXPIRE = -1;

    private final RedisMessage value;

    // 过期时间戳 (毫秒, -1 表示不过期)
    private final long expireAt;

    private final long version;

    public RedisData(RedisMessage value, long expireAt, long version) {
        this.value = value;
        this.expireAt = expireAt;
        this.version = version;
    }

    public boolean hasExpire() {
        return expireAt != NO_EXPIRE;
    }

    public boolean isExpired(long nowMillis) {
        return expireAt != NO_EXPIRE && nowMillis >= expireAt;
    }

    // 换值，保留过期时间和版本
    public RedisData withValue(RedisMessage newValue) {
        return new RedisData(newValue, expireAt, version);
    }
}
