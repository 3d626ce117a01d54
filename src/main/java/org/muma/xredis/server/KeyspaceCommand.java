package org.muma.xredis.server;

import io.netty.util.concurrent.Promise;
import org.muma.xredis.common.RedisData;
import org.muma.xredis.protocol.RedisMessage;

/**
 * 提交给 KeyspaceEngine 的命令消息
 * 由分发器 (或过期定时器、启动加载) 创建，引擎只消费一次，并通过 reply 恰好回复一次。
 *
 * @param version DELETE 专用：NO_VERSION 表示无条件删除，否则只删除该版本的记录
 */
public record KeyspaceCommand(Type type,
                              String key,
                              RedisMessage value,
                              long expireAt,
                              long version,
                              Promise<RedisMessage> reply) {

    public static final long NO_VERSION = -1;

    public enum Type {
        SET, GET, EXISTS, DELETE, INCREMENT, DECREMENT, LPUSH, RPUSH, SAVE, LOAD
    }

    public static KeyspaceCommand set(String key, RedisMessage value, long expireAt, Promise<RedisMessage> reply) {
        return new KeyspaceCommand(Type.SET, key, value, expireAt, NO_VERSION, reply);
    }

    public static KeyspaceCommand keyOnly(Type type, String key, Promise<RedisMessage> reply) {
        return new KeyspaceCommand(type, key, null, RedisData.NO_EXPIRE, NO_VERSION, reply);
    }

    public static KeyspaceCommand deleteVersion(String key, long version, Promise<RedisMessage> reply) {
        return new KeyspaceCommand(Type.DELETE, key, null, RedisData.NO_EXPIRE, version, reply);
    }

    public static KeyspaceCommand push(Type type, String key, RedisMessage value, Promise<RedisMessage> reply) {
        return new KeyspaceCommand(type, key, value, RedisData.NO_EXPIRE, NO_VERSION, reply);
    }

    public static KeyspaceCommand noKey(Type type, Promise<RedisMessage> reply) {
        return new KeyspaceCommand(type, null, null, RedisData.NO_EXPIRE, NO_VERSION, reply);
    }
}
