package org.muma.xredis.protocol;

// 空值，编码为 $-1\r\n
public record NilMessage() implements RedisMessage {

    public static final NilMessage INSTANCE = new NilMessage();
}
