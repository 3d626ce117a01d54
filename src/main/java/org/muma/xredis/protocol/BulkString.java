package org.muma.xredis.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

// 字符串 ($)，二进制安全。Nil 由 NilMessage 表示，这里的 content 永远非 null
public record BulkString(byte[] content) implements RedisMessage {

    public BulkString {
        if (content == null) {
            throw new IllegalArgumentException("BulkString content must not be null, use NilMessage");
        }
        content = content.clone();
    }

    public BulkString(String s) {
        this(RedisMessage.toBytes(s));
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public int length() {
        return content.length;
    }

    public String asString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    // record 对数组默认按引用比较，这里改为按内容比较
    @Override
    public boolean equals(Object o) {
        return o instanceof BulkString other && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "BulkString[" + asString() + "]";
    }
}
