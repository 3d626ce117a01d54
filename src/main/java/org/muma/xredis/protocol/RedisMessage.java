package org.muma.xredis.protocol;

import java.nio.charset.StandardCharsets;

/**
 * 协议值 (同时也是存储值)
 * 封闭的五种变体，编码、快照、分发处都按变体穷举处理。
 */
public sealed interface RedisMessage permits
        BulkString, RedisInteger, ErrorMessage, RedisArray, NilMessage {

    // 辅助方法：将字符串转为字节数组
    static byte[] toBytes(String content) {
        return content == null ? new byte[0] : content.getBytes(StandardCharsets.UTF_8);
    }
}
