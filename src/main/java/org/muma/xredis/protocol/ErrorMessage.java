package org.muma.xredis.protocol;

// 错误 (-)，内容不能包含 CRLF
public record ErrorMessage(String content) implements RedisMessage {

    public ErrorMessage {
        if (content == null) {
            content = "";
        }
    }
}
