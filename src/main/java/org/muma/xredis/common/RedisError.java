package org.muma.xredis.common;

import org.muma.xredis.protocol.ErrorMessage;

/**
 * 返回给客户端的错误码，文本是稳定的协议约定
 */
public enum RedisError {

    FAILED_DESERIALIZATION("ERR FAILED-DESERIALIZING"),
    UNEXPECTED_ARGUMENT_TYPE("ERR UNEXPECTED-ARGUMENT-TYPE"),
    INVALID_ARGUMENTS_COUNT("ERR INVALID-ARGUMENTS-NUMBER"),
    INVALID_COMMAND("ERR INVALID-COMMAND"),
    UNRECOGNIZED_TIMEOUT_MODE("ERR UNRECOGNIZED-TIMEOUT-MODE"),
    INVALID_TIMEOUT_VALUE("ERR INVALID-TIMEOUT-VALUE"),
    NOT_NUMERIC_OR_OVERFLOW("ERR VALUE-NOT-NUMERIC-OR-MAX-REACHED"),
    NOT_A_LIST("ERR VALUE-NOT-A-LIST"),
    PERSISTENCE_FAILED("ERR PERSISTENCE-FAILED"),
    INTERNAL("ERR INTERNAL-ERROR");

    private final ErrorMessage message;

    RedisError(String text) {
        this.message = new ErrorMessage(text);
    }

    public ErrorMessage toMessage() {
        return message;
    }
}
