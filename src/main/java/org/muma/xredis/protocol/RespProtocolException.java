package org.muma.xredis.protocol;

/**
 * 帧解析失败
 */
public class RespProtocolException extends IllegalStateException {

    public enum Reason {
        // 缺少 CRLF、长度/数字无法解析、数据被截断
        MALFORMED_FRAME,
        // 首字节不是 + - : $ *
        UNRECOGNIZED_TYPE
    }

    private final Reason reason;

    public RespProtocolException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
