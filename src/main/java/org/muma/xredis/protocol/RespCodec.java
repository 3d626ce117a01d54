package org.muma.xredis.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.muma.xredis.protocol.RespProtocolException.Reason.MALFORMED_FRAME;
import static org.muma.xredis.protocol.RespProtocolException.Reason.UNRECOGNIZED_TYPE;

/**
 * RESP 协议编解码
 * 纯函数、无状态，直接作用于完整的 byte[] 请求 (不做流式/半包解析)。
 */
public final class RespCodec {

    // RESP 协议常量
    private static final byte PLUS_BYTE = '+';
    private static final byte MINUS_BYTE = '-';
    private static final byte COLON_BYTE = ':';
    private static final byte DOLLAR_BYTE = '$';
    private static final byte ASTERISK_BYTE = '*';

    // 回车换行
    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final byte[] CRLF = {CR, LF};
    private static final byte[] NIL = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    static final int MAX_DEPTH = 512;

    /**
     * 解码结果：值 + 消耗的字节数
     */
    public record Decoded(RedisMessage message, int bytesConsumed) {
    }

    private RespCodec() {
    }

    // ---------------- Encode ----------------

    public static byte[] encode(RedisMessage msg) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream(64);
        write(bos, msg);
        return bos.toByteArray();
    }

    // 递归写入
    private static void write(ByteArrayOutputStream out, RedisMessage msg) {
        if (msg instanceof BulkString b) {
            out.write(DOLLAR_BYTE);
            writeAscii(out, String.valueOf(b.length()));
            out.writeBytes(CRLF);
            out.writeBytes(b.content());
            out.writeBytes(CRLF);
        } else if (msg instanceof RedisInteger i) {
            out.write(COLON_BYTE);
            writeAscii(out, String.valueOf(i.value()));
            out.writeBytes(CRLF);
        } else if (msg instanceof ErrorMessage e) {
            out.write(MINUS_BYTE);
            out.writeBytes(e.content().getBytes(StandardCharsets.UTF_8));
            out.writeBytes(CRLF);
        } else if (msg instanceof RedisArray a) {
            out.write(ASTERISK_BYTE);
            writeAscii(out, String.valueOf(a.size()));
            out.writeBytes(CRLF);
            for (RedisMessage element : a.elements()) {
                write(out, element);
            }
        } else if (msg instanceof NilMessage) {
            out.writeBytes(NIL);
        } else {
            // sealed 接口下不可达
            throw new IllegalArgumentException("Unsupported message: " + msg);
        }
    }

    private static void writeAscii(ByteArrayOutputStream out, String s) {
        out.writeBytes(s.getBytes(StandardCharsets.US_ASCII));
    }

    // ---------------- Decode ----------------

    public static Decoded decode(byte[] data) {
        return decode(data, 0);
    }

    /**
     * 从 offset 开始解码一个完整帧
     *
     * @throws RespProtocolException 帧不完整或格式错误
     */
    public static Decoded decode(byte[] data, int offset) {
        return readNextObject(data, offset, 0);
    }

    private static Decoded readNextObject(byte[] data, int offset, int depth) {
        if (offset >= data.length) {
            throw new RespProtocolException(MALFORMED_FRAME, "Unexpected end of frame at offset " + offset);
        }
        if (depth > MAX_DEPTH) {
            throw new RespProtocolException(MALFORMED_FRAME, "Frame nested deeper than " + MAX_DEPTH);
        }

        byte type = data[offset];
        return switch (type) {
            case PLUS_BYTE -> {
                int end = indexOfCrlf(data, offset + 1);
                yield new Decoded(new BulkString(slice(data, offset + 1, end)), end + 2 - offset);
            }
            case MINUS_BYTE -> {
                int end = indexOfCrlf(data, offset + 1);
                String text = new String(data, offset + 1, end - offset - 1, StandardCharsets.UTF_8);
                yield new Decoded(new ErrorMessage(text), end + 2 - offset);
            }
            case COLON_BYTE -> {
                int end = indexOfCrlf(data, offset + 1);
                yield new Decoded(new RedisInteger(parseLong(data, offset + 1, end)), end + 2 - offset);
            }
            case DOLLAR_BYTE -> decodeBulkString(data, offset);
            case ASTERISK_BYTE -> decodeArray(data, offset, depth);
            default -> throw new RespProtocolException(UNRECOGNIZED_TYPE,
                    "Unknown RESP type byte: 0x" + Integer.toHexString(type & 0xFF));
        };
    }

    // 解析 BulkString: $<length>\r\n<data>\r\n
    private static Decoded decodeBulkString(byte[] data, int offset) {
        int headerEnd = indexOfCrlf(data, offset + 1);
        long length = parseLong(data, offset + 1, headerEnd);
        int headerConsumed = headerEnd + 2 - offset;
        if (length == -1) {
            return new Decoded(NilMessage.INSTANCE, headerConsumed);
        }
        if (length < 0 || length > Integer.MAX_VALUE) {
            throw new RespProtocolException(MALFORMED_FRAME, "Invalid bulk string length: " + length);
        }

        int start = headerEnd + 2;
        // 用 long 计算，避免 start + length 溢出
        long trailer = (long) start + length;
        if (trailer + 2 > data.length) {
            throw new RespProtocolException(MALFORMED_FRAME, "Bulk string truncated, declared " + length + " bytes");
        }
        int end = (int) trailer;
        if (data[end] != CR || data[end + 1] != LF) {
            throw new RespProtocolException(MALFORMED_FRAME, "Expected CRLF after bulk string payload");
        }
        return new Decoded(new BulkString(slice(data, start, end)), headerConsumed + (int) length + 2);
    }

    // 解析 Array: *<count>\r\n<element1>...<elementN>
    private static Decoded decodeArray(byte[] data, int offset, int depth) {
        int headerEnd = indexOfCrlf(data, offset + 1);
        long count = parseLong(data, offset + 1, headerEnd);
        int consumed = headerEnd + 2 - offset;
        if (count == -1) {
            return new Decoded(NilMessage.INSTANCE, consumed);
        }
        if (count < 0 || count > Integer.MAX_VALUE) {
            throw new RespProtocolException(MALFORMED_FRAME, "Invalid array length: " + count);
        }

        // 每个元素至少 3 字节，按剩余长度限制初始容量，防止伪造的超大 count
        int capacity = (int) Math.min(count, (data.length - offset - consumed) / 3 + 1);
        List<RedisMessage> elements = new ArrayList<>(capacity);
        for (long i = 0; i < count; i++) {
            Decoded element = readNextObject(data, offset + consumed, depth + 1);
            elements.add(element.message());
            consumed += element.bytesConsumed();
        }
        return new Decoded(new RedisArray(elements), consumed);
    }

    // 辅助：查找 from 之后第一个 \r\n 的位置 (指向 \r)
    private static int indexOfCrlf(byte[] data, int from) {
        for (int i = from; i + 1 < data.length; i++) {
            if (data[i] == CR && data[i + 1] == LF) {
                return i;
            }
        }
        throw new RespProtocolException(MALFORMED_FRAME, "Missing CRLF terminator");
    }

    private static long parseLong(byte[] data, int from, int to) {
        String s = new String(data, from, to - from, StandardCharsets.US_ASCII);
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new RespProtocolException(MALFORMED_FRAME, "Not a number: '" + s + "'");
        }
    }

    private static byte[] slice(byte[] data, int from, int to) {
        byte[] bytes = new byte[to - from];
        System.arraycopy(data, from, bytes, 0, bytes.length);
        return bytes;
    }
}
