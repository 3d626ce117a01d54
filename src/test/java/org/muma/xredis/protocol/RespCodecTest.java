package org.muma.xredis.protocol;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RespCodecTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String encode(RedisMessage msg) {
        return new String(RespCodec.encode(msg), StandardCharsets.UTF_8);
    }

    private static RespProtocolException.Reason failure(String frame) {
        RespProtocolException e = assertThrows(RespProtocolException.class, () -> RespCodec.decode(bytes(frame)));
        return e.getReason();
    }

    @Test
    void testEncodeScalars() {
        assertEquals("$3\r\nbli\r\n", encode(new BulkString("bli")));
        assertEquals("$0\r\n\r\n", encode(new BulkString("")));
        assertEquals(":-42\r\n", encode(new RedisInteger(-42)));
        assertEquals("-ERR INVALID-COMMAND\r\n", encode(new ErrorMessage("ERR INVALID-COMMAND")));
        assertEquals("$-1\r\n", encode(NilMessage.INSTANCE));
    }

    @Test
    void testEncodeNestedArray() {
        RedisArray array = RedisArray.of(new BulkString("a"), new RedisInteger(1),
                RedisArray.of(NilMessage.INSTANCE), RedisArray.EMPTY);
        assertEquals("*4\r\n$1\r\na\r\n:1\r\n*1\r\n$-1\r\n*0\r\n", encode(array));
    }

    @Test
    void testEncodeUsesByteLengthNotCharLength() {
        // "é" 是两个 UTF-8 字节
        assertEquals("$2\r\né\r\n", encode(new BulkString("é")));
    }

    @Test
    void testDecodeSimpleStringBecomesBulkString() {
        RespCodec.Decoded decoded = RespCodec.decode(bytes("+OK\r\n"));
        assertEquals(new BulkString("OK"), decoded.message());
        assertEquals(5, decoded.bytesConsumed());
    }

    @Test
    void testDecodeErrorAndInteger() {
        RespCodec.Decoded error = RespCodec.decode(bytes("-ERR boom\r\n"));
        assertEquals(new ErrorMessage("ERR boom"), error.message());
        assertEquals(11, error.bytesConsumed());

        RespCodec.Decoded integer = RespCodec.decode(bytes(":-9223372036854775808\r\n"));
        assertEquals(new RedisInteger(Long.MIN_VALUE), integer.message());
        assertEquals(23, integer.bytesConsumed());
    }

    @Test
    void testDecodeBulkStringByteCount() {
        RespCodec.Decoded decoded = RespCodec.decode(bytes("$3\r\nfoo\r\n"));
        assertEquals(new BulkString("foo"), decoded.message());
        // header(4) + payload(3) + CRLF(2)
        assertEquals(9, decoded.bytesConsumed());
    }

    @Test
    void testDecodeBinarySafeBulkString() {
        byte[] frame = {'$', '3', '\r', '\n', 0, '\r', '\n', '\r', '\n'};
        RespCodec.Decoded decoded = RespCodec.decode(frame);
        assertArrayEquals(new byte[]{0, '\r', '\n'}, ((BulkString) decoded.message()).content());
        assertEquals(9, decoded.bytesConsumed());
    }

    @Test
    void testDecodeNil() {
        assertEquals(NilMessage.INSTANCE, RespCodec.decode(bytes("$-1\r\n")).message());
        assertEquals(NilMessage.INSTANCE, RespCodec.decode(bytes("*-1\r\n")).message());
        assertEquals(5, RespCodec.decode(bytes("*-1\r\n")).bytesConsumed());
    }

    @Test
    void testDecodeCommandArray() {
        RespCodec.Decoded decoded = RespCodec.decode(bytes("*3\r\n$3\r\nSET\r\n$3\r\nbla\r\n$3\r\nbli\r\n"));
        assertEquals(RedisArray.ofStrings("SET", "bla", "bli"), decoded.message());
        assertEquals(31, decoded.bytesConsumed());
    }

    @Test
    void testDecodeWithOffsetReadsSequentialFrames() {
        byte[] data = bytes(":1\r\n$2\r\nhi\r\n");
        RespCodec.Decoded first = RespCodec.decode(data);
        RespCodec.Decoded second = RespCodec.decode(data, first.bytesConsumed());

        assertEquals(new RedisInteger(1), first.message());
        assertEquals(new BulkString("hi"), second.message());
        assertEquals(data.length, first.bytesConsumed() + second.bytesConsumed());
    }

    @Test
    void testEncodedValueDecodesToItself() {
        RedisArray value = RedisArray.of(new BulkString("x"), new RedisInteger(7), new ErrorMessage("ERR e"),
                NilMessage.INSTANCE, RedisArray.ofStrings("a", "b"));
        byte[] encoded = RespCodec.encode(value);

        RespCodec.Decoded decoded = RespCodec.decode(encoded);
        assertEquals(value, decoded.message());
        assertEquals(encoded.length, decoded.bytesConsumed());
    }

    @Test
    void testUnknownTypeByte() {
        assertEquals(RespProtocolException.Reason.UNRECOGNIZED_TYPE, failure("xxxx"));
        assertEquals(RespProtocolException.Reason.UNRECOGNIZED_TYPE, failure("*1\r\n?oops\r\n"));
    }

    @Test
    void testMalformedFrames() {
        assertEquals(RespProtocolException.Reason.MALFORMED_FRAME, failure(""));
        assertEquals(RespProtocolException.Reason.MALFORMED_FRAME, failure("+OK"));
        assertEquals(RespProtocolException.Reason.MALFORMED_FRAME, failure(":abc\r\n"));
        assertEquals(RespProtocolException.Reason.MALFORMED_FRAME, failure("$x\r\nfoo\r\n"));
        assertEquals(RespProtocolException.Reason.MALFORMED_FRAME, failure("$-2\r\n"));
        // 截断
        assertEquals(RespProtocolException.Reason.MALFORMED_FRAME, failure("$5\r\nab\r\n"));
        // 缺少结尾 CRLF
        assertEquals(RespProtocolException.Reason.MALFORMED_FRAME, failure("$2\r\nabXY"));
        // 元素不够
        assertEquals(RespProtocolException.Reason.MALFORMED_FRAME, failure("*2\r\n$1\r\na\r\n"));
        assertEquals(RespProtocolException.Reason.MALFORMED_FRAME, failure("*-5\r\n"));
    }

    @Test
    void testHugeDeclaredArrayDoesNotAllocate() {
        assertEquals(RespProtocolException.Reason.MALFORMED_FRAME, failure("*2147483647\r\n:1\r\n"));
    }

    @Test
    void testNestingDepthIsBounded() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < RespCodec.MAX_DEPTH + 10; i++) {
            sb.append("*1\r\n");
        }
        sb.append(":1\r\n");
        assertEquals(RespProtocolException.Reason.MALFORMED_FRAME, failure(sb.toString()));
    }
}
