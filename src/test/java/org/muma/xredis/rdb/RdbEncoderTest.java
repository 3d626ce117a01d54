package org.muma.xredis.rdb;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.xredis.protocol.BulkString;
import org.muma.xredis.protocol.NilMessage;
import org.muma.xredis.protocol.RedisArray;
import org.muma.xredis.protocol.RedisInteger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RdbEncoderTest {

    private ByteArrayOutputStream bos;
    private RdbEncoder encoder;

    @BeforeEach
    void setUp() {
        bos = new ByteArrayOutputStream();
        encoder = new RdbEncoder(bos);
    }

    @Test
    void testWriteLength() throws IOException {
        // Case 1: < 64 (0x05)
        encoder.writeLength(5);
        assertArrayEquals(new byte[]{0x05}, bos.toByteArray());
        bos.reset();

        // Case 2: > 64 (100) -> 01xxxxxx (0x40 | 0) (100) -> 0x40 0x64
        encoder.writeLength(100);
        assertArrayEquals(new byte[]{0x40, 0x64}, bos.toByteArray());
        bos.reset();

        // Case 3: > 16384 (20000) -> 0x80 + int(20000)
        encoder.writeLength(20000);
        // 20000 = 0x00004E20 (Big Endian: 00 00 4E 20)
        assertArrayEquals(new byte[]{(byte) 0x80, 0, 0, 0x4E, 0x20}, bos.toByteArray());
    }

    @Test
    void testWriteLengthOutOfRange() {
        assertThrows(IOException.class, () -> encoder.writeLength(-1));
        assertThrows(IOException.class, () -> encoder.writeLength(0x1_0000_0000L));
    }

    @Test
    void testWriteString() throws IOException {
        encoder.writeString("foo");
        // len=3 (0x03), 'f', 'o', 'o'
        assertArrayEquals(new byte[]{0x03, 'f', 'o', 'o'}, bos.toByteArray());
    }

    @Test
    void testWriteInteger() throws IOException {
        encoder.writeValue(new RedisInteger(258));
        // [Type=1] + 8 字节 Big Endian
        assertArrayEquals(new byte[]{RdbType.INTEGER, 0, 0, 0, 0, 0, 0, 0x01, 0x02}, bos.toByteArray());
    }

    @Test
    void testWriteList() throws IOException {
        encoder.writeValue(RedisArray.of(new BulkString("a"), NilMessage.INSTANCE));

        // Expected:
        // [Type=3] [Len=2]
        // [Type=0] [Len=1] 'a'
        // [Type=4]
        assertArrayEquals(new byte[]{RdbType.ARRAY, 0x02, RdbType.STRING, 0x01, 'a', RdbType.NIL}, bos.toByteArray());
    }
}
