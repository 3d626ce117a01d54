package org.muma.xredis.rdb;

import org.muma.xredis.protocol.BulkString;
import org.muma.xredis.protocol.ErrorMessage;
import org.muma.xredis.protocol.NilMessage;
import org.muma.xredis.protocol.RedisArray;
import org.muma.xredis.protocol.RedisInteger;
import org.muma.xredis.protocol.RedisMessage;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * 快照序列化器
 * 负责将 RedisMessage 转换为 RDB 风格的字节流。
 */
public class RdbEncoder {

    private final OutputStream out;

    public RdbEncoder(OutputStream out) {
        this.out = out;
    }

    public void writeByte(int b) throws IOException {
        out.write(b);
    }

    /**
     * 写入字节数组 (原样写入，不带长度)
     */
    public void writeBytes(byte[] bytes) throws IOException {
        out.write(bytes);
    }

    /**
     * 写入 RDB 长度编码 (Length Encoding)
     * <p>
     * 规则:
     * - 00xxxxxx: len < 64 (1 byte)
     * - 01xxxxxx: len < 16384 (2 bytes)
     * - 10000000: len >= 16384 (5 bytes, 1 byte flag + 4 bytes len)
     */
    public void writeLength(long len) throws IOException {
        if (len < 0 || len > 0xFFFFFFFFL) {
            throw new IOException("Length out of range: " + len);
        }
        if (len < 64) {
            out.write((int) (len & 0xFF));
        } else if (len < 16384) {
            // 高 2 位是 01，剩下 14 位存长度
            out.write(0x40 | (int) ((len >> 8) & 0x3F));
            out.write((int) (len & 0xFF));
        } else {
            out.write(0x80);
            writeInt((int) len);
        }
    }

    /**
     * 写入 4 字节整数 (Big Endian)
     */
    private void writeInt(int v) throws IOException {
        out.write((v >>> 24) & 0xFF);
        out.write((v >>> 16) & 0xFF);
        out.write((v >>> 8) & 0xFF);
        out.write(v & 0xFF);
    }

    /**
     * 写入 8 字节长整数 (Big Endian)
     */
    public void writeLong(long v) throws IOException {
        for (int shift = 56; shift >= 0; shift -= 8) {
            out.write((int) (v >>> shift) & 0xFF);
        }
    }

    /**
     * 写入字符串对象
     * 格式: [Length][Content]
     */
    public void writeString(byte[] bytes) throws IOException {
        writeLength(bytes.length);
        writeBytes(bytes);
    }

    public void writeString(String str) throws IOException {
        writeString(str.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 写入一个值: [Type][Payload]
     */
    public void writeValue(RedisMessage value) throws IOException {
        writeByte(typeOf(value));
        writePayload(value);
    }

    public int typeOf(RedisMessage value) {
        if (value instanceof BulkString) return RdbType.STRING;
        if (value instanceof RedisInteger) return RdbType.INTEGER;
        if (value instanceof ErrorMessage) return RdbType.ERROR;
        if (value instanceof RedisArray) return RdbType.ARRAY;
        return RdbType.NIL;
    }

    /**
     * 只写值本身，不带类型标记；数组元素递归写入，每个元素自带类型标记
     */
    public void writePayload(RedisMessage value) throws IOException {
        if (value instanceof BulkString b) {
            writeString(b.content());
        } else if (value instanceof RedisInteger i) {
            writeLong(i.value());
        } else if (value instanceof ErrorMessage e) {
            writeString(e.content());
        } else if (value instanceof RedisArray a) {
            writeLength(a.size());
            for (RedisMessage element : a.elements()) {
                writeValue(element);
            }
        } else if (!(value instanceof NilMessage)) {
            throw new IOException("Unsupported value: " + value);
        }
    }
}
