package org.muma.xredis.rdb;

import org.muma.xredis.protocol.BulkString;
import org.muma.xredis.protocol.ErrorMessage;
import org.muma.xredis.protocol.NilMessage;
import org.muma.xredis.protocol.RedisArray;
import org.muma.xredis.protocol.RedisInteger;
import org.muma.xredis.protocol.RedisMessage;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 快照反序列化器
 * 只从内存中的完整快照读取，所以可以用 available() 校验声明的长度，截断的数据不会触发超大分配。
 */
public class RdbDecoder {

    private static final int MAX_DEPTH = 512;

    private final DataInputStream in;

    public RdbDecoder(ByteArrayInputStream in) {
        // 使用 DataInputStream 方便读取 byte, int, long
        this.in = new DataInputStream(in);
    }

    /**
     * 读取一个字节 (0-255)
     */
    public int readByte() throws IOException {
        return in.readUnsignedByte();
    }

    public byte[] readBytes(int len) throws IOException {
        if (len > in.available()) {
            throw new EOFException("Snapshot truncated: need " + len + " bytes, " + in.available() + " left");
        }
        byte[] bytes = new byte[len];
        in.readFully(bytes);
        return bytes;
    }

    /**
     * 读取 RDB 长度编码
     */
    public long readLength() throws IOException {
        int b = in.readUnsignedByte();
        // 取高 2 位
        int type = (b & 0xC0) >> 6;

        if (type == 0) {
            return b & 0x3F;
        } else if (type == 1) {
            int next = in.readUnsignedByte();
            return ((b & 0x3F) << 8) | next;
        } else if (type == 2) {
            return in.readInt() & 0xFFFFFFFFL; // 转为无符号 long
        } else {
            throw new IOException("Unsupported length encoding type: " + type);
        }
    }

    public byte[] readString() throws IOException {
        long len = readLength();
        if (len > Integer.MAX_VALUE) {
            throw new IOException("String too long: " + len);
        }
        return readBytes((int) len);
    }

    public String readStringUtf8() throws IOException {
        return new String(readString(), StandardCharsets.UTF_8);
    }

    public int remaining() throws IOException {
        return in.available();
    }

    public long readLong() throws IOException {
        return in.readLong();
    }

    /**
     * 读取一个带类型标记的值
     */
    public RedisMessage readValue() throws IOException {
        return readValue(readByte(), 0);
    }

    public RedisMessage readValue(int type) throws IOException {
        return readValue(type, 0);
    }

    private RedisMessage readValue(int type, int depth) throws IOException {
        if (depth > MAX_DEPTH) {
            throw new IOException("Value nested deeper than " + MAX_DEPTH);
        }
        return switch (type) {
            case RdbType.STRING -> new BulkString(readString());
            case RdbType.INTEGER -> new RedisInteger(readLong());
            case RdbType.ERROR -> new ErrorMessage(readStringUtf8());
            case RdbType.ARRAY -> {
                long size = readLength();
                // 每个元素至少 1 字节
                if (size > in.available()) {
                    throw new EOFException("Array size " + size + " exceeds remaining snapshot");
                }
                List<RedisMessage> elements = new ArrayList<>((int) size);
                for (long i = 0; i < size; i++) {
                    elements.add(readValue(readByte(), depth + 1));
                }
                yield new RedisArray(elements);
            }
            case RdbType.NIL -> NilMessage.INSTANCE;
            default -> throw new IOException("Unknown value type: " + type);
        };
    }
}
