package org.muma.xredis.rdb;

import org.muma.xredis.common.RedisData;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.LongSupplier;
import java.util.zip.CRC32;

/**
 * 整个键空间 <-> 快照字节
 * <p>
 * 格式:
 * <pre>
 * "XREDIS" "0001"
 * { [0xFC expireAt(8)] type key value }*
 * 0xFF
 * crc32(8, 覆盖前面所有字节)
 * </pre>
 * 过期时间存的是绝对时间戳，加载后剩余 TTL 自然变短。
 */
public class RdbSnapshotCodec {

    private static final int HEADER_LENGTH = RdbConstants.MAGIC.length + RdbConstants.VERSION.length;

    public byte[] serialize(Map<String, RedisData> entries) throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream(256);
        RdbEncoder encoder = new RdbEncoder(bos);

        // 1. Header
        encoder.writeBytes(RdbConstants.MAGIC);
        encoder.writeBytes(RdbConstants.VERSION);

        // 2. Key-Value
        for (Map.Entry<String, RedisData> entry : entries.entrySet()) {
            RedisData data = entry.getValue();
            if (data.hasExpire()) {
                encoder.writeByte(RdbConstants.OP_EXPIRETIME_MS);
                encoder.writeLong(data.getExpireAt());
            }
            // [type][key][payload]
            encoder.writeByte(encoder.typeOf(data.getValue()));
            encoder.writeString(entry.getKey());
            encoder.writePayload(data.getValue());
        }

        // 3. EOF + checksum
        encoder.writeByte(RdbConstants.OP_EOF);
        CRC32 crc = new CRC32();
        crc.update(bos.toByteArray());
        encoder.writeLong(crc.getValue());
        return bos.toByteArray();
    }

    /**
     * 反序列化为一个全新的 Map，不触碰当前键空间
     *
     * @param versions 为每条记录分配版本号
     * @throws IOException 魔数/版本不符、截断、未知操作码或校验和不一致
     */
    public Map<String, RedisData> deserialize(byte[] blob, LongSupplier versions) throws IOException {
        if (blob.length < HEADER_LENGTH + 1 + RdbConstants.CHECKSUM_LENGTH) {
            throw new IOException("Snapshot too short: " + blob.length + " bytes");
        }
        verifyChecksum(blob);

        int bodyLength = blob.length - RdbConstants.CHECKSUM_LENGTH;
        RdbDecoder decoder = new RdbDecoder(new ByteArrayInputStream(blob, 0, bodyLength));

        // 1. Check Magic + Version
        byte[] magic = decoder.readBytes(RdbConstants.MAGIC.length);
        if (!Arrays.equals(magic, RdbConstants.MAGIC)) {
            throw new IOException("Invalid snapshot: bad magic");
        }
        byte[] version = decoder.readBytes(RdbConstants.VERSION.length);
        if (!Arrays.equals(version, RdbConstants.VERSION)) {
            throw new IOException("Unsupported snapshot version: " + new String(version, StandardCharsets.US_ASCII));
        }

        // 2. Loop Opcodes
        Map<String, RedisData> entries = new LinkedHashMap<>();
        long expireAt = RedisData.NO_EXPIRE;
        while (true) {
            int type = decoder.readByte();

            if (type == RdbConstants.OP_EOF) {
                break;
            }
            if (type == RdbConstants.OP_EXPIRETIME_MS) {
                if (expireAt != RedisData.NO_EXPIRE) {
                    throw new IOException("Two expire opcodes in a row");
                }
                expireAt = decoder.readLong();
                continue;
            }

            String key = decoder.readStringUtf8();
            entries.put(key, new RedisData(decoder.readValue(type), expireAt, versions.getAsLong()));
            expireAt = RedisData.NO_EXPIRE;
        }
        if (expireAt != RedisData.NO_EXPIRE) {
            throw new IOException("Dangling expire opcode before EOF");
        }
        if (decoder.remaining() != 0) {
            throw new IOException("Trailing bytes after EOF");
        }
        return entries;
    }

    private void verifyChecksum(byte[] blob) throws IOException {
        int bodyLength = blob.length - RdbConstants.CHECKSUM_LENGTH;
        long expected = ByteBuffer.wrap(blob, bodyLength, RdbConstants.CHECKSUM_LENGTH).getLong();
        CRC32 crc = new CRC32();
        crc.update(blob, 0, bodyLength);
        if (crc.getValue() != expected) {
            throw new IOException("Snapshot checksum mismatch");
        }
    }
}
