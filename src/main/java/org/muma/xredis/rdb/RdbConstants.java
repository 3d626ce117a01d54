package org.muma.xredis.rdb;

import java.nio.charset.StandardCharsets;

public class RdbConstants {

    // Header: XREDIS0001
    public static final byte[] MAGIC = "XREDIS".getBytes(StandardCharsets.US_ASCII);
    public static final byte[] VERSION = "0001".getBytes(StandardCharsets.US_ASCII);

    // --- OpCodes (操作码) ---

    // 标识过期时间 (毫秒, 8 bytes)，紧跟在它后面的那条记录生效
    public static final int OP_EXPIRETIME_MS = 0xFC; // 252

    // 标识快照结束，之后是 8 字节 CRC32 校验和
    public static final int OP_EOF = 0xFF; // 255

    public static final int CHECKSUM_LENGTH = 8;

    private RdbConstants() {
    }
}
