package org.muma.xredis.rdb;

import java.io.IOException;
import java.util.Optional;

/**
 * 快照的外部存储
 * 引擎只关心 "整块写入" 和 "整块读出或不存在"，存储本身的同步由实现负责。
 */
public interface PersistenceGateway {

    void save(byte[] blob) throws IOException;

    /**
     * @return 没有快照时返回 Optional.empty()，这不是错误
     */
    Optional<byte[]> load() throws IOException;
}
