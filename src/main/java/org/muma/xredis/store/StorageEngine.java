package org.muma.xredis.store;

import org.muma.xredis.common.RedisData;

import java.util.Map;

/**
 * 键空间存储
 * <p>
 * 实现不是线程安全的：只允许 RedisCoreExecutor 线程访问。
 * 所有读路径都先做惰性过期检查，过期的记录立即删除，不会被返回。
 */
public interface StorageEngine {

    // 过期或不存在时返回 null
    RedisData get(String key);

    void put(String key, RedisData data);

    // 返回删除前是否存在一条未过期的记录
    boolean remove(String key);

    /**
     * 按版本删除：只有当前记录的版本等于 version 时才删除
     */
    boolean removeIfVersion(String key, long version);

    /**
     * 未过期记录的快照视图 (SAVE 用)，遍历过程中顺带清理过期记录
     */
    Map<String, RedisData> liveEntries();

    // 整体替换 (LOAD 用)
    void replaceAll(Map<String, RedisData> entries);

    int size();
}
