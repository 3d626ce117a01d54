package org.muma.xredis.store.impl;

import org.muma.xredis.common.RedisData;
import org.muma.xredis.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

public class MemoryStorageEngine implements StorageEngine {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorageEngine.class);

    // 单线程独占，不需要 ConcurrentHashMap
    private final Map<String, RedisData> memoryDb = new HashMap<>();

    private final Clock clock;

    public MemoryStorageEngine() {
        this(Clock.systemUTC());
    }

    public MemoryStorageEngine(Clock clock) {
        this.clock = clock;
    }

    @Override
    public RedisData get(String key) {
        RedisData data = memoryDb.get(key);
        if (data == null) return null;

        // 惰性删除 (Lazy Expiration)
        if (data.isExpired(clock.millis())) {
            memoryDb.remove(key);
            log.debug("Lazy expired key: {}", key);
            return null;
        }
        return data;
    }

    @Override
    public void put(String key, RedisData data) {
        memoryDb.put(key, data);
    }

    @Override
    public boolean remove(String key) {
        RedisData data = memoryDb.remove(key);
        return data != null && !data.isExpired(clock.millis());
    }

    @Override
    public boolean removeIfVersion(String key, long version) {
        RedisData data = memoryDb.get(key);
        if (data == null || data.getVersion() != version) {
            return false;
        }
        memoryDb.remove(key);
        return true;
    }

    @Override
    public Map<String, RedisData> liveEntries() {
        long now = clock.millis();
        Map<String, RedisData> live = new LinkedHashMap<>(memoryDb.size());
        Iterator<Map.Entry<String, RedisData>> iterator = memoryDb.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, RedisData> entry = iterator.next();
            if (entry.getValue().isExpired(now)) {
                iterator.remove();
            } else {
                live.put(entry.getKey(), entry.getValue());
            }
        }
        return Collections.unmodifiableMap(live);
    }

    @Override
    public void replaceAll(Map<String, RedisData> entries) {
        memoryDb.clear();
        memoryDb.putAll(entries);
    }

    @Override
    public int size() {
        return memoryDb.size();
    }
}
