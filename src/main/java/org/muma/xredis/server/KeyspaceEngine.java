package org.muma.xredis.server;

import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.ImmediateEventExecutor;
import io.netty.util.concurrent.Promise;
import org.muma.xredis.common.RedisData;
import org.muma.xredis.common.RedisError;
import org.muma.xredis.protocol.BulkString;
import org.muma.xredis.protocol.NilMessage;
import org.muma.xredis.protocol.RedisArray;
import org.muma.xredis.protocol.RedisInteger;
import org.muma.xredis.protocol.RedisMessage;
import org.muma.xredis.rdb.PersistenceGateway;
import org.muma.xredis.rdb.RdbSnapshotCodec;
import org.muma.xredis.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;

/**
 * 键空间引擎 (Actor)
 * <p>
 * 唯一拥有 StorageEngine 的组件。所有命令都被包装成 {@link KeyspaceCommand}
 * 投递到 {@link RedisCoreExecutor}，按到达顺序逐个执行，每个命令恰好回复一次。
 * 公共方法可以从任意线程调用，返回的 Future 在命令执行完后完成。
 */
public class KeyspaceEngine {

    private static final Logger log = LoggerFactory.getLogger(KeyspaceEngine.class);

    private static final BulkString OK = new BulkString("OK");

    private final RedisCoreExecutor coreExecutor = new RedisCoreExecutor();
    private final StorageEngine storage;
    private final PersistenceGateway gateway;
    private final RdbSnapshotCodec snapshotCodec = new RdbSnapshotCodec();
    private final ActiveExpireScheduler expireScheduler;
    private final Clock clock;
    private final long slowlogThresholdMillis;

    // 只在核心线程读写
    private long nextVersion = 1;

    public KeyspaceEngine(StorageEngine storage, PersistenceGateway gateway, Clock clock, long slowlogThresholdMillis) {
        this.storage = storage;
        this.gateway = gateway;
        this.clock = clock;
        this.slowlogThresholdMillis = slowlogThresholdMillis;
        this.expireScheduler = new ActiveExpireScheduler(clock, this::expire);
    }

    public static BulkString ok() {
        return OK;
    }

    // ---------------- 投递接口 ----------------

    /**
     * @param expireAt 绝对毫秒时间戳，{@link RedisData#NO_EXPIRE} 表示不过期
     */
    public Future<RedisMessage> set(String key, RedisMessage value, long expireAt) {
        return submit(KeyspaceCommand.set(key, value, expireAt, coreExecutor.newPromise()));
    }

    public Future<RedisMessage> get(String key) {
        return submit(KeyspaceCommand.keyOnly(KeyspaceCommand.Type.GET, key, coreExecutor.newPromise()));
    }

    public Future<RedisMessage> exists(String key) {
        return submit(KeyspaceCommand.keyOnly(KeyspaceCommand.Type.EXISTS, key, coreExecutor.newPromise()));
    }

    public Future<RedisMessage> delete(String key) {
        return submit(KeyspaceCommand.keyOnly(KeyspaceCommand.Type.DELETE, key, coreExecutor.newPromise()));
    }

    /**
     * 主动过期：只有记录的版本仍是 version 时才删除
     */
    public Future<RedisMessage> expire(String key, long version) {
        return submit(KeyspaceCommand.deleteVersion(key, version, coreExecutor.newPromise()));
    }

    public Future<RedisMessage> increment(String key) {
        return submit(KeyspaceCommand.keyOnly(KeyspaceCommand.Type.INCREMENT, key, coreExecutor.newPromise()));
    }

    public Future<RedisMessage> decrement(String key) {
        return submit(KeyspaceCommand.keyOnly(KeyspaceCommand.Type.DECREMENT, key, coreExecutor.newPromise()));
    }

    public Future<RedisMessage> lpush(String key, RedisMessage value) {
        return submit(KeyspaceCommand.push(KeyspaceCommand.Type.LPUSH, key, value, coreExecutor.newPromise()));
    }

    public Future<RedisMessage> rpush(String key, RedisMessage value) {
        return submit(KeyspaceCommand.push(KeyspaceCommand.Type.RPUSH, key, value, coreExecutor.newPromise()));
    }

    public Future<RedisMessage> save() {
        return submit(KeyspaceCommand.noKey(KeyspaceCommand.Type.SAVE, coreExecutor.newPromise()));
    }

    public Future<RedisMessage> load() {
        return submit(KeyspaceCommand.noKey(KeyspaceCommand.Type.LOAD, coreExecutor.newPromise()));
    }

    /**
     * 不需要访问键空间的回复 (PING、ECHO、参数错误) 也排进核心线程的队列，
     * 保证同一连接上的回复顺序和请求顺序一致
     */
    public Future<RedisMessage> completed(RedisMessage message) {
        Promise<RedisMessage> reply = coreExecutor.newPromise();
        try {
            coreExecutor.execute(() -> reply.setSuccess(message));
            return reply;
        } catch (RejectedExecutionException e) {
            return rejected("reply");
        }
    }

    public long currentTimeMillis() {
        return clock.millis();
    }

    public void shutdown() {
        expireScheduler.shutdown();
        coreExecutor.shutdownGracefully().syncUninterruptibly();
        log.info("Keyspace engine stopped");
    }

    private Future<RedisMessage> submit(KeyspaceCommand command) {
        try {
            coreExecutor.execute(() -> process(command));
            return command.reply();
        } catch (RejectedExecutionException e) {
            return rejected(command.type().name());
        }
    }

    private Future<RedisMessage> rejected(String what) {
        log.warn("Keyspace engine is shut down, rejecting {}", what);
        return ImmediateEventExecutor.INSTANCE.newSucceededFuture(RedisError.INTERNAL.toMessage());
    }

    // ---------------- 核心线程 ----------------

    private void process(KeyspaceCommand command) {
        long start = System.nanoTime();
        RedisMessage result;
        try {
            result = apply(command);
        } catch (RuntimeException e) {
            log.error("Unexpected error executing {} on key {}", command.type(), command.key(), e);
            result = RedisError.INTERNAL.toMessage();
        }

        long costMillis = (System.nanoTime() - start) / 1_000_000;
        if (costMillis > slowlogThresholdMillis) {
            log.warn("Slow command detected: {} {} cost {}ms", command.type(), command.key(), costMillis);
        }
        Promise<RedisMessage> reply = command.reply();
        reply.setSuccess(result);
    }

    private RedisMessage apply(KeyspaceCommand command) {
        return switch (command.type()) {
            case SET -> doSet(command);
            case GET -> doGet(command.key());
            case EXISTS -> RedisInteger.of(storage.get(command.key()) != null);
            case DELETE -> doDelete(command);
            case INCREMENT -> doIncrBy(command.key(), 1);
            case DECREMENT -> doIncrBy(command.key(), -1);
            case LPUSH -> doPush(command, true);
            case RPUSH -> doPush(command, false);
            case SAVE -> doSave();
            case LOAD -> doLoad();
        };
    }

    private RedisMessage doSet(KeyspaceCommand command) {
        long version = nextVersion++;
        storage.put(command.key(), new RedisData(command.value(), command.expireAt(), version));
        if (command.expireAt() != RedisData.NO_EXPIRE) {
            expireScheduler.schedule(command.key(), version, command.expireAt());
        } else {
            expireScheduler.cancel(command.key());
        }
        return OK;
    }

    private RedisMessage doGet(String key) {
        RedisData data = storage.get(key);
        return data == null ? NilMessage.INSTANCE : data.getValue();
    }

    private RedisMessage doDelete(KeyspaceCommand command) {
        if (command.version() == KeyspaceCommand.NO_VERSION) {
            expireScheduler.cancel(command.key());
            return RedisInteger.of(storage.remove(command.key()));
        }
        boolean removed = storage.removeIfVersion(command.key(), command.version());
        if (removed) {
            log.debug("Active expired key: {}", command.key());
        }
        return RedisInteger.of(removed);
    }

    private RedisMessage doIncrBy(String key, long delta) {
        RedisData data = storage.get(key);
        long current = 0;
        if (data != null) {
            Long parsed = toLong(data.getValue());
            if (parsed == null) {
                return RedisError.NOT_NUMERIC_OR_OVERFLOW.toMessage();
            }
            current = parsed;
        }

        long next;
        try {
            next = Math.addExact(current, delta);
        } catch (ArithmeticException e) {
            return RedisError.NOT_NUMERIC_OR_OVERFLOW.toMessage();
        }

        // 以十进制字符串存回，保留原有的过期时间
        BulkString result = new BulkString(Long.toString(next));
        storage.put(key, data == null
                ? new RedisData(result, RedisData.NO_EXPIRE, nextVersion++)
                : data.withValue(result));
        return result;
    }

    private static Long toLong(RedisMessage value) {
        if (value instanceof RedisInteger integer) {
            return integer.value();
        }
        if (value instanceof BulkString bulk) {
            try {
                return Long.parseLong(bulk.asString());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private RedisMessage doPush(KeyspaceCommand command, boolean head) {
        RedisData data = storage.get(command.key());
        if (data != null && !(data.getValue() instanceof RedisArray)) {
            return RedisError.NOT_A_LIST.toMessage();
        }

        RedisArray list = data == null ? RedisArray.EMPTY : (RedisArray) data.getValue();
        RedisArray pushed = head ? list.prepend(command.value()) : list.append(command.value());
        storage.put(command.key(), data == null
                ? new RedisData(pushed, RedisData.NO_EXPIRE, nextVersion++)
                : data.withValue(pushed));
        return OK;
    }

    private RedisMessage doSave() {
        long start = System.currentTimeMillis();
        try {
            Map<String, RedisData> live = storage.liveEntries();
            gateway.save(snapshotCodec.serialize(live));
            log.info("DB saved on disk. Keys: {}, cost {} ms", live.size(), System.currentTimeMillis() - start);
            return OK;
        } catch (IOException e) {
            log.error("Snapshot save failed", e);
            return RedisError.PERSISTENCE_FAILED.toMessage();
        }
    }

    /**
     * 加载失败时键空间保持原样
     */
    private RedisMessage doLoad() {
        Optional<byte[]> blob;
        try {
            blob = gateway.load();
        } catch (IOException e) {
            log.error("Snapshot read failed, keeping {} resident keys", storage.size(), e);
            return RedisError.PERSISTENCE_FAILED.toMessage();
        }
        if (blob.isEmpty()) {
            log.info("No snapshot found, starting with an empty keyspace");
            return OK;
        }

        Map<String, RedisData> loaded;
        try {
            loaded = snapshotCodec.deserialize(blob.get(), () -> nextVersion++);
        } catch (IOException e) {
            log.error("Snapshot is corrupt, keeping {} resident keys", storage.size(), e);
            return RedisError.PERSISTENCE_FAILED.toMessage();
        }

        long now = clock.millis();
        Map<String, RedisData> live = new LinkedHashMap<>(loaded.size());
        loaded.forEach((key, data) -> {
            if (!data.isExpired(now)) {
                live.put(key, data);
            }
        });
        storage.replaceAll(live);
        expireScheduler.cancelAll();
        live.forEach((key, data) -> {
            if (data.hasExpire()) {
                expireScheduler.schedule(key, data.getVersion(), data.getExpireAt());
            }
        });

        log.info("Snapshot loaded. Keys: {}, already expired: {}", live.size(), loaded.size() - live.size());
        return OK;
    }
}
