package org.muma.xredis.server;

import org.muma.xredis.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 主动过期
 * 带过期时间的 key 写入时登记一个定时器，到点后向引擎提交一个带版本号的 DELETE。
 * 每个 key 最多保留一个定时器：重新登记、无过期的 SET、DEL 都会取消旧的。
 * 取消和触发之间仍可能有竞争，所以 DELETE 带版本号，过时的 DELETE 什么也不做。
 */
public class ActiveExpireScheduler {

    private static final Logger log = LoggerFactory.getLogger(ActiveExpireScheduler.class);

    @FunctionalInterface
    public interface ExpireAction {
        void expire(String key, long version);
    }

    private record PendingExpire(long version, ScheduledFuture<?> future) {
    }

    private final ScheduledThreadPoolExecutor timer =
            new ScheduledThreadPoolExecutor(1, ThreadUtils.namedThreadFactory("XRedis-Active-Expire"));

    // 核心线程登记/取消，定时器线程触发后清理
    private final Map<String, PendingExpire> pending = new ConcurrentHashMap<>();

    private final Clock clock;
    private final ExpireAction action;

    public ActiveExpireScheduler(Clock clock, ExpireAction action) {
        this.clock = clock;
        this.action = action;
        // 取消的任务立即出队，反复改写同一个 key 不会堆积
        timer.setRemoveOnCancelPolicy(true);
    }

    public void schedule(String key, long version, long expireAt) {
        long delay = Math.max(0, expireAt - clock.millis());
        ScheduledFuture<?> future;
        try {
            future = timer.schedule(() -> fire(key, version), delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // 关闭过程中：惰性过期仍然生效
            log.debug("Active expire timer already stopped, key {} left to lazy expiration", key);
            return;
        }
        PendingExpire previous = pending.put(key, new PendingExpire(version, future));
        if (previous != null) {
            previous.future().cancel(false);
        }
    }

    public void cancel(String key) {
        PendingExpire previous = pending.remove(key);
        if (previous != null) {
            previous.future().cancel(false);
        }
    }

    public void cancelAll() {
        pending.keySet().forEach(this::cancel);
    }

    private void fire(String key, long version) {
        pending.computeIfPresent(key, (k, p) -> p.version() == version ? null : p);
        action.expire(key, version);
    }

    // 还在排队的定时器数量
    int queuedTimers() {
        return timer.getQueue().size();
    }

    public void shutdown() {
        timer.shutdownNow();
        pending.clear();
    }
}
