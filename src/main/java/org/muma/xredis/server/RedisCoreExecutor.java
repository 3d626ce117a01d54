package org.muma.xredis.server;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import org.muma.xredis.utils.ThreadUtils;

import java.util.concurrent.TimeUnit;

/**
 * 核心业务线程 (Single Thread Logic)
 * 键空间的所有读写都在这里按提交顺序排队执行，一次一个，实现了无锁化。
 */
public class RedisCoreExecutor {

    // 使用 Netty 的 DefaultEventExecutor，它是一个高效的单线程事件循环
    private final EventExecutor singleThread = new DefaultEventExecutor(ThreadUtils.namedThreadFactory("XRedis-Core"));

    /**
     * @throws java.util.concurrent.RejectedExecutionException 已关闭
     */
    public void execute(Runnable task) {
        singleThread.execute(task);
    }

    // 一次性回复通道，完成两次会抛 IllegalStateException
    public <T> Promise<T> newPromise() {
        return singleThread.newPromise();
    }

    public Future<?> shutdownGracefully() {
        // 不需要静默期：队列里剩下的命令仍会执行完
        return singleThread.shutdownGracefully(0, 5, TimeUnit.SECONDS);
    }
}
