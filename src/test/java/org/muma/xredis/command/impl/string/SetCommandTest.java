package org.muma.xredis.command.impl.string;

import io.netty.util.concurrent.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.xredis.MutableClock;
import org.muma.xredis.protocol.BulkString;
import org.muma.xredis.protocol.NilMessage;
import org.muma.xredis.protocol.RedisArray;
import org.muma.xredis.protocol.RedisMessage;
import org.muma.xredis.rdb.PersistenceGateway;
import org.muma.xredis.server.KeyspaceEngine;
import org.muma.xredis.store.impl.MemoryStorageEngine;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class SetCommandTest {

    private static final long NOW = 1_700_000_000_000L;

    private MutableClock clock;
    private KeyspaceEngine engine;
    private SetCommand set;
    private GetCommand get;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        engine = new KeyspaceEngine(new MemoryStorageEngine(clock), mock(PersistenceGateway.class), clock, 10);
        set = new SetCommand();
        get = new GetCommand();
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    // 辅助方法：构造参数
    private RedisArray args(String... args) {
        return RedisArray.ofStrings(args);
    }

    private static RedisMessage await(Future<RedisMessage> future) {
        return future.syncUninterruptibly().getNow();
    }

    @Test
    void testExpirationModes() {
        assertEquals(NOW + 10_000, SetCommand.ExpirationMode.EX.toExpireAt(10, NOW));
        assertEquals(NOW + 10, SetCommand.ExpirationMode.PX.toExpireAt(10, NOW));
        assertEquals(5_000, SetCommand.ExpirationMode.EXAT.toExpireAt(5, NOW));
        assertEquals(5, SetCommand.ExpirationMode.PXAT.toExpireAt(5, NOW));
    }

    @Test
    void testExpirationModeOverflow() {
        assertThrows(ArithmeticException.class, () -> SetCommand.ExpirationMode.EX.toExpireAt(Long.MAX_VALUE / 10, NOW));
        assertThrows(ArithmeticException.class, () -> SetCommand.ExpirationMode.PX.toExpireAt(Long.MAX_VALUE, NOW));
        assertThrows(ArithmeticException.class, () -> SetCommand.ExpirationMode.EXAT.toExpireAt(Long.MIN_VALUE, NOW));
    }

    @Test
    void testParseMode() {
        assertEquals(SetCommand.ExpirationMode.EXAT, SetCommand.ExpirationMode.parse("exat"));
        assertEquals(SetCommand.ExpirationMode.PX, SetCommand.ExpirationMode.parse("Px"));
        assertNull(SetCommand.ExpirationMode.parse("NX"));
    }

    @Test
    void testRelativeExpiration() {
        await(set.execute(engine, args("SET", "k", "v", "EX", "10")));
        clock.advance(9_999);
        assertEquals(new BulkString("v"), await(get.execute(engine, args("GET", "k"))));

        clock.advance(1);
        assertEquals(NilMessage.INSTANCE, await(get.execute(engine, args("GET", "k"))));
    }

    @Test
    void testAbsoluteExpiration() {
        await(set.execute(engine, args("SET", "k", "v", "PXAT", Long.toString(NOW + 500))));
        assertEquals(new BulkString("v"), await(get.execute(engine, args("GET", "k"))));

        clock.set(NOW + 500);
        assertEquals(NilMessage.INSTANCE, await(get.execute(engine, args("GET", "k"))));
    }

    @Test
    void testNegativeAbsoluteInstantIsNotTreatedAsNoExpire() {
        // -1 是 "不过期" 的标记，不能被当成永不过期
        await(set.execute(engine, args("SET", "k", "v", "PXAT", "-1")));
        assertEquals(NilMessage.INSTANCE, await(get.execute(engine, args("GET", "k"))));
    }
}
