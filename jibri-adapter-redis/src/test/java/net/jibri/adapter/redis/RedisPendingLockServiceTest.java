package net.jibri.adapter.redis;

import org.awaitility.Awaitility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class RedisPendingLockServiceTest extends RedisTestSupport {

    private RedisPendingLockService locks;

    @BeforeEach
    void init() {
        locks = new RedisPendingLockService(redis, "test-instance");
    }

    @Test
    @DisplayName("NX: 보유 중인 락은 다시 획득되지 않는다")
    void heldLock_isExclusive() {
        assertTrue(locks.tryAcquire("jibri:pending:w1", Duration.ofSeconds(30)));
        assertFalse(locks.tryAcquire("jibri:pending:w1", Duration.ofSeconds(30)));

        assertTrue(redis.get("jibri:pending:w1").startsWith("test-instance:"));
        assertTrue(redis.pttl("jibri:pending:w1") > 0);
    }

    @Test
    @DisplayName("holdFor가 지나면 다시 획득할 수 있다")
    void lock_expires() {
        assertTrue(locks.tryAcquire("jibri:pending:w2", Duration.ofMillis(300)));

        Awaitility.await().atMost(Duration.ofSeconds(5))
                .until(() -> locks.tryAcquire("jibri:pending:w2", Duration.ofSeconds(30)));
    }

    @Test
    @DisplayName("여러 스레드가 같은 키를 동시에 노려도 성공은 하나")
    void concurrentAcquire_singleWinner() throws Exception {
        int threads = 16;
        var pool = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            var other = new RedisPendingLockService(redis, "instance-" + i);
            results.add(pool.submit(() -> {
                ready.countDown();
                ready.await();
                return other.tryAcquire("jibri:pending:hot", Duration.ofSeconds(30));
            }));
        }

        int winners = 0;
        for (Future<Boolean> f : results) {
            if (f.get()) winners++;
        }
        pool.shutdownNow();

        assertEquals(1, winners);
    }
}
