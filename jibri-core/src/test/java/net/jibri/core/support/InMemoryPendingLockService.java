package net.jibri.core.support;

import net.jibri.core.spi.PendingLockService;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/** SET NX PX 와 같은 의미의 인메모리 락 */
public final class InMemoryPendingLockService implements PendingLockService {
    private final Map<String, Instant> held = new ConcurrentHashMap<>();
    private final Supplier<Instant> clock;
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger failuresToInject = new AtomicInteger();

    public InMemoryPendingLockService(Supplier<Instant> clock) {
        this.clock = clock;
    }

    /** 다음 n번 호출은 전송 오류로 실패 */
    public void failNext(int n) {
        failuresToInject.set(n);
    }

    public int calls() {
        return calls.get();
    }

    public boolean isHeld(String key) {
        Instant until = held.get(key);
        return until != null && until.isAfter(clock.get());
    }

    @Override
    public boolean tryAcquire(String key, Duration holdFor) {
        calls.incrementAndGet();
        if (failuresToInject.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new IllegalStateException("connection reset");
        }
        Instant now = clock.get();
        AtomicBoolean acquired = new AtomicBoolean();
        held.compute(key, (k, until) -> {
            if (until != null && until.isAfter(now)) return until;
            acquired.set(true);
            return now.plus(holdFor);
        });
        return acquired.get();
    }
}
