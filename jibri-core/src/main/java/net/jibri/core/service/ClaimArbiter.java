package net.jibri.core.service;

import net.jibri.core.model.KeySpace;
import net.jibri.core.spi.PendingLockService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * 워커 하나에 대한 pending 락 획득.
 * 실패 원인(이미 보유 중 / 스토어 오류)은 구분하지 않는다: 둘 다 "다음 후보로".
 */
public final class ClaimArbiter {
    private static final Logger log = LoggerFactory.getLogger(ClaimArbiter.class);

    private final PendingLockService locks;
    private final KeySpace keys;
    private final Duration pendingTtl;
    private final int attempts;
    private final RetryPolicy retry;

    public ClaimArbiter(PendingLockService locks, KeySpace keys, Duration pendingTtl,
                        int attempts, RetryPolicy retry) {
        this.locks = Objects.requireNonNull(locks, "locks");
        this.keys = Objects.requireNonNull(keys, "keys");
        this.pendingTtl = Objects.requireNonNull(pendingTtl, "pendingTtl");
        this.retry = Objects.requireNonNull(retry, "retry");
        if (attempts < 1) throw new IllegalArgumentException("attempts must be >= 1");
        this.attempts = attempts;
    }

    /** 같은 id로 다시 불러도 안전 (단순 재시도) */
    public boolean attemptClaim(String workerId) {
        return attemptClaim(workerId, () -> true);
    }

    /** 실패 후 keepRetrying 이 false 면 남은 재시도(백오프 포함)를 건너뛴다 */
    boolean attemptClaim(String workerId, BooleanSupplier keepRetrying) {
        String key = keys.pendingKey(workerId);
        log.debug("attempting lock of {}", key);

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                if (locks.tryAcquire(key, pendingTtl)) {
                    log.debug("{} lock obtained", key);
                    return true;
                }
            } catch (Exception e) {
                log.warn("error obtaining lock for {} (attempt {}/{}): {}", key, attempt, attempts, e.toString());
            }

            if (attempt == attempts) break;
            if (!keepRetrying.getAsBoolean()) {
                log.debug("{} not obtained, moving on to the next candidate", key);
                return false;
            }
            if (!backoff(attempt)) {
                return false;
            }
        }
        log.debug("{} not obtained after {} attempts", key, attempts);
        return false;
    }

    private boolean backoff(int attempt) {
        Duration wait = retry.nextBackoff(attempt);
        if (wait.isZero() || wait.isNegative()) return true;
        try {
            Thread.sleep(wait.toMillis());
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
