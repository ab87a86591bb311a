package net.jibri.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * 트래커 동작 파라미터.
 * pendingTtl은 idleTtl보다 훨씬 길어야 한다: 클레임된 워커가 잡 할당 전에
 * 늦은 스캔에서 다시 idle로 발견되지 않도록.
 */
public record TrackerSettings(
        String namespace,
        Duration idleTtl,         // idle 레코드 만료
        Duration pendingTtl,      // pending 락 보유 시간
        int lockAttempts,         // 락 획득 총 시도 횟수
        Duration lockRetryDelay,  // 재시도 기본 간격
        Duration lockRetryJitter  // 재시도 간격에 더해지는 랜덤 최대치
) {
    public static final Duration DEFAULT_IDLE_TTL = Duration.ofSeconds(90);
    public static final Duration DEFAULT_PENDING_TTL = Duration.ofSeconds(10_000);

    public TrackerSettings {
        Objects.requireNonNull(namespace, "namespace");
        requirePositive(idleTtl, "idleTtl");
        requirePositive(pendingTtl, "pendingTtl");
        if (lockAttempts < 1) throw new IllegalArgumentException("lockAttempts must be >= 1");
        Objects.requireNonNull(lockRetryDelay, "lockRetryDelay");
        Objects.requireNonNull(lockRetryJitter, "lockRetryJitter");
        if (lockRetryDelay.isNegative() || lockRetryJitter.isNegative()) {
            throw new IllegalArgumentException("lock retry delay/jitter must not be negative");
        }
    }

    public static TrackerSettings defaults() {
        return new TrackerSettings(KeySpace.DEFAULT_NAMESPACE,
                DEFAULT_IDLE_TTL, DEFAULT_PENDING_TTL,
                3, Duration.ofMillis(200), Duration.ofMillis(200));
    }

    public KeySpace keySpace() {
        return new KeySpace(namespace);
    }

    public TrackerSettings withTtls(Duration idle, Duration pending) {
        return new TrackerSettings(namespace, idle, pending, lockAttempts, lockRetryDelay, lockRetryJitter);
    }

    public TrackerSettings withLockRetry(int attempts, Duration delay, Duration jitter) {
        return new TrackerSettings(namespace, idleTtl, pendingTtl, attempts, delay, jitter);
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " must be positive");
    }
}
