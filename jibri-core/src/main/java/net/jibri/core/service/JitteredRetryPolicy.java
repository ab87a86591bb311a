package net.jibri.core.service;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/** 락 경합 시 여러 클레이머가 같은 박자로 재시도하지 않도록 지터를 섞는다 */
final class JitteredRetryPolicy implements RetryPolicy {
    private final long delayMs;
    private final long jitterMs;

    JitteredRetryPolicy(Duration delay, Duration jitter) {
        this.delayMs = Objects.requireNonNull(delay, "delay").toMillis();
        this.jitterMs = Objects.requireNonNull(jitter, "jitter").toMillis();
    }

    @Override
    public Duration nextBackoff(long attempt) {
        long extra = jitterMs <= 0 ? 0 : ThreadLocalRandom.current().nextLong(jitterMs + 1);
        return Duration.ofMillis(delayMs + extra);
    }
}
