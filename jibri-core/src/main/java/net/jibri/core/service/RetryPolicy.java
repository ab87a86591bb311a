package net.jibri.core.service;

import java.time.Duration;

public interface RetryPolicy {
    /** attempt: 방금 실패한 시도 번호 (1부터) */
    Duration nextBackoff(long attempt);

    /** 고정 백오프 정책 */
    static RetryPolicy fixed(Duration backoff) {
        return attempt -> backoff;
    }

    /** delay + [0, jitter] 균등 랜덤 */
    static RetryPolicy jittered(Duration delay, Duration jitter) {
        return new JitteredRetryPolicy(delay, jitter);
    }
}
