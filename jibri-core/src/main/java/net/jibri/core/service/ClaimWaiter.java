package net.jibri.core.service;

import net.jibri.core.event.IdleEvent;
import net.jibri.core.event.IdleListener;
import net.jibri.core.event.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * claimNextAvailable 호출 1건의 대기 상태.
 * - 스캔 전에 구독되므로 스캔 중 들어온 알림은 큐에 쌓였다가 startWaiting() 이후 처리
 * - 알림은 한 번에 하나씩만 클레임 시도 → 호출 1건당 클레임되는 워커는 최대 1개
 * - 큐에 이미 있는 workerId 는 다시 넣지 않는다
 * - 뒤에 다른 알림이 기다리고 있으면 락 재시도 백오프 없이 다음 후보로 넘어간다
 */
final class ClaimWaiter implements IdleListener {
    private static final Logger log = LoggerFactory.getLogger(ClaimWaiter.class);

    private final ClaimArbiter arbiter;
    private final Executor executor;
    private final CompletableFuture<String> result = new CompletableFuture<>();
    private final Queue<String> notified = new ConcurrentLinkedQueue<>();
    private final Set<String> queued = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean draining = new AtomicBoolean();
    private volatile boolean waiting;
    private volatile Subscription subscription;

    ClaimWaiter(ClaimArbiter arbiter, Executor executor) {
        this.arbiter = arbiter;
        this.executor = executor;
    }

    /** 완료 전에 직접 해제할 구독 */
    void attach(Subscription subscription) {
        this.subscription = subscription;
    }

    void detach() {
        Subscription s = subscription;
        if (s != null) s.close();
    }

    CompletableFuture<String> result() {
        return result;
    }

    boolean isDone() {
        return result.isDone();
    }

    @Override
    public void onIdle(IdleEvent event) {
        if (result.isDone()) return;
        if (queued.add(event.workerId())) {
            notified.add(event.workerId());
        }
        if (waiting) schedule();
    }

    /** 스캔 소진 → 알림 대기 단계로 */
    void startWaiting() {
        waiting = true;
        schedule();
    }

    /** 클레임 성공 결과 전달. 호출자가 이미 포기했다면 false */
    boolean offer(String workerId) {
        detach();
        if (result.complete(workerId)) {
            return true;
        }
        log.warn("{} claimed after the caller stopped waiting; it stays pending until its lock expires", workerId);
        return false;
    }

    void fail(Throwable cause) {
        detach();
        result.completeExceptionally(cause);
    }

    private void schedule() {
        if (result.isDone() || notified.isEmpty()) return;
        if (!draining.compareAndSet(false, true)) return;
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            fail(e);
        }
    }

    private void drain() {
        try {
            String workerId;
            while (!result.isDone() && (workerId = notified.poll()) != null) {
                queued.remove(workerId);
                if (arbiter.attemptClaim(workerId, () -> notified.isEmpty() && !result.isDone())) {
                    log.debug("{} is pending", workerId);
                    offer(workerId);
                    return;
                }
            }
        } finally {
            draining.set(false);
        }
        // drain 도중 들어온 알림
        schedule();
    }
}
