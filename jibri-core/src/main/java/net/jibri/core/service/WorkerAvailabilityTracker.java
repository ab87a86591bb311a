package net.jibri.core.service;

import net.jibri.core.event.IdleEventChannel;
import net.jibri.core.event.IdleListener;
import net.jibri.core.event.Subscription;
import net.jibri.core.model.KeySpace;
import net.jibri.core.model.TrackerSettings;
import net.jibri.core.model.WorkerState;
import net.jibri.core.spi.IdleRecordStore;
import net.jibri.core.spi.PendingLockService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 워커 풀 가용성 트래커.
 * publish → (스캔) → 클레임 → (후보 소진 시) idle 알림 대기 → 클레임 재시도.
 * 여러 인스턴스가 동시에 돌아도 워커당 클레임 1건은 pending 락이 보장한다.
 */
public final class WorkerAvailabilityTracker {
    private static final Logger log = LoggerFactory.getLogger(WorkerAvailabilityTracker.class);

    private final StatePublisher publisher;
    private final AvailabilityScanner scanner;
    private final ClaimArbiter arbiter;
    private final IdleEventChannel events;
    private final Executor executor;

    public WorkerAvailabilityTracker(StatePublisher publisher,
                                     AvailabilityScanner scanner,
                                     ClaimArbiter arbiter,
                                     IdleEventChannel events,
                                     Executor executor) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.arbiter = Objects.requireNonNull(arbiter, "arbiter");
        this.events = Objects.requireNonNull(events, "events");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /** SPI 구현체와 설정만으로 조립 */
    public static WorkerAvailabilityTracker create(IdleRecordStore store,
                                                   PendingLockService locks,
                                                   IdleEventChannel events,
                                                   TrackerSettings settings,
                                                   Executor executor) {
        KeySpace keys = settings.keySpace();
        return new WorkerAvailabilityTracker(
                new StatePublisher(store, events, keys, settings.idleTtl()),
                new AvailabilityScanner(store, keys),
                new ClaimArbiter(locks, keys, settings.pendingTtl(), settings.lockAttempts(),
                        RetryPolicy.jittered(settings.lockRetryDelay(), settings.lockRetryJitter())),
                events,
                executor);
    }

    public boolean publish(WorkerState state) throws Exception {
        return publisher.publish(state);
    }

    public boolean attemptClaim(String workerId) {
        return arbiter.attemptClaim(workerId);
    }

    /** 지금 발견 가능한 idle 워커 (스냅샷 아님: 약한 일관성) */
    public List<String> idleWorkers() throws Exception {
        return scanner.scanIdle();
    }

    /** 가용성 전이를 직접 관찰하려는 호출자용 */
    public Subscription subscribe(IdleListener listener) {
        return events.subscribe(listener);
    }

    /**
     * idle 워커 하나를 클레임. 풀이 포화면 새 idle 알림이 올 때까지 무기한 대기한다.
     * 반환된 future를 cancel 하면 대기를 포기하고 리스너가 해제된다.
     */
    public CompletableFuture<String> claimNextAvailable() {
        ClaimWaiter waiter = start();
        CompletableFuture<String> claim = waiter.result();

        // 내부 future는 노출하지 않는다. 호출자 쪽에서 먼저 끝내면(cancel/complete) 대기도 정리
        CompletableFuture<String> out = claim.whenComplete((id, err) -> waiter.detach());
        out.whenComplete((id, err) -> {
            if (!claim.isDone()) claim.cancel(false);
        });
        return out;
    }

    /** 최대 maxWait 만큼만 대기. 시간 초과 시 Optional.empty() 로 끝나고 리스너는 해제된다 */
    public CompletableFuture<Optional<String>> claimNextAvailable(Duration maxWait) {
        Objects.requireNonNull(maxWait, "maxWait");
        ClaimWaiter waiter = start();
        CompletableFuture<String> claim = waiter.result();
        claim.completeOnTimeout(null, Math.max(0, maxWait.toMillis()), TimeUnit.MILLISECONDS);

        // 구독 해제가 끝난 뒤에 결과가 보이도록
        CompletableFuture<Optional<String>> out = claim
                .whenComplete((id, err) -> waiter.detach())
                .thenApply(Optional::ofNullable);
        out.whenComplete((v, err) -> {
            if (err != null) claim.cancel(false); // 바깥 future 취소 → 안쪽 대기도 정리
        });
        return out;
    }

    private ClaimWaiter start() {
        ClaimWaiter waiter = new ClaimWaiter(arbiter, executor);
        // 스캔 전에 구독: 스캔과 대기 사이에 들어온 알림을 놓치지 않기 위해
        waiter.attach(events.subscribe(waiter));
        // 외부에서 cancel/완료시킨 경우
        waiter.result().whenComplete((id, err) -> waiter.detach());

        try {
            executor.execute(() -> scanThenWait(waiter));
        } catch (RejectedExecutionException e) {
            waiter.fail(e);
        }
        return waiter;
    }

    private void scanThenWait(ClaimWaiter waiter) {
        List<String> idle;
        try {
            idle = scanner.scanIdle();
        } catch (Exception e) {
            log.warn("idle scan failed: {}", e.toString());
            waiter.fail(e);
            return;
        }
        log.debug("idle workers: {}", idle);

        for (String workerId : idle) {
            if (waiter.isDone()) return;
            if (arbiter.attemptClaim(workerId)) {
                log.debug("{} is now pending", workerId);
                waiter.offer(workerId);
                return;
            }
        }

        if (!waiter.isDone()) {
            log.debug("no claimable idle worker, waiting for idle notification");
            waiter.startWaiting();
        }
    }
}
