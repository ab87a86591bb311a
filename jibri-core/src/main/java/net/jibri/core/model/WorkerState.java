package net.jibri.core.model;

import java.util.Objects;

/** 워커가 보고한 현재 상태 (publish 호출마다 외부에서 전달, 코어는 저장하지 않음) */
public record WorkerState(
        String workerId,          // 불투명 식별자, 공백 불가
        BusyStatus busyStatus,
        HealthStatus healthStatus
) {
    public WorkerState {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
        Objects.requireNonNull(busyStatus, "busyStatus");
        Objects.requireNonNull(healthStatus, "healthStatus");
    }

    public static WorkerState idle(String workerId) {
        return new WorkerState(workerId, BusyStatus.IDLE, HealthStatus.HEALTHY);
    }

    public static WorkerState busy(String workerId) {
        return new WorkerState(workerId, BusyStatus.BUSY, HealthStatus.HEALTHY);
    }

    /** IDLE 이면서 HEALTHY 일 때만 후보가 된다 */
    public boolean isAvailable() {
        return busyStatus == BusyStatus.IDLE && healthStatus == HealthStatus.HEALTHY;
    }
}
