package net.jibri.core.event;

import java.util.Objects;

/** 워커가 idle+healthy로 전이했다는 프로세스 내 알림 (저장되지 않음) */
public record IdleEvent(String workerId, Origin origin) {

    public enum Origin {
        LOCAL,   // 이 프로세스의 publish
        REMOTE   // 다른 인스턴스에서 릴레이됨
    }

    public IdleEvent {
        Objects.requireNonNull(workerId, "workerId");
        Objects.requireNonNull(origin, "origin");
    }

    public static IdleEvent local(String workerId) {
        return new IdleEvent(workerId, Origin.LOCAL);
    }

    public static IdleEvent remote(String workerId) {
        return new IdleEvent(workerId, Origin.REMOTE);
    }

    public boolean isLocal() {
        return origin == Origin.LOCAL;
    }
}
