package net.jibri.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 트래커 인스턴스가 소유하는 idle 알림 채널.
 * emit은 호출 스레드에서 동기로 fan-out 한다. 리스너는 오래 걸리는 작업을 직접 하지 말 것.
 */
public final class IdleEventChannel {
    private static final Logger log = LoggerFactory.getLogger(IdleEventChannel.class);

    private final Set<Handle> handles = new CopyOnWriteArraySet<>();

    public Subscription subscribe(IdleListener listener) {
        Objects.requireNonNull(listener, "listener");
        Handle h = new Handle(listener);
        handles.add(h);
        return h;
    }

    public void emit(IdleEvent event) {
        Objects.requireNonNull(event, "event");
        for (Handle h : handles) {
            try {
                h.listener.onIdle(event);
            } catch (RuntimeException e) {
                // 한 리스너 실패가 publisher나 다른 리스너로 번지지 않게
                log.warn("idle listener failed for {}: {}", event.workerId(), e.toString(), e);
            }
        }
    }

    public int listenerCount() {
        return handles.size();
    }

    private final class Handle implements Subscription {
        private final IdleListener listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Handle(IdleListener listener) {
            this.listener = listener;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            if (active.compareAndSet(true, false)) {
                handles.remove(this);
            }
        }
    }
}
