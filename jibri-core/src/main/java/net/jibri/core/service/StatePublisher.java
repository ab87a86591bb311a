package net.jibri.core.service;

import net.jibri.core.event.IdleEvent;
import net.jibri.core.event.IdleEventChannel;
import net.jibri.core.model.KeySpace;
import net.jibri.core.model.WorkerState;
import net.jibri.core.spi.IdleRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/** 워커 상태 → idle 레코드(만료 포함) 반영 */
public final class StatePublisher {
    private static final Logger log = LoggerFactory.getLogger(StatePublisher.class);

    static final String IDLE_MARKER = "1";

    private final IdleRecordStore store;
    private final IdleEventChannel events;
    private final KeySpace keys;
    private final Duration idleTtl;

    public StatePublisher(IdleRecordStore store, IdleEventChannel events, KeySpace keys, Duration idleTtl) {
        this.store = Objects.requireNonNull(store, "store");
        this.events = Objects.requireNonNull(events, "events");
        this.keys = Objects.requireNonNull(keys, "keys");
        this.idleTtl = Objects.requireNonNull(idleTtl, "idleTtl");
    }

    /**
     * idle+healthy면 레코드를 (재)기록하고 LOCAL 알림 후 true.
     * 그 외에는 레코드를 지우고 false. 스토어 오류는 그대로 던진다.
     */
    public boolean publish(WorkerState state) throws Exception {
        Objects.requireNonNull(state, "state");
        String key = keys.idleKey(state.workerId());

        if (state.isAvailable()) {
            store.putWithExpiry(key, IDLE_MARKER, idleTtl);
            log.debug("{} idle (ttl={})", state.workerId(), idleTtl);
            events.emit(IdleEvent.local(state.workerId()));
            return true;
        }

        // 만료를 기다리지 않고 즉시 후보에서 제외
        store.delete(key);
        log.debug("{} not idle: busy={} health={}", state.workerId(), state.busyStatus(), state.healthStatus());
        return false;
    }
}
