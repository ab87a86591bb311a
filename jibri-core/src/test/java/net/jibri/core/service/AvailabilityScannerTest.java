package net.jibri.core.service;

import net.jibri.core.model.WorkerState;
import net.jibri.core.spi.IdleRecordStore;
import net.jibri.core.spi.ScanPage;
import net.jibri.core.spi.StoreException;
import net.jibri.core.support.TrackerTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AvailabilityScannerTest extends TrackerTestSupport {

    @Test
    @DisplayName("여러 페이지에 걸친 스캔을 커서가 0으로 돌아올 때까지 따라간다")
    void followsCursorAcrossPages() throws Exception {
        for (String id : List.of("a", "b", "c", "d", "e")) {
            tracker.publish(WorkerState.idle(id));
        }
        tracker.publish(WorkerState.busy("c"));

        var scanner = new AvailabilityScanner(store, keys);
        assertEquals(List.of("a", "b", "d", "e"), scanner.scanIdle());
    }

    @Test
    @DisplayName("콜론을 포함한 workerId도 그대로 복원한다")
    void workerIdWithColon() throws Exception {
        tracker.publish(WorkerState.idle("eu-west:host-7"));

        assertEquals(List.of("eu-west:host-7"), tracker.idleWorkers());
    }

    @Test
    @DisplayName("스캔 중 중복 키는 한 번만 후보가 된다")
    void duplicateKeys_areCollapsed() throws Exception {
        IdleRecordStore scripted = new IdleRecordStore() {
            @Override public void putWithExpiry(String key, String value, Duration ttl) { }
            @Override public void delete(String key) { }
            @Override public ScanPage scan(String cursor, String matchPattern) {
                return switch (cursor) {
                    case "0" -> new ScanPage("17", List.of("jibri:idle:x", "jibri:idle:y"));
                    case "17" -> new ScanPage("4", List.of());
                    default -> new ScanPage("0", List.of("jibri:idle:y", "jibri:idle:z"));
                };
            }
        };

        assertEquals(List.of("x", "y", "z"), new AvailabilityScanner(scripted, keys).scanIdle());
    }

    @Test
    @DisplayName("workerId 가 없는 키는 건너뛰고 나머지 후보는 그대로 돌려준다")
    void keyWithoutWorkerId_isSkipped() throws Exception {
        store.putWithExpiry("jibri:idle:", "1", Duration.ofMinutes(1));
        tracker.publish(WorkerState.idle("w1"));
        tracker.publish(WorkerState.idle("w2"));

        assertEquals(List.of("w1", "w2"), new AvailabilityScanner(store, keys).scanIdle());
    }

    @Test
    @DisplayName("스캔 오류는 전파된다")
    void scanError_propagates() {
        store.failScans(true);

        assertThrows(StoreException.class, () -> new AvailabilityScanner(store, keys).scanIdle());
    }
}
