package net.jibri.core.service;

import net.jibri.core.model.KeySpace;
import net.jibri.core.spi.IdleRecordStore;
import net.jibri.core.spi.ScanPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** 현재 idle 레코드를 커서 스캔으로 모두 열거 (스토어 열거 순서 그대로, 중복 제거) */
public final class AvailabilityScanner {
    private static final Logger log = LoggerFactory.getLogger(AvailabilityScanner.class);

    private final IdleRecordStore store;
    private final KeySpace keys;

    public AvailabilityScanner(IdleRecordStore store, KeySpace keys) {
        this.store = Objects.requireNonNull(store, "store");
        this.keys = Objects.requireNonNull(keys, "keys");
    }

    public List<String> scanIdle() throws Exception {
        Set<String> ids = new LinkedHashSet<>();
        String cursor = IdleRecordStore.INITIAL_CURSOR;
        ScanPage page;
        do {
            page = store.scan(cursor, keys.idlePattern());
            for (String key : page.keys()) {
                // 패턴에는 걸리지만 workerId 가 없는 키 (예: "{ns}:idle:") 는 후보가 아니다
                if (!keys.isIdleKey(key)) {
                    log.warn("skipping key without worker id: '{}'", key);
                    continue;
                }
                ids.add(keys.workerIdOf(key));
            }
            cursor = page.cursor();
        } while (!page.last());
        return new ArrayList<>(ids);
    }
}
