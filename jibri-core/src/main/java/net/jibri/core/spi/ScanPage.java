package net.jibri.core.spi;

import java.util.List;
import java.util.Objects;

/** 커서 스캔 한 페이지. cursor가 다시 INITIAL_CURSOR면 스캔 종료 */
public record ScanPage(String cursor, List<String> keys) {
    public ScanPage {
        Objects.requireNonNull(cursor, "cursor");
        keys = keys == null ? List.of() : List.copyOf(keys);
    }

    public boolean last() {
        return IdleRecordStore.INITIAL_CURSOR.equals(cursor);
    }
}
