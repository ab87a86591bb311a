package net.jibri.adapter.redis;

import net.jibri.core.model.KeySpace;
import net.jibri.core.spi.IdleRecordStore;
import net.jibri.core.spi.ScanPage;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RedisIdleRecordStoreTest extends RedisTestSupport {

    private final KeySpace keys = new KeySpace("jibri");
    private RedisIdleRecordStore store;

    @BeforeEach
    void init() {
        store = new RedisIdleRecordStore(redis, 5); // 작은 COUNT로 여러 페이지 유도
    }

    @Test
    @DisplayName("putWithExpiry: 값과 만료가 함께 설정된다")
    void put_setsValueAndTtl() {
        store.putWithExpiry(keys.idleKey("w1"), "1", Duration.ofSeconds(90));

        assertEquals("1", redis.get("jibri:idle:w1"));
        long pttl = redis.pttl("jibri:idle:w1");
        assertTrue(pttl > 85_000 && pttl <= 90_000, "pttl=" + pttl);
    }

    @Test
    @DisplayName("delete는 멱등")
    void delete_isIdempotent() {
        store.putWithExpiry(keys.idleKey("w1"), "1", Duration.ofSeconds(90));

        store.delete(keys.idleKey("w1"));
        store.delete(keys.idleKey("w1"));

        assertEquals(0L, redis.exists("jibri:idle:w1"));
    }

    @Test
    @DisplayName("SCAN: 여러 페이지를 돌아 네임스페이스 안의 idle 키만 모은다")
    void scan_collectsAcrossPages() {
        for (int i = 0; i < 40; i++) {
            store.putWithExpiry(keys.idleKey("w" + i), "1", Duration.ofSeconds(90));
        }
        redis.set("jibri:pending:w1", "someone");
        redis.set("other:idle:w1", "1");

        Set<String> seen = new HashSet<>();
        int pages = 0;
        String cursor = IdleRecordStore.INITIAL_CURSOR;
        ScanPage page;
        do {
            page = store.scan(cursor, keys.idlePattern());
            seen.addAll(page.keys());
            cursor = page.cursor();
            pages++;
        } while (!page.last());

        assertEquals(40, seen.size());
        assertTrue(seen.stream().allMatch(k -> k.startsWith("jibri:idle:")));
        assertTrue(pages > 1, "expected multiple pages, got " + pages);
    }

    @Test
    @DisplayName("만료된 레코드는 스캔에서 사라진다")
    void expiredRecord_disappears() {
        store.putWithExpiry(keys.idleKey("short"), "1", Duration.ofMillis(300));

        Awaitility.await().atMost(Duration.ofSeconds(5)).until(() ->
                store.scan(IdleRecordStore.INITIAL_CURSOR, keys.idlePattern()).keys().isEmpty()
                        && redis.exists("jibri:idle:short") == 0L);
    }
}
