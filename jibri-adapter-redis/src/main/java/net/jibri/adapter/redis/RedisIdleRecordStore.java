package net.jibri.adapter.redis;

import io.lettuce.core.KeyScanCursor;
import io.lettuce.core.ScanArgs;
import io.lettuce.core.ScanCursor;
import io.lettuce.core.SetArgs;
import io.lettuce.core.api.sync.RedisCommands;
import net.jibri.core.spi.IdleRecordStore;
import net.jibri.core.spi.ScanPage;
import net.jibri.core.spi.StoreException;

import java.time.Duration;
import java.util.Objects;

/**
 * idle 레코드 = SET key 1 PX ttl (만료는 쓰기와 원자적).
 * SCAN은 Redis 보장 그대로 약한 일관성 (중복/중간 삭제 가능).
 */
public final class RedisIdleRecordStore implements IdleRecordStore {
    public static final int DEFAULT_SCAN_COUNT = 100;

    private final RedisCommands<String, String> redis;
    private final int scanCount;

    public RedisIdleRecordStore(RedisCommands<String, String> redis) {
        this(redis, DEFAULT_SCAN_COUNT);
    }

    public RedisIdleRecordStore(RedisCommands<String, String> redis, int scanCount) {
        this.redis = Objects.requireNonNull(redis, "redis");
        if (scanCount < 1) throw new IllegalArgumentException("scanCount must be >= 1");
        this.scanCount = scanCount;
    }

    public int scanCount() {
        return scanCount;
    }

    @Override
    public void putWithExpiry(String key, String value, Duration ttl) {
        String reply = redis.set(key, value, SetArgs.Builder.px(ttl.toMillis()));
        if (!RedisUtil.ok(reply)) {
            throw new StoreException("unable to set " + key + " (reply=" + reply + ")");
        }
    }

    @Override
    public void delete(String key) {
        redis.del(key);
    }

    @Override
    public ScanPage scan(String cursor, String matchPattern) {
        KeyScanCursor<String> page = redis.scan(
                ScanCursor.of(cursor),
                ScanArgs.Builder.matches(matchPattern).limit(scanCount));
        // 마지막 페이지면 Redis가 커서 "0"을 돌려준다
        String next = page.isFinished() ? INITIAL_CURSOR : page.getCursor();
        return new ScanPage(next, page.getKeys());
    }
}
