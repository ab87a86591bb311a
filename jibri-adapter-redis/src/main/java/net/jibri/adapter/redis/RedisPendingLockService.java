package net.jibri.adapter.redis;

import io.lettuce.core.SetArgs;
import io.lettuce.core.api.sync.RedisCommands;
import net.jibri.core.spi.PendingLockService;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * 단일 Redis 노드 기준 락: SET key token NX PX holdFor.
 * token은 획득마다 새로 만든다 (인스턴스id:uuid). 해제는 만료로만.
 */
public final class RedisPendingLockService implements PendingLockService {
    private final RedisCommands<String, String> redis;
    private final String instanceId;

    public RedisPendingLockService(RedisCommands<String, String> redis, String instanceId) {
        this.redis = Objects.requireNonNull(redis, "redis");
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
    }

    @Override
    public boolean tryAcquire(String key, Duration holdFor) {
        String token = instanceId + ":" + UUID.randomUUID();
        String reply = redis.set(key, token, SetArgs.Builder.nx().px(holdFor.toMillis()));
        return RedisUtil.ok(reply);
    }
}
