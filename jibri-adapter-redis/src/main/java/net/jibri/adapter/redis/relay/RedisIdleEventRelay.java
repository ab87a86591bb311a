package net.jibri.adapter.redis.relay;

import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.pubsub.RedisPubSubAdapter;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import net.jibri.core.event.IdleEvent;
import net.jibri.core.event.IdleEventChannel;
import net.jibri.core.event.Subscription;
import net.jibri.core.model.KeySpace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 인스턴스 간 idle 알림 릴레이 (Redis pub/sub).
 * - LOCAL 알림 → PUBLISH {ns}:idle-events "{instanceId}|{workerId}"
 * - 다른 인스턴스의 메시지 → 로컬 채널에 REMOTE 알림
 * REMOTE 알림은 다시 내보내지 않는다 (루프 방지). 자기 메시지는 무시.
 */
public final class RedisIdleEventRelay implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RedisIdleEventRelay.class);

    static final char SEPARATOR = '|';

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> publishConnection;
    private final IdleEventChannel events;
    private final String channel;
    private final String instanceId;

    private StatefulRedisPubSubConnection<String, String> pubSub;
    private Subscription localSubscription;

    public RedisIdleEventRelay(RedisClient client,
                               StatefulRedisConnection<String, String> publishConnection,
                               IdleEventChannel events,
                               String channel,
                               String instanceId) {
        this.client = Objects.requireNonNull(client, "client");
        this.publishConnection = Objects.requireNonNull(publishConnection, "publishConnection");
        this.events = Objects.requireNonNull(events, "events");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
        if (instanceId.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("instanceId must not contain '" + SEPARATOR + "'");
        }
    }

    public static String channelFor(KeySpace keys) {
        return keys.namespace() + ":idle-events";
    }

    public synchronized void start() {
        if (pubSub != null) return;
        StatefulRedisPubSubConnection<String, String> conn = client.connectPubSub();
        try {
            conn.addListener(new RedisPubSubAdapter<>() {
                @Override
                public void message(String ch, String message) {
                    onMessage(message);
                }
            });
            conn.sync().subscribe(channel);
        } catch (RuntimeException e) {
            // 구독 실패: 연결을 닫고 미시작 상태로 남긴다
            conn.close();
            throw e;
        }
        pubSub = conn;
        localSubscription = events.subscribe(this::forward);
        log.info("idle relay started: channel={} instance={}", channel, instanceId);
    }

    public synchronized boolean isRunning() {
        return pubSub != null;
    }

    @Override
    public synchronized void close() {
        if (pubSub == null) return;
        localSubscription.close();
        pubSub.close();
        pubSub = null;
        localSubscription = null;
        log.info("idle relay stopped: channel={}", channel);
    }

    private void forward(IdleEvent event) {
        if (!event.isLocal()) return;
        // publisher 스레드를 막지 않도록 async
        publishConnection.async()
                .publish(channel, instanceId + SEPARATOR + event.workerId())
                .whenComplete((receivers, err) -> {
                    if (err != null) {
                        log.warn("failed to relay idle event for {}: {}", event.workerId(), err.toString());
                    }
                });
    }

    private void onMessage(String message) {
        int sep = message.indexOf(SEPARATOR);
        if (sep <= 0 || sep == message.length() - 1) {
            log.warn("ignoring malformed idle relay message: {}", message);
            return;
        }
        if (instanceId.equals(message.substring(0, sep))) return;
        events.emit(IdleEvent.remote(message.substring(sep + 1)));
    }
}
