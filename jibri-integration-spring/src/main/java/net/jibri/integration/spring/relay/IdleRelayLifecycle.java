package net.jibri.integration.spring.relay;

import net.jibri.adapter.redis.relay.RedisIdleEventRelay;
import org.springframework.context.SmartLifecycle;

/** 릴레이 구독을 컨텍스트 기동/종료에 맞춘다 */
public class IdleRelayLifecycle implements SmartLifecycle {
    private final RedisIdleEventRelay relay;

    public IdleRelayLifecycle(RedisIdleEventRelay relay) {
        this.relay = relay;
    }

    @Override
    public void start() {
        relay.start();
    }

    @Override
    public void stop() {
        relay.close();
    }

    @Override
    public boolean isRunning() {
        return relay.isRunning();
    }

    public RedisIdleEventRelay relay() {
        return relay;
    }
}
