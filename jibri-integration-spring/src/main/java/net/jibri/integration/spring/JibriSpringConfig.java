package net.jibri.integration.spring;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import net.jibri.adapter.redis.RedisPendingLockService;
import net.jibri.adapter.redis.RedisUtil;
import net.jibri.core.event.IdleEventChannel;
import net.jibri.core.spi.PendingLockService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class JibriSpringConfig {

    // 락 소유 토큰과 릴레이 발신자 구분에 같은 id를 쓴다
    private final String instanceId = RedisUtil.newInstanceId();

    public String instanceId() {
        return instanceId;
    }

    // Redis 연결 (RedisURI는 bootstrap 또는 앱에서 주입)
    @Bean(destroyMethod = "shutdown")
    public RedisClient jibriRedisClient(RedisURI jibriRedisUri) {
        return RedisClient.create(jibriRedisUri);
    }

    // StatefulRedisConnection은 thread-safe: 스토어/락/릴레이 publish가 공유
    @Bean(destroyMethod = "close")
    public StatefulRedisConnection<String, String> jibriRedisConnection(RedisClient jibriRedisClient) {
        return jibriRedisClient.connect();
    }

    // SPI 구현 등록 (adapter-redis 재사용). IdleRecordStore 는 scan-count 설정과 함께 bootstrap 에서 등록
    @Bean
    public PendingLockService pendingLockService(StatefulRedisConnection<String, String> jibriRedisConnection) {
        return new RedisPendingLockService(jibriRedisConnection.sync(), instanceId);
    }

    // 트래커 인스턴스 소유 채널 (프로세스 전역 아님)
    @Bean
    public IdleEventChannel idleEventChannel() {
        return new IdleEventChannel();
    }

    // 스캔/락 재시도(sleep 포함)는 이 풀에서. publisher 스레드는 알림만 넣고 빠진다
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService jibriClaimExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("jibri-claim-"));
    }
}
