package net.jibri.bootstrap.autoconfigure;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import net.jibri.adapter.redis.RedisConnectionSettings;
import net.jibri.adapter.redis.RedisIdleRecordStore;
import net.jibri.adapter.redis.relay.RedisIdleEventRelay;
import net.jibri.bootstrap.props.JibriProperties;
import net.jibri.core.event.IdleEventChannel;
import net.jibri.core.model.TrackerSettings;
import net.jibri.core.service.*;
import net.jibri.core.spi.IdleRecordStore;
import net.jibri.core.spi.PendingLockService;
import net.jibri.integration.spring.JibriSpringConfig;
import net.jibri.integration.spring.relay.IdleRelayLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.util.concurrent.ExecutorService;

@AutoConfiguration
@EnableConfigurationProperties(JibriProperties.class)
@Import(JibriSpringConfig.class) // integration-spring: redis/spi/executor wiring
public class JibriAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(JibriAutoConfiguration.class);

    // --- 접속/설정 ---

    @Bean
    @ConditionalOnMissingBean(RedisURI.class)
    public RedisURI jibriRedisUri(JibriProperties props) {
        var r = props.getRedis();
        return new RedisConnectionSettings(r.getHost(), r.getPort(), r.getUsername(), r.getPassword(),
                r.isSsl(), r.getDatabase(), r.getTimeout()).toUri();
    }

    @Bean
    @ConditionalOnMissingBean
    public TrackerSettings trackerSettings(JibriProperties props) {
        TrackerSettings s = props.toSettings();
        log.info("jibri tracker: namespace={} idleTtl={} pendingTtl={} lockAttempts={}",
                s.namespace(), s.idleTtl(), s.pendingTtl(), s.lockAttempts());
        return s;
    }

    @Bean
    @ConditionalOnMissingBean(IdleRecordStore.class)
    public IdleRecordStore idleRecordStore(StatefulRedisConnection<String, String> jibriRedisConnection,
                                           JibriProperties props) {
        return new RedisIdleRecordStore(jibriRedisConnection.sync(), props.getRedis().getScanCount());
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public StatePublisher statePublisher(IdleRecordStore store, IdleEventChannel events, TrackerSettings settings) {
        return new StatePublisher(store, events, settings.keySpace(), settings.idleTtl());
    }

    @Bean
    @ConditionalOnMissingBean
    public AvailabilityScanner availabilityScanner(IdleRecordStore store, TrackerSettings settings) {
        return new AvailabilityScanner(store, settings.keySpace());
    }

    @Bean
    @ConditionalOnMissingBean
    public ClaimArbiter claimArbiter(PendingLockService locks, TrackerSettings settings) {
        return new ClaimArbiter(locks, settings.keySpace(), settings.pendingTtl(), settings.lockAttempts(),
                RetryPolicy.jittered(settings.lockRetryDelay(), settings.lockRetryJitter()));
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkerAvailabilityTracker workerAvailabilityTracker(StatePublisher publisher,
                                                               AvailabilityScanner scanner,
                                                               ClaimArbiter arbiter,
                                                               IdleEventChannel events,
                                                               @Qualifier("jibriClaimExecutor") ExecutorService executor) {
        return new WorkerAvailabilityTracker(publisher, scanner, arbiter, events, executor);
    }

    // --- 인스턴스 간 idle 알림 (기본 off) ---

    @Bean
    @ConditionalOnProperty(prefix = "jibri.relay", name = "enabled", havingValue = "true")
    public IdleRelayLifecycle idleRelayLifecycle(RedisClient jibriRedisClient,
                                                 StatefulRedisConnection<String, String> jibriRedisConnection,
                                                 IdleEventChannel events,
                                                 TrackerSettings settings,
                                                 JibriSpringConfig springConfig) {
        var relay = new RedisIdleEventRelay(jibriRedisClient, jibriRedisConnection, events,
                RedisIdleEventRelay.channelFor(settings.keySpace()), springConfig.instanceId());
        return new IdleRelayLifecycle(relay);
    }
}
