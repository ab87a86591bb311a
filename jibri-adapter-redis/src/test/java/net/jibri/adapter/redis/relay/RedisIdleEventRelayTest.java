package net.jibri.adapter.redis.relay;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.codec.StringCodec;
import io.lettuce.core.output.IntegerOutput;
import io.lettuce.core.output.StatusOutput;
import io.lettuce.core.protocol.CommandArgs;
import io.lettuce.core.protocol.CommandType;
import net.jibri.adapter.redis.RedisTestSupport;
import net.jibri.core.event.IdleEventChannel;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class RedisIdleEventRelayTest extends RedisTestSupport {

    private static final String NO_SUBSCRIBE_USER = "jibri-nosub";
    private static final String PASSWORD = "nosub-pw";

    @AfterEach
    void dropUser() {
        redis.dispatch(CommandType.ACL, new IntegerOutput<>(StringCodec.UTF8),
                new CommandArgs<>(StringCodec.UTF8).add("DELUSER").add(NO_SUBSCRIBE_USER));
    }

    @Test
    @DisplayName("구독이 거부되면 start()는 예외를 던지고, 연결은 닫히며 릴레이는 미시작 상태로 남는다")
    void failedSubscribe_closesConnectionAndStaysStopped() {
        // SUBSCRIBE 만 막힌 계정
        redis.dispatch(CommandType.ACL, new StatusOutput<>(StringCodec.UTF8),
                new CommandArgs<>(StringCodec.UTF8).add("SETUSER").add(NO_SUBSCRIBE_USER)
                        .add("reset").add("on").add(">" + PASSWORD).add("~*").add("+@all").add("-subscribe"));

        RedisURI uri = RedisURI.create(redisUrl);
        uri.setUsername(NO_SUBSCRIBE_USER);
        uri.setPassword(PASSWORD.toCharArray());
        RedisClient restricted = RedisClient.create(uri);
        IdleEventChannel events = new IdleEventChannel();
        try {
            var relay = new RedisIdleEventRelay(restricted, connection, events, "jibri:idle-events", "inst-1");

            assertThrows(RedisException.class, relay::start);
            assertFalse(relay.isRunning());
            assertEquals(0, events.listenerCount());

            Awaitility.await().atMost(Duration.ofSeconds(5))
                    .until(() -> connectionsOf(NO_SUBSCRIBE_USER) == 0);

            relay.close(); // 미시작 상태의 close 는 no-op
            assertFalse(relay.isRunning());
        } finally {
            restricted.shutdown();
        }
    }

    private long connectionsOf(String user) {
        return Arrays.stream(redis.clientList().split("\n"))
                .filter(line -> line.contains(" user=" + user))
                .count();
    }
}
