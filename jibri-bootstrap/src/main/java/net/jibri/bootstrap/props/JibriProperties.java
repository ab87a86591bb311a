package net.jibri.bootstrap.props;

import net.jibri.adapter.redis.RedisIdleRecordStore;
import net.jibri.core.model.KeySpace;
import net.jibri.core.model.TrackerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties("jibri")
public class JibriProperties {
    private Redis redis = new Redis();
    private Tracker tracker = new Tracker();
    private Lock lock = new Lock();
    private Relay relay = new Relay();

    public Redis getRedis() {
        return redis;
    }

    public void setRedis(Redis redis) {
        this.redis = redis;
    }

    public Tracker getTracker() {
        return tracker;
    }

    public void setTracker(Tracker tracker) {
        this.tracker = tracker;
    }

    public Lock getLock() {
        return lock;
    }

    public void setLock(Lock lock) {
        this.lock = lock;
    }

    public Relay getRelay() {
        return relay;
    }

    public void setRelay(Relay relay) {
        this.relay = relay;
    }

    /** 코어 설정 레코드로 변환 */
    public TrackerSettings toSettings() {
        return new TrackerSettings(
                tracker.getNamespace(),
                tracker.getIdleTtl(),
                tracker.getPendingTtl(),
                lock.getAttempts(),
                lock.getRetryDelay(),
                lock.getRetryJitter());
    }

    public static class Redis {
        private String host = "localhost";
        private int port = 6379;
        private String username;
        private String password;
        private boolean ssl = false;
        private int database = 0;
        private Duration timeout = Duration.ofSeconds(10);
        private int scanCount = RedisIdleRecordStore.DEFAULT_SCAN_COUNT;

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public boolean isSsl() {
            return ssl;
        }

        public void setSsl(boolean ssl) {
            this.ssl = ssl;
        }

        public int getDatabase() {
            return database;
        }

        public void setDatabase(int database) {
            this.database = database;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getScanCount() {
            return scanCount;
        }

        public void setScanCount(int scanCount) {
            this.scanCount = scanCount;
        }
    }

    public static class Tracker {
        private String namespace = KeySpace.DEFAULT_NAMESPACE;
        private Duration idleTtl = TrackerSettings.DEFAULT_IDLE_TTL;
        private Duration pendingTtl = TrackerSettings.DEFAULT_PENDING_TTL; // idleTtl보다 훨씬 길게

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }

        public Duration getIdleTtl() {
            return idleTtl;
        }

        public void setIdleTtl(Duration idleTtl) {
            this.idleTtl = idleTtl;
        }

        public Duration getPendingTtl() {
            return pendingTtl;
        }

        public void setPendingTtl(Duration pendingTtl) {
            this.pendingTtl = pendingTtl;
        }
    }

    public static class Lock {
        private int attempts = 3;
        private Duration retryDelay = Duration.ofMillis(200);
        private Duration retryJitter = Duration.ofMillis(200);

        public int getAttempts() {
            return attempts;
        }

        public void setAttempts(int attempts) {
            this.attempts = attempts;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }

        public Duration getRetryJitter() {
            return retryJitter;
        }

        public void setRetryJitter(Duration retryJitter) {
            this.retryJitter = retryJitter;
        }
    }

    public static class Relay {
        private boolean enabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
