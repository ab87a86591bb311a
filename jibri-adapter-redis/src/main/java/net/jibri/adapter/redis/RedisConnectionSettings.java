package net.jibri.adapter.redis;

import io.lettuce.core.RedisURI;

import java.time.Duration;

/** Redis 접속 정보 → RedisURI */
public record RedisConnectionSettings(String host,
                                      int port,
                                      String username,
                                      String password,
                                      boolean ssl,
                                      int database,
                                      Duration timeout) {

    public RedisURI toUri() {
        RedisURI.Builder builder = RedisURI.builder()
                .withHost(host)
                .withPort(port)
                .withSsl(ssl)
                .withDatabase(database);
        if (timeout != null) {
            builder.withTimeout(timeout);
        }
        if (username != null && password != null) {
            builder.withAuthentication(username, password.toCharArray());
        } else if (password != null) {
            builder.withPassword(password.toCharArray());
        }
        return builder.build();
    }
}
