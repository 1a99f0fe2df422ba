package wikidb.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Bounds of the connection pool. The pool keeps {@code poolSize} connections and opens up to
 * {@code maxOverflow} more under load; idle overflow connections are retired after {@code idleTimeout}.
 */
@Value
@Builder(toBuilder = true)
public class PoolSettings {
    public static final PoolSettings DEFAULTS = PoolSettings.builder().build();

    @Builder.Default
    int poolSize = 10;

    @Builder.Default
    int maxOverflow = 20;

    @Builder.Default
    boolean prePing = true;

    @Builder.Default
    boolean echo = true;

    @Builder.Default
    Duration connectionTimeout = Duration.ofSeconds(30);

    @Builder.Default
    Duration idleTimeout = Duration.ofMinutes(10);

    @Builder.Default
    Duration maxLifetime = Duration.ofMinutes(30);

    @Builder.Default
    String poolName = "wikidb-pool";

    public int maxConnections() {
        return poolSize + maxOverflow;
    }
}
