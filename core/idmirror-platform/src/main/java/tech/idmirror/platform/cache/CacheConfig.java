package tech.idmirror.platform.cache;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Configuration for the cache layer.
 */
@ConfigMapping(prefix = "idmirror.cache")
public interface CacheConfig {

    /**
     * Cache backend type: MEMORY or REDIS.
     */
    @WithDefault("MEMORY")
    CacheStore.CacheType type();

    /**
     * Default time-to-live when a caller gives none.
     */
    @WithDefault("5m")
    Duration ttl();

    /**
     * Maximum number of entries (in-memory backend only).
     */
    @WithDefault("10000")
    long maxSize();

    @WithDefault("5m")
    Duration userTtl();

    @WithDefault("10m")
    Duration organizationTtl();

    @WithDefault("2m")
    Duration teamTtl();

    /**
     * Redis configuration (only used when type=REDIS).
     */
    Redis redis();

    interface Redis {
        /**
         * Prepended to every key written to Redis.
         */
        @WithDefault("idmirror:")
        String keyPrefix();
    }
}
