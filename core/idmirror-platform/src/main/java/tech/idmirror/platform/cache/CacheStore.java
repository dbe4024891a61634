package tech.idmirror.platform.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value backend with per-entry TTL.
 *
 * <p>Supported backends:
 * <ul>
 *   <li>MEMORY - in-process Caffeine (default, single node)</li>
 *   <li>REDIS - Redis (shared across instances)</li>
 * </ul>
 *
 * <p>Configure via:
 * <pre>
 * idmirror.cache.type=MEMORY|REDIS
 * idmirror.cache.ttl=5m
 * </pre>
 *
 * <p>Backends may throw on connection or storage failures. Application code talks to
 * {@link CacheService}, which absorbs those failures.
 */
public interface CacheStore {

    /**
     * @return the stored value, or empty if absent or expired
     */
    Optional<String> get(String key);

    /**
     * Store a value, replacing any previous value for the key.
     */
    void put(String key, String value, Duration ttl);

    /**
     * @return true if an entry was removed
     */
    boolean delete(String key);

    /**
     * Remove every key matching a glob pattern where {@code *} matches any run of
     * characters, e.g. {@code user:*}.
     *
     * @return number of entries removed
     */
    long deleteByPattern(String pattern);

    enum CacheType {
        MEMORY,
        REDIS
    }
}
