package tech.idmirror.platform.cache;

import io.quarkus.arc.lookup.LookupIfProperty;
import io.quarkus.redis.datasource.RedisDataSource;
import io.quarkus.redis.datasource.keys.KeyCommands;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.KeyScanCursor;
import io.quarkus.redis.datasource.value.ValueCommands;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed cache for multi-instance deployments.
 *
 * <p>To enable:
 * <pre>
 * quarkus.redis.hosts=redis://localhost:6379
 * idmirror.cache.type=REDIS
 * </pre>
 *
 * <p>Pattern deletes use SCAN rather than KEYS so Redis is never blocked.
 *
 * <p>Note: @Typed excludes CacheStore from bean types so only the
 * CacheStoreProducer can provide the CacheStore interface.
 */
@Singleton
@Typed(RedisCacheStore.class)
@LookupIfProperty(name = "idmirror.cache.type", stringValue = "REDIS")
public class RedisCacheStore implements CacheStore {

    private static final Logger LOG = Logger.getLogger(RedisCacheStore.class);
    private static final int SCAN_BATCH = 100;

    private final ValueCommands<String, String> values;
    private final KeyCommands<String> keys;
    private final String keyPrefix;

    @Inject
    public RedisCacheStore(RedisDataSource redis, CacheConfig config) {
        this.values = redis.value(String.class);
        this.keys = redis.key();
        this.keyPrefix = config.redis().keyPrefix();
        LOG.infof("Redis cache store ready, key prefix '%s'", keyPrefix);
    }

    private String buildKey(String key) {
        return keyPrefix + key;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(buildKey(key)));
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        values.setex(buildKey(key), Math.max(1L, ttl.toSeconds()), value);
    }

    @Override
    public boolean delete(String key) {
        return keys.del(buildKey(key)) > 0;
    }

    @Override
    public long deleteByPattern(String pattern) {
        KeyScanCursor<String> cursor = keys.scan(new KeyScanArgs().match(buildKey(pattern)).count(SCAN_BATCH));
        long removed = 0;
        while (cursor.hasNext()) {
            Set<String> batch = cursor.next();
            if (!batch.isEmpty()) {
                removed += keys.del(batch.toArray(new String[0]));
            }
        }
        LOG.debugf("Deleted %d Redis keys matching %s", removed, pattern);
        return removed;
    }
}
