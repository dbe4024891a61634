package tech.idmirror.platform.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Optional;

/**
 * Cache-aside primitives over a {@link CacheStore}, with JSON serialization.
 *
 * <p>No method ever throws. Backend and serialization failures are logged at WARN, counted,
 * and reported as a miss or a no-op, so a cache outage can never fail the caller.
 */
@ApplicationScoped
public class CacheService {

    private static final Logger LOG = Logger.getLogger(CacheService.class);

    static final String HITS = "idmirror.cache.hits";
    static final String MISSES = "idmirror.cache.misses";
    static final String ERRORS = "idmirror.cache.errors";

    private final CacheStore store;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Duration defaultTtl;

    @Inject
    public CacheService(CacheStore store, ObjectMapper objectMapper, MeterRegistry meterRegistry, CacheConfig config) {
        this(store, objectMapper, meterRegistry, config.ttl());
    }

    public CacheService(CacheStore store, ObjectMapper objectMapper, MeterRegistry meterRegistry, Duration defaultTtl) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.defaultTtl = defaultTtl;
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key, objectMapper.getTypeFactory().constructType(type));
    }

    public <T> Optional<T> get(String key, TypeReference<T> type) {
        return get(key, objectMapper.getTypeFactory().constructType(type));
    }

    private <T> Optional<T> get(String key, JavaType type) {
        String json;
        try {
            json = store.get(key).orElse(null);
        } catch (Exception e) {
            recordError("get", key, e);
            return Optional.empty();
        }

        if (json == null) {
            counter(MISSES, "prefix", CacheKeys.prefixOf(key)).increment();
            return Optional.empty();
        }

        try {
            T value = objectMapper.readValue(json, type);
            counter(HITS, "prefix", CacheKeys.prefixOf(key)).increment();
            return Optional.ofNullable(value);
        } catch (Exception e) {
            recordError("deserialize", key, e);
            // Unreadable entry (e.g. written by an older model version); drop it.
            delete(key);
            return Optional.empty();
        }
    }

    public boolean set(String key, Object value) {
        return set(key, value, defaultTtl);
    }

    /**
     * @return false if the value could not be stored
     */
    public boolean set(String key, Object value, Duration ttl) {
        try {
            store.put(key, objectMapper.writeValueAsString(value), ttl != null ? ttl : defaultTtl);
            return true;
        } catch (Exception e) {
            recordError("set", key, e);
            return false;
        }
    }

    public boolean delete(String key) {
        try {
            return store.delete(key);
        } catch (Exception e) {
            recordError("delete", key, e);
            return false;
        }
    }

    /**
     * @return number of entries removed, 0 if the backend failed
     */
    public long deleteByPattern(String pattern) {
        try {
            long removed = store.deleteByPattern(pattern);
            LOG.debugf("Invalidated %d cache entries matching %s", removed, pattern);
            return removed;
        } catch (Exception e) {
            recordError("delete_pattern", pattern, e);
            return 0;
        }
    }

    private void recordError(String operation, String key, Exception e) {
        LOG.warnf("Cache %s failed for key %s: %s", operation, key, e.getMessage());
        try {
            counter(ERRORS, "operation", operation).increment();
        } catch (RuntimeException metricsFailure) {
            LOG.debugf("Could not record cache error metric: %s", metricsFailure.getMessage());
        }
    }

    private Counter counter(String name, String tagKey, String tagValue) {
        return Counter.builder(name).tag(tagKey, tagValue).register(meterRegistry);
    }
}
