package tech.idmirror.platform.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * In-process cache backed by Caffeine, with a TTL per entry.
 *
 * <p>Not shared across instances. Good for development and single-node deployments.
 *
 * <p>Note: @Typed excludes CacheStore from bean types so only the
 * CacheStoreProducer can provide the CacheStore interface.
 */
@Singleton
@Typed(InMemoryCacheStore.class)
public class InMemoryCacheStore implements CacheStore {

    private final Cache<String, Entry> cache;

    @Inject
    public InMemoryCacheStore(CacheConfig config) {
        this(config.maxSize());
    }

    public InMemoryCacheStore(long maxSize) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfter(new PerEntryExpiry())
            .build();
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = cache.getIfPresent(key);
        return entry != null ? Optional.of(entry.value) : Optional.empty();
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        cache.put(key, new Entry(value, ttl));
    }

    @Override
    public boolean delete(String key) {
        return cache.asMap().remove(key) != null;
    }

    @Override
    public long deleteByPattern(String pattern) {
        Pattern regex = globToRegex(pattern);
        List<String> matching = cache.asMap().keySet().stream()
            .filter(key -> regex.matcher(key).matches())
            .collect(Collectors.toList());
        long removed = 0;
        for (String key : matching) {
            if (cache.asMap().remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (String part : glob.split("\\*", -1)) {
            if (regex.length() > 0) {
                regex.append(".*");
            }
            regex.append(Pattern.quote(part));
        }
        return Pattern.compile(regex.toString());
    }

    private static final class Entry {
        final String value;
        final long ttlNanos;

        Entry(String value, Duration ttl) {
            this.value = value;
            this.ttlNanos = ttl.toNanos();
        }
    }

    private static final class PerEntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos;
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
