package tech.idmirror.platform.user;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.idmirror.platform.cache.MirrorCacheService;
import tech.idmirror.platform.common.errors.ErrorKind;
import tech.idmirror.platform.common.errors.IdMirrorException;
import tech.idmirror.platform.sync.EntitySyncEngine;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read access to user mirrors plus login tracking.
 *
 * <p>Reads go cache first, then local storage. They never call the identity provider;
 * use {@link EntitySyncEngine#syncUser(String)} to pull a user that is not mirrored yet.
 */
@ApplicationScoped
public class UserMirrorService {

    private static final Logger LOG = Logger.getLogger(UserMirrorService.class);

    private final UserMirrorRepository users;
    private final EntitySyncEngine sync;
    private final MirrorCacheService cache;
    private final Clock clock;

    @Inject
    public UserMirrorService(UserMirrorRepository users, EntitySyncEngine sync, MirrorCacheService cache) {
        this(users, sync, cache, Clock.systemUTC());
    }

    public UserMirrorService(UserMirrorRepository users, EntitySyncEngine sync, MirrorCacheService cache, Clock clock) {
        this.users = users;
        this.sync = sync;
        this.cache = cache;
        this.clock = clock;
    }

    public Optional<UserMirror> getUser(String userId) {
        if (userId == null) {
            return Optional.empty();
        }

        Optional<UserMirror> cached = cache.getUser(userId);
        if (cached.isPresent()) {
            return cached;
        }

        Optional<UserMirror> user = users.findById(userId);
        user.ifPresent(cache::putUser);
        return user;
    }

    /**
     * Batch lookup in one query. Unknown ids are left out; order follows {@code userIds}.
     */
    public List<UserMirror> getUsersByIds(Collection<String> userIds) {
        if (userIds == null || userIds.isEmpty()) {
            return List.of();
        }
        LinkedHashSet<String> ids = new LinkedHashSet<>(userIds);
        Map<String, UserMirror> byId = users.findByIds(ids).stream()
            .collect(Collectors.toMap(u -> u.id, Function.identity(), (a, b) -> a));

        List<UserMirror> result = new ArrayList<>(byId.size());
        for (String id : ids) {
            UserMirror user = byId.get(id);
            if (user != null) {
                result.add(user);
            }
        }
        return result;
    }

    /**
     * Record a successful login. Mirrors the user first if it is not known locally.
     */
    public UserMirror recordLogin(String userId, String ipAddress) {
        UserMirror updated = sync.write("login " + userId,
            () -> users.findByIdForUpdate(userId).map(user -> applyLogin(user, ipAddress)).orElse(null));

        if (updated == null) {
            LOG.infof("Login for unmirrored user %s, syncing first", userId);
            sync.syncUser(userId);
            updated = sync.write("login " + userId, () -> applyLogin(
                users.findByIdForUpdate(userId).orElseThrow(() -> new IdMirrorException(
                    ErrorKind.NOT_FOUND, "User not found", Map.of("userId", userId))),
                ipAddress));
        }

        cache.putUser(updated);
        return updated;
    }

    private UserMirror applyLogin(UserMirror user, String ipAddress) {
        Instant now = clock.instant();
        user.lastLoginAt = now;
        user.lastLoginIp = ipAddress;
        user.touch(now);
        users.update(user);
        return user;
    }
}
