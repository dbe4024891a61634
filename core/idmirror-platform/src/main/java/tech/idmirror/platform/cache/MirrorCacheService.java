package tech.idmirror.platform.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.idmirror.platform.organization.OrganizationMirror;
import tech.idmirror.platform.provider.RemoteMembership;
import tech.idmirror.platform.user.UserMirror;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Cache entries for mirrored users, organizations and team member lists.
 *
 * <p>Keys: {@code user:{id}}, {@code org:{id}}, {@code team:{orgId}:members}.
 */
@ApplicationScoped
public class MirrorCacheService {

    private static final Logger LOG = Logger.getLogger(MirrorCacheService.class);
    private static final TypeReference<List<RemoteMembership>> MEMBERS_TYPE = new TypeReference<>() {
    };

    private final CacheService cache;
    private final Duration userTtl;
    private final Duration organizationTtl;
    private final Duration teamTtl;

    @Inject
    public MirrorCacheService(CacheService cache, CacheConfig config) {
        this(cache, config.userTtl(), config.organizationTtl(), config.teamTtl());
    }

    public MirrorCacheService(CacheService cache, Duration userTtl, Duration organizationTtl, Duration teamTtl) {
        this.cache = cache;
        this.userTtl = userTtl;
        this.organizationTtl = organizationTtl;
        this.teamTtl = teamTtl;
    }

    public Optional<UserMirror> getUser(String userId) {
        return cache.get(CacheKeys.user(userId), UserMirror.class);
    }

    public void putUser(UserMirror user) {
        cache.set(CacheKeys.user(user.id), user, userTtl);
    }

    public void evictUser(String userId) {
        cache.delete(CacheKeys.user(userId));
    }

    public long evictAllUsers() {
        return cache.deleteByPattern(CacheKeys.allOf(CacheKeys.USER));
    }

    public Optional<OrganizationMirror> getOrganization(String organizationId) {
        return cache.get(CacheKeys.organization(organizationId), OrganizationMirror.class);
    }

    public void putOrganization(OrganizationMirror organization) {
        cache.set(CacheKeys.organization(organization.id), organization, organizationTtl);
    }

    public void evictOrganization(String organizationId) {
        cache.delete(CacheKeys.organization(organizationId));
        cache.delete(CacheKeys.teamMembers(organizationId));
        LOG.debugf("Evicted cached organization %s", organizationId);
    }

    public Optional<List<RemoteMembership>> getTeamMembers(String organizationId) {
        return cache.get(CacheKeys.teamMembers(organizationId), MEMBERS_TYPE);
    }

    public void putTeamMembers(String organizationId, List<RemoteMembership> members) {
        cache.set(CacheKeys.teamMembers(organizationId), members, teamTtl);
    }

    public void evictTeamMembers(String organizationId) {
        cache.delete(CacheKeys.teamMembers(organizationId));
    }
}
