package tech.idmirror.platform.organization;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.idmirror.platform.cache.MirrorCacheService;
import tech.idmirror.platform.common.errors.ErrorKind;
import tech.idmirror.platform.common.errors.IdMirrorException;
import tech.idmirror.platform.provider.IdentityProviderFacade;
import tech.idmirror.platform.provider.RemoteMembership;
import tech.idmirror.platform.provider.RemoteOrganization;
import tech.idmirror.platform.sync.EntitySyncEngine;
import tech.idmirror.platform.user.UserMirror;
import tech.idmirror.platform.user.UserMirrorRepository;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Organization lookups, creation and local edits on top of the mirror.
 *
 * <p>Lookups read through: cache, then local storage, then a lazy sync from the
 * identity provider.
 */
@ApplicationScoped
public class OrganizationService {

    private static final Logger LOG = Logger.getLogger(OrganizationService.class);

    static final String ADMIN_ROLE = "admin";

    private final OrganizationMirrorRepository organizations;
    private final UserMirrorRepository users;
    private final IdentityProviderFacade provider;
    private final EntitySyncEngine sync;
    private final MirrorCacheService cache;
    private final Clock clock;

    @Inject
    public OrganizationService(
            OrganizationMirrorRepository organizations,
            UserMirrorRepository users,
            IdentityProviderFacade provider,
            EntitySyncEngine sync,
            MirrorCacheService cache) {
        this(organizations, users, provider, sync, cache, Clock.systemUTC());
    }

    public OrganizationService(
            OrganizationMirrorRepository organizations,
            UserMirrorRepository users,
            IdentityProviderFacade provider,
            EntitySyncEngine sync,
            MirrorCacheService cache,
            Clock clock) {
        this.organizations = organizations;
        this.users = users;
        this.provider = provider;
        this.sync = sync;
        this.cache = cache;
        this.clock = clock;
    }

    /**
     * @throws tech.idmirror.platform.provider.ProviderException NOT_FOUND kind if the provider does not know the id
     */
    public OrganizationMirror getOrganization(String organizationId) {
        Optional<OrganizationMirror> cached = cache.getOrganization(organizationId);
        if (cached.isPresent()) {
            return cached.get();
        }

        Optional<OrganizationMirror> local = organizations.findById(organizationId);
        if (local.isPresent()) {
            cache.putOrganization(local.get());
            return local.get();
        }

        LOG.infof("Organization %s not mirrored yet, syncing", organizationId);
        return sync.syncOrganization(organizationId);
    }

    /**
     * One batch query for the mirrored ids, then a lazy sync for each missing one. Ids that
     * cannot be synced are skipped with a warning. Order follows {@code organizationIds}.
     */
    public List<OrganizationMirror> getOrganizationsByIds(Collection<String> organizationIds) {
        if (organizationIds == null || organizationIds.isEmpty()) {
            return List.of();
        }
        LinkedHashSet<String> ids = new LinkedHashSet<>(organizationIds);
        Map<String, OrganizationMirror> byId = organizations.findByIds(ids).stream()
            .collect(Collectors.toMap(o -> o.id, Function.identity(), (a, b) -> a));

        List<OrganizationMirror> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            OrganizationMirror organization = byId.get(id);
            if (organization == null) {
                try {
                    organization = sync.syncOrganization(id);
                } catch (IdMirrorException e) {
                    LOG.warnf("Skipping organization %s: %s", id, e.getMessage());
                    continue;
                }
            }
            result.add(organization);
        }
        return result;
    }

    /**
     * Create a tenant at the identity provider and mirror it right away. When a creator is
     * given, they are added as admin.
     */
    public OrganizationMirror createOrganization(String name, String creatorUserId) {
        if (name == null || name.isBlank()) {
            throw new IdMirrorException(ErrorKind.VALIDATION, "Organization name is required");
        }
        RemoteOrganization remote = provider.createOrganization(name.trim());
        if (creatorUserId != null) {
            provider.createOrganizationMembership(creatorUserId, remote.id(), ADMIN_ROLE);
        }
        OrganizationMirror organization = sync.mirrorOrganization(remote, null);
        LOG.infof("Created organization %s (%s)", organization.id, organization.name);
        return organization;
    }

    /**
     * Return the user's first organization, creating a personal workspace if they have none.
     */
    public OrganizationMirror ensureUserHasOrganization(String userId) {
        List<RemoteMembership> memberships = provider.listMemberships(userId, null);
        Optional<RemoteMembership> first = memberships.stream()
            .filter(RemoteMembership::isActive)
            .filter(m -> m.organizationId() != null)
            .findFirst();
        if (first.isPresent()) {
            return getOrganization(first.get().organizationId());
        }

        UserMirror user = users.findById(userId).orElseGet(() -> sync.syncUser(userId));
        String workspaceName = personalWorkspaceName(user);

        RemoteOrganization remote = provider.createOrganization(workspaceName);
        provider.createOrganizationMembership(userId, remote.id(), ADMIN_ROLE);
        OrganizationMirror workspace = sync.mirrorOrganization(remote, userId);
        LOG.infof("Created personal workspace %s for user %s", workspace.id, userId);
        return workspace;
    }

    static String personalWorkspaceName(UserMirror user) {
        String owner = user.firstName;
        if (owner == null || owner.isBlank()) {
            owner = user.email != null && user.email.contains("@")
                ? user.email.substring(0, user.email.indexOf('@'))
                : user.email;
        }
        if (owner == null || owner.isBlank()) {
            return "My Workspace";
        }
        return owner.trim() + "'s Workspace";
    }

    /**
     * Apply local edits. A new name re-derives the slug; settings are merged.
     */
    public OrganizationMirror updateOrganization(String organizationId, OrganizationUpdate update) {
        // Make sure a mirror exists before locking it.
        getOrganization(organizationId);

        OrganizationMirror updated = sync.write("update organization " + organizationId, () -> {
            OrganizationMirror organization = organizations.findByIdForUpdate(organizationId)
                .orElseThrow(() -> new IdMirrorException(ErrorKind.NOT_FOUND, "Organization not found",
                    Map.of("organizationId", organizationId)));
            applyUpdate(organization, update);
            organization.touch(clock.instant());
            organizations.update(organization);
            return organization;
        });

        cache.evictOrganization(organizationId);
        LOG.infof("Updated organization %s (%s)", updated.id, updated.name);
        return updated;
    }

    private void applyUpdate(OrganizationMirror organization, OrganizationUpdate update) {
        if (update.name() != null && !update.name().isBlank()
                && !Objects.equals(update.name().trim(), organization.name)) {
            organization.name = update.name().trim();
            organization.slug = sync.allocateSlug(organization.name, organization.id);
        }
        if (update.logoUrl() != null) {
            organization.logoUrl = update.logoUrl();
        }
        if (update.billingEmail() != null) {
            organization.billingEmail = update.billingEmail();
        }
        if (update.settings() != null) {
            Map<String, Object> merged = new LinkedHashMap<>(
                organization.settings != null ? organization.settings : Map.of());
            merged.putAll(update.settings());
            organization.settings = merged;
        }
    }

    /**
     * @throws IdMirrorException FORBIDDEN if the provider reports no active membership
     */
    public RemoteMembership verifyMembership(String userId, String organizationId) {
        return provider.listMemberships(userId, organizationId).stream()
            .filter(m -> organizationId.equals(m.organizationId()))
            .filter(RemoteMembership::isActive)
            .findFirst()
            .orElseThrow(() -> new IdMirrorException(ErrorKind.FORBIDDEN,
                "User is not a member of this organization",
                Map.of("userId", userId, "organizationId", organizationId)));
    }

    /**
     * Members of an organization, cached under {@code team:{orgId}:members}.
     */
    public List<RemoteMembership> listMembers(String organizationId) {
        Optional<List<RemoteMembership>> cached = cache.getTeamMembers(organizationId);
        if (cached.isPresent()) {
            return cached.get();
        }
        List<RemoteMembership> members = provider.listMemberships(null, organizationId);
        cache.putTeamMembers(organizationId, members);
        return members;
    }
}
