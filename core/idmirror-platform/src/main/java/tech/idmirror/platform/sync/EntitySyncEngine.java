package tech.idmirror.platform.sync;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.idmirror.platform.cache.MirrorCacheService;
import tech.idmirror.platform.organization.OrganizationMirror;
import tech.idmirror.platform.organization.OrganizationMirrorRepository;
import tech.idmirror.platform.organization.Slugs;
import tech.idmirror.platform.provider.IdentityProviderFacade;
import tech.idmirror.platform.provider.RemoteOrganization;
import tech.idmirror.platform.provider.RemoteUser;
import tech.idmirror.platform.user.UserMirror;
import tech.idmirror.platform.user.UserMirrorRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Upserts local mirrors of provider users and organizations.
 *
 * <p>The remote entity is fetched once per call, through the circuit breaker. The local write
 * then runs in its own transaction: lock the row, update it if present, insert it otherwise,
 * flush. If two callers mirror the same never-seen id at once, one insert wins and the other
 * fails with a unique violation; {@link ConflictRetry} re-runs the loser, which now finds the
 * row and completes as an update. Both callers end up with the same mirror and the table
 * never holds two rows for one id.
 *
 * <p>Successful writes refresh the cache entry for the mirror.
 */
@ApplicationScoped
public class EntitySyncEngine {

    private static final Logger LOG = Logger.getLogger(EntitySyncEngine.class);

    static final String CONFLICTS_COUNTER = "idmirror.sync.conflicts";

    private final IdentityProviderFacade provider;
    private final UserMirrorRepository users;
    private final OrganizationMirrorRepository organizations;
    private final TransactionRunner transactions;
    private final ConflictRetry retry;
    private final MirrorCacheService cache;
    private final Clock clock;
    private final Counter userConflicts;
    private final Counter organizationConflicts;

    @Inject
    public EntitySyncEngine(
            IdentityProviderFacade provider,
            UserMirrorRepository users,
            OrganizationMirrorRepository organizations,
            TransactionRunner transactions,
            ConflictRetry retry,
            MirrorCacheService cache,
            MeterRegistry meterRegistry) {
        this(provider, users, organizations, transactions, retry, cache, meterRegistry, Clock.systemUTC());
    }

    public EntitySyncEngine(
            IdentityProviderFacade provider,
            UserMirrorRepository users,
            OrganizationMirrorRepository organizations,
            TransactionRunner transactions,
            ConflictRetry retry,
            MirrorCacheService cache,
            MeterRegistry meterRegistry,
            Clock clock) {
        this.provider = provider;
        this.users = users;
        this.organizations = organizations;
        this.transactions = transactions;
        this.retry = retry;
        this.cache = cache;
        this.clock = clock;
        this.userConflicts = Counter.builder(CONFLICTS_COUNTER)
            .description("Write conflicts hit while mirroring entities")
            .tag("entity", "user")
            .register(meterRegistry);
        this.organizationConflicts = Counter.builder(CONFLICTS_COUNTER)
            .description("Write conflicts hit while mirroring entities")
            .tag("entity", "organization")
            .register(meterRegistry);
    }

    /**
     * Fetch a user from the provider and upsert its mirror.
     *
     * @throws tech.idmirror.platform.resilience.CircuitOpenException if the provider breaker is open
     * @throws tech.idmirror.platform.provider.ProviderException if the provider call fails
     * @throws DatabaseException if every write attempt conflicted
     */
    public UserMirror syncUser(String userId) {
        RemoteUser remote = provider.getUser(userId);
        return mirrorUser(remote);
    }

    /**
     * Upsert a user mirror from already-fetched provider data.
     */
    public UserMirror mirrorUser(RemoteUser remote) {
        UserMirror mirror = retry.execute("user " + remote.id(),
            () -> transactions.inNewTransaction(() -> upsertUser(remote)),
            conflict -> userConflicts.increment());
        cache.putUser(mirror);
        return mirror;
    }

    public OrganizationMirror syncOrganization(String organizationId) {
        RemoteOrganization remote = provider.getOrganization(organizationId);
        return mirrorOrganization(remote, null);
    }

    /**
     * Upsert an organization mirror from already-fetched provider data.
     *
     * @param ownerUserId when non-null, the mirror is marked as this user's personal workspace
     */
    public OrganizationMirror mirrorOrganization(RemoteOrganization remote, String ownerUserId) {
        OrganizationMirror mirror = retry.execute("organization " + remote.id(),
            () -> transactions.inNewTransaction(() -> upsertOrganization(remote, ownerUserId)),
            conflict -> organizationConflicts.increment());
        cache.putOrganization(mirror);
        return mirror;
    }

    private UserMirror upsertUser(RemoteUser remote) {
        Instant now = clock.instant();
        Optional<UserMirror> existing = users.findByIdForUpdate(remote.id());

        if (existing.isPresent()) {
            UserMirror user = existing.get();
            applyRemote(user, remote);
            user.touch(now);
            users.update(user);
            LOG.debugf("Updated user mirror %s", user.id);
            return user;
        }

        UserMirror user = new UserMirror();
        user.id = remote.id();
        applyRemote(user, remote);
        user.createdAt = now;
        user.updatedAt = now;
        users.insert(user);
        LOG.infof("Created user mirror %s (%s)", user.id, user.email);
        return user;
    }

    private static void applyRemote(UserMirror user, RemoteUser remote) {
        user.email = remote.email();
        user.firstName = remote.firstName();
        user.lastName = remote.lastName();
        user.avatarUrl = remote.profilePictureUrl();
        user.emailVerified = remote.emailVerified();
    }

    private OrganizationMirror upsertOrganization(RemoteOrganization remote, String ownerUserId) {
        Instant now = clock.instant();
        Optional<OrganizationMirror> existing = organizations.findByIdForUpdate(remote.id());

        if (existing.isPresent()) {
            OrganizationMirror organization = existing.get();
            if (!Objects.equals(remote.name(), organization.name)) {
                organization.name = remote.name();
                organization.slug = allocateSlug(remote.name(), organization.id);
            }
            if (ownerUserId != null) {
                organization.personalWorkspace = true;
                organization.ownerUserId = ownerUserId;
            }
            organization.touch(now);
            organizations.update(organization);
            LOG.debugf("Updated organization mirror %s", organization.id);
            return organization;
        }

        OrganizationMirror organization = new OrganizationMirror();
        organization.id = remote.id();
        organization.name = remote.name();
        organization.slug = allocateSlug(remote.name(), remote.id());
        organization.personalWorkspace = ownerUserId != null;
        organization.ownerUserId = ownerUserId;
        organization.createdAt = now;
        organization.updatedAt = now;
        organizations.insert(organization);
        LOG.infof("Created organization mirror %s (slug %s)", organization.id, organization.slug);
        return organization;
    }

    /**
     * Slug for {@code name}, suffixed with part of the id when another organization owns the
     * plain slug. Must run inside the write transaction.
     */
    public String allocateSlug(String name, String organizationId) {
        String base = Slugs.generate(name);
        Optional<OrganizationMirror> owner = organizations.findBySlug(base);
        if (owner.isEmpty() || owner.get().id.equals(organizationId)) {
            return base;
        }
        String slug = Slugs.disambiguate(base, organizationId);
        LOG.debugf("Slug %s taken by %s, using %s for %s", base, owner.get().id, slug, organizationId);
        return slug;
    }

    /**
     * Run a mirror write with the same conflict handling as a sync. Used for local edits of
     * mirrored rows (login tracking, organization settings).
     */
    public <T> T write(String operation, Supplier<T> work) {
        return retry.execute(operation, () -> transactions.inNewTransaction(work));
    }
}
