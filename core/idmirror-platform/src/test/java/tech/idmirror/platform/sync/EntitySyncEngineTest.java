package tech.idmirror.platform.sync;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.idmirror.platform.cache.MirrorCacheService;
import tech.idmirror.platform.organization.OrganizationMirror;
import tech.idmirror.platform.provider.IdentityProviderClient;
import tech.idmirror.platform.provider.IdentityProviderFacade;
import tech.idmirror.platform.provider.ProviderHttpException;
import tech.idmirror.platform.provider.ProviderTimeoutException;
import tech.idmirror.platform.provider.RemoteOrganization;
import tech.idmirror.platform.provider.RemoteUser;
import tech.idmirror.platform.resilience.CircuitBreakerRegistry;
import tech.idmirror.platform.resilience.CircuitOpenException;
import tech.idmirror.platform.support.InMemoryOrganizationMirrorRepository;
import tech.idmirror.platform.support.InMemoryUserMirrorRepository;
import tech.idmirror.platform.support.InlineTransactionRunner;
import tech.idmirror.platform.support.MutableClock;
import tech.idmirror.platform.user.UserMirror;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for mirroring users and organizations.
 *
 * <p>Repositories are in-memory and raise the same constraint violations Hibernate raises on
 * PostgreSQL, so first-insert races resolve through the real retry path.
 */
@ExtendWith(MockitoExtension.class)
class EntitySyncEngineTest {

    private static final String PROVIDER = "identity-provider";

    @Mock
    IdentityProviderClient client;

    @Mock
    MirrorCacheService cache;

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private InMemoryUserMirrorRepository users;
    private InMemoryOrganizationMirrorRepository organizations;
    private InlineTransactionRunner transactions;
    private EntitySyncEngine engine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        meterRegistry = new SimpleMeterRegistry();
        users = new InMemoryUserMirrorRepository();
        organizations = new InMemoryOrganizationMirrorRepository();
        transactions = new InlineTransactionRunner();

        CircuitBreakerRegistry breakers = new CircuitBreakerRegistry(5, Duration.ofSeconds(30), clock, meterRegistry);
        IdentityProviderFacade facade = new IdentityProviderFacade(client, breakers, PROVIDER);
        ConflictRetry retry = new ConflictRetry(3, BackoffPolicy.none(), duration -> {
        });
        engine = new EntitySyncEngine(facade, users, organizations, transactions, retry, cache, meterRegistry, clock);
    }

    private static RemoteUser remoteUser(String id, String email, String firstName) {
        return new RemoteUser(id, email, firstName, "Lovelace", "https://img.test/" + id, true);
    }

    private double conflicts(String entity) {
        return meterRegistry.get(EntitySyncEngine.CONFLICTS_COUNTER).tag("entity", entity).counter().count();
    }

    private static <T> List<T> runConcurrently(int callers, Callable<T> call) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(executor.submit(call));
            }
            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    // ========================================
    // Users
    // ========================================

    @Test
    @DisplayName("syncUser should create a mirror for a new user and cache it")
    void syncUser_shouldCreateMirror_whenUnknown() {
        // Arrange
        when(client.getUser("user_1")).thenReturn(remoteUser("user_1", "ada@example.com", "Ada"));

        // Act
        UserMirror user = engine.syncUser("user_1");

        // Assert
        assertThat(user.id).isEqualTo("user_1");
        assertThat(user.email).isEqualTo("ada@example.com");
        assertThat(user.avatarUrl).isEqualTo("https://img.test/user_1");
        assertThat(user.createdAt).isEqualTo(clock.instant());
        assertThat(user.updatedAt).isEqualTo(clock.instant());
        assertThat(users.rowCount()).isEqualTo(1);
        verify(cache).putUser(user);
    }

    @Test
    @DisplayName("syncUser should refresh provider fields and keep local ones")
    void syncUser_shouldUpdateExistingMirror() {
        // Arrange
        UserMirror existing = new UserMirror();
        existing.id = "user_1";
        existing.email = "old@example.com";
        existing.settings.put("theme", "dark");
        existing.lastLoginIp = "10.0.0.1";
        existing.createdAt = Instant.parse("2025-06-01T00:00:00Z");
        existing.updatedAt = Instant.parse("2025-06-01T00:00:00Z");
        users.save(existing);
        when(client.getUser("user_1")).thenReturn(remoteUser("user_1", "new@example.com", "Ada"));

        // Act
        UserMirror user = engine.syncUser("user_1");

        // Assert
        assertThat(user.email).isEqualTo("new@example.com");
        assertThat(user.settings).containsEntry("theme", "dark");
        assertThat(user.lastLoginIp).isEqualTo("10.0.0.1");
        assertThat(user.createdAt).isEqualTo(Instant.parse("2025-06-01T00:00:00Z"));
        assertThat(user.updatedAt).isEqualTo(clock.instant());
        assertThat(users.findById("user_1")).get().extracting(u -> u.email).isEqualTo("new@example.com");
    }

    @Test
    @DisplayName("updatedAt should never move backwards")
    void syncUser_shouldKeepUpdatedAtMonotonic() {
        UserMirror existing = new UserMirror();
        existing.id = "user_1";
        existing.email = "ada@example.com";
        existing.createdAt = Instant.parse("2025-06-01T00:00:00Z");
        existing.updatedAt = Instant.parse("2026-06-01T00:00:00Z");
        users.save(existing);
        when(client.getUser("user_1")).thenReturn(remoteUser("user_1", "ada@example.com", "Ada"));

        UserMirror user = engine.syncUser("user_1");

        assertThat(user.updatedAt).isEqualTo(Instant.parse("2026-06-01T00:00:00Z"));
        assertThat(user.firstName).isEqualTo("Ada");
    }

    @Test
    @DisplayName("concurrent first syncs of one user should leave exactly one row")
    void syncUser_shouldConvergeOnOneRow_whenCallersRace() throws Exception {
        // Arrange
        int callers = 8;
        when(client.getUser("user_1")).thenReturn(remoteUser("user_1", "ada@example.com", "Ada"));
        users.holdFirstLookups(callers);

        // Act
        List<UserMirror> results = runConcurrently(callers, () -> engine.syncUser("user_1"));

        // Assert
        assertThat(results).hasSize(callers).allSatisfy(user -> {
            assertThat(user.id).isEqualTo("user_1");
            assertThat(user.email).isEqualTo("ada@example.com");
        });
        assertThat(users.rowCount()).isEqualTo(1);
        assertThat(users.successfulInserts()).isEqualTo(1);
        assertThat(conflicts("user")).isEqualTo(callers - 1);
        verify(client, times(callers)).getUser("user_1");
    }

    @Test
    @DisplayName("an open breaker should fail the sync before any write")
    void syncUser_shouldNotWrite_whenCircuitOpen() {
        // Arrange
        when(client.getUser(any())).thenThrow(new ProviderTimeoutException("slow", Duration.ofSeconds(10), null));
        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> engine.syncUser("user_1")).isInstanceOf(ProviderTimeoutException.class);
        }

        // Act / Assert
        assertThatThrownBy(() -> engine.syncUser("user_1")).isInstanceOf(CircuitOpenException.class);
        verify(client, times(5)).getUser("user_1");
        assertThat(transactions.transactions()).isZero();
        assertThat(users.rowCount()).isZero();
        verifyNoInteractions(cache);
    }

    @Test
    @DisplayName("a user unknown to the provider should not be mirrored")
    void syncUser_shouldPropagateNotFound() {
        when(client.getUser("user_missing")).thenThrow(new ProviderHttpException(404, "Not found"));

        assertThatThrownBy(() -> engine.syncUser("user_missing"))
            .isInstanceOf(ProviderHttpException.class);
        assertThat(users.rowCount()).isZero();
    }

    // ========================================
    // Organizations
    // ========================================

    @Test
    @DisplayName("parallel syncs of org_42 should produce one row with one slug")
    void syncOrganization_shouldConverge_whenCallersRace() throws Exception {
        // Arrange
        when(client.getOrganization("org_42")).thenReturn(new RemoteOrganization("org_42", "Acme"));
        organizations.holdFirstLookups(2);

        // Act
        List<OrganizationMirror> results = runConcurrently(2, () -> engine.syncOrganization("org_42"));

        // Assert
        assertThat(results).extracting(o -> o.id).containsOnly("org_42");
        assertThat(results).extracting(o -> o.slug).containsOnly("acme");
        assertThat(organizations.rowCount()).isEqualTo(1);
        assertThat(conflicts("organization")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("a taken slug should be suffixed with the end of the organization id")
    void syncOrganization_shouldDisambiguateSlug() {
        // Arrange
        OrganizationMirror other = new OrganizationMirror();
        other.id = "org_other";
        other.name = "Acme";
        other.slug = "acme";
        organizations.save(other);
        when(client.getOrganization("org_01HQX7ABC123")).thenReturn(new RemoteOrganization("org_01HQX7ABC123", "Acme"));

        // Act
        OrganizationMirror organization = engine.syncOrganization("org_01HQX7ABC123");

        // Assert
        assertThat(organization.slug).isEqualTo("acme-abc123");
        assertThat(organization.plan).isEqualTo(OrganizationMirror.DEFAULT_PLAN);
        verify(cache).putOrganization(organization);
    }

    @Test
    @DisplayName("a renamed organization should get a slug derived from the new name")
    void syncOrganization_shouldRederiveSlug_onRename() {
        OrganizationMirror existing = new OrganizationMirror();
        existing.id = "org_42";
        existing.name = "Acme";
        existing.slug = "acme";
        existing.billingEmail = "billing@acme.test";
        existing.createdAt = Instant.parse("2025-01-01T00:00:00Z");
        existing.updatedAt = Instant.parse("2025-01-01T00:00:00Z");
        organizations.save(existing);
        when(client.getOrganization("org_42")).thenReturn(new RemoteOrganization("org_42", "Acme Labs"));

        OrganizationMirror organization = engine.syncOrganization("org_42");

        assertThat(organization.name).isEqualTo("Acme Labs");
        assertThat(organization.slug).isEqualTo("acme-labs");
        assertThat(organization.billingEmail).isEqualTo("billing@acme.test");
        assertThat(organization.updatedAt).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("mirrorOrganization with an owner should mark a personal workspace")
    void mirrorOrganization_shouldMarkPersonalWorkspace() {
        OrganizationMirror organization = engine.mirrorOrganization(
            new RemoteOrganization("org_7", "Ada's Workspace"), "user_1");

        assertThat(organization.personalWorkspace).isTrue();
        assertThat(organization.ownerUserId).isEqualTo("user_1");
        assertThat(organization.slug).isEqualTo("adas-workspace");
        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("allocateSlug should keep the plain slug for its current owner")
    void allocateSlug_shouldKeepOwnSlug() {
        OrganizationMirror existing = new OrganizationMirror();
        existing.id = "org_42";
        existing.name = "Acme";
        existing.slug = "acme";
        organizations.save(existing);

        assertThat(engine.allocateSlug("Acme", "org_42")).isEqualTo("acme");
        assertThat(engine.allocateSlug("Acme", "org_99xyz1")).isEqualTo("acme-99xyz1");
    }
}
