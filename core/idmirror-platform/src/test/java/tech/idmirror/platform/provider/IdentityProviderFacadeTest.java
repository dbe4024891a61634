package tech.idmirror.platform.provider;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.idmirror.platform.resilience.CircuitBreakerRegistry;
import tech.idmirror.platform.resilience.CircuitOpenException;
import tech.idmirror.platform.resilience.CircuitState;
import tech.idmirror.platform.support.MutableClock;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the breaker-guarded provider façade.
 */
@ExtendWith(MockitoExtension.class)
class IdentityProviderFacadeTest {

    private static final String PROVIDER = "identity-provider";

    @Mock
    IdentityProviderClient client;

    private CircuitBreakerRegistry breakers;
    private IdentityProviderFacade facade;

    @BeforeEach
    void setUp() {
        breakers = new CircuitBreakerRegistry(3, Duration.ofSeconds(30),
            MutableClock.startingAt("2026-01-01T00:00:00Z"), new SimpleMeterRegistry());
        facade = new IdentityProviderFacade(client, breakers, PROVIDER);
    }

    @Test
    @DisplayName("getUser should return the provider's answer while closed")
    void getUser_shouldDelegate_whenClosed() {
        // Arrange
        RemoteUser user = new RemoteUser("user_1", "ada@example.com", "Ada", "Lovelace", null, true);
        when(client.getUser("user_1")).thenReturn(user);

        // Act
        RemoteUser result = facade.getUser("user_1");

        // Assert
        assertThat(result).isEqualTo(user);
        assertThat(facade.breakerState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    @DisplayName("not-found answers should pass through without tripping the breaker")
    void getOrganization_shouldNotTrip_onNotFound() {
        when(client.getOrganization("org_missing")).thenThrow(new ProviderHttpException(404, "Not found"));

        for (int i = 0; i < 10; i++) {
            assertThatThrownBy(() -> facade.getOrganization("org_missing"))
                .isInstanceOf(ProviderHttpException.class);
        }

        assertThat(facade.breakerState()).isEqualTo(CircuitState.CLOSED);
        verify(client, times(10)).getOrganization("org_missing");
    }

    @Test
    @DisplayName("an open breaker should stop every operation from reaching the client")
    void operations_shouldShortCircuit_whenOpen() {
        // Arrange
        when(client.getUser(anyString())).thenThrow(new ProviderTimeoutException("slow", Duration.ofSeconds(10), null));
        for (int i = 0; i < 3; i++) {
            catchThrowable(() -> facade.getUser("user_1"));
        }

        // Act / Assert
        assertThatThrownBy(() -> facade.getUser("user_1")).isInstanceOf(CircuitOpenException.class);
        assertThatThrownBy(() -> facade.listMemberships("user_1", null)).isInstanceOf(CircuitOpenException.class);
        assertThatThrownBy(() -> facade.createOrganization("Acme")).isInstanceOf(CircuitOpenException.class);
        assertThatThrownBy(() -> facade.listAuditEvents("org_1", 10, null)).isInstanceOf(CircuitOpenException.class);

        verify(client, times(3)).getUser("user_1");
        verifyNoMoreInteractions(client);
        assertThat(facade.breakerState()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    @DisplayName("membership operations should share the provider breaker")
    void memberships_shouldDelegate() {
        RemoteMembership membership = new RemoteMembership("om_1", "user_1", "org_1", "admin", "active");
        when(client.listMemberships("user_1", "org_1")).thenReturn(List.of(membership));
        when(client.createOrganizationMembership("user_1", "org_1", "admin")).thenReturn(membership);

        assertThat(facade.listMemberships("user_1", "org_1")).containsExactly(membership);
        assertThat(facade.createOrganizationMembership("user_1", "org_1", "admin")).isEqualTo(membership);
        assertThat(breakers.stats()).singleElement()
            .satisfies(stats -> assertThat(stats.successfulCalls()).isEqualTo(2));
    }
}
