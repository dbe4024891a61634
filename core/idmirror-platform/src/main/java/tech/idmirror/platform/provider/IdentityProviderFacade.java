package tech.idmirror.platform.provider;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.idmirror.platform.resilience.CircuitBreakerConfig;
import tech.idmirror.platform.resilience.CircuitBreakerRegistry;
import tech.idmirror.platform.resilience.CircuitState;

import java.util.List;

/**
 * Typed identity provider operations, each guarded by the provider's circuit breaker.
 *
 * <p>While the breaker is open every method throws
 * {@link tech.idmirror.platform.resilience.CircuitOpenException} immediately, without
 * touching the network. Permanent errors (404, 403, validation) pass through unchanged.
 */
@ApplicationScoped
public class IdentityProviderFacade {

    private final IdentityProviderClient client;
    private final CircuitBreakerRegistry breakers;
    private final String dependencyName;

    @Inject
    public IdentityProviderFacade(IdentityProviderClient client, CircuitBreakerRegistry breakers, CircuitBreakerConfig config) {
        this(client, breakers, config.identityProviderName());
    }

    public IdentityProviderFacade(IdentityProviderClient client, CircuitBreakerRegistry breakers, String dependencyName) {
        this.client = client;
        this.breakers = breakers;
        this.dependencyName = dependencyName;
    }

    public RemoteUser getUser(String userId) {
        return breakers.wrap(dependencyName, () -> client.getUser(userId));
    }

    public RemoteOrganization getOrganization(String organizationId) {
        return breakers.wrap(dependencyName, () -> client.getOrganization(organizationId));
    }

    public List<RemoteMembership> listMemberships(String userId, String organizationId) {
        return breakers.wrap(dependencyName, () -> client.listMemberships(userId, organizationId));
    }

    public RemoteOrganization createOrganization(String name) {
        return breakers.wrap(dependencyName, () -> client.createOrganization(name));
    }

    public RemoteMembership createOrganizationMembership(String userId, String organizationId, String roleSlug) {
        return breakers.wrap(dependencyName,
            () -> client.createOrganizationMembership(userId, organizationId, roleSlug));
    }

    public RemoteAuditEventPage listAuditEvents(String organizationId, int limit, String cursor) {
        return breakers.wrap(dependencyName, () -> client.listAuditEvents(organizationId, limit, cursor));
    }

    public String dependencyName() {
        return dependencyName;
    }

    public CircuitState breakerState() {
        return breakers.getBreakerState(dependencyName);
    }
}
