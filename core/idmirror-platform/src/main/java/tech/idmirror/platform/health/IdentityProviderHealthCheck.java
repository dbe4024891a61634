package tech.idmirror.platform.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import tech.idmirror.platform.resilience.CircuitBreakerConfig;
import tech.idmirror.platform.resilience.CircuitBreakerRegistry;
import tech.idmirror.platform.resilience.CircuitBreakerStats;
import tech.idmirror.platform.resilience.CircuitState;

/**
 * Readiness check for the identity provider.
 *
 * <p>Reports DOWN while the provider's circuit is OPEN, so the instance is taken out of the
 * load balancer instead of answering every request with a fast failure. Every known breaker
 * is listed in the response data.
 */
@ApplicationScoped
@Readiness
public class IdentityProviderHealthCheck implements HealthCheck {

    static final String NAME = "Identity provider";

    @Inject
    CircuitBreakerRegistry breakers;

    @Inject
    CircuitBreakerConfig config;

    @Override
    public HealthCheckResponse call() {
        String dependency = config.identityProviderName();
        CircuitState state = breakers.getBreakerState(dependency);

        HealthCheckResponseBuilder builder = HealthCheckResponse.builder()
            .name(NAME)
            .status(state != CircuitState.OPEN)
            .withData("dependency", dependency)
            .withData("state", state.name());

        for (CircuitBreakerStats stats : breakers.stats()) {
            builder.withData(stats.name() + ".state", stats.state().name());
            builder.withData(stats.name() + ".trips", stats.trips());
            builder.withData(stats.name() + ".consecutiveFailures", stats.consecutiveFailures());
        }

        return builder.build();
    }
}
