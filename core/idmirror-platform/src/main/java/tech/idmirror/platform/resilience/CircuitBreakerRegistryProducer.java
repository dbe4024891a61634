package tech.idmirror.platform.resilience;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.time.Clock;

/**
 * CDI producer for the process-wide {@link CircuitBreakerRegistry}.
 */
@ApplicationScoped
public class CircuitBreakerRegistryProducer {

    private static final Logger LOG = Logger.getLogger(CircuitBreakerRegistryProducer.class);

    @Inject
    CircuitBreakerConfig config;

    @Inject
    MeterRegistry meterRegistry;

    @Produces
    @Singleton
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        LOG.infof("Circuit breakers: failureThreshold=%d, recoveryTimeout=%s",
            config.failureThreshold(), config.recoveryTimeout());
        return new CircuitBreakerRegistry(
            config.failureThreshold(),
            config.recoveryTimeout(),
            Clock.systemUTC(),
            meterRegistry,
            FailureClassifier.DEFAULT);
    }
}
