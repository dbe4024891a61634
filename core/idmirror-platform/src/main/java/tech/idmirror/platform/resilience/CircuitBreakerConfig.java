package tech.idmirror.platform.resilience;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Configuration for the circuit breakers guarding outbound dependencies.
 *
 * <pre>
 * idmirror.circuit-breaker.failure-threshold=5
 * idmirror.circuit-breaker.recovery-timeout=30s
 * </pre>
 */
@ConfigMapping(prefix = "idmirror.circuit-breaker")
public interface CircuitBreakerConfig {

    /**
     * Consecutive breaker-countable failures that open the circuit.
     */
    @WithDefault("5")
    int failureThreshold();

    /**
     * Time the circuit stays open before a single probe call is let through.
     */
    @WithDefault("30s")
    Duration recoveryTimeout();

    /**
     * Dependency name used for every identity provider call.
     */
    @WithDefault("identity-provider")
    String identityProviderName();
}
