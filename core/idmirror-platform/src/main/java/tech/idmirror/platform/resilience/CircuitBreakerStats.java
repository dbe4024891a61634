package tech.idmirror.platform.resilience;

import java.time.Instant;

/**
 * Point-in-time snapshot of one circuit breaker, for health reporting.
 *
 * @param name                dependency name
 * @param state               current mode
 * @param consecutiveFailures breaker-countable failures since the last success
 * @param trips               number of transitions into OPEN since startup
 * @param successfulCalls     calls that completed normally
 * @param failedCalls         calls that failed with a breaker-countable error
 * @param rejectedCalls       calls short-circuited while open
 * @param lastTransitionAt    when the breaker last changed mode, null if never
 */
public record CircuitBreakerStats(
    String name,
    CircuitState state,
    int consecutiveFailures,
    long trips,
    long successfulCalls,
    long failedCalls,
    long rejectedCalls,
    Instant lastTransitionAt
) {

    public double failureRate() {
        long total = successfulCalls + failedCalls;
        if (total == 0) {
            return 0.0;
        }
        return (double) failedCalls / total * 100.0;
    }
}
