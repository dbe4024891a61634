package tech.idmirror.platform.resilience;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Micrometer instruments for one circuit breaker.
 *
 * <ul>
 *   <li>{@code idmirror.circuit.state} gauge: 0 closed, 1 half-open, 2 open</li>
 *   <li>{@code idmirror.circuit.trips} counter: transitions into OPEN</li>
 *   <li>{@code idmirror.circuit.rejected} counter: calls short-circuited while open</li>
 * </ul>
 */
final class CircuitBreakerMetrics {

    static final String STATE_GAUGE = "idmirror.circuit.state";
    static final String TRIPS_COUNTER = "idmirror.circuit.trips";
    static final String REJECTED_COUNTER = "idmirror.circuit.rejected";
    static final String DEPENDENCY_TAG = "dependency";

    private final Counter trips;
    private final Counter rejected;

    CircuitBreakerMetrics(MeterRegistry registry, CircuitBreaker breaker) {
        Gauge.builder(STATE_GAUGE, breaker, b -> b.state().gaugeValue())
            .description("Circuit breaker state (0=closed, 1=half-open, 2=open)")
            .tag(DEPENDENCY_TAG, breaker.name())
            .register(registry);

        this.trips = Counter.builder(TRIPS_COUNTER)
            .description("Number of times the circuit opened")
            .tag(DEPENDENCY_TAG, breaker.name())
            .register(registry);

        this.rejected = Counter.builder(REJECTED_COUNTER)
            .description("Calls rejected while the circuit was open")
            .tag(DEPENDENCY_TAG, breaker.name())
            .register(registry);
    }

    void recordTrip() {
        trips.increment();
    }

    void recordRejected() {
        rejected.increment();
    }
}
