package tech.idmirror.platform.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Owns one {@link CircuitBreaker} per external dependency name.
 *
 * <p>Breakers are created lazily on the first call to a dependency and live for the
 * lifetime of the registry. State is process-local; nothing is shared across instances.
 *
 * <p>Every breaker shares one Resilience4j config: a count-based window of
 * {@code failureThreshold} calls that opens only when all of them failed, so it opens on
 * exactly {@code failureThreshold} consecutive countable failures. Errors the failure
 * predicate rejects are ignored rather than recorded as successes.
 *
 * <p>Produced as a singleton by {@link CircuitBreakerRegistryProducer} and injected into
 * call sites.
 */
public class CircuitBreakerRegistry {

    private final Duration recoveryTimeout;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final io.github.resilience4j.circuitbreaker.CircuitBreakerConfig breakerConfig;

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(
            int failureThreshold,
            Duration recoveryTimeout,
            Clock clock,
            MeterRegistry meterRegistry,
            Predicate<Throwable> failurePredicate) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        Predicate<Throwable> countsAsFailure = failurePredicate != null ? failurePredicate : FailureClassifier.DEFAULT;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.breakerConfig = io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.custom()
            .slidingWindowType(SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(failureThreshold)
            .minimumNumberOfCalls(failureThreshold)
            .failureRateThreshold(100)
            // Only failures open the circuit, never slow successes.
            .slowCallDurationThreshold(Duration.ofDays(1))
            .waitDurationInOpenState(recoveryTimeout)
            .permittedNumberOfCallsInHalfOpenState(1)
            .recordException(countsAsFailure)
            .ignoreException(error -> !countsAsFailure.test(error))
            .build();
    }

    public CircuitBreakerRegistry(int failureThreshold, Duration recoveryTimeout, Clock clock, MeterRegistry meterRegistry) {
        this(failureThreshold, recoveryTimeout, clock, meterRegistry, FailureClassifier.DEFAULT);
    }

    /**
     * Invoke {@code operation} under the breaker for {@code dependencyName}.
     *
     * <p>Breaker-countable failures (network, timeout, 5xx) are counted and rethrown.
     * Other exceptions propagate unchanged and do not touch the breaker.
     *
     * @throws CircuitOpenException without invoking the operation while the circuit is open
     */
    public <T> T wrap(String dependencyName, Supplier<T> operation) {
        return breaker(dependencyName).execute(operation);
    }

    public void run(String dependencyName, Runnable operation) {
        breaker(dependencyName).execute(() -> {
            operation.run();
            return null;
        });
    }

    /**
     * Current mode for a dependency. Unknown dependencies report CLOSED without
     * creating a breaker.
     */
    public CircuitState getBreakerState(String dependencyName) {
        CircuitBreaker breaker = breakers.get(dependencyName);
        return breaker != null ? breaker.state() : CircuitState.CLOSED;
    }

    public CircuitBreaker breaker(String dependencyName) {
        if (dependencyName == null || dependencyName.isBlank()) {
            throw new IllegalArgumentException("dependencyName is required");
        }
        return breakers.computeIfAbsent(dependencyName, name -> new CircuitBreaker(
            name, breakerConfig, recoveryTimeout, clock, meterRegistry));
    }

    public List<CircuitBreakerStats> stats() {
        return breakers.values().stream()
            .map(CircuitBreaker::stats)
            .sorted(Comparator.comparing(CircuitBreakerStats::name))
            .collect(Collectors.toList());
    }

    /**
     * Force a dependency's breaker back to CLOSED.
     *
     * @return false if no breaker exists for the name
     */
    public boolean reset(String dependencyName) {
        CircuitBreaker breaker = breakers.get(dependencyName);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }
}
