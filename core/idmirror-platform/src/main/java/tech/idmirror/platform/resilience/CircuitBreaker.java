package tech.idmirror.platform.resilience;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.internal.CircuitBreakerStateMachine;
import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Circuit breaker for one named dependency, backed by a Resilience4j state machine.
 *
 * <p>The Resilience4j config built by {@link CircuitBreakerRegistry} gives consecutive-failure
 * semantics: a count-based window as large as the threshold that opens at a 100% failure rate,
 * and a single permitted call while half-open. Calls after the recovery timeout are let through
 * once the clock is strictly past it.
 *
 * <p>This class adds what the library does not track: time until the next probe for
 * {@link CircuitOpenException#retryAfter()}, lifetime counters for health reporting and the
 * {@code idmirror.circuit.*} meters.
 */
public final class CircuitBreaker {

    private static final Logger LOG = Logger.getLogger(CircuitBreaker.class);

    private final String name;
    private final Duration recoveryTimeout;
    private final Clock clock;
    private final io.github.resilience4j.circuitbreaker.CircuitBreaker delegate;
    private final CircuitBreakerMetrics metrics;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicLong trips = new AtomicLong();
    private final AtomicLong successfulCalls = new AtomicLong();
    private final AtomicLong failedCalls = new AtomicLong();
    private final AtomicLong rejectedCalls = new AtomicLong();
    private volatile Instant openedAt;
    private volatile Instant lastTransitionAt;

    CircuitBreaker(
            String name,
            io.github.resilience4j.circuitbreaker.CircuitBreakerConfig config,
            Duration recoveryTimeout,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.name = name;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
        this.delegate = new CircuitBreakerStateMachine(name, config, clock);
        this.metrics = meterRegistry != null ? new CircuitBreakerMetrics(meterRegistry, this) : null;
        registerListeners();
    }

    public String name() {
        return name;
    }

    public CircuitState state() {
        return toCircuitState(delegate.getState());
    }

    /**
     * Run an operation under this breaker.
     *
     * @throws CircuitOpenException if the circuit is open or a probe is already in flight
     */
    public <T> T execute(Supplier<T> operation) {
        try {
            return delegate.executeSupplier(operation);
        } catch (CallNotPermittedException e) {
            Duration retryAfter = retryAfter();
            LOG.debugf("Circuit breaker [%s] rejected call, retry after %dms", name, retryAfter.toMillis());
            throw new CircuitOpenException(name, retryAfter);
        }
    }

    /**
     * Force the breaker back to CLOSED and clear the failure counter.
     */
    public void reset() {
        delegate.reset();
        LOG.infof("Circuit breaker [%s] manually reset", name);
    }

    public CircuitBreakerStats stats() {
        return new CircuitBreakerStats(
            name, state(), consecutiveFailures.get(), trips.get(),
            successfulCalls.get(), failedCalls.get(), rejectedCalls.get(), lastTransitionAt);
    }

    private Duration retryAfter() {
        Instant opened = openedAt;
        if (state() != CircuitState.OPEN || opened == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), opened.plus(recoveryTimeout));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private void registerListeners() {
        delegate.getEventPublisher()
            .onSuccess(event -> {
                successfulCalls.incrementAndGet();
                consecutiveFailures.set(0);
            })
            .onError(event -> {
                failedCalls.incrementAndGet();
                int failures = consecutiveFailures.incrementAndGet();
                LOG.debugf("Circuit breaker [%s] failure %d: %s", name, failures, event.getThrowable().getMessage());
            })
            .onCallNotPermitted(event -> {
                rejectedCalls.incrementAndGet();
                if (metrics != null) {
                    metrics.recordRejected();
                }
            })
            .onReset(event -> consecutiveFailures.set(0))
            .onStateTransition(event -> onTransition(
                toCircuitState(event.getStateTransition().getFromState()),
                toCircuitState(event.getStateTransition().getToState())));
    }

    private void onTransition(CircuitState from, CircuitState to) {
        Instant now = clock.instant();
        lastTransitionAt = now;
        if (to == CircuitState.OPEN) {
            openedAt = now;
            trips.incrementAndGet();
            if (metrics != null) {
                metrics.recordTrip();
            }
            LOG.warnf("Circuit breaker [%s] %s -> OPEN after %d consecutive failures",
                name, from, consecutiveFailures.get());
        } else {
            if (to == CircuitState.CLOSED) {
                consecutiveFailures.set(0);
            }
            LOG.infof("Circuit breaker [%s] %s -> %s", name, from, to);
        }
    }

    private static CircuitState toCircuitState(io.github.resilience4j.circuitbreaker.CircuitBreaker.State state) {
        switch (state) {
            case OPEN:
            case FORCED_OPEN:
                return CircuitState.OPEN;
            case HALF_OPEN:
                return CircuitState.HALF_OPEN;
            default:
                return CircuitState.CLOSED;
        }
    }
}
