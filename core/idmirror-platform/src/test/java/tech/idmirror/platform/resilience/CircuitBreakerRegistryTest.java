package tech.idmirror.platform.resilience;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.idmirror.platform.provider.ProviderNetworkException;
import tech.idmirror.platform.support.MutableClock;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class CircuitBreakerRegistryTest {

    private CircuitBreakerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CircuitBreakerRegistry(2, Duration.ofSeconds(30),
            MutableClock.startingAt("2026-01-01T00:00:00Z"), new SimpleMeterRegistry());
    }

    private void fail(String dependency) {
        catchThrowable(() -> registry.wrap(dependency, () -> {
            throw new ProviderNetworkException("down", null);
        }));
    }

    @Test
    @DisplayName("getBreakerState should report CLOSED for unknown dependencies without creating one")
    void getBreakerState_shouldReportClosed_forUnknownDependency() {
        assertThat(registry.getBreakerState("never-called")).isEqualTo(CircuitState.CLOSED);
        assertThat(registry.stats()).isEmpty();
    }

    @Test
    @DisplayName("breakers should be independent per dependency name")
    void wrap_shouldKeepBreakersIndependent() {
        fail("billing");
        fail("billing");

        assertThat(registry.getBreakerState("billing")).isEqualTo(CircuitState.OPEN);
        assertThat(registry.getBreakerState("identity-provider")).isEqualTo(CircuitState.CLOSED);
        assertThat(registry.wrap("identity-provider", () -> 42)).isEqualTo(42);
    }

    @Test
    @DisplayName("run should execute side-effecting operations under the breaker")
    void run_shouldExecuteRunnable() {
        AtomicInteger counter = new AtomicInteger();

        registry.run("mailer", counter::incrementAndGet);

        assertThat(counter.get()).isEqualTo(1);
        assertThat(registry.stats()).extracting(CircuitBreakerStats::name).containsExactly("mailer");
    }

    @Test
    @DisplayName("stats should be sorted by dependency name")
    void stats_shouldBeSortedByName() {
        registry.wrap("zeta", () -> 1);
        registry.wrap("alpha", () -> 1);

        assertThat(registry.stats()).extracting(CircuitBreakerStats::name).containsExactly("alpha", "zeta");
    }

    @Test
    @DisplayName("reset should report whether a breaker existed")
    void reset_shouldReportExistence() {
        fail("billing");
        fail("billing");

        assertThat(registry.reset("billing")).isTrue();
        assertThat(registry.getBreakerState("billing")).isEqualTo(CircuitState.CLOSED);
        assertThat(registry.reset("unknown")).isFalse();
    }

    @Test
    @DisplayName("breaker should reject blank dependency names")
    void breaker_shouldRejectBlankName() {
        assertThatThrownBy(() -> registry.breaker(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
