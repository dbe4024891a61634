package tech.idmirror.platform.resilience;

/**
 * Mode of a single dependency's circuit breaker.
 *
 * <p>The gauge value is what {@code idmirror.circuit.state} reports:
 * 0 = closed, 1 = half-open, 2 = open.
 */
public enum CircuitState {
    CLOSED(0),
    HALF_OPEN(1),
    OPEN(2);

    private final int gaugeValue;

    CircuitState(int gaugeValue) {
        this.gaugeValue = gaugeValue;
    }

    public int gaugeValue() {
        return gaugeValue;
    }
}
