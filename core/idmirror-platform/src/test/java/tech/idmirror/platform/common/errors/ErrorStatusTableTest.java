package tech.idmirror.platform.common.errors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.idmirror.platform.resilience.CircuitOpenException;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class ErrorStatusTableTest {

    @Test
    @DisplayName("every error kind should have a status")
    void asMap_shouldCoverEveryKind() {
        assertThat(ErrorStatusTable.asMap()).containsOnlyKeys(ErrorKind.values());
    }

    @Test
    @DisplayName("statusFor should map kinds to HTTP statuses")
    void statusFor_shouldMapKinds() {
        assertThat(ErrorStatusTable.statusFor(ErrorKind.TRANSIENT_PROVIDER)).isEqualTo(503);
        assertThat(ErrorStatusTable.statusFor(ErrorKind.CIRCUIT_OPEN)).isEqualTo(503);
        assertThat(ErrorStatusTable.statusFor(ErrorKind.NOT_FOUND)).isEqualTo(404);
        assertThat(ErrorStatusTable.statusFor(ErrorKind.VALIDATION)).isEqualTo(400);
        assertThat(ErrorStatusTable.statusFor(ErrorKind.FORBIDDEN)).isEqualTo(403);
        assertThat(ErrorStatusTable.statusFor(ErrorKind.DATABASE_CONFLICT)).isEqualTo(409);
        assertThat(ErrorStatusTable.statusFor(ErrorKind.DATABASE)).isEqualTo(500);
    }

    @Test
    @DisplayName("statusFor should fall back to 500 for a missing kind")
    void statusFor_shouldReturn500_forNull() {
        assertThat(ErrorStatusTable.statusFor(null)).isEqualTo(500);
    }

    @Test
    @DisplayName("exceptions should expose their status and copy their details")
    void exception_shouldExposeStatusAndDetails() {
        CircuitOpenException open = new CircuitOpenException("identity-provider", Duration.ofSeconds(12));

        assertThat(open.httpStatus()).isEqualTo(503);
        assertThat(open.kind()).isEqualTo(ErrorKind.CIRCUIT_OPEN);
        assertThat(open.details()).containsEntry("retryAfterSeconds", 12L);
        assertThatThrownBy(() -> open.details().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }
}
