package tech.idmirror.platform.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.idmirror.platform.common.errors.ErrorKind;

import static org.assertj.core.api.Assertions.*;

class ProviderHttpExceptionTest {

    @Test
    @DisplayName("server errors should be transient")
    void kindFor_shouldBeTransient_for5xx() {
        assertThat(ProviderHttpException.kindFor(500)).isEqualTo(ErrorKind.TRANSIENT_PROVIDER);
        assertThat(ProviderHttpException.kindFor(502)).isEqualTo(ErrorKind.TRANSIENT_PROVIDER);
        assertThat(new ProviderHttpException(503, "down").isTransient()).isTrue();
    }

    @Test
    @DisplayName("client errors should map to the closest permanent kind")
    void kindFor_shouldMapClientErrors() {
        assertThat(ProviderHttpException.kindFor(400)).isEqualTo(ErrorKind.VALIDATION);
        assertThat(ProviderHttpException.kindFor(422)).isEqualTo(ErrorKind.VALIDATION);
        assertThat(ProviderHttpException.kindFor(401)).isEqualTo(ErrorKind.UNAUTHORIZED);
        assertThat(ProviderHttpException.kindFor(403)).isEqualTo(ErrorKind.FORBIDDEN);
        assertThat(ProviderHttpException.kindFor(404)).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(ProviderHttpException.kindFor(409)).isEqualTo(ErrorKind.CONFLICT);
        assertThat(ProviderHttpException.kindFor(429)).isEqualTo(ErrorKind.RATE_LIMITED);
        assertThat(ProviderHttpException.kindFor(418)).isEqualTo(ErrorKind.PERMANENT_PROVIDER);
    }

    @Test
    @DisplayName("the response body should be kept in the details, truncated")
    void constructor_shouldTruncateBody() {
        ProviderHttpException e = new ProviderHttpException(404, "missing", "x".repeat(600));

        assertThat(e.statusCode()).isEqualTo(404);
        assertThat(e.httpStatus()).isEqualTo(404);
        assertThat(e.isTransient()).isFalse();
        assertThat((String) e.details().get("body")).hasSize(500);
    }
}
