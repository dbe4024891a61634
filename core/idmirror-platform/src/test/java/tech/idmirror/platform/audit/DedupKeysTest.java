package tech.idmirror.platform.audit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.idmirror.platform.provider.RemoteAuditEvent;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DedupKeysTest {

    private static NormalizedAuditEvent normalized(String action, String actorId) {
        return new NormalizedAuditEvent(action, actorId, null, null, "target_1", null, null, null,
            Instant.parse("2026-03-01T10:00:00Z"), Map.of());
    }

    @Test
    @DisplayName("the provider's event id should be the key when present")
    void of_shouldUseProviderId() {
        RemoteAuditEvent remote = new RemoteAuditEvent("evt_1", "a", "2026-03-01T10:00:00Z", null, null, null, null);

        assertThat(DedupKeys.of("org_1", remote, normalized("a", "user_1"))).isEqualTo("evt_1");
    }

    @Test
    @DisplayName("id-less events should get a deterministic hash key")
    void of_shouldHashIdLessEvents() {
        RemoteAuditEvent remote = new RemoteAuditEvent(" ", "a", "2026-03-01T10:00:00Z", null, null, null, null);

        String key = DedupKeys.of("org_1", remote, normalized("a", "user_1"));

        assertThat(key).startsWith(DedupKeys.GENERATED_PREFIX).hasSize(DedupKeys.GENERATED_PREFIX.length() + 64);
        assertThat(DedupKeys.of("org_1", remote, normalized("a", "user_1"))).isEqualTo(key);
        assertThat(DedupKeys.of("org_2", remote, normalized("a", "user_1"))).isNotEqualTo(key);
        assertThat(DedupKeys.of("org_1", remote, normalized("a", "user_2"))).isNotEqualTo(key);
    }
}
