package tech.idmirror.platform.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Audit event as returned by the identity provider.
 *
 * <p>{@code actor}, {@code targets} entries and {@code context} arrive in more than one
 * shape (JSON objects, maps, or typed objects from other clients), so they stay untyped
 * here and are flattened by the audit normalizer.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteAuditEvent(
    String id,
    String action,
    @JsonProperty("occurred_at") String occurredAt,
    Object actor,
    List<Object> targets,
    Object context,
    Map<String, Object> metadata
) {
}
