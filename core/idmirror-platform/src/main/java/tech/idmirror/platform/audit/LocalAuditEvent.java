package tech.idmirror.platform.audit;

import java.time.Instant;
import java.util.Map;

/**
 * Audit event recorded by application code.
 *
 * @param occurredAt when the action happened; null means now
 */
public record LocalAuditEvent(
    String organizationId,
    String actorId,
    String actorEmail,
    String action,
    String targetType,
    String targetId,
    String targetName,
    String ipAddress,
    String userAgent,
    Map<String, Object> metadata,
    Instant occurredAt
) {

    public static LocalAuditEvent of(String organizationId, String actorId, String action) {
        return new LocalAuditEvent(organizationId, actorId, null, action,
            null, null, null, null, null, Map.of(), null);
    }
}
