package tech.idmirror.platform.audit;

import java.time.Instant;
import java.util.Map;

/**
 * Canonical flat form of a remote audit event, whatever shape its actor, target and
 * context arrived in.
 */
public record NormalizedAuditEvent(
    String action,
    String actorId,
    String actorName,
    String targetType,
    String targetId,
    String targetName,
    String ipAddress,
    String userAgent,
    Instant occurredAt,
    Map<String, Object> providerMetadata
) {
}
