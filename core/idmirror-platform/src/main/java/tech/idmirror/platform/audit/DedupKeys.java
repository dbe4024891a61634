package tech.idmirror.platform.audit;

import tech.idmirror.platform.provider.RemoteAuditEvent;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Dedup keys for remote audit events.
 *
 * <p>The provider's event id when present. Otherwise a SHA-256 over organization, action,
 * raw occurrence time, actor id and target id, prefixed {@value #GENERATED_PREFIX}, so the
 * same id-less event always maps to the same key.
 */
public final class DedupKeys {

    public static final String GENERATED_PREFIX = "gen_";

    private DedupKeys() {
    }

    public static String of(String organizationId, RemoteAuditEvent remote, NormalizedAuditEvent normalized) {
        if (remote.id() != null && !remote.id().isBlank()) {
            return remote.id();
        }
        return generated(organizationId, normalized.action(), remote.occurredAt(),
            normalized.actorId(), normalized.targetId());
    }

    static String generated(String organizationId, String action, String occurredAt, String actorId, String targetId) {
        String material = String.join("\u001f",
            nullToEmpty(organizationId),
            nullToEmpty(action),
            nullToEmpty(occurredAt),
            nullToEmpty(actorId),
            nullToEmpty(targetId));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(material.getBytes(StandardCharsets.UTF_8));
            return GENERATED_PREFIX + HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
