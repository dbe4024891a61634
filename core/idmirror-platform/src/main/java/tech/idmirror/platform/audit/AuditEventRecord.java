package tech.idmirror.platform.audit;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only audit fact, either ingested from the identity provider or recorded locally.
 *
 * <p>Remote events carry a dedup key (the provider's event id, or a derived hash when the
 * provider sent none). No two records of one organization share a dedup key. Local events
 * have none.
 */
public class AuditEventRecord {

    /** Provider event id, copied into {@link #metadata}. */
    public static final String PROVIDER_EVENT_ID = "provider_event_id";

    /** Provider-supplied metadata, nested under this key in {@link #metadata}. */
    public static final String PROVIDER_METADATA = "provider_metadata";

    public String id;

    public String organizationId;

    public String actorId;

    public String actorEmail;

    public String action;

    public String targetType;

    public String targetId;

    public String targetName;

    public String ipAddress;

    public String userAgent;

    public Map<String, Object> metadata = new LinkedHashMap<>();

    public String dedupKey;

    public AuditEventSource source;

    public Instant occurredAt;

    public Instant ingestedAt;

    public AuditEventRecord() {
    }
}
