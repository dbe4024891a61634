package tech.idmirror.platform.audit.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * JPA entity for the audit_events table.
 */
@Entity
@Table(name = "audit_events",
    uniqueConstraints = @UniqueConstraint(name = "uq_audit_events_org_dedup", columnNames = {"organization_id", "dedup_key"}),
    indexes = {
        @Index(name = "idx_audit_events_org_occurred", columnList = "organization_id, occurred_at"),
        @Index(name = "idx_audit_events_org_actor", columnList = "organization_id, actor_id")
    })
public class AuditEventEntity {

    /** Column widths, mirrored by V1__mirror_schema.sql. */
    public static final int ID_LENGTH = 255;
    public static final int TEXT_LENGTH = 255;
    public static final int TARGET_TYPE_LENGTH = 100;
    public static final int IP_ADDRESS_LENGTH = 64;
    public static final int USER_AGENT_LENGTH = 1024;

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "organization_id", nullable = false, length = ID_LENGTH)
    public String organizationId;

    @Column(name = "actor_id", length = ID_LENGTH)
    public String actorId;

    @Column(name = "actor_email", length = TEXT_LENGTH)
    public String actorEmail;

    @Column(name = "action", nullable = false, length = TEXT_LENGTH)
    public String action;

    @Column(name = "target_type", length = TARGET_TYPE_LENGTH)
    public String targetType;

    @Column(name = "target_id", length = ID_LENGTH)
    public String targetId;

    @Column(name = "target_name", length = TEXT_LENGTH)
    public String targetName;

    @Column(name = "ip_address", length = IP_ADDRESS_LENGTH)
    public String ipAddress;

    @Column(name = "user_agent", length = USER_AGENT_LENGTH)
    public String userAgent;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    public String metadata;

    @Column(name = "dedup_key", length = ID_LENGTH)
    public String dedupKey;

    @Column(name = "source", nullable = false, length = 20)
    public String source;

    @Column(name = "occurred_at", nullable = false)
    public Instant occurredAt;

    @Column(name = "ingested_at", nullable = false)
    public Instant ingestedAt;

    public AuditEventEntity() {
    }
}
