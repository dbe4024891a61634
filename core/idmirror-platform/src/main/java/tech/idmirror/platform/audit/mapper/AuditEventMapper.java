package tech.idmirror.platform.audit.mapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import tech.idmirror.platform.audit.AuditEventRecord;
import tech.idmirror.platform.audit.AuditEventSource;
import tech.idmirror.platform.audit.entity.AuditEventEntity;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mapper between the AuditEventRecord domain model and its JPA entity.
 */
public final class AuditEventMapper {

    private static final Logger LOG = Logger.getLogger(AuditEventMapper.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private AuditEventMapper() {
    }

    public static AuditEventRecord toDomain(AuditEventEntity entity) {
        if (entity == null) {
            return null;
        }

        AuditEventRecord domain = new AuditEventRecord();
        domain.id = entity.id;
        domain.organizationId = entity.organizationId;
        domain.actorId = entity.actorId;
        domain.actorEmail = entity.actorEmail;
        domain.action = entity.action;
        domain.targetType = entity.targetType;
        domain.targetId = entity.targetId;
        domain.targetName = entity.targetName;
        domain.ipAddress = entity.ipAddress;
        domain.userAgent = entity.userAgent;
        domain.metadata = readMetadata(entity.metadata, entity.id);
        domain.dedupKey = entity.dedupKey;
        domain.source = AuditEventSource.fromTag(entity.source);
        domain.occurredAt = entity.occurredAt;
        domain.ingestedAt = entity.ingestedAt;
        return domain;
    }

    public static AuditEventEntity toEntity(AuditEventRecord domain) {
        if (domain == null) {
            return null;
        }

        AuditEventEntity entity = new AuditEventEntity();
        entity.id = domain.id;
        entity.organizationId = domain.organizationId;
        entity.actorId = domain.actorId;
        entity.actorEmail = domain.actorEmail;
        entity.action = domain.action;
        entity.targetType = domain.targetType;
        entity.targetId = domain.targetId;
        entity.targetName = domain.targetName;
        entity.ipAddress = domain.ipAddress;
        entity.userAgent = domain.userAgent;
        entity.metadata = writeMetadata(domain.metadata);
        entity.dedupKey = domain.dedupKey;
        entity.source = domain.source != null ? domain.source.tag() : AuditEventSource.LOCAL.tag();
        entity.occurredAt = domain.occurredAt != null ? domain.occurredAt : Instant.now();
        entity.ingestedAt = domain.ingestedAt != null ? domain.ingestedAt : Instant.now();
        return entity;
    }

    private static Map<String, Object> readMetadata(String json, String id) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (Exception e) {
            LOG.warnf("Unreadable metadata on audit event %s: %s", id, e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    private static String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (Exception e) {
            throw new IllegalArgumentException("Audit metadata is not serializable to JSON", e);
        }
    }
}
