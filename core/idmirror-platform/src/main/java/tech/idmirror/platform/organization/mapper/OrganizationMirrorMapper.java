package tech.idmirror.platform.organization.mapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import tech.idmirror.platform.organization.OrganizationMirror;
import tech.idmirror.platform.organization.entity.OrganizationMirrorEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mapper between the OrganizationMirror domain model and its JPA entity.
 */
public final class OrganizationMirrorMapper {

    private static final Logger LOG = Logger.getLogger(OrganizationMirrorMapper.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private OrganizationMirrorMapper() {
    }

    public static OrganizationMirror toDomain(OrganizationMirrorEntity entity) {
        if (entity == null) {
            return null;
        }

        OrganizationMirror domain = new OrganizationMirror();
        domain.id = entity.id;
        domain.name = entity.name;
        domain.slug = entity.slug;
        domain.logoUrl = entity.logoUrl;
        domain.settings = readMap(entity.settings, "settings");
        domain.billingEmail = entity.billingEmail;
        domain.stripeCustomerId = entity.stripeCustomerId;
        domain.plan = entity.plan != null ? entity.plan : OrganizationMirror.DEFAULT_PLAN;
        domain.planLimits = readMap(entity.planLimits, "plan_limits");
        domain.personalWorkspace = entity.personalWorkspace;
        domain.ownerUserId = entity.ownerUserId;
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        return domain;
    }

    public static OrganizationMirrorEntity toEntity(OrganizationMirror domain) {
        if (domain == null) {
            return null;
        }

        OrganizationMirrorEntity entity = new OrganizationMirrorEntity();
        entity.id = domain.id;
        updateEntity(entity, domain);
        entity.createdAt = domain.createdAt;
        return entity;
    }

    public static void updateEntity(OrganizationMirrorEntity entity, OrganizationMirror domain) {
        entity.name = domain.name;
        entity.slug = domain.slug;
        entity.logoUrl = domain.logoUrl;
        entity.settings = writeMap(domain.settings);
        entity.billingEmail = domain.billingEmail;
        entity.stripeCustomerId = domain.stripeCustomerId;
        entity.plan = domain.plan != null ? domain.plan : OrganizationMirror.DEFAULT_PLAN;
        entity.planLimits = writeMap(domain.planLimits);
        entity.personalWorkspace = domain.personalWorkspace;
        entity.ownerUserId = domain.ownerUserId;
        entity.updatedAt = domain.updatedAt;
    }

    private static Map<String, Object> readMap(String json, String column) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (Exception e) {
            LOG.warnf("Unreadable organization %s JSON, using empty map: %s", column, e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    private static String writeMap(Map<String, Object> map) {
        if (map == null || map.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(map);
        } catch (Exception e) {
            throw new IllegalArgumentException("Organization map is not serializable to JSON", e);
        }
    }
}
