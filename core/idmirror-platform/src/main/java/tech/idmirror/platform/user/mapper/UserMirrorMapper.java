package tech.idmirror.platform.user.mapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import tech.idmirror.platform.user.UserMirror;
import tech.idmirror.platform.user.entity.UserMirrorEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mapper between the UserMirror domain model and its JPA entity.
 */
public final class UserMirrorMapper {

    private static final Logger LOG = Logger.getLogger(UserMirrorMapper.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> SETTINGS_TYPE = new TypeReference<>() {
    };

    private UserMirrorMapper() {
    }

    public static UserMirror toDomain(UserMirrorEntity entity) {
        if (entity == null) {
            return null;
        }

        UserMirror domain = new UserMirror();
        domain.id = entity.id;
        domain.email = entity.email;
        domain.firstName = entity.firstName;
        domain.lastName = entity.lastName;
        domain.avatarUrl = entity.avatarUrl;
        domain.emailVerified = entity.emailVerified;
        domain.settings = readSettings(entity.settings);
        domain.lastLoginAt = entity.lastLoginAt;
        domain.lastLoginIp = entity.lastLoginIp;
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        return domain;
    }

    public static UserMirrorEntity toEntity(UserMirror domain) {
        if (domain == null) {
            return null;
        }

        UserMirrorEntity entity = new UserMirrorEntity();
        entity.id = domain.id;
        updateEntity(entity, domain);
        entity.createdAt = domain.createdAt;
        return entity;
    }

    /**
     * Copy mutable fields onto a managed entity. The id and createdAt are never changed.
     */
    public static void updateEntity(UserMirrorEntity entity, UserMirror domain) {
        entity.email = domain.email;
        entity.firstName = domain.firstName;
        entity.lastName = domain.lastName;
        entity.avatarUrl = domain.avatarUrl;
        entity.emailVerified = domain.emailVerified;
        entity.settings = writeSettings(domain.settings);
        entity.lastLoginAt = domain.lastLoginAt;
        entity.lastLoginIp = domain.lastLoginIp;
        entity.updatedAt = domain.updatedAt;
    }

    private static Map<String, Object> readSettings(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, SETTINGS_TYPE);
        } catch (Exception e) {
            LOG.warnf("Unreadable user settings JSON, using empty settings: %s", e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    private static String writeSettings(Map<String, Object> settings) {
        if (settings == null || settings.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(settings);
        } catch (Exception e) {
            throw new IllegalArgumentException("User settings are not serializable to JSON", e);
        }
    }
}
