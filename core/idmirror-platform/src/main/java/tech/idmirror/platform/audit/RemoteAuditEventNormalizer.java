package tech.idmirror.platform.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.idmirror.platform.audit.entity.AuditEventEntity;
import tech.idmirror.platform.provider.RemoteAuditEvent;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens remote audit events into {@link NormalizedAuditEvent}.
 *
 * <p>Actor, target and context may arrive as a {@link Map}, a Jackson {@link JsonNode} or any
 * bean/record exposing {@code id}, {@code name}, {@code type}, {@code location} and
 * {@code user_agent}. All three are turned into a map first, so field extraction happens in
 * one place. Only the first target is kept. {@code context.location} carries the client IP.
 *
 * <p>Every field is fitted to its audit_events column. Free text (action, names, location,
 * user agent) is cut to the column width. Identifiers that do not fit are rejected, since a
 * shortened id would point at a different entity.
 */
@ApplicationScoped
public class RemoteAuditEventNormalizer {

    static final String UNKNOWN_ACTION = "unknown";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Inject
    public RemoteAuditEventNormalizer(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    public RemoteAuditEventNormalizer(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @throws AuditNormalizationException when a field has an unusable shape or value
     */
    public NormalizedAuditEvent normalize(RemoteAuditEvent event) {
        if (event == null) {
            throw new AuditNormalizationException("Audit event is null");
        }

        Map<String, Object> actor = asMap(event.actor(), "actor");
        Map<String, Object> target = asMap(firstTarget(event.targets()), "target");
        Map<String, Object> context = asMap(event.context(), "context");

        String actorName = text(actor, "name");
        if (actorName == null) {
            actorName = text(actor, "email");
        }

        String action = event.action() != null && !event.action().isBlank() ? event.action() : UNKNOWN_ACTION;
        identifier(event.id(), "id");

        return new NormalizedAuditEvent(
            truncate(action, AuditEventEntity.TEXT_LENGTH),
            identifier(text(actor, "id"), "actor id"),
            truncate(actorName, AuditEventEntity.TEXT_LENGTH),
            truncate(text(target, "type"), AuditEventEntity.TARGET_TYPE_LENGTH),
            identifier(text(target, "id"), "target id"),
            truncate(text(target, "name"), AuditEventEntity.TEXT_LENGTH),
            truncate(firstNonNull(text(context, "location"), text(context, "ip_address")),
                AuditEventEntity.IP_ADDRESS_LENGTH),
            truncate(firstNonNull(text(context, "user_agent"), text(context, "userAgent")),
                AuditEventEntity.USER_AGENT_LENGTH),
            parseOccurredAt(event.occurredAt()),
            event.metadata() != null ? new LinkedHashMap<>(event.metadata()) : Map.of());
    }

    private static Object firstTarget(List<Object> targets) {
        return targets == null || targets.isEmpty() ? null : targets.get(0);
    }

    @SuppressWarnings("unchecked")
    Map<String, Object> asMap(Object value, String field) {
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        if (value instanceof JsonNode && ((JsonNode) value).isNull()) {
            return Map.of();
        }
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean
                || (value instanceof JsonNode && !((JsonNode) value).isObject())) {
            throw new AuditNormalizationException("Audit event " + field + " is a scalar, expected an object");
        }
        try {
            return objectMapper.convertValue(value, Map.class);
        } catch (IllegalArgumentException e) {
            throw new AuditNormalizationException("Audit event " + field + " has an unreadable shape", e);
        }
    }

    private static String text(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Map || value instanceof Iterable) {
            return null;
        }
        String text = String.valueOf(value);
        return text.isBlank() ? null : text;
    }

    static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        int end = maxLength;
        if (Character.isHighSurrogate(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }

    private static String identifier(String value, String field) {
        if (value != null && value.length() > AuditEventEntity.ID_LENGTH) {
            throw new AuditNormalizationException("Audit event " + field + " exceeds "
                + AuditEventEntity.ID_LENGTH + " characters");
        }
        return value;
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }

    private Instant parseOccurredAt(String occurredAt) {
        if (occurredAt == null || occurredAt.isBlank()) {
            return clock.instant();
        }
        try {
            return Instant.parse(occurredAt);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(occurredAt).toInstant();
            } catch (DateTimeParseException nested) {
                throw new AuditNormalizationException("Unparseable occurred_at: " + occurredAt, nested);
            }
        }
    }
}
