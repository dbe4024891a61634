package tech.idmirror.platform.shared;

/**
 * Locally generated entity types and their 3-character ID prefixes.
 *
 * <p>User and organization mirrors are keyed by the identity provider's own ids and
 * never get a local id; only locally-owned facts do.
 *
 * <pre>
 * String id = TsidGenerator.generate(EntityType.AUDIT_EVENT);  // "aud_0HZXEQ5Y8JY5Z"
 * </pre>
 */
public enum EntityType {

    AUDIT_EVENT("aud");

    private final String prefix;

    EntityType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
