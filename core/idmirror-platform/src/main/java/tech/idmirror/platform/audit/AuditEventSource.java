package tech.idmirror.platform.audit;

/**
 * Where an audit event came from.
 */
public enum AuditEventSource {

    /** Pulled from the identity provider's audit feed. */
    REMOTE("remote"),

    /** Recorded directly by application code. */
    LOCAL("local");

    private final String tag;

    AuditEventSource(String tag) {
        this.tag = tag;
    }

    /**
     * Value stored in the source column and used as metric tag.
     */
    public String tag() {
        return tag;
    }

    public static AuditEventSource fromTag(String tag) {
        for (AuditEventSource source : values()) {
            if (source.tag.equalsIgnoreCase(tag)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown audit event source: " + tag);
    }
}
