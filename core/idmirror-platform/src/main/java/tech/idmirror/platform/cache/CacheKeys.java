package tech.idmirror.platform.cache;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Builds colon-joined cache keys ({@code prefix:id[:subkey]}) so that a whole entity class
 * can be invalidated with one pattern such as {@code user:*}.
 */
public final class CacheKeys {

    public static final String USER = "user";
    public static final String ORGANIZATION = "org";
    public static final String TEAM = "team";

    public static final String SEPARATOR = ":";

    private CacheKeys() {
    }

    public static String of(String prefix, Object... segments) {
        Objects.requireNonNull(prefix, "prefix");
        StringJoiner key = new StringJoiner(SEPARATOR);
        key.add(prefix);
        for (Object segment : segments) {
            key.add(String.valueOf(segment));
        }
        return key.toString();
    }

    /**
     * Pattern matching every key under a prefix.
     */
    public static String allOf(String prefix) {
        return prefix + SEPARATOR + "*";
    }

    public static String user(String userId) {
        return of(USER, userId);
    }

    public static String organization(String organizationId) {
        return of(ORGANIZATION, organizationId);
    }

    public static String teamMembers(String organizationId) {
        return of(TEAM, organizationId, "members");
    }

    /**
     * First segment of a key, used as a metric tag.
     */
    static String prefixOf(String key) {
        int separator = key.indexOf(SEPARATOR);
        return separator > 0 ? key.substring(0, separator) : key;
    }
}
