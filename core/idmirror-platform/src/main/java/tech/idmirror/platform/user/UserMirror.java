package tech.idmirror.platform.user;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Local copy of a user whose system of record is the identity provider.
 *
 * <p>The id is the provider's user id: externally issued and immutable. At most one mirror
 * exists per id. {@code updatedAt} never moves backwards.
 */
public class UserMirror {

    public String id;

    public String email;

    public String firstName;

    public String lastName;

    public String avatarUrl;

    public boolean emailVerified;

    /**
     * Free-form user preferences. Owned locally; never overwritten by a sync.
     */
    public Map<String, Object> settings = new LinkedHashMap<>();

    public Instant lastLoginAt;

    public String lastLoginIp;

    public Instant createdAt;

    public Instant updatedAt;

    public UserMirror() {
    }

    public String displayName() {
        StringBuilder name = new StringBuilder();
        if (firstName != null && !firstName.isBlank()) {
            name.append(firstName.trim());
        }
        if (lastName != null && !lastName.isBlank()) {
            if (name.length() > 0) {
                name.append(' ');
            }
            name.append(lastName.trim());
        }
        return name.length() > 0 ? name.toString() : email;
    }

    /**
     * Advance {@code updatedAt} to {@code now} unless it is already later.
     */
    public void touch(Instant now) {
        if (updatedAt == null || now.isAfter(updatedAt)) {
            updatedAt = now;
        }
    }

    public UserMirror copy() {
        UserMirror copy = new UserMirror();
        copy.id = id;
        copy.email = email;
        copy.firstName = firstName;
        copy.lastName = lastName;
        copy.avatarUrl = avatarUrl;
        copy.emailVerified = emailVerified;
        copy.settings = settings != null ? new LinkedHashMap<>(settings) : new LinkedHashMap<>();
        copy.lastLoginAt = lastLoginAt;
        copy.lastLoginIp = lastLoginIp;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        return copy;
    }
}
