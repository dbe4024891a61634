package tech.idmirror.platform.user.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * JPA entity for the users table.
 */
@Entity
@Table(name = "users")
public class UserMirrorEntity {

    @Id
    @Column(name = "id", length = 255)
    public String id;

    @Column(name = "email", nullable = false)
    public String email;

    @Column(name = "first_name")
    public String firstName;

    @Column(name = "last_name")
    public String lastName;

    @Column(name = "avatar_url", length = 1024)
    public String avatarUrl;

    @Column(name = "email_verified", nullable = false)
    public boolean emailVerified;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "settings", columnDefinition = "jsonb")
    public String settings;

    @Column(name = "last_login_at")
    public Instant lastLoginAt;

    @Column(name = "last_login_ip", length = 64)
    public String lastLoginIp;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public UserMirrorEntity() {
    }
}
