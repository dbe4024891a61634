package tech.idmirror.platform.organization.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * JPA entity for the organizations table. The slug column carries a unique constraint.
 */
@Entity
@Table(name = "organizations")
public class OrganizationMirrorEntity {

    @Id
    @Column(name = "id", length = 255)
    public String id;

    @Column(name = "name", nullable = false)
    public String name;

    @Column(name = "slug", nullable = false, unique = true, length = 100)
    public String slug;

    @Column(name = "logo_url", length = 1024)
    public String logoUrl;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "settings", columnDefinition = "jsonb")
    public String settings;

    @Column(name = "billing_email")
    public String billingEmail;

    @Column(name = "stripe_customer_id")
    public String stripeCustomerId;

    @Column(name = "plan", nullable = false, length = 50)
    public String plan;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "plan_limits", columnDefinition = "jsonb")
    public String planLimits;

    @Column(name = "is_personal_workspace", nullable = false)
    public boolean personalWorkspace;

    @Column(name = "owner_user_id", length = 255)
    public String ownerUserId;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public OrganizationMirrorEntity() {
    }
}
