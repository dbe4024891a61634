package tech.idmirror.platform.organization;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Local copy of a tenant whose system of record is the identity provider.
 *
 * <p>Billing and plan fields are owned locally. The slug is unique and always derived
 * from the name (see {@link Slugs}).
 */
public class OrganizationMirror {

    public static final String DEFAULT_PLAN = "free";

    public String id;

    public String name;

    public String slug;

    public String logoUrl;

    public Map<String, Object> settings = new LinkedHashMap<>();

    public String billingEmail;

    public String stripeCustomerId;

    public String plan = DEFAULT_PLAN;

    public Map<String, Object> planLimits = new LinkedHashMap<>();

    public boolean personalWorkspace;

    /**
     * Provider user id of the owner, for personal workspaces.
     */
    public String ownerUserId;

    public Instant createdAt;

    public Instant updatedAt;

    public OrganizationMirror() {
    }

    /**
     * Advance {@code updatedAt} to {@code now} unless it is already later.
     */
    public void touch(Instant now) {
        if (updatedAt == null || now.isAfter(updatedAt)) {
            updatedAt = now;
        }
    }

    public OrganizationMirror copy() {
        OrganizationMirror copy = new OrganizationMirror();
        copy.id = id;
        copy.name = name;
        copy.slug = slug;
        copy.logoUrl = logoUrl;
        copy.settings = settings != null ? new LinkedHashMap<>(settings) : new LinkedHashMap<>();
        copy.billingEmail = billingEmail;
        copy.stripeCustomerId = stripeCustomerId;
        copy.plan = plan;
        copy.planLimits = planLimits != null ? new LinkedHashMap<>(planLimits) : new LinkedHashMap<>();
        copy.personalWorkspace = personalWorkspace;
        copy.ownerUserId = ownerUserId;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        return copy;
    }
}
