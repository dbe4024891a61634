package tech.idmirror.platform.organization;

import java.util.Map;

/**
 * Local edits to an organization mirror. Null fields are left unchanged; settings are
 * merged into the existing map rather than replacing it.
 */
public record OrganizationUpdate(
    String name,
    String logoUrl,
    String billingEmail,
    Map<String, Object> settings
) {

    public static OrganizationUpdate rename(String name) {
        return new OrganizationUpdate(name, null, null, null);
    }
}
