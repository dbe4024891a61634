package tech.idmirror.platform.provider;

/**
 * Link between a user and an organization, with the role slug granted in it.
 */
public record RemoteMembership(
    String id,
    String userId,
    String organizationId,
    String role,
    String status
) {

    public boolean isActive() {
        return status == null || "active".equalsIgnoreCase(status);
    }
}
