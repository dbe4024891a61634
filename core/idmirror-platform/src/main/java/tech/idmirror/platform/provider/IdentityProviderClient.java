package tech.idmirror.platform.provider;

import java.util.List;

/**
 * Raw operations against the external identity provider.
 *
 * <p>Implementations throw {@link ProviderNetworkException}, {@link ProviderTimeoutException}
 * or {@link ProviderHttpException}. They know nothing about circuit breaking; callers go
 * through {@link IdentityProviderFacade}.
 */
public interface IdentityProviderClient {

    RemoteUser getUser(String userId);

    RemoteOrganization getOrganization(String organizationId);

    /**
     * List memberships filtered by user, organization or both. Either filter may be null.
     */
    List<RemoteMembership> listMemberships(String userId, String organizationId);

    RemoteOrganization createOrganization(String name);

    RemoteMembership createOrganizationMembership(String userId, String organizationId, String roleSlug);

    /**
     * @param cursor opaque cursor from a previous page, or null for the first page
     */
    RemoteAuditEventPage listAuditEvents(String organizationId, int limit, String cursor);
}
