package tech.idmirror.platform.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Organization (tenant) as returned by the identity provider.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteOrganization(
    String id,
    String name
) {
}
