package tech.idmirror.platform.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User as returned by the identity provider.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteUser(
    String id,
    String email,
    @JsonProperty("first_name") String firstName,
    @JsonProperty("last_name") String lastName,
    @JsonProperty("profile_picture_url") String profilePictureUrl,
    @JsonProperty("email_verified") boolean emailVerified
) {
}
