package tech.idmirror.platform.provider;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Connection settings for the identity provider HTTP API.
 */
@ConfigMapping(prefix = "idmirror.provider")
public interface IdentityProviderConfig {

    @WithDefault("https://api.workos.com")
    String baseUrl();

    Optional<String> apiKey();

    /**
     * Per-request timeout. A request exceeding it counts as a breaker failure.
     */
    @WithDefault("10s")
    Duration timeout();

    @WithDefault("5s")
    Duration connectTimeout();
}
