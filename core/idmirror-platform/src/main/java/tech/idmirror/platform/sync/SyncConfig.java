package tech.idmirror.platform.sync;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Retry settings for mirror writes.
 *
 * <pre>
 * idmirror.sync.max-attempts=3
 * idmirror.sync.base-backoff=100ms
 * </pre>
 */
@ConfigMapping(prefix = "idmirror.sync")
public interface SyncConfig {

    @WithDefault("3")
    int maxAttempts();

    /**
     * Delay after the first conflicting attempt; doubled after each further one.
     */
    @WithDefault("100ms")
    Duration baseBackoff();
}
