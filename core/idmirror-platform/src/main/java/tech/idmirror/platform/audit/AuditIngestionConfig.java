package tech.idmirror.platform.audit;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.List;
import java.util.Optional;

/**
 * Audit ingestion settings.
 *
 * <pre>
 * idmirror.audit.page-size=100
 * idmirror.audit.schedule.enabled=true
 * idmirror.audit.schedule.interval=5m
 * idmirror.audit.schedule.organizations=org_1,org_2
 * </pre>
 */
@ConfigMapping(prefix = "idmirror.audit")
public interface AuditIngestionConfig {

    /**
     * Events requested per provider page.
     */
    @WithDefault("100")
    int pageSize();

    Schedule schedule();

    interface Schedule {

        @WithDefault("false")
        boolean enabled();

        /**
         * Read by the scheduler annotation through {@code ${idmirror.audit.schedule.interval}}.
         */
        @WithDefault("5m")
        String interval();

        /**
         * Organizations pulled on every run.
         */
        Optional<List<String>> organizations();

        /**
         * Upper bound on provider pages per organization and run.
         */
        @WithDefault("10")
        int maxPages();
    }
}
