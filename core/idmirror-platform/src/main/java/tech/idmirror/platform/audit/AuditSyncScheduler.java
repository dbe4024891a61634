package tech.idmirror.platform.audit;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Periodically pulls the audit feed of the configured organizations.
 *
 * <p>Disabled unless {@code idmirror.audit.schedule.enabled=true}. A failing organization
 * (provider down, circuit open) is logged and the run moves on to the next one.
 */
@ApplicationScoped
public class AuditSyncScheduler {

    private static final Logger LOG = Logger.getLogger(AuditSyncScheduler.class);

    @Inject
    AuditIngestionConfig config;

    @Inject
    AuditIngestionService ingestionService;

    @Scheduled(every = "${idmirror.audit.schedule.interval:5m}",
        identity = "audit-event-sync",
        concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void syncConfiguredOrganizations() {
        if (!config.schedule().enabled()) {
            return;
        }
        runOnce();
    }

    /**
     * @return total number of new events stored across all organizations
     */
    int runOnce() {
        List<String> organizations = config.schedule().organizations().orElse(List.of());
        if (organizations.isEmpty()) {
            LOG.trace("No organizations configured for audit sync");
            return 0;
        }

        int total = 0;
        for (String organizationId : organizations) {
            try {
                total += ingestionService.syncAllEvents(organizationId, config.pageSize(), config.schedule().maxPages());
            } catch (Exception e) {
                LOG.errorf(e, "Audit sync failed for organization %s", organizationId);
            }
        }
        LOG.infof("Scheduled audit sync stored %d new events across %d organizations", total, organizations.size());
        return total;
    }
}
