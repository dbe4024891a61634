package tech.idmirror.platform.audit;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.idmirror.platform.audit.entity.AuditEventEntity;
import tech.idmirror.platform.common.Page;
import tech.idmirror.platform.common.errors.ErrorKind;
import tech.idmirror.platform.common.errors.IdMirrorException;
import tech.idmirror.platform.provider.IdentityProviderFacade;
import tech.idmirror.platform.provider.RemoteAuditEvent;
import tech.idmirror.platform.provider.RemoteAuditEventPage;
import tech.idmirror.platform.shared.EntityType;
import tech.idmirror.platform.shared.TsidGenerator;
import tech.idmirror.platform.sync.ConflictRetry;
import tech.idmirror.platform.sync.TransactionRunner;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pulls the identity provider's audit feed into local storage, and records local events.
 *
 * <p>Ingestion is idempotent: every remote event gets a dedup key, keys already stored for
 * the organization are skipped, and the database enforces uniqueness on
 * (organization_id, dedup_key). A page is committed as one batch. If a concurrent ingestion
 * of the same page wins the race, the batch conflicts, rolls back and is re-run, and the
 * re-run skips what the other run stored.
 */
@ApplicationScoped
public class AuditIngestionService {

    private static final Logger LOG = Logger.getLogger(AuditIngestionService.class);

    static final String INGESTED_COUNTER = "idmirror.audit.ingested";
    static final int MAX_PAGE_SIZE = 100;

    private final IdentityProviderFacade provider;
    private final AuditEventRepository events;
    private final RemoteAuditEventNormalizer normalizer;
    private final TransactionRunner transactions;
    private final ConflictRetry retry;
    private final Clock clock;
    private final int defaultPageSize;
    private final Counter remoteIngested;
    private final Counter localIngested;

    @Inject
    public AuditIngestionService(
            IdentityProviderFacade provider,
            AuditEventRepository events,
            RemoteAuditEventNormalizer normalizer,
            TransactionRunner transactions,
            ConflictRetry retry,
            MeterRegistry meterRegistry,
            AuditIngestionConfig config) {
        this(provider, events, normalizer, transactions, retry, meterRegistry, Clock.systemUTC(), config.pageSize());
    }

    public AuditIngestionService(
            IdentityProviderFacade provider,
            AuditEventRepository events,
            RemoteAuditEventNormalizer normalizer,
            TransactionRunner transactions,
            ConflictRetry retry,
            MeterRegistry meterRegistry,
            Clock clock,
            int defaultPageSize) {
        if (defaultPageSize < 1 || defaultPageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("defaultPageSize must be between 1 and " + MAX_PAGE_SIZE);
        }
        this.provider = provider;
        this.events = events;
        this.normalizer = normalizer;
        this.transactions = transactions;
        this.retry = retry;
        this.clock = clock;
        this.defaultPageSize = defaultPageSize;
        this.remoteIngested = Counter.builder(INGESTED_COUNTER)
            .description("Audit events stored")
            .tag("source", AuditEventSource.REMOTE.tag())
            .register(meterRegistry);
        this.localIngested = Counter.builder(INGESTED_COUNTER)
            .description("Audit events stored")
            .tag("source", AuditEventSource.LOCAL.tag())
            .register(meterRegistry);
    }

    /**
     * Ingest the first page of remote events for an organization, {@code idmirror.audit.page-size}
     * events at most.
     */
    public int syncEvents(String organizationId) {
        return syncEvents(organizationId, defaultPageSize);
    }

    /**
     * Ingest the first page of remote events for an organization.
     *
     * @return number of newly stored records; 0 when the page holds only known events
     */
    public int syncEvents(String organizationId, int limit) {
        return syncPage(organizationId, limit, null).inserted();
    }

    /**
     * Follow provider cursors, ingesting up to {@code maxPages} pages.
     *
     * @return total number of newly stored records
     */
    public int syncAllEvents(String organizationId, int pageSize, int maxPages) {
        int total = 0;
        String cursor = null;
        for (int page = 0; page < maxPages; page++) {
            PageResult result = syncPage(organizationId, pageSize, cursor);
            total += result.inserted();
            if (result.nextCursor() == null) {
                break;
            }
            cursor = result.nextCursor();
        }
        LOG.infof("Audit sync for organization %s stored %d new events", organizationId, total);
        return total;
    }

    PageResult syncPage(String organizationId, int limit, String cursor) {
        requireOrganization(organizationId);
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new IdMirrorException(ErrorKind.VALIDATION, "limit must be between 1 and " + MAX_PAGE_SIZE,
                Map.of("limit", limit));
        }

        RemoteAuditEventPage page = provider.listAuditEvents(organizationId, limit, cursor);
        if (page.events().isEmpty()) {
            LOG.debugf("No audit events found for organization %s", organizationId);
            return new PageResult(0, null);
        }

        List<Candidate> candidates = normalizePage(organizationId, page.events());

        int inserted = 0;
        if (!candidates.isEmpty()) {
            inserted = retry.execute("audit page for " + organizationId,
                () -> transactions.inNewTransaction(() -> storeNew(organizationId, candidates)));
        }

        remoteIngested.increment(inserted);
        LOG.infof("Ingested %d of %d audit events for organization %s",
            inserted, page.events().size(), organizationId);
        return new PageResult(inserted, page.hasMore() ? page.nextCursor() : null);
    }

    /**
     * Normalize every event, skipping (and logging) the ones that cannot be normalized and
     * duplicates within the page.
     */
    private List<Candidate> normalizePage(String organizationId, List<RemoteAuditEvent> remoteEvents) {
        Map<String, Candidate> byKey = new LinkedHashMap<>();
        for (RemoteAuditEvent remote : remoteEvents) {
            try {
                NormalizedAuditEvent normalized = normalizer.normalize(remote);
                String dedupKey = DedupKeys.of(organizationId, remote, normalized);
                byKey.putIfAbsent(dedupKey, new Candidate(dedupKey, normalized));
            } catch (RuntimeException e) {
                LOG.warnf("Skipping audit event %s for organization %s: %s",
                    remote != null ? remote.id() : null, organizationId, e.getMessage());
            }
        }
        return new ArrayList<>(byKey.values());
    }

    private int storeNew(String organizationId, List<Candidate> candidates) {
        Set<String> existing = events.findExistingDedupKeys(organizationId,
            candidates.stream().map(Candidate::dedupKey).toList());

        Instant now = clock.instant();
        List<AuditEventRecord> batch = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (!existing.contains(candidate.dedupKey())) {
                batch.add(toRecord(organizationId, candidate, now));
            }
        }
        events.insertAll(batch);
        return batch.size();
    }

    private static AuditEventRecord toRecord(String organizationId, Candidate candidate, Instant now) {
        NormalizedAuditEvent event = candidate.event();

        AuditEventRecord record = new AuditEventRecord();
        record.id = TsidGenerator.generate(EntityType.AUDIT_EVENT);
        record.organizationId = organizationId;
        record.actorId = event.actorId();
        record.actorEmail = event.actorName();
        record.action = event.action();
        record.targetType = event.targetType();
        record.targetId = event.targetId();
        record.targetName = event.targetName();
        record.ipAddress = event.ipAddress();
        record.userAgent = event.userAgent();
        record.dedupKey = candidate.dedupKey();
        record.metadata = new LinkedHashMap<>();
        record.metadata.put(AuditEventRecord.PROVIDER_EVENT_ID, candidate.dedupKey());
        if (!event.providerMetadata().isEmpty()) {
            record.metadata.put(AuditEventRecord.PROVIDER_METADATA, event.providerMetadata());
        }
        record.source = AuditEventSource.REMOTE;
        record.occurredAt = event.occurredAt();
        record.ingestedAt = now;
        return record;
    }

    /**
     * Record an application-generated event. No dedup check: local events are unique.
     */
    public AuditEventRecord createLocalEvent(LocalAuditEvent eventData) {
        requireOrganization(eventData.organizationId());
        if (eventData.action() == null || eventData.action().isBlank()) {
            throw new IdMirrorException(ErrorKind.VALIDATION, "action is required");
        }

        Instant now = clock.instant();
        AuditEventRecord record = new AuditEventRecord();
        record.id = TsidGenerator.generate(EntityType.AUDIT_EVENT);
        record.organizationId = eventData.organizationId();
        record.actorId = eventData.actorId();
        record.actorEmail = RemoteAuditEventNormalizer.truncate(eventData.actorEmail(), AuditEventEntity.TEXT_LENGTH);
        record.action = RemoteAuditEventNormalizer.truncate(eventData.action(), AuditEventEntity.TEXT_LENGTH);
        record.targetType = RemoteAuditEventNormalizer.truncate(eventData.targetType(), AuditEventEntity.TARGET_TYPE_LENGTH);
        record.targetId = eventData.targetId();
        record.targetName = RemoteAuditEventNormalizer.truncate(eventData.targetName(), AuditEventEntity.TEXT_LENGTH);
        record.ipAddress = RemoteAuditEventNormalizer.truncate(eventData.ipAddress(), AuditEventEntity.IP_ADDRESS_LENGTH);
        record.userAgent = RemoteAuditEventNormalizer.truncate(eventData.userAgent(), AuditEventEntity.USER_AGENT_LENGTH);
        record.metadata = eventData.metadata() != null ? new LinkedHashMap<>(eventData.metadata()) : new LinkedHashMap<>();
        record.source = AuditEventSource.LOCAL;
        record.occurredAt = eventData.occurredAt() != null ? eventData.occurredAt() : now;
        record.ingestedAt = now;

        transactions.inNewTransaction(() -> {
            events.insert(record);
            return record;
        });
        localIngested.increment();
        LOG.infof("Recorded audit event %s for user %s in organization %s",
            record.action, record.actorId, record.organizationId);
        return record;
    }

    public Page<AuditEventRecord> listOrganizationEvents(String organizationId, String cursor, int limit) {
        requireOrganization(organizationId);
        return events.findPage(organizationId, cursor, clampLimit(limit));
    }

    public List<AuditEventRecord> listUserEvents(String organizationId, String userId, int limit, int offset) {
        requireOrganization(organizationId);
        return events.findByActor(organizationId, userId, clampLimit(limit), Math.max(0, offset));
    }

    private static int clampLimit(int limit) {
        return Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
    }

    private static void requireOrganization(String organizationId) {
        if (organizationId == null || organizationId.isBlank()) {
            throw new IdMirrorException(ErrorKind.VALIDATION, "organizationId is required");
        }
    }

    private record Candidate(String dedupKey, NormalizedAuditEvent event) {
    }

    record PageResult(int inserted, String nextCursor) {
    }
}
