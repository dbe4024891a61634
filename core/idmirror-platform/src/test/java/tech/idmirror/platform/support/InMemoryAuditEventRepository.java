package tech.idmirror.platform.support;

import org.hibernate.exception.DataException;
import tech.idmirror.platform.audit.AuditEventRecord;
import tech.idmirror.platform.audit.AuditEventRepository;
import tech.idmirror.platform.audit.entity.AuditEventEntity;
import tech.idmirror.platform.common.Page;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Audit table stand-in enforcing uniqueness of (organization_id, dedup_key) and the
 * varchar column widths.
 *
 * <p>{@link #beforeNextInsertAll(Runnable)} runs a write just before the next batch insert,
 * which is how a concurrent ingestion committing first looks from inside a transaction.
 */
public class InMemoryAuditEventRepository implements AuditEventRepository {

    private final List<AuditEventRecord> rows = new ArrayList<>();
    private Runnable beforeNextInsertAll;
    private int batches;

    public synchronized void beforeNextInsertAll(Runnable interleaved) {
        this.beforeNextInsertAll = interleaved;
    }

    @Override
    public synchronized Set<String> findExistingDedupKeys(String organizationId, Collection<String> dedupKeys) {
        return rows.stream()
            .filter(r -> organizationId.equals(r.organizationId))
            .map(r -> r.dedupKey)
            .filter(Objects::nonNull)
            .filter(dedupKeys::contains)
            .collect(Collectors.toSet());
    }

    @Override
    public synchronized void insert(AuditEventRecord event) {
        insertAll(List.of(event));
    }

    @Override
    public synchronized void insertAll(List<AuditEventRecord> events) {
        if (beforeNextInsertAll != null) {
            Runnable interleaved = beforeNextInsertAll;
            beforeNextInsertAll = null;
            interleaved.run();
        }
        events.forEach(InMemoryAuditEventRepository::checkWidths);
        Set<String> batchKeys = new HashSet<>();
        for (AuditEventRecord event : events) {
            if (event.dedupKey == null) {
                continue;
            }
            boolean exists = !batchKeys.add(event.dedupKey)
                || !findExistingDedupKeys(event.organizationId, List.of(event.dedupKey)).isEmpty();
            if (exists) {
                throw Conflicts.uniqueViolation("uq_audit_events_org_dedup");
            }
        }
        rows.addAll(events);
        batches++;
    }

    private static void checkWidths(AuditEventRecord event) {
        checkWidth(event.organizationId, AuditEventEntity.ID_LENGTH);
        checkWidth(event.actorId, AuditEventEntity.ID_LENGTH);
        checkWidth(event.actorEmail, AuditEventEntity.TEXT_LENGTH);
        checkWidth(event.action, AuditEventEntity.TEXT_LENGTH);
        checkWidth(event.targetType, AuditEventEntity.TARGET_TYPE_LENGTH);
        checkWidth(event.targetId, AuditEventEntity.ID_LENGTH);
        checkWidth(event.targetName, AuditEventEntity.TEXT_LENGTH);
        checkWidth(event.ipAddress, AuditEventEntity.IP_ADDRESS_LENGTH);
        checkWidth(event.userAgent, AuditEventEntity.USER_AGENT_LENGTH);
        checkWidth(event.dedupKey, AuditEventEntity.ID_LENGTH);
    }

    private static void checkWidth(String value, int width) {
        if (value != null && value.length() > width) {
            SQLException sql = new SQLException(
                "ERROR: value too long for type character varying(" + width + ")", "22001");
            throw new DataException("could not execute statement", sql);
        }
    }

    @Override
    public synchronized Page<AuditEventRecord> findPage(String organizationId, String afterCursor, int limit) {
        List<AuditEventRecord> newestFirst = rows.stream()
            .filter(r -> organizationId.equals(r.organizationId))
            .filter(r -> afterCursor == null || r.id.compareTo(afterCursor) < 0)
            .sorted(Comparator.comparing((AuditEventRecord r) -> r.id).reversed())
            .limit(limit + 1L)
            .collect(Collectors.toList());
        return Page.of(newestFirst, limit, r -> r.id);
    }

    @Override
    public synchronized List<AuditEventRecord> findByActor(String organizationId, String actorId, int limit, int offset) {
        return rows.stream()
            .filter(r -> organizationId.equals(r.organizationId) && Objects.equals(actorId, r.actorId))
            .sorted(Comparator.comparing((AuditEventRecord r) -> r.occurredAt).reversed())
            .skip(offset)
            .limit(limit)
            .collect(Collectors.toList());
    }

    public synchronized long countByOrganization(String organizationId) {
        return rows.stream().filter(r -> organizationId.equals(r.organizationId)).count();
    }

    public synchronized List<AuditEventRecord> all() {
        return List.copyOf(rows);
    }

    public synchronized int batches() {
        return batches;
    }
}
