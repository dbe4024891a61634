package tech.idmirror.platform.audit;

import tech.idmirror.platform.common.Page;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Storage for audit event records. Records are only ever inserted.
 */
public interface AuditEventRepository {

    /**
     * Which of the given dedup keys already exist for the organization, in one query.
     */
    Set<String> findExistingDedupKeys(String organizationId, Collection<String> dedupKeys);

    void insert(AuditEventRecord event);

    /**
     * Insert a batch and flush once.
     */
    void insertAll(List<AuditEventRecord> events);

    /**
     * Newest first, cursor-paginated by record id.
     *
     * @param afterCursor id of the last record of the previous page, or null for the first page
     */
    Page<AuditEventRecord> findPage(String organizationId, String afterCursor, int limit);

    /**
     * Events performed by one user, newest first.
     */
    List<AuditEventRecord> findByActor(String organizationId, String actorId, int limit, int offset);

}
