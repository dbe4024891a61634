package tech.idmirror.platform.audit.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Page;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import tech.idmirror.platform.audit.AuditEventRecord;
import tech.idmirror.platform.audit.AuditEventRepository;
import tech.idmirror.platform.audit.entity.AuditEventEntity;
import tech.idmirror.platform.audit.mapper.AuditEventMapper;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Panache-based implementation of AuditEventRepository.
 */
@ApplicationScoped
public class PanacheAuditEventRepository implements AuditEventRepository, PanacheRepositoryBase<AuditEventEntity, String> {

    @Override
    public Set<String> findExistingDedupKeys(String organizationId, Collection<String> dedupKeys) {
        if (dedupKeys == null || dedupKeys.isEmpty()) {
            return Set.of();
        }
        List<String> existing = getEntityManager().createQuery(
                "SELECT e.dedupKey FROM AuditEventEntity e "
                    + "WHERE e.organizationId = :organizationId AND e.dedupKey IN :keys",
                String.class)
            .setParameter("organizationId", organizationId)
            .setParameter("keys", dedupKeys)
            .getResultList();
        return new HashSet<>(existing);
    }

    @Override
    public void insert(AuditEventRecord event) {
        persistAndFlush(AuditEventMapper.toEntity(event));
    }

    @Override
    public void insertAll(List<AuditEventRecord> events) {
        if (events.isEmpty()) {
            return;
        }
        persist(events.stream().map(AuditEventMapper::toEntity));
        flush();
    }

    @Override
    public tech.idmirror.platform.common.Page<AuditEventRecord> findPage(String organizationId, String afterCursor, int limit) {
        List<AuditEventEntity> entities;
        if (afterCursor == null || afterCursor.isBlank()) {
            entities = find("organizationId = :organizationId",
                    Sort.descending("id"),
                    Parameters.with("organizationId", organizationId))
                .page(Page.ofSize(limit + 1))
                .list();
        } else {
            entities = find("organizationId = :organizationId AND id < :cursor",
                    Sort.descending("id"),
                    Parameters.with("organizationId", organizationId).and("cursor", afterCursor))
                .page(Page.ofSize(limit + 1))
                .list();
        }

        List<AuditEventRecord> events = entities.stream()
            .map(AuditEventMapper::toDomain)
            .toList();

        return tech.idmirror.platform.common.Page.of(events, limit, event -> event.id);
    }

    @Override
    public List<AuditEventRecord> findByActor(String organizationId, String actorId, int limit, int offset) {
        return getEntityManager().createQuery(
                "FROM AuditEventEntity WHERE organizationId = :organizationId AND actorId = :actorId "
                    + "ORDER BY occurredAt DESC, id DESC",
                AuditEventEntity.class)
            .setParameter("organizationId", organizationId)
            .setParameter("actorId", actorId)
            .setFirstResult(offset)
            .setMaxResults(limit)
            .getResultList()
            .stream()
            .map(AuditEventMapper::toDomain)
            .toList();
    }
}
