package tech.idmirror.platform.organization.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import tech.idmirror.platform.organization.OrganizationMirror;
import tech.idmirror.platform.organization.OrganizationMirrorRepository;
import tech.idmirror.platform.organization.entity.OrganizationMirrorEntity;
import tech.idmirror.platform.organization.mapper.OrganizationMirrorMapper;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * EntityManager-backed implementation of OrganizationMirrorRepository.
 */
@ApplicationScoped
public class PanacheOrganizationMirrorRepository implements OrganizationMirrorRepository {

    @Inject
    EntityManager em;

    @Override
    public Optional<OrganizationMirror> findById(String id) {
        return Optional.ofNullable(OrganizationMirrorMapper.toDomain(em.find(OrganizationMirrorEntity.class, id)));
    }

    @Override
    public Optional<OrganizationMirror> findByIdForUpdate(String id) {
        return Optional.ofNullable(OrganizationMirrorMapper.toDomain(
            em.find(OrganizationMirrorEntity.class, id, LockModeType.PESSIMISTIC_WRITE)));
    }

    @Override
    public List<OrganizationMirror> findByIds(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return em.createQuery("FROM OrganizationMirrorEntity WHERE id IN :ids", OrganizationMirrorEntity.class)
            .setParameter("ids", ids)
            .getResultList()
            .stream()
            .map(OrganizationMirrorMapper::toDomain)
            .toList();
    }

    @Override
    public Optional<OrganizationMirror> findBySlug(String slug) {
        return em.createQuery("FROM OrganizationMirrorEntity WHERE slug = :slug", OrganizationMirrorEntity.class)
            .setParameter("slug", slug)
            .setMaxResults(1)
            .getResultList()
            .stream()
            .findFirst()
            .map(OrganizationMirrorMapper::toDomain);
    }

    @Override
    public void insert(OrganizationMirror organization) {
        em.persist(OrganizationMirrorMapper.toEntity(organization));
        em.flush();
    }

    @Override
    public void update(OrganizationMirror organization) {
        OrganizationMirrorEntity entity = em.find(OrganizationMirrorEntity.class, organization.id);
        if (entity == null) {
            throw new IllegalStateException("Organization mirror " + organization.id + " does not exist");
        }
        OrganizationMirrorMapper.updateEntity(entity, organization);
        em.flush();
    }
}
