package tech.idmirror.platform.user.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import tech.idmirror.platform.user.UserMirror;
import tech.idmirror.platform.user.UserMirrorRepository;
import tech.idmirror.platform.user.entity.UserMirrorEntity;
import tech.idmirror.platform.user.mapper.UserMirrorMapper;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * EntityManager-backed implementation of UserMirrorRepository.
 *
 * <p>Runs inside the caller's transaction; it never opens one of its own.
 */
@ApplicationScoped
public class PanacheUserMirrorRepository implements UserMirrorRepository {

    @Inject
    EntityManager em;

    @Override
    public Optional<UserMirror> findById(String id) {
        return Optional.ofNullable(UserMirrorMapper.toDomain(em.find(UserMirrorEntity.class, id)));
    }

    @Override
    public Optional<UserMirror> findByIdForUpdate(String id) {
        return Optional.ofNullable(UserMirrorMapper.toDomain(
            em.find(UserMirrorEntity.class, id, LockModeType.PESSIMISTIC_WRITE)));
    }

    @Override
    public List<UserMirror> findByIds(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return em.createQuery("FROM UserMirrorEntity WHERE id IN :ids", UserMirrorEntity.class)
            .setParameter("ids", ids)
            .getResultList()
            .stream()
            .map(UserMirrorMapper::toDomain)
            .toList();
    }

    @Override
    public void insert(UserMirror user) {
        em.persist(UserMirrorMapper.toEntity(user));
        em.flush();
    }

    @Override
    public void update(UserMirror user) {
        UserMirrorEntity entity = em.find(UserMirrorEntity.class, user.id);
        if (entity == null) {
            throw new IllegalStateException("User mirror " + user.id + " does not exist");
        }
        UserMirrorMapper.updateEntity(entity, user);
        em.flush();
    }
}
