package tech.idmirror.platform.organization;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage for organization mirrors. Write methods flush immediately.
 */
public interface OrganizationMirrorRepository {

    Optional<OrganizationMirror> findById(String id);

    /**
     * Read with a row-level write lock held until the enclosing transaction ends.
     */
    Optional<OrganizationMirror> findByIdForUpdate(String id);

    List<OrganizationMirror> findByIds(Collection<String> ids);

    Optional<OrganizationMirror> findBySlug(String slug);

    void insert(OrganizationMirror organization);

    void update(OrganizationMirror organization);
}
