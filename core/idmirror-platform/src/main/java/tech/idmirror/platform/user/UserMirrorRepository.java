package tech.idmirror.platform.user;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage for user mirrors.
 *
 * <p>Write methods flush immediately so uniqueness and lock conflicts surface inside the
 * caller's transaction attempt rather than at commit.
 */
public interface UserMirrorRepository {

    Optional<UserMirror> findById(String id);

    /**
     * Read with a row-level write lock held until the enclosing transaction ends.
     */
    Optional<UserMirror> findByIdForUpdate(String id);

    List<UserMirror> findByIds(Collection<String> ids);

    void insert(UserMirror user);

    void update(UserMirror user);
}
