package tech.idmirror.platform.support;

import tech.idmirror.platform.user.UserMirror;
import tech.idmirror.platform.user.UserMirrorRepository;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Users table stand-in with a primary key constraint.
 *
 * <p>{@link #holdFirstLookups(int)} makes the first N locked reads wait for each other after
 * reading, so N concurrent first-time syncs all see "no row" and race on the insert.
 */
public class InMemoryUserMirrorRepository implements UserMirrorRepository {

    private final ConcurrentMap<String, UserMirror> rows = new ConcurrentHashMap<>();
    private final AtomicInteger lookups = new AtomicInteger();
    private final AtomicInteger inserts = new AtomicInteger();
    private volatile CyclicBarrier barrier;
    private volatile int heldLookups;

    public void holdFirstLookups(int parties) {
        this.barrier = new CyclicBarrier(parties);
        this.heldLookups = parties;
    }

    @Override
    public Optional<UserMirror> findById(String id) {
        return Optional.ofNullable(rows.get(id)).map(UserMirror::copy);
    }

    @Override
    public Optional<UserMirror> findByIdForUpdate(String id) {
        Optional<UserMirror> result = findById(id);
        if (barrier != null && lookups.incrementAndGet() <= heldLookups) {
            try {
                barrier.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            } catch (BrokenBarrierException | TimeoutException e) {
                throw new IllegalStateException("Callers never met at the barrier", e);
            }
        }
        return result;
    }

    @Override
    public List<UserMirror> findByIds(Collection<String> ids) {
        return ids.stream().map(rows::get).filter(Objects::nonNull).map(UserMirror::copy).toList();
    }

    @Override
    public void insert(UserMirror user) {
        if (rows.putIfAbsent(user.id, user.copy()) != null) {
            throw Conflicts.uniqueViolation("users_pkey");
        }
        inserts.incrementAndGet();
    }

    @Override
    public void update(UserMirror user) {
        if (rows.replace(user.id, user.copy()) == null) {
            throw new IllegalStateException("User mirror " + user.id + " does not exist");
        }
    }

    public void save(UserMirror user) {
        rows.put(user.id, user.copy());
    }

    public int rowCount() {
        return rows.size();
    }

    public int successfulInserts() {
        return inserts.get();
    }
}
