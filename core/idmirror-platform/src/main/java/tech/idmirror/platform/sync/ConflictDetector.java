package tech.idmirror.platform.sync;

import jakarta.persistence.EntityExistsException;
import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.OptimisticLockException;
import jakarta.persistence.PessimisticLockException;
import org.hibernate.exception.ConstraintViolationException;
import org.hibernate.exception.LockAcquisitionException;

import java.sql.SQLException;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Recognises write conflicts worth retrying: unique violations, serialization failures,
 * deadlocks and lock timeouts.
 *
 * <p>Transaction managers wrap the interesting exception several levels deep, so the whole
 * cause chain is inspected.
 */
public final class ConflictDetector {

    /** unique_violation, serialization_failure, deadlock_detected */
    private static final Set<String> CONFLICT_SQL_STATES = Set.of("23505", "40001", "40P01");

    private ConflictDetector() {
    }

    public static boolean isConflict(Throwable error) {
        Map<Throwable, Boolean> seen = new IdentityHashMap<>();
        Throwable current = error;
        while (current != null && seen.put(current, Boolean.TRUE) == null) {
            if (isConflictType(current)) {
                return true;
            }
            if (current instanceof SQLException) {
                String state = ((SQLException) current).getSQLState();
                if (state != null && CONFLICT_SQL_STATES.contains(state)) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean isConflictType(Throwable error) {
        return error instanceof ConstraintViolationException
            || error instanceof LockAcquisitionException
            || error instanceof OptimisticLockException
            || error instanceof PessimisticLockException
            || error instanceof LockTimeoutException
            || error instanceof EntityExistsException;
    }
}
