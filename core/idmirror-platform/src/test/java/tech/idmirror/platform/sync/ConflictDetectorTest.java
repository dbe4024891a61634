package tech.idmirror.platform.sync;

import jakarta.persistence.OptimisticLockException;
import jakarta.persistence.PersistenceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.idmirror.platform.support.Conflicts;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.*;

class ConflictDetectorTest {

    @Test
    @DisplayName("unique violations should be conflicts, however deeply wrapped")
    void isConflict_shouldWalkCauseChain() {
        RuntimeException wrapped = new RuntimeException("commit failed",
            new PersistenceException("flush failed", Conflicts.uniqueViolation("users_pkey")));

        assertThat(ConflictDetector.isConflict(wrapped)).isTrue();
    }

    @Test
    @DisplayName("serialization failures and deadlocks should be conflicts by SQL state")
    void isConflict_shouldRecognizeSqlStates() {
        assertThat(ConflictDetector.isConflict(new PersistenceException(new SQLException("serialize", "40001")))).isTrue();
        assertThat(ConflictDetector.isConflict(new PersistenceException(new SQLException("deadlock", "40P01")))).isTrue();
        assertThat(ConflictDetector.isConflict(new PersistenceException(new SQLException("not null", "23502")))).isFalse();
    }

    @Test
    @DisplayName("lock failures should be conflicts")
    void isConflict_shouldRecognizeLockFailures() {
        assertThat(ConflictDetector.isConflict(new OptimisticLockException("stale"))).isTrue();
    }

    @Test
    @DisplayName("other errors should not be conflicts")
    void isConflict_shouldRejectOtherErrors() {
        assertThat(ConflictDetector.isConflict(new IllegalArgumentException("bad"))).isFalse();
        assertThat(ConflictDetector.isConflict(null)).isFalse();
    }
}
