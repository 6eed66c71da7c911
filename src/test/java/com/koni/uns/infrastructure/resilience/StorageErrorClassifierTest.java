package com.koni.uns.infrastructure.resilience;

import com.koni.uns.domain.exception.TransientStorageException;
import com.koni.uns.tags.UnitTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for StorageErrorClassifier.
 */
@UnitTest
class StorageErrorClassifierTest {

    private final StorageErrorClassifier classifier = new StorageErrorClassifier();

    @Test
    void shouldTreatTransientExceptionTypesAsRetryable() {
        assertThat(classifier.test(new TransientStorageException("busy"))).isTrue();
        assertThat(classifier.test(new QueryTimeoutException("slow"))).isTrue();
        assertThat(classifier.test(new CannotAcquireLockException("locked"))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "SQLITE_BUSY: database is locked",
            "Lock timeout exceeded",
            "Deadlock found when trying to get lock",
            "Cannot access a disposed object",
            "A second operation was started on this context"
    })
    void shouldTreatKnownTransientMessagesAsRetryable(String message) {
        assertThat(classifier.test(new IllegalStateException(message))).isTrue();
    }

    @Test
    void shouldInspectCauseChain() {
        RuntimeException wrapped = new RuntimeException("write failed", new IllegalStateException("database is locked"));

        assertThat(classifier.test(wrapped)).isTrue();
    }

    @Test
    void shouldNotRetryConstraintViolationsOrBugs() {
        assertThat(classifier.test(new DataIntegrityViolationException("duplicate key"))).isFalse();
        assertThat(classifier.test(new IllegalArgumentException("bad input"))).isFalse();
        assertThat(classifier.test(new NullPointerException())).isFalse();
    }
}
