package com.koni.uns.infrastructure.resilience;

import com.koni.uns.domain.exception.TransientStorageException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.TransientDataAccessException;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Retryable-error predicate of the storage retry policy.
 *
 * A failure is transient when it, or any of its causes, is a {@link TransientStorageException},
 * a Spring transient or lock-contention data access exception, or carries a message reporting
 * a locked database, a disposed context or a concurrent second operation on the same context.
 */
public class StorageErrorClassifier implements Predicate<Throwable> {

    private static final List<String> TRANSIENT_MESSAGES = List.of(
            "database is locked",
            "lock timeout",
            "deadlock",
            "disposed",
            "second operation"
    );

    private static final int MAX_CAUSE_DEPTH = 10;

    @Override
    public boolean test(Throwable throwable) {
        Throwable current = throwable;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            if (current instanceof TransientStorageException
                    || current instanceof TransientDataAccessException
                    || current instanceof PessimisticLockingFailureException) {
                return true;
            }
            if (hasTransientMessage(current.getMessage())) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    private boolean hasTransientMessage(String message) {
        if (message == null) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        return TRANSIENT_MESSAGES.stream().anyMatch(normalized::contains);
    }
}
