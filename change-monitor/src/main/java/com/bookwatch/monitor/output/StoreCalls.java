package com.bookwatch.monitor.output;

import com.bookwatch.monitor.service.TransientStoreException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Shared JDBC helpers for the stores: maps connection-level failures, including a transaction
 * that cannot be opened, to {@link TransientStoreException} so callers can retry them.
 */
final class StoreCalls {

    private StoreCalls() {
    }

    static <T> T translate(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (TransientDataAccessException | RecoverableDataAccessException
                 | DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new TransientStoreException(operation + " failed: " + e.getMessage(), e);
        }
    }

    static void run(String operation, Runnable call) {
        translate(operation, () -> {
            call.run();
            return null;
        });
    }

    static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant instant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
