package com.hailmary.exception;

import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.dao.NonTransientDataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Maps low-level failures from JDBC and Elasticsearch onto {@link SyncException}.
 */
public final class FailureClassifier {

    private FailureClassifier() {
        // utility class
    }

    /**
     * Wraps {@code failure} into a transient or configuration error for {@code sourceName}.
     * Failures that are already {@link SyncException}s are returned unchanged.
     */
    public static SyncException classify(String sourceName, String stage, Throwable failure) {
        if (failure instanceof SyncException syncException) {
            return syncException;
        }
        String message = stage + " failed for source '" + sourceName + "': " + failure.getMessage();
        if (isTransient(failure)) {
            return new TransientSyncException(sourceName, message, failure);
        }
        return new SyncConfigurationException(sourceName, message, failure);
    }

    static boolean isTransient(Throwable failure) {
        if (failure instanceof TransientDataAccessException
                || failure instanceof RecoverableDataAccessException
                || failure instanceof DataAccessResourceFailureException
                || failure instanceof QueryTimeoutException) {
            return true;
        }
        // bad SQL grammar: unknown relation or column
        if (failure instanceof InvalidDataAccessResourceUsageException) {
            return false;
        }
        if (failure instanceof NonTransientDataAccessException) {
            return false;
        }
        if (failure instanceof ElasticsearchException esException) {
            int status = esException.status();
            return status == 429 || status >= 500;
        }
        if (failure instanceof IOException || failure instanceof UncheckedIOException) {
            return true;
        }
        Throwable cause = failure.getCause();
        if (cause != null && cause != failure) {
            return isTransient(cause);
        }
        // unknown failures are retried
        return true;
    }
}
