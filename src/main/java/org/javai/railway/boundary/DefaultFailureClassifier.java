package org.javai.railway.boundary;

import org.javai.railway.Failure;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLTransientException;
import java.util.concurrent.TimeoutException;

/**
 * Default classifier for common JDK exceptions.
 *
 * <p>Network, timeout and transient SQL problems become {@code ServiceUnavailable}, missing
 * files {@code NotFound}, permission problems {@code Forbidden}, and duplicates
 * {@code Conflict}. Anything else is {@code Unexpected}. The operation name becomes the
 * failure's instance.
 */
public class DefaultFailureClassifier implements FailureClassifier {

    @Override
    public Failure classify(String operation, Throwable t) {
        String detail = describe(t);

        if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
            return new Failure.ServiceUnavailable("Timeout: " + detail, "network.timeout", operation);
        }

        if (t instanceof ConnectException) {
            return new Failure.ServiceUnavailable("Connection refused: " + detail, "network.connection_refused", operation);
        }

        if (t instanceof UnknownHostException) {
            return new Failure.ServiceUnavailable("Unknown host: " + detail, "network.unknown_host", operation);
        }

        if (t instanceof TimeoutException) {
            return new Failure.ServiceUnavailable("Operation timeout: " + detail, "operation.timeout", operation);
        }

        if (t instanceof FileNotFoundException || t instanceof NoSuchFileException) {
            return new Failure.NotFound("File not found: " + detail, "io.file_not_found", operation);
        }

        if (t instanceof AccessDeniedException) {
            return new Failure.Forbidden("Access denied: " + detail, "io.access_denied", operation);
        }

        if (t instanceof FileAlreadyExistsException) {
            return new Failure.Conflict("File already exists: " + detail, "io.file_exists", operation);
        }

        if (t instanceof IOException) {
            return new Failure.ServiceUnavailable("IO error: " + detail, "io.error", operation);
        }

        if (t instanceof SQLIntegrityConstraintViolationException) {
            return new Failure.Conflict("Constraint violation: " + detail, "sql.constraint", operation);
        }

        if (t instanceof SQLTransientException) {
            return new Failure.ServiceUnavailable("SQL transient error: " + detail, "sql.transient", operation);
        }

        if (t instanceof SQLException sqlEx) {
            String sqlState = sqlEx.getSQLState();
            if (sqlState != null && sqlState.startsWith("08")) {
                // Connection exceptions
                return new Failure.ServiceUnavailable("SQL connection error: " + detail, "sql.connection", operation);
            }
            return new Failure.Unexpected("SQL error: " + detail, "sql.error", operation);
        }

        return new Failure.Unexpected(detail, "unknown." + t.getClass().getSimpleName(), operation);
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message != null && !message.isBlank() ? message : t.getClass().getName();
    }
}
