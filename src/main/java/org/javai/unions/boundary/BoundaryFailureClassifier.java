package org.javai.unions.boundary;

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
import java.sql.SQLTransientException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import org.javai.unions.Failure;

/**
 * Classifies common JDK checked exceptions (IO, network, SQL) into failures for use with
 * {@link Boundary}.
 *
 * <p>File system conditions with a clear meaning map to a specific kind: a missing file is
 * {@code NotFoundError}, a denied access is {@code AuthorizationError} and an existing
 * target is {@code ConflictError}. Those failures carry the operation and the exception
 * class as metadata. Everything else becomes a general failure, whose message names the
 * operation instead.
 *
 * <p>This classifier is not meant for RuntimeExceptions; {@link Boundary} lets those
 * propagate.
 */
public class BoundaryFailureClassifier implements FailureClassifier {

    public static final String OPERATION_KEY = "operation";
    public static final String EXCEPTION_KEY = "exception";

    @Override
    public Failure classify(String operation, Throwable t) {
        // File system: specific kinds
        if (t instanceof FileNotFoundException || t instanceof NoSuchFileException) {
            return Failure.notFound("io.file_not_found", messageFor("File not found", t), metadata(operation, t));
        }

        if (t instanceof AccessDeniedException) {
            return Failure.authorization("io.access_denied", messageFor("Access denied", t), metadata(operation, t));
        }

        if (t instanceof FileAlreadyExistsException) {
            return Failure.conflict("io.file_exists", messageFor("File already exists", t), metadata(operation, t));
        }

        // Network
        if (t instanceof SocketTimeoutException) {
            return general(operation, "network.timeout", "Socket timeout", t);
        }

        if (t instanceof HttpTimeoutException) {
            return general(operation, "network.http_timeout", "HTTP timeout", t);
        }

        if (t instanceof ConnectException) {
            return general(operation, "network.connection_refused", "Connection refused", t);
        }

        if (t instanceof UnknownHostException) {
            return general(operation, "network.unknown_host", "Unknown host", t);
        }

        if (t instanceof TimeoutException) {
            return general(operation, "operation.timeout", "Operation timeout", t);
        }

        if (t instanceof IOException) {
            return general(operation, "io.io_error", "IO error", t);
        }

        // SQL
        if (t instanceof SQLTransientException) {
            return general(operation, "sql.transient", "SQL transient error", t);
        }

        if (t instanceof SQLException sqlEx) {
            return classifySqlException(operation, sqlEx);
        }

        return classifyUnknownException(operation, t);
    }

    private static Failure classifySqlException(String operation, SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null && sqlState.startsWith("08")) {
            // Connection exceptions
            return general(operation, "sql.connection", "SQL connection error", sqlEx);
        }
        if (sqlState != null && sqlState.startsWith("23")) {
            // Integrity constraint violation
            return Failure.conflict("sql.constraint", messageFor("SQL constraint violation", sqlEx),
                    metadata(operation, sqlEx));
        }
        return general(operation, "sql.error", "SQL error", sqlEx);
    }

    private static Failure classifyUnknownException(String operation, Throwable t) {
        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getName();
        return Failure.of("unknown." + t.getClass().getSimpleName(), operation + " failed: " + message);
    }

    private static Failure general(String operation, String code, String prefix, Throwable t) {
        return Failure.of(code, operation + " failed: " + messageFor(prefix, t));
    }

    private static Map<String, Object> metadata(String operation, Throwable t) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(OPERATION_KEY, operation);
        metadata.put(EXCEPTION_KEY, t.getClass().getName());
        return metadata;
    }

    private static String messageFor(String prefix, Throwable t) {
        return t.getMessage() != null ? prefix + ": " + t.getMessage() : prefix;
    }
}
