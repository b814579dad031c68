package org.javai.tryagain.boundary;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.util.concurrent.TimeoutException;

/**
 * Default taxonomy of common JDK exceptions: which ones are worth retrying.
 */
public final class TransientExceptions {

    private TransientExceptions() {}

    /**
     * Timeouts, refused connections, transient SQL errors and IO errors in general are
     * transient. Unknown hosts, missing files and denied access are not, nor is anything
     * outside IO, networking and SQL.
     */
    public static boolean isTransient(Throwable t) {
        // Network
        if (t instanceof SocketTimeoutException
                || t instanceof HttpTimeoutException
                || t instanceof ConnectException
                || t instanceof TimeoutException) {
            return true;
        }
        if (t instanceof UnknownHostException) {
            return false;
        }

        // File system: permanent
        if (t instanceof FileNotFoundException
                || t instanceof NoSuchFileException
                || t instanceof AccessDeniedException) {
            return false;
        }

        // General IO: assume transient unless we know otherwise
        if (t instanceof IOException) {
            return true;
        }

        if (t instanceof SQLTransientException) {
            return true;
        }
        if (t instanceof SQLException sqlEx) {
            // SQL state class 08: connection exceptions
            String sqlState = sqlEx.getSQLState();
            return sqlState != null && sqlState.startsWith("08");
        }

        return false;
    }
}
