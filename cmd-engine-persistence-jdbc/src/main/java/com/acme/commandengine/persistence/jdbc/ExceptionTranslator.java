package com.acme.commandengine.persistence.jdbc;

import com.acme.commandengine.core.PermanentException;
import com.acme.commandengine.core.TransientException;
import org.slf4j.Logger;

import java.sql.SQLException;
import java.util.Locale;

/**
 * Utility class for translating SQLException to engine exceptions.
 * Determines whether an exception is permanent (non-retryable) or transient (retryable).
 */
public class ExceptionTranslator {

    private static final String UNIQUE_VIOLATION = "23505";

    private ExceptionTranslator() {
        // Utility class - no instantiation
    }

    /**
     * Translates a SQLException to either PermanentException or TransientException.
     *
     * @param originalException The SQLException that occurred
     * @param operation         Description of the operation that failed
     * @param logger            Logger for error reporting
     * @return PermanentException for non-retryable errors, TransientException for retryable ones
     */
    public static RuntimeException translateException(
            SQLException originalException, String operation, Logger logger) {

        logger.error("Database operation failed: {}", operation, originalException);

        if (isTransientError(originalException)) {
            return new TransientException(
                    String.format("Transient database error during %s: %s", operation,
                            originalException.getMessage()), originalException);
        }

        if (isPermanentError(originalException)) {
            return new PermanentException(
                    String.format("Permanent database error during %s: %s", operation,
                            originalException.getMessage()), originalException);
        }

        // Default to TransientException when in doubt
        return new TransientException(
                String.format("Database error during %s: %s", operation, originalException.getMessage()),
                originalException);
    }

    /**
     * Whether the exception reports a violated unique constraint. For the events table this means
     * another writer already appended the same revision of the aggregate.
     */
    public static boolean isUniqueViolation(SQLException exception) {
        return exception != null && UNIQUE_VIOLATION.equals(exception.getSQLState());
    }

    /**
     * Transient errors include connection failures, lock and statement timeouts, deadlocks,
     * serialization failures and pool exhaustion.
     */
    private static boolean isTransientError(SQLException exception) {
        if (exception == null) {
            return false;
        }

        String message = lowerCaseMessage(exception);
        if (message.contains("timeout") || message.contains("connection refused") ||
                message.contains("deadlock") || message.contains("lock timeout") ||
                message.contains("too many connections") || message.contains("pool exhausted")) {
            return true;
        }

        String sqlState = exception.getSQLState();
        if (sqlState != null) {
            // 08xxx - Connection Exception
            // 40xxx - Transaction Rollback
            if (sqlState.startsWith("08") || sqlState.startsWith("40")) {
                return true;
            }
            // 57P03 - Cannot connect now
            if (sqlState.equals("57P03")) {
                return true;
            }
        }

        // H2: 90008 - invalid value / timeout
        return exception.getErrorCode() == 90008;
    }

    /**
     * Permanent errors include missing tables or columns, constraint violations, syntax errors and
     * data type mismatches.
     */
    private static boolean isPermanentError(SQLException exception) {
        if (exception == null) {
            return false;
        }

        String message = lowerCaseMessage(exception);
        if (message.contains("syntax error") || message.contains("table not found") ||
                message.contains("column not found") || message.contains("does not exist") ||
                message.contains("constraint violation") || message.contains("unique constraint") ||
                message.contains("foreign key") || message.contains("type mismatch")) {
            return true;
        }

        String sqlState = exception.getSQLState();
        if (sqlState != null) {
            // 22xxx - Data Exception
            // 23xxx - Integrity Constraint Violation
            // 42xxx - Syntax Error / Access Violation
            // 3Dxxx / 3Fxxx - Invalid Catalog / Schema Name
            if (sqlState.startsWith("22") || sqlState.startsWith("23") || sqlState.startsWith("42") ||
                    sqlState.startsWith("3D") || sqlState.startsWith("3F")) {
                return true;
            }
        }

        // H2: 90002 - method only allowed for a query, 90007 - object already closed,
        // 42122 - column not found
        int errorCode = exception.getErrorCode();
        return errorCode == 90002 || errorCode == 90007 || errorCode == 42122;
    }

    private static String lowerCaseMessage(SQLException exception) {
        String message = exception.getMessage();
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }
}
