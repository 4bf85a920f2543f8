package de.bsommerfeld.jwlsync.db;

import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;
import java.util.Locale;

/**
 * Classifies {@link SQLException}s raised by the SQLite driver.
 */
final class SqliteErrors {

    private SqliteErrors() {
    }

    /** {@code true} for UNIQUE and PRIMARY KEY violations. */
    static boolean isUniqueViolation(SQLException e) {
        if (e instanceof SQLiteException sqlite) {
            SQLiteErrorCode code = sqlite.getResultCode();
            if (code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE
                    || code == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY) {
                return true;
            }
        }
        String message = message(e);
        return message.contains("unique constraint failed") || message.contains("primary key constraint failed");
    }

    /** {@code true} for any constraint violation (UNIQUE, NOT NULL, CHECK, FOREIGN KEY). */
    static boolean isConstraintViolation(SQLException e) {
        return e.getErrorCode() == SQLiteErrorCode.SQLITE_CONSTRAINT.code
                || message(e).contains("constraint failed");
    }

    private static String message(SQLException e) {
        return e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
    }
}
