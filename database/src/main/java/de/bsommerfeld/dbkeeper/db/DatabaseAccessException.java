package de.bsommerfeld.dbkeeper.db;

/**
 * Unchecked wrapper for {@link java.sql.SQLException}. Statement failures are
 * programming or environment errors for every caller of this module, so they
 * are not part of method signatures.
 */
public class DatabaseAccessException extends RuntimeException {

    public DatabaseAccessException(String message, Throwable cause) {
        super(message, cause);
    }

    public DatabaseAccessException(String message) {
        super(message);
    }
}
