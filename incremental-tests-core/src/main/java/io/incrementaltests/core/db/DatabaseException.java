package io.incrementaltests.core.db;

/**
 * A read or write against the test database failed.
 */
public class DatabaseException extends RuntimeException {

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
