package io.github.flameyossnowy.tabula.api.exceptions;

/**
 * Raised when the underlying relational engine fails (constraint violations, connectivity).
 * The driver exception is kept as the cause and its message is carried over unchanged.
 */
public class RepositoryException extends RuntimeException {
    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(Throwable cause) {
        super(cause.getMessage(), cause);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
