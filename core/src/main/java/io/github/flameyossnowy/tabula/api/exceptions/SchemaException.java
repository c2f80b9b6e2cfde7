package io.github.flameyossnowy.tabula.api.exceptions;

/**
 * Malformed type registry. Raised while mappings are compiled, never inside a live transaction.
 */
public class SchemaException extends RuntimeException {
    public SchemaException(String message) {
        super(message);
    }
}
