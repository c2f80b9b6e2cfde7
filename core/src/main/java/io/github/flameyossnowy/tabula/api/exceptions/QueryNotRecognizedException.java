package io.github.flameyossnowy.tabula.api.exceptions;

/**
 * Raised for a filter, sort or page specifier the query pipeline does not implement.
 * No partial result is ever produced once this is thrown.
 */
public class QueryNotRecognizedException extends RuntimeException {
    private final transient Object specifier;

    public QueryNotRecognizedException(String message, Object specifier) {
        super(message + ": " + specifier);
        this.specifier = specifier;
    }

    public Object getSpecifier() {
        return specifier;
    }
}
