package io.github.flameyossnowy.tabula.api.exceptions.json;

/**
 * Malformed JSON while reading a schema declaration or a wire payload.
 */
public class JsonProcessException extends RuntimeException {
    private final JsonLocation location;

    public JsonProcessException(String message, JsonLocation location) {
        super(message + " (at " + location + ')');
        this.location = location;
    }

    public JsonProcessException(String message, Throwable cause, JsonLocation location) {
        super(message + " (at " + location + ')', cause);
        this.location = location;
    }

    public JsonLocation getLocation() {
        return location;
    }
}
