package io.github.flameyossnowy.tabula.api.exceptions;

import io.github.flameyossnowy.tabula.api.record.RecordIdentity;
import org.jetbrains.annotations.NotNull;

public class RecordNotFoundException extends RuntimeException {
    private final String type;
    private final String id;

    public RecordNotFoundException(String type, String id) {
        super("Record not found: " + type + ':' + id);
        this.type = type;
        this.id = id;
    }

    public RecordNotFoundException(@NotNull RecordIdentity identity) {
        this(identity.type(), identity.id());
    }

    public String getType() {
        return type;
    }

    public String getId() {
        return id;
    }

    public RecordIdentity getIdentity() {
        return new RecordIdentity(type, id);
    }
}
