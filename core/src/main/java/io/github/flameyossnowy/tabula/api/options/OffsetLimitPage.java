package io.github.flameyossnowy.tabula.api.options;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Skips {@code offset} records and keeps at most {@code limit}. Either bound may be absent.
 */
public record OffsetLimitPage(@Nullable Integer offset, @Nullable Integer limit) implements PageOption {
    public OffsetLimitPage {
        if (offset != null && offset < 0) throw new IllegalArgumentException("offset must not be negative: " + offset);
        if (limit != null && limit < 0) throw new IllegalArgumentException("limit must not be negative: " + limit);
    }

    @Override
    public @NotNull String kind() {
        return "offsetLimit";
    }
}
