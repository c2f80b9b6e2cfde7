package io.github.flameyossnowy.tabula.api.options;

import org.jetbrains.annotations.NotNull;

/**
 * A filter specifier. Backends translate the kinds they understand and reject the rest.
 */
public interface FilterOption {
    /**
     * Wire kind of this filter, e.g. {@code attribute}.
     */
    @NotNull String kind();
}
