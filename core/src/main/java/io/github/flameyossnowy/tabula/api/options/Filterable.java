package io.github.flameyossnowy.tabula.api.options;

import org.jetbrains.annotations.NotNull;

/**
 * A builder that {@link QueryField} can attach filters to.
 */
public interface Filterable {
    void addFilter(@NotNull FilterOption filter);
}
