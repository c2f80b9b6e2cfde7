package io.github.flameyossnowy.tabula.api.options;

import org.jetbrains.annotations.NotNull;

public interface SortOption {
    @NotNull String kind();
}
