package io.github.flameyossnowy.tabula.api.options;

import org.jetbrains.annotations.NotNull;

public interface PageOption {
    @NotNull String kind();
}
