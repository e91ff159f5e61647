package io.github.flameyossnowy.resources.api.meta;

import io.github.flameyossnowy.resources.api.resource.Resource;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Computes the value a property takes when a new resource is created without it.
 */
@FunctionalInterface
public interface DefaultValue {

    @Nullable Object defaultFor(@NotNull Resource resource);

    static @NotNull DefaultValue constant(@Nullable Object value) {
        return resource -> value;
    }
}
