package io.github.flameyossnowy.resources.api.query;

import io.github.flameyossnowy.resources.api.meta.Property;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;

public record Condition(@NotNull Property property, @NotNull Operator operator, @Nullable Object value) {

    public static @NotNull Condition eq(@NotNull Property property, @Nullable Object value) {
        return new Condition(property, Operator.EQ, value);
    }

    public static @NotNull Condition in(@NotNull Property property, @NotNull Collection<?> values) {
        return new Condition(property, Operator.IN, values);
    }

    public boolean matches(@Nullable Object actual) {
        return operator.matches(actual, value);
    }
}
