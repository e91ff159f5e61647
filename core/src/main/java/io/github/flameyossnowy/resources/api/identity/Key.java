package io.github.flameyossnowy.resources.api.identity;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;

/**
 * The ordered values of a model's key properties. Every component is non-null.
 */
public record Key(@NotNull List<Object> values) {
    public Key {
        values = List.copyOf(values);
        if (values.isEmpty()) {
            throw new IllegalArgumentException("A key needs at least one component");
        }
    }

    public static @NotNull Key of(Object... values) {
        return new Key(Arrays.asList(values));
    }

    public int size() {
        return values.size();
    }

    public Object get(int index) {
        return values.get(index);
    }

    @Override
    public String toString() {
        return values.size() == 1 ? String.valueOf(values.get(0)) : values.toString();
    }
}
