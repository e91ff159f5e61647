package io.github.flameyossnowy.resources.api.query;

import io.github.flameyossnowy.resources.api.meta.Property;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Comparator;

/**
 * One ordering column of a query or of a model's default order.
 */
public record Direction(@NotNull Property property, @NotNull SortOrder order) {

    @SuppressWarnings({ "unchecked", "rawtypes" })
    private static final Comparator<Object> VALUES = Comparator.nullsFirst((a, b) -> ((Comparable) a).compareTo(b));

    public static @NotNull Direction asc(@NotNull Property property) {
        return new Direction(property, SortOrder.ASC);
    }

    public static @NotNull Direction desc(@NotNull Property property) {
        return new Direction(property, SortOrder.DESC);
    }

    /**
     * Compares two raw values of this column, honoring the sort order.
     *
     * @throws ClassCastException if the values are not mutually comparable
     */
    public int compare(@Nullable Object left, @Nullable Object right) {
        int cmp = VALUES.compare(left, right);
        return order == SortOrder.DESC ? -cmp : cmp;
    }
}
