package io.github.flameyossnowy.resources.api.relationship;

import org.jetbrains.annotations.NotNull;

/**
 * The minimum and maximum number of resources on the far side of a relationship.
 * {@link #N} stands for "unbounded".
 */
public record Cardinality(int min, int max) {
    public static final int N = Integer.MAX_VALUE;

    /**
     * @throws IllegalArgumentException if the bounds are n..n, inverted, negative, or max is below 1
     */
    public Cardinality {
        if (min == N && max == N) {
            throw new IllegalArgumentException(
                "Cardinality may not be n..n. The cardinality specifies the min/max number of results from the association");
        }
        if (min > max) {
            throw new IllegalArgumentException("Cardinality min (" + min + ") cannot be larger than the max (" + max + ")");
        }
        if (min < 0) {
            throw new IllegalArgumentException("Cardinality min must be greater than or equal to 0, but was " + min);
        }
        if (max < 1) {
            throw new IllegalArgumentException("Cardinality max must be greater than or equal to 1, but was " + max);
        }
    }

    public static @NotNull Cardinality exactly(int count) {
        return new Cardinality(count, count);
    }

    public static @NotNull Cardinality range(int min, int max) {
        return new Cardinality(min, max);
    }

    public static @NotNull Cardinality atLeast(int min) {
        return new Cardinality(min, N);
    }

    /**
     * Zero or more.
     */
    public static @NotNull Cardinality n() {
        return new Cardinality(0, N);
    }

    public boolean isUnbounded() {
        return max == N;
    }

    @Override
    public String toString() {
        String upper = max == N ? "n" : String.valueOf(max);
        return min == max ? upper : min + ".." + upper;
    }
}
