package io.github.flameyossnowy.resources.api.query;

import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Comparison operators a storage adapter is expected to understand.
 */
@SuppressWarnings({ "unchecked", "rawtypes" })
public enum Operator {
    EQ {
        @Override
        public boolean matches(@Nullable Object actual, @Nullable Object expected) {
            return Objects.equals(actual, expected);
        }
    },
    NE {
        @Override
        public boolean matches(@Nullable Object actual, @Nullable Object expected) {
            return !Objects.equals(actual, expected);
        }
    },
    GT {
        @Override
        public boolean matches(@Nullable Object actual, @Nullable Object expected) {
            return compare(actual, expected) > 0;
        }
    },
    GTE {
        @Override
        public boolean matches(@Nullable Object actual, @Nullable Object expected) {
            return compare(actual, expected) >= 0;
        }
    },
    LT {
        @Override
        public boolean matches(@Nullable Object actual, @Nullable Object expected) {
            return actual != null && expected != null && compare(actual, expected) < 0;
        }
    },
    LTE {
        @Override
        public boolean matches(@Nullable Object actual, @Nullable Object expected) {
            return actual != null && expected != null && compare(actual, expected) <= 0;
        }
    },
    IN {
        @Override
        public boolean matches(@Nullable Object actual, @Nullable Object expected) {
            if (!(expected instanceof Collection<?> values)) {
                throw new IllegalArgumentException("IN expects a collection, got " + expected);
            }
            return values.contains(actual);
        }
    },
    LIKE {
        @Override
        public boolean matches(@Nullable Object actual, @Nullable Object expected) {
            if (actual == null || expected == null) return false;
            String regex = Pattern.quote(expected.toString())
                .replace("%", "\\E.*\\Q")
                .replace("_", "\\E.\\Q");
            return actual.toString().matches(regex);
        }
    };

    public abstract boolean matches(@Nullable Object actual, @Nullable Object expected);

    // nulls never satisfy an ordering comparison
    private static int compare(@Nullable Object actual, @Nullable Object expected) {
        if (actual == null || expected == null) return Integer.MIN_VALUE;
        return ((Comparable) actual).compareTo(expected);
    }
}
