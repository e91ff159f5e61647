package io.github.flameyossnowy.resources.api.cache;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A lazily filled value holder that distinguishes "never computed" from
 * "computed as null".
 * <p>
 * Resources keep one slot per attribute, per association and for their cached key,
 * so a lazy load is only triggered for {@link Unloaded} slots and a loaded
 * {@code null} is never fetched twice.
 *
 * @param <V> the held value type
 */
public sealed interface Slot<V> {

    @SuppressWarnings("unchecked")
    @Contract(pure = true)
    static <V> @NotNull Slot<V> unloaded() {
        return (Slot<V>) Unloaded.INSTANCE;
    }

    @SuppressWarnings("unchecked")
    @Contract(pure = true)
    static <V> @NotNull Slot<V> of(@Nullable V value) {
        return value == null ? (Slot<V>) LoadedNil.INSTANCE : new Loaded<>(value);
    }

    boolean isLoaded();

    /**
     * The held value, {@code null} when unloaded or loaded as null.
     */
    @Nullable V value();

    record Unloaded<V>() implements Slot<V> {
        private static final Unloaded<?> INSTANCE = new Unloaded<>();

        @Override
        public boolean isLoaded() {
            return false;
        }

        @Override
        public @Nullable V value() {
            return null;
        }

        @Override
        public String toString() {
            return "<not loaded>";
        }
    }

    record Loaded<V>(@NotNull V value) implements Slot<V> {
        @Override
        public boolean isLoaded() {
            return true;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record LoadedNil<V>() implements Slot<V> {
        private static final LoadedNil<?> INSTANCE = new LoadedNil<>();

        @Override
        public boolean isLoaded() {
            return true;
        }

        @Override
        public @Nullable V value() {
            return null;
        }

        @Override
        public String toString() {
            return "null";
        }
    }
}
