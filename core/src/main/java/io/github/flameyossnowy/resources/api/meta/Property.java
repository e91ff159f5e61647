package io.github.flameyossnowy.resources.api.meta;

import io.github.flameyossnowy.resources.api.cache.Slot;
import io.github.flameyossnowy.resources.api.resource.Resource;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Objects;

/**
 * One declared attribute of a model, and the accessor used to read and write it
 * on a {@link Resource}.
 * <p>
 * Properties are immutable once built. A property is lazy unless it is a key, the
 * inheritance discriminator, or declared with {@code lazy(false)}; lazy properties
 * are fetched together with the rest of their lazy group on first access.
 */
public final class Property {
    public static final String DEFAULT_LAZY_GROUP = "default";

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
        boolean.class, Boolean.class,
        byte.class, Byte.class,
        short.class, Short.class,
        char.class, Character.class,
        int.class, Integer.class,
        long.class, Long.class,
        float.class, Float.class,
        double.class, Double.class
    );

    private final String name;
    private final Class<?> type;
    private final boolean nullable;
    private final @Nullable DefaultValue defaultValue;
    private final boolean key;
    private final boolean serial;
    private final boolean discriminator;
    private final boolean lazy;
    private final String lazyGroup;
    private final boolean accessible;

    private Property(Builder builder) {
        this.name = builder.name;
        this.type = builder.type;
        this.key = builder.key || builder.serial;
        this.serial = builder.serial;
        this.discriminator = builder.discriminator;
        this.nullable = !this.key && builder.nullable;
        this.defaultValue = builder.defaultValue;
        this.lazy = builder.lazy != null ? builder.lazy : !(this.key || this.discriminator);
        this.lazyGroup = builder.lazyGroup;
        this.accessible = builder.accessible;
    }

    public static @NotNull Builder builder(@NotNull String name, @NotNull Class<?> type) {
        return new Builder(name, type);
    }

    /**
     * An auto-incrementing {@link Long} key.
     */
    public static @NotNull Property serial(@NotNull String name) {
        return builder(name, Long.class).serial().build();
    }

    /**
     * The single-table inheritance discriminator. Its value is the {@link Model} a
     * row belongs to and it defaults to the resource's own model.
     */
    public static @NotNull Property discriminator(@NotNull String name) {
        return builder(name, Model.class).discriminator().build();
    }

    public static @NotNull Property of(@NotNull String name, @NotNull Class<?> type) {
        return builder(name, type).build();
    }

    public @NotNull String name() {
        return name;
    }

    public @NotNull Class<?> type() {
        return type;
    }

    public boolean isNullable() {
        return nullable;
    }

    public boolean isKey() {
        return key;
    }

    public boolean isSerial() {
        return serial;
    }

    public boolean isDiscriminator() {
        return discriminator;
    }

    public boolean isLazy() {
        return lazy;
    }

    public @NotNull String lazyGroup() {
        return lazyGroup;
    }

    /**
     * Whether mass assignment and {@link Resource#attributes()} may touch this property.
     */
    public boolean isAccessible() {
        return accessible;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public @Nullable Object defaultFor(@NotNull Resource resource) {
        return defaultValue == null ? null : defaultValue.defaultFor(resource);
    }

    /**
     * Reads the value, lazy loading it on a saved resource or applying the default
     * on a new one.
     */
    public @Nullable Object get(@NotNull Resource resource) {
        Slot<Object> slot = resource.slot(this);
        if (slot.isLoaded()) {
            return slot.value();
        }

        if (resource.isSaved()) {
            resource.lazyLoad(this);
            return resource.slot(this).value();
        }

        Object value = defaultFor(resource);
        if (value == null) {
            resource.putSlot(this, Slot.of(null));
        } else {
            set(resource, value);
        }
        return value;
    }

    /**
     * Reads the value without loading anything; {@code null} when not loaded.
     */
    public @Nullable Object getLoaded(@NotNull Resource resource) {
        return resource.slot(this).value();
    }

    /**
     * Writes the value and records the pre-mutation value the first time the
     * attribute changes. Writing the recorded original back makes the attribute
     * clean again.
     *
     * @throws IllegalArgumentException if the value is not of this property's type
     */
    public void set(@NotNull Resource resource, @Nullable Object value) {
        checkType(value);

        Slot<Object> slot = resource.slot(this);
        boolean loaded = slot.isLoaded();
        Object original = slot.value();
        if (loaded && Objects.equals(original, value)) {
            return;
        }

        resource.trackOriginal(this, original, value);
        resource.putSlot(this, Slot.of(value));
    }

    /**
     * Writes a value that came from the repository; nothing is marked dirty.
     */
    public void setLoaded(@NotNull Resource resource, @Nullable Object value) {
        checkType(value);
        resource.putSlot(this, Slot.of(value));
    }

    public boolean isLoaded(@NotNull Resource resource) {
        return resource.slot(this).isLoaded();
    }

    /**
     * @throws IllegalArgumentException if a non-null value is not of this property's type
     */
    public void checkType(@Nullable Object value) {
        if (value != null && !type.isInstance(value)) {
            throw new IllegalArgumentException(
                "Property '" + name + "' expects " + type.getSimpleName()
                    + " but got " + value.getClass().getSimpleName());
        }
    }

    @Override
    public String toString() {
        return "Property{" + name + ": " + type.getSimpleName() + '}';
    }

    public static final class Builder {
        private final String name;
        private final Class<?> type;
        private boolean nullable = true;
        private DefaultValue defaultValue;
        private boolean key;
        private boolean serial;
        private boolean discriminator;
        private Boolean lazy;
        private String lazyGroup = DEFAULT_LAZY_GROUP;
        private boolean accessible = true;

        private Builder(String name, Class<?> type) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Property name cannot be null or blank");
            }
            this.name = name;
            this.type = WRAPPERS.getOrDefault(Objects.requireNonNull(type, "Property type cannot be null"), type);
        }

        @Contract("-> this")
        public Builder key() {
            this.key = true;
            return this;
        }

        @Contract("-> this")
        public Builder serial() {
            if (!Number.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException("Serial property '" + name + "' must be numeric");
            }
            this.serial = true;
            this.key = true;
            return this;
        }

        @Contract("-> this")
        public Builder discriminator() {
            if (type != Model.class) {
                throw new IllegalArgumentException("Discriminator property '" + name + "' must hold a Model");
            }
            this.discriminator = true;
            this.defaultValue = Resource::model;
            return this;
        }

        @Contract("_ -> this")
        public Builder nullable(boolean nullable) {
            this.nullable = nullable;
            return this;
        }

        @Contract("_ -> this")
        public Builder defaultValue(@Nullable Object value) {
            if (value != null && !type.isInstance(value)) {
                throw new IllegalArgumentException("Default for '" + name + "' is not a " + type.getSimpleName());
            }
            this.defaultValue = DefaultValue.constant(value);
            return this;
        }

        @Contract("_ -> this")
        public Builder defaultValue(@NotNull DefaultValue defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        @Contract("_ -> this")
        public Builder lazy(boolean lazy) {
            this.lazy = lazy;
            return this;
        }

        /**
         * Puts this lazy property in a named group fetched together on first access.
         */
        @Contract("_ -> this")
        public Builder lazyGroup(@NotNull String group) {
            this.lazy = true;
            this.lazyGroup = group;
            return this;
        }

        @Contract("-> this")
        public Builder privateAccess() {
            this.accessible = false;
            return this;
        }

        public Property build() {
            if (key && lazy != null && lazy) {
                throw new IllegalArgumentException("Key property '" + name + "' cannot be lazy");
            }
            return new Property(this);
        }
    }
}
