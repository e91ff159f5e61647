package io.github.flameyossnowy.resources.api.meta;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.UnmodifiableView;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * The ordered properties a model declares for one repository.
 */
public final class PropertySet implements Iterable<Property> {
    private final String modelName;
    private final Map<String, Property> byName = new LinkedHashMap<>();

    private volatile List<Property> ordered = List.of();

    PropertySet(String modelName) {
        this.modelName = modelName;
    }

    synchronized void add(@NotNull Property property) {
        if (byName.containsKey(property.name())) {
            throw new IllegalArgumentException("Property '" + property.name() + "' is already declared in " + modelName);
        }
        if (property.isDiscriminator() && discriminator() != null) {
            throw new IllegalArgumentException(modelName + " already has a discriminator property");
        }
        byName.put(property.name(), property);
        ordered = List.copyOf(byName.values());
    }

    synchronized PropertySet copy(String modelName) {
        PropertySet copy = new PropertySet(modelName);
        copy.byName.putAll(byName);
        copy.ordered = ordered;
        return copy;
    }

    public @Nullable Property get(@NotNull String name) {
        for (Property property : ordered) {
            if (property.name().equals(name)) {
                return property;
            }
        }
        return null;
    }

    /**
     * @throws IllegalArgumentException if the model has no such property
     */
    public @NotNull Property require(@NotNull String name) {
        Property property = get(name);
        if (property == null) {
            throw new IllegalArgumentException("Unknown property '" + name + "' in " + modelName);
        }
        return property;
    }

    public boolean contains(@NotNull Property property) {
        return ordered.contains(property);
    }

    public @NotNull List<Property> key() {
        List<Property> key = new ArrayList<>(2);
        for (Property property : ordered) {
            if (property.isKey()) key.add(property);
        }
        return key;
    }

    /**
     * Properties loaded by a query that does not name its fields.
     */
    public @NotNull List<Property> defaults() {
        List<Property> defaults = new ArrayList<>();
        for (Property property : ordered) {
            if (!property.isLazy()) defaults.add(property);
        }
        return defaults;
    }

    /**
     * All lazy properties of the given group, in declaration order.
     */
    public @NotNull List<Property> lazyContext(@NotNull String group) {
        List<Property> context = new ArrayList<>();
        for (Property property : ordered) {
            if (property.isLazy() && property.lazyGroup().equals(group)) context.add(property);
        }
        return context;
    }

    public @Nullable Property discriminator() {
        for (Property property : ordered) {
            if (property.isDiscriminator()) return property;
        }
        return null;
    }

    public @NotNull List<String> names() {
        List<String> names = new ArrayList<>(ordered.size());
        for (Property property : ordered) names.add(property.name());
        return names;
    }

    public @UnmodifiableView @NotNull List<Property> asList() {
        return Collections.unmodifiableList(ordered);
    }

    public Stream<Property> stream() {
        return ordered.stream();
    }

    public int size() {
        return ordered.size();
    }

    @Override
    public @NotNull Iterator<Property> iterator() {
        return ordered.iterator();
    }

    @Override
    public String toString() {
        return modelName + names();
    }
}
