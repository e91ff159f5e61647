package io.github.flameyossnowy.resources.api.relationship;

import io.github.flameyossnowy.resources.api.identity.Key;
import io.github.flameyossnowy.resources.api.meta.Model;
import io.github.flameyossnowy.resources.api.meta.Property;
import io.github.flameyossnowy.resources.api.query.Condition;
import io.github.flameyossnowy.resources.api.query.QueryOption;
import io.github.flameyossnowy.resources.api.resource.Resource;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The child side of an association: the declaring model holds the key of one parent.
 * Child key properties default to {@code <relationship name>_<parent key name>}.
 */
public final class ManyToOne extends Relationship {
    ManyToOne(@NotNull Definition definition) {
        super(definition);
    }

    @Override
    protected @NotNull Relationship create(@NotNull Definition definition) {
        return new ManyToOne(definition);
    }

    @Override
    public boolean isCollection() {
        return false;
    }

    @Override
    protected @NotNull String childKeyPrefix() {
        return underscore(name);
    }

    @Override
    protected @Nullable Object load(@NotNull Resource child) {
        List<Property> childKey = childKey();
        List<Object> values = new ArrayList<>(childKey.size());
        for (Property property : childKey) {
            Object value = property.get(child);
            if (value == null) return null;
            values.add(value);
        }

        Model parent = parentModel();
        List<Property> parentKey = parentKey();
        if (parentKey.equals(parent.key(parentRepositoryName))) {
            Resource cached = parentRepository().identityMap(parent).get(new Key(values));
            if (cached != null && cached.model().isA(parent)) {
                return cached;
            }
        }

        List<Condition> conditions = new ArrayList<>(parentKey.size());
        for (int i = 0; i < parentKey.size(); i++) {
            conditions.add(Condition.eq(parentKey.get(i), values.get(i)));
        }
        return parent.first(parent.query(parentRepository(), Map.of(QueryOption.CONDITIONS, conditions)));
    }

    /**
     * Sets the parent and copies its key into the child key; a {@code null} parent
     * clears the child key.
     */
    @Override
    public void set(@NotNull Resource child, @Nullable Object value) {
        if (value == null) {
            super.set(child, null);
            for (Property property : childKey()) property.set(child, null);
            return;
        }
        if (!(value instanceof Resource parent) || !parent.model().isA(parentModel())) {
            throw new IllegalArgumentException("Relationship '" + name + "' expects a " + parentModel() + ", got " + value);
        }
        super.set(child, parent);
        propagateKey(child);
    }

    /**
     * Copies the loaded parent's key into the child key. A parent that has no key yet
     * leaves the child key untouched.
     */
    public void propagateKey(@NotNull Resource child) {
        if (getLoaded(child) instanceof Resource parent) {
            assignChildKey(parent, child);
        }
    }

    @Override
    public void eagerLoad(@NotNull List<Resource> sources) {
        List<Property> childKey = childKey();
        if (childKey.size() != 1) {
            super.eagerLoad(sources);
            return;
        }

        Property childProperty = childKey.get(0);
        Property parentProperty = parentKey().get(0);
        Set<Object> keys = new LinkedHashSet<>();
        for (Resource source : sources) {
            if (isLoaded(source)) continue;
            Object value = childProperty.get(source);
            if (value != null) keys.add(value);
        }
        if (keys.isEmpty()) {
            return;
        }

        Model parent = parentModel();
        Map<Object, Resource> parents = new HashMap<>();
        for (Resource resource : parent.all(parent.query(
            parentRepository(),
            Map.of(QueryOption.CONDITIONS, List.of(Condition.in(parentProperty, keys)))
        ))) {
            parents.put(parentProperty.get(resource), resource);
        }

        for (Resource source : sources) {
            if (isLoaded(source)) continue;
            Object value = childProperty.get(source);
            super.set(source, value == null ? null : parents.get(value));
        }
    }
}
