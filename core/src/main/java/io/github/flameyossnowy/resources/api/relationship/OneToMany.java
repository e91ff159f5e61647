package io.github.flameyossnowy.resources.api.relationship;

import io.github.flameyossnowy.resources.api.meta.Property;
import io.github.flameyossnowy.resources.api.query.Condition;
import io.github.flameyossnowy.resources.api.query.QueryOption;
import io.github.flameyossnowy.resources.api.resource.Resource;
import io.github.flameyossnowy.resources.api.resource.ResourceCollection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A parent with a collection of children, each carrying the parent key.
 * <p>
 * The collection is loaded on first use. Reading it from a parent that was never
 * saved fails with an {@link io.github.flameyossnowy.resources.api.exceptions.UnsavedParentException}
 * unless children were added to it first.
 */
public final class OneToMany extends Relationship {
    OneToMany(@NotNull Definition definition) {
        super(definition);
    }

    @Override
    protected @NotNull Relationship create(@NotNull Definition definition) {
        return new OneToMany(definition);
    }

    @Override
    public boolean isCollection() {
        return true;
    }

    @Override
    protected @NotNull Object load(@NotNull Resource resource) {
        return ResourceCollection.association(resource, this);
    }

    /**
     * The children of a parent; the collection is not read until it is used.
     */
    public @NotNull ResourceCollection children(@NotNull Resource parent) {
        return (ResourceCollection) get(parent);
    }

    @Override
    public void set(@NotNull Resource resource, @Nullable Object value) {
        ResourceCollection collection = ResourceCollection.loadedAssociation(resource, this, List.of());
        if (value instanceof Iterable<?> iterable) {
            for (Object member : iterable) {
                collection.add((Resource) member);
            }
        } else if (value != null) {
            throw new IllegalArgumentException("Relationship '" + name + "' expects a collection, got " + value);
        }
        super.set(resource, collection);
    }

    @Override
    public boolean saveChildren(@NotNull Resource parent) {
        if (!(getLoaded(parent) instanceof ResourceCollection collection) || !collection.isLoaded()) {
            return true;
        }

        boolean saved = true;
        for (Resource child : collection) {
            assignChildKey(parent, child);
            saved &= child.save();
        }
        return saved;
    }

    /**
     * Loads the children of every saved source with one query when the parent key is
     * a single column.
     */
    @Override
    public void eagerLoad(@NotNull List<Resource> sources) {
        List<Property> parentKey = parentKey();
        if (parentKey.size() != 1) {
            super.eagerLoad(sources);
            return;
        }

        Property parentProperty = parentKey.get(0);
        Property childProperty = childKey().get(0);
        Map<Object, List<Resource>> bySourceKey = new HashMap<>();
        Set<Object> keys = new LinkedHashSet<>();
        for (Resource source : sources) {
            if (source.isNew() || isLoaded(source)) continue;
            Object value = parentProperty.get(source);
            if (value == null) continue;
            keys.add(value);
            bySourceKey.computeIfAbsent(value, ignored -> new ArrayList<>()).add(source);
        }
        if (keys.isEmpty()) {
            return;
        }

        Map<Object, List<Resource>> childrenByKey = new HashMap<>();
        ResourceCollection children = childModel().all(childModel().query(
            childRepository(),
            Map.of(QueryOption.CONDITIONS, List.of(Condition.in(childProperty, keys)))
        ));
        for (Resource child : children) {
            childrenByKey.computeIfAbsent(childProperty.get(child), ignored -> new ArrayList<>()).add(child);
        }

        for (Map.Entry<Object, List<Resource>> entry : bySourceKey.entrySet()) {
            List<Resource> members = childrenByKey.getOrDefault(entry.getKey(), List.of());
            for (Resource source : entry.getValue()) {
                super.set(source, ResourceCollection.loadedAssociation(source, this, members));
            }
        }
    }
}
