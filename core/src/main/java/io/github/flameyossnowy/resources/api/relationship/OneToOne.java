package io.github.flameyossnowy.resources.api.relationship;

import io.github.flameyossnowy.resources.api.resource.Resource;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A parent with exactly one child, which carries the parent key.
 */
public final class OneToOne extends Relationship {
    OneToOne(@NotNull Definition definition) {
        super(definition);
    }

    @Override
    protected @NotNull Relationship create(@NotNull Definition definition) {
        return new OneToOne(definition);
    }

    @Override
    public boolean isCollection() {
        return false;
    }

    @Override
    protected @Nullable Object load(@NotNull Resource resource) {
        if (resource.isNew()) {
            return null;
        }
        return childModel().first(query(resource));
    }

    @Override
    public void set(@NotNull Resource resource, @Nullable Object value) {
        if (value != null && !(value instanceof Resource child && child.model().isA(childModel()))) {
            throw new IllegalArgumentException("Relationship '" + name + "' expects a " + childModel() + ", got " + value);
        }
        super.set(resource, value);
    }

    @Override
    public boolean saveChildren(@NotNull Resource parent) {
        if (!(getLoaded(parent) instanceof Resource child)) {
            return true;
        }
        assignChildKey(parent, child);
        return child.save();
    }
}
