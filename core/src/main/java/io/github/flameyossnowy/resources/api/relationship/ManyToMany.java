package io.github.flameyossnowy.resources.api.relationship;

import io.github.flameyossnowy.resources.api.exceptions.UnsavedParentException;
import io.github.flameyossnowy.resources.api.meta.Model;
import io.github.flameyossnowy.resources.api.resource.Resource;
import io.github.flameyossnowy.resources.api.resource.ResourceCollection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Targets reached through a join model: the {@code through} relationship leads
 * from the parent to join rows, and a many-to-one on the join model leads on to
 * each target. Read only; join rows are owned by the storage layer.
 */
public final class ManyToMany extends Relationship {
    ManyToMany(@NotNull Definition definition) {
        super(definition);
        Objects.requireNonNull(definition.through(), "Many-to-many relationships need a through relationship");
    }

    @Override
    protected @NotNull Relationship create(@NotNull Definition definition) {
        return new ManyToMany(definition);
    }

    @Override
    public boolean isCollection() {
        return true;
    }

    @Override
    public @NotNull Relationship through() {
        return Objects.requireNonNull(super.through());
    }

    /**
     * The many-to-one on the join model that points at the target model.
     *
     * @throws IllegalStateException if the join model declares none
     */
    public @NotNull ManyToOne via() {
        Relationship through = through();
        Model target = childModel();
        for (Relationship relationship : through.childModel().relationships(through.childRepositoryName()).values()) {
            if (relationship instanceof ManyToOne manyToOne && target.isA(manyToOne.parentModel())) {
                return manyToOne;
            }
        }
        throw new IllegalStateException(
            "Join model " + through.childModel() + " of relationship '" + name + "' does not belong to " + target);
    }

    @Override
    protected @NotNull Object load(@NotNull Resource resource) {
        if (resource.isNew()) {
            throw new UnsavedParentException(this, resource);
        }

        ManyToOne via = via();
        List<Resource> targets = new ArrayList<>();
        if (through().get(resource) instanceof Iterable<?> joins) {
            for (Object join : joins) {
                Object target = via.get((Resource) join);
                if (target instanceof Resource found && !targets.contains(found)) {
                    targets.add(found);
                }
            }
        }
        return ResourceCollection.loadedAssociation(resource, this, targets);
    }

    @Override
    public void set(@NotNull Resource resource, @Nullable Object value) {
        throw new UnsupportedOperationException("Many-to-many relationship '" + name + "' is read only");
    }
}
