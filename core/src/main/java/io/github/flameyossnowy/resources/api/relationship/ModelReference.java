package io.github.flameyossnowy.resources.api.relationship;

import io.github.flameyossnowy.resources.api.meta.Model;
import io.github.flameyossnowy.resources.api.repository.RepositoryRegistry;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A model known either directly or by a name resolved on first use.
 */
final class ModelReference {
    private final String name;
    private volatile @Nullable Model model;

    private ModelReference(String name, @Nullable Model model) {
        this.name = name;
        this.model = model;
    }

    static ModelReference of(@NotNull Model model) {
        return new ModelReference(model.name(), model);
    }

    static ModelReference deferred(@NotNull String name) {
        return new ModelReference(name, null);
    }

    String name() {
        return name;
    }

    boolean refersTo(@NotNull Model candidate) {
        Model resolved = model;
        return resolved != null ? resolved == candidate : name.equals(candidate.name());
    }

    Model resolve(RepositoryRegistry registry) {
        Model resolved = model;
        if (resolved == null) {
            resolved = registry.requireModel(name);
            model = resolved;
        }
        return resolved;
    }

    @Override
    public String toString() {
        return name;
    }
}
