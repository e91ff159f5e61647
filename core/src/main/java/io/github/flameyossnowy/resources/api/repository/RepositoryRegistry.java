package io.github.flameyossnowy.resources.api.repository;

import io.github.flameyossnowy.resources.api.meta.Model;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the named repositories of an application and the models declared
 * against them.
 * <p>
 * One registry is created at startup and handed to every model builder.
 */
public final class RepositoryRegistry {
    public static final String DEFAULT_REPOSITORY_NAME = "default";

    private final Map<String, Repository> repositories = new ConcurrentHashMap<>();
    private final Map<String, Model> models = new ConcurrentHashMap<>();

    public @NotNull Repository register(@NotNull Repository repository) {
        repositories.put(repository.name(), repository);
        return repository;
    }

    public @NotNull DefaultRepository register(@NotNull String name, @NotNull RepositoryAdapter adapter) {
        DefaultRepository repository = new DefaultRepository(name, adapter);
        repositories.put(name, repository);
        return repository;
    }

    /**
     * @throws IllegalArgumentException if nothing is registered under the name
     */
    public @NotNull Repository repository(@NotNull String name) {
        Repository repository = repositories.get(name);
        if (repository == null) {
            throw new IllegalArgumentException("Unknown repository '" + name + "'");
        }
        return repository;
    }

    public @NotNull Repository defaultRepository() {
        return repository(DEFAULT_REPOSITORY_NAME);
    }

    public boolean hasRepository(@NotNull String name) {
        return repositories.containsKey(name);
    }

    @ApiStatus.Internal
    public void registerModel(@NotNull Model model) {
        if (models.putIfAbsent(model.name(), model) != null) {
            throw new IllegalArgumentException("Model '" + model.name() + "' is already declared");
        }
    }

    public @Nullable Model model(@NotNull String name) {
        return models.get(name);
    }

    /**
     * @throws IllegalStateException if no model was declared under the name
     */
    public @NotNull Model requireModel(@NotNull String name) {
        Model model = models.get(name);
        if (model == null) {
            throw new IllegalStateException("No model named '" + name + "' has been declared");
        }
        return model;
    }

    public @NotNull Collection<Model> models() {
        return List.copyOf(models.values());
    }
}
