package io.github.flameyossnowy.resources.api.repository;

import io.github.flameyossnowy.resources.api.identity.IdentityMap;
import io.github.flameyossnowy.resources.api.meta.Model;
import io.github.flameyossnowy.resources.api.meta.Property;
import io.github.flameyossnowy.resources.api.query.Query;
import io.github.flameyossnowy.resources.api.resource.Resource;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;

/**
 * A named data store as seen by the resource lifecycle.
 * <p>
 * Every call blocks until the store answers. Counts are the number of affected
 * rows; callers compare them against the number they expected.
 */
public interface Repository {
    @NotNull String name();

    /**
     * Persists new resources, assigning serial keys on them.
     */
    int create(@NotNull List<? extends Resource> resources);

    /**
     * Materialises the rows selected by the query, one instance per key.
     */
    @NotNull List<Resource> read(@NotNull Query query);

    int update(@NotNull Map<Property, Object> attributes, @NotNull Query query);

    int delete(@NotNull Query query);

    /**
     * The identity map for the model's base model in this repository.
     */
    @NotNull IdentityMap identityMap(@NotNull Model model);
}
