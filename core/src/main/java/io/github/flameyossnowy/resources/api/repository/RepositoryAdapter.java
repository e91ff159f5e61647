package io.github.flameyossnowy.resources.api.repository;

import io.github.flameyossnowy.resources.api.meta.Property;
import io.github.flameyossnowy.resources.api.query.Query;
import io.github.flameyossnowy.resources.api.resource.Resource;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;

/**
 * The storage collaborator behind a {@link DefaultRepository}.
 * <p>
 * Adapters speak in rows keyed by property name. Serial keys are written back on
 * the created resources with {@link Property#setLoaded}.
 */
public interface RepositoryAdapter {
    int create(@NotNull List<? extends Resource> resources);

    /**
     * Rows for the query, each holding at least the query's fields.
     */
    @NotNull List<Map<String, Object>> read(@NotNull Query query);

    int update(@NotNull Map<Property, Object> attributes, @NotNull Query query);

    int delete(@NotNull Query query);
}
