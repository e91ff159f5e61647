package io.github.flameyossnowy.resources.api.repository;

import io.github.flameyossnowy.resources.api.identity.IdentityMap;
import io.github.flameyossnowy.resources.api.identity.Key;
import io.github.flameyossnowy.resources.api.meta.Model;
import io.github.flameyossnowy.resources.api.meta.Property;
import io.github.flameyossnowy.resources.api.meta.PropertySet;
import io.github.flameyossnowy.resources.api.query.Query;
import io.github.flameyossnowy.resources.api.query.QueryOption;
import io.github.flameyossnowy.resources.api.relationship.Relationship;
import io.github.flameyossnowy.resources.api.resource.Resource;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A {@link Repository} over a {@link RepositoryAdapter}. It owns the identity maps
 * and turns rows into resources, reusing the live instance of every key it has
 * seen before.
 */
public class DefaultRepository implements Repository {
    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultRepository.class);

    private final String name;
    private final RepositoryAdapter adapter;
    private final Map<Model, IdentityMap> identityMaps = new ConcurrentHashMap<>();

    public DefaultRepository(@NotNull String name, @NotNull RepositoryAdapter adapter) {
        this.name = name;
        this.adapter = adapter;
    }

    @Override
    public @NotNull String name() {
        return name;
    }

    public @NotNull RepositoryAdapter adapter() {
        return adapter;
    }

    @Override
    public int create(@NotNull List<? extends Resource> resources) {
        int created = adapter.create(resources);
        LOGGER.debug("Created {} of {} resources in {}", created, resources.size(), name);
        return created;
    }

    @Override
    public int update(@NotNull Map<Property, Object> attributes, @NotNull Query query) {
        return adapter.update(attributes, query);
    }

    @Override
    public int delete(@NotNull Query query) {
        return adapter.delete(query);
    }

    /**
     * Reads rows and materialises them. Existing instances take the values of
     * attributes they have not loaded, or of every clean attribute when the query
     * reloads. Rows of a subclass become instances of that subclass. The query's
     * links are eager loaded for all of the results.
     */
    @Override
    public @NotNull List<Resource> read(@NotNull Query query) {
        Model model = query.model();
        PropertySet properties = model.properties(name);
        Property discriminator = properties.discriminator();

        List<Property> required = new ArrayList<>(properties.key());
        if (discriminator != null) required.add(discriminator);
        Query readQuery = query.fields().containsAll(required) ? query : query.merge(Map.of(QueryOption.FIELDS, required));

        List<Map<String, Object>> rows = adapter.read(readQuery);
        IdentityMap identityMap = identityMap(model);
        List<Resource> resources = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            resources.add(materialise(readQuery, row, identityMap, discriminator));
        }

        for (Relationship link : readQuery.links()) {
            link.eagerLoad(resources);
        }
        LOGGER.debug("Read {} {} resources from {}", resources.size(), model, name);
        return resources;
    }

    private Resource materialise(Query query, Map<String, Object> row, IdentityMap identityMap, @Nullable Property discriminator) {
        Model model = query.model();
        if (discriminator != null) {
            Object value = toValue(model, discriminator, row.get(discriminator.name()));
            if (value instanceof Model subclass && subclass.isA(model)) {
                model = subclass;
            }
        }

        Key key = keyOf(query.model(), row);
        Resource existing = key == null ? null : identityMap.get(key);
        if (existing == null) {
            Resource fresh = model.newResource();
            fresh.bindPersisted(this);
            for (Property property : query.fields()) {
                if (row.containsKey(property.name())) {
                    property.setLoaded(fresh, toValue(model, property, row.get(property.name())));
                }
            }
            if (key == null) {
                return fresh;
            }
            existing = identityMap.putIfAbsent(key, fresh);
            if (existing == fresh) {
                return fresh;
            }
        }

        for (Property property : query.fields()) {
            if (row.containsKey(property.name())) {
                existing.loadAttribute(property, toValue(model, property, row.get(property.name())), query.isReload());
            }
        }
        return existing;
    }

    private @Nullable Key keyOf(Model model, Map<String, Object> row) {
        List<Property> key = model.key(name);
        List<Object> values = new ArrayList<>(key.size());
        for (Property property : key) {
            Object value = toValue(model, property, row.get(property.name()));
            if (value == null) return null;
            values.add(value);
        }
        return new Key(values);
    }

    /**
     * Discriminators may come back as model names.
     */
    private static @Nullable Object toValue(Model model, Property property, @Nullable Object value) {
        if (property.isDiscriminator() && value instanceof String modelName) {
            Model resolved = model.baseModel().descendant(modelName);
            if (resolved == null) {
                throw new IllegalStateException("Row names unknown model '" + modelName + "' under " + model.baseModel());
            }
            return resolved;
        }
        return value;
    }

    @Override
    public @NotNull IdentityMap identityMap(@NotNull Model model) {
        return identityMaps.computeIfAbsent(model.baseModel(), ignored -> new IdentityMap());
    }

    @Override
    public String toString() {
        return "DefaultRepository{" + name + '}';
    }
}
