package io.github.flameyossnowy.resources.api.meta;

import io.github.flameyossnowy.resources.api.callsite.Callsite;
import io.github.flameyossnowy.resources.api.identity.Key;
import io.github.flameyossnowy.resources.api.query.Condition;
import io.github.flameyossnowy.resources.api.query.Direction;
import io.github.flameyossnowy.resources.api.query.Query;
import io.github.flameyossnowy.resources.api.query.QueryOption;
import io.github.flameyossnowy.resources.api.query.SortOrder;
import io.github.flameyossnowy.resources.api.relationship.Cardinality;
import io.github.flameyossnowy.resources.api.relationship.ManyToOne;
import io.github.flameyossnowy.resources.api.relationship.Relationship;
import io.github.flameyossnowy.resources.api.relationship.RelationshipOptions;
import io.github.flameyossnowy.resources.api.relationship.RelationshipRegistry;
import io.github.flameyossnowy.resources.api.repository.Repository;
import io.github.flameyossnowy.resources.api.repository.RepositoryRegistry;
import io.github.flameyossnowy.resources.api.resource.Resource;
import io.github.flameyossnowy.resources.api.resource.ResourceCollection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Metadata of one resource class: its properties per repository, key, default
 * order, relationships and place in a single-table inheritance tree.
 * <p>
 * Models are declared through {@link #builder(String, RepositoryRegistry)} and
 * subclassed through {@link #extend(String, Function)}.
 */
public final class Model {
    private final String name;
    private final RepositoryRegistry registry;
    private final String defaultRepositoryName;
    private final @Nullable Model parent;
    private final Function<Model, ? extends Resource> factory;

    private final Map<String, PropertySet> properties = new ConcurrentHashMap<>();
    private final List<OrderColumn> defaultOrder;
    private final List<Model> descendants = new CopyOnWriteArrayList<>();
    private final RelationshipRegistry relationships;

    private Model(
        String name,
        RepositoryRegistry registry,
        String defaultRepositoryName,
        @Nullable Model parent,
        Function<Model, ? extends Resource> factory,
        PropertySet defaults,
        List<OrderColumn> defaultOrder
    ) {
        this.name = name;
        this.registry = registry;
        this.defaultRepositoryName = defaultRepositoryName;
        this.parent = parent;
        this.factory = factory;
        this.defaultOrder = new CopyOnWriteArrayList<>(defaultOrder);
        this.properties.put(defaultRepositoryName, defaults);
        this.relationships = parent == null
            ? new RelationshipRegistry(this)
            : parent.relationships.cloneFor(this);
    }

    public static @NotNull Builder builder(@NotNull String name, @NotNull RepositoryRegistry registry) {
        return new Builder(name, registry);
    }

    public @NotNull String name() {
        return name;
    }

    public @NotNull RepositoryRegistry registry() {
        return registry;
    }

    public @NotNull String defaultRepositoryName() {
        return defaultRepositoryName;
    }

    /**
     * The repository resources of this model use before they are persisted.
     */
    public @NotNull Repository repository() {
        return registry.repository(defaultRepositoryName);
    }

    public @NotNull PropertySet properties() {
        return properties(defaultRepositoryName);
    }

    /**
     * The properties for a repository; a repository other than the default starts
     * as a copy of the default set.
     */
    public @NotNull PropertySet properties(@NotNull String repositoryName) {
        return properties.computeIfAbsent(repositoryName, ignored -> properties.get(defaultRepositoryName).copy(name));
    }

    /**
     * Declares another property in every repository this model knows about, and in
     * every descendant.
     */
    public @NotNull Model property(@NotNull Property property) {
        for (PropertySet set : properties.values()) {
            set.add(property);
        }
        for (Model descendant : descendants) {
            descendant.property(property);
        }
        return this;
    }

    public @NotNull List<Property> key() {
        return key(defaultRepositoryName);
    }

    public @NotNull List<Property> key(@NotNull String repositoryName) {
        return properties(repositoryName).key();
    }

    /**
     * The declared order, or the key ascending when none was declared.
     */
    public @NotNull List<Direction> defaultOrder(@NotNull String repositoryName) {
        PropertySet set = properties(repositoryName);
        if (defaultOrder.isEmpty()) {
            List<Direction> order = new ArrayList<>();
            for (Property property : set.key()) order.add(Direction.asc(property));
            return order;
        }

        List<Direction> order = new ArrayList<>(defaultOrder.size());
        for (OrderColumn column : defaultOrder) {
            order.add(new Direction(set.require(column.property()), column.order()));
        }
        return order;
    }

    /**
     * The serial key property, or {@code null} when the model has none.
     */
    public @Nullable Property identityField() {
        for (Property property : key()) {
            if (property.isSerial()) return property;
        }
        return null;
    }

    public @NotNull RelationshipRegistry relationships() {
        return relationships;
    }

    public @NotNull Map<String, Relationship> relationships(@NotNull String repositoryName) {
        return relationships.relationships(repositoryName);
    }

    public @NotNull Relationship has(@NotNull Cardinality cardinality, @NotNull String name) {
        return relationships.has(cardinality, name, RelationshipOptions.none());
    }

    public @NotNull Relationship has(@NotNull Cardinality cardinality, @NotNull String name, @NotNull RelationshipOptions options) {
        return relationships.has(cardinality, name, options);
    }

    public @NotNull ManyToOne belongsTo(@NotNull String name) {
        return relationships.belongsTo(name, RelationshipOptions.none());
    }

    public @NotNull ManyToOne belongsTo(@NotNull String name, @NotNull RelationshipOptions options) {
        return relationships.belongsTo(name, options);
    }

    /**
     * Declares the relationship for {@code repositoryName} only; other repositories keep their own declarations.
     */
    public @NotNull Relationship has(@NotNull String repositoryName, @NotNull Cardinality cardinality,
                                     @NotNull String name, @NotNull RelationshipOptions options) {
        return relationships.has(repositoryName, cardinality, name, options);
    }

    public @NotNull ManyToOne belongsTo(@NotNull String repositoryName, @NotNull String name, @NotNull RelationshipOptions options) {
        return relationships.belongsTo(repositoryName, name, options);
    }

    public @Nullable Model parent() {
        return parent;
    }

    public @NotNull Model baseModel() {
        Model model = this;
        while (model.parent != null) model = model.parent;
        return model;
    }

    /**
     * Whether this model is {@code other} or descends from it.
     */
    public boolean isA(@NotNull Model other) {
        for (Model model = this; model != null; model = model.parent) {
            if (model == other) return true;
        }
        return false;
    }

    public @NotNull List<Model> descendants() {
        return Collections.unmodifiableList(descendants);
    }

    /**
     * This model and all of its descendants, depth first.
     */
    public @NotNull List<Model> selfAndDescendants() {
        List<Model> models = new ArrayList<>();
        models.add(this);
        for (Model descendant : descendants) models.addAll(descendant.selfAndDescendants());
        return models;
    }

    public @Nullable Model descendant(@NotNull String name) {
        for (Model model : selfAndDescendants()) {
            if (model.name.equals(name)) return model;
        }
        return null;
    }

    /**
     * The name rows of this model are stored under; shared by an inheritance tree.
     */
    public @NotNull String storageName() {
        return baseModel().name;
    }

    /**
     * Declares a single-table inheritance subclass. Properties and default order
     * are copied; relationships are cloned with references to this model rewritten
     * to the subclass.
     */
    public @NotNull Model extend(@NotNull String name, @NotNull Function<Model, ? extends Resource> factory) {
        Model subclass = new Model(
            name,
            registry,
            defaultRepositoryName,
            this,
            factory,
            properties(defaultRepositoryName).copy(name),
            defaultOrder
        );
        for (Map.Entry<String, PropertySet> entry : properties.entrySet()) {
            if (!entry.getKey().equals(defaultRepositoryName)) {
                subclass.properties.put(entry.getKey(), entry.getValue().copy(name));
            }
        }
        registry.registerModel(subclass);
        descendants.add(subclass);
        return subclass;
    }

    public @NotNull Model extend(@NotNull String name) {
        return extend(name, factory);
    }

    public @NotNull Resource newResource() {
        return Objects.requireNonNull(factory.apply(this), "Resource factory returned null for " + name);
    }

    /**
     * @throws IllegalArgumentException if an attribute is unknown or not accessible
     */
    public @NotNull Resource newResource(@NotNull Map<String, ?> attributes) {
        Resource resource = newResource();
        resource.setAttributes(attributes);
        return resource;
    }

    /**
     * Builds and saves a resource; check {@link Resource#isSaved()} for the outcome.
     */
    public @NotNull Resource create(@NotNull Map<String, ?> attributes) {
        Resource resource = newResource(attributes);
        resource.save();
        return resource;
    }

    public @NotNull Query query() {
        return query(repository(), Map.of());
    }

    /**
     * A query over this model loading the default fields in the default order.
     * Subclass queries are restricted to the subclass and its descendants.
     */
    public @NotNull Query query(@NotNull Repository repository, @NotNull Map<QueryOption, ?> options) {
        Map<QueryOption, Object> defaults = new EnumMap<>(QueryOption.class);
        defaults.put(QueryOption.ORDER, defaultOrder(repository.name()));

        Property discriminator = properties(repository.name()).discriminator();
        if (discriminator != null && parent != null) {
            defaults.put(QueryOption.CONDITIONS, List.of(Condition.in(discriminator, selfAndDescendants())));
        }

        Query query = new Query(repository, this, defaults);
        return query.update(options);
    }

    /**
     * A query selecting exactly the resource with the given key.
     */
    public @NotNull Query toQuery(@NotNull Repository repository, @NotNull Key key) {
        List<Property> keyProperties = key(repository.name());
        if (keyProperties.size() != key.size()) {
            throw new IllegalArgumentException("Key " + key + " does not match the key of " + name + " " + keyProperties);
        }

        List<Condition> conditions = new ArrayList<>(key.size());
        for (int i = 0; i < key.size(); i++) {
            conditions.add(Condition.eq(keyProperties.get(i), key.get(i)));
        }
        return query(repository, Map.of(QueryOption.CONDITIONS, conditions));
    }

    public @NotNull ResourceCollection all() {
        return all(query());
    }

    public @NotNull ResourceCollection all(@NotNull Query query) {
        return all(query, null);
    }

    /**
     * Reads the query; members remember the collection so lazy loads fetch for all
     * of them at once, and report what they load to the callsite when one is given.
     */
    public @NotNull ResourceCollection all(@NotNull Query query, @Nullable Callsite callsite) {
        if (!query.model().isA(this)) {
            throw new IllegalArgumentException("Query for " + query.model() + " cannot load " + name);
        }
        List<Resource> resources = query.repository().read(query);
        ResourceCollection collection = new ResourceCollection(query, resources, callsite);
        for (Resource resource : resources) {
            resource.setCollection(collection);
        }
        return collection;
    }

    public @Nullable Resource first(@NotNull Query query) {
        ResourceCollection collection = all(query.merge(Map.of(QueryOption.LIMIT, 1)));
        return collection.isEmpty() ? null : collection.get(0);
    }

    /**
     * Looks the key up in the identity map before reading it.
     *
     * @throws IllegalArgumentException if the values do not match the key properties in number or type
     */
    public @Nullable Resource get(@NotNull Object... keyValues) {
        Repository repository = repository();
        List<Property> keyProperties = key(repository.name());
        if (keyValues.length != keyProperties.size()) {
            throw new IllegalArgumentException(
                "Model '" + name + "' expects " + keyProperties.size() + " key value(s) but got " + keyValues.length);
        }
        for (int i = 0; i < keyValues.length; i++) {
            keyProperties.get(i).checkType(keyValues[i]);
        }
        Key key = Key.of(keyValues);
        Resource resource = repository.identityMap(this).get(key);
        if (resource != null && resource.model().isA(this)) {
            return resource;
        }
        return first(toQuery(repository, key));
    }

    @Override
    public String toString() {
        return name;
    }

    private record OrderColumn(String property, SortOrder order) {
    }

    public static final class Builder {
        private final String name;
        private final RepositoryRegistry registry;
        private final Map<String, Property> properties = new LinkedHashMap<>();
        private final List<OrderColumn> order = new ArrayList<>();
        private String repositoryName = RepositoryRegistry.DEFAULT_REPOSITORY_NAME;
        private Function<Model, ? extends Resource> factory = Resource::new;

        private Builder(String name, RepositoryRegistry registry) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Model name cannot be null or blank");
            }
            this.name = name;
            this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        }

        public Builder repository(@NotNull String repositoryName) {
            this.repositoryName = repositoryName;
            return this;
        }

        public Builder factory(@NotNull Function<Model, ? extends Resource> factory) {
            this.factory = factory;
            return this;
        }

        public Builder property(@NotNull Property property) {
            if (properties.putIfAbsent(property.name(), property) != null) {
                throw new IllegalArgumentException("Property '" + property.name() + "' is already declared in " + name);
            }
            return this;
        }

        public Builder property(@NotNull String name, @NotNull Class<?> type) {
            return property(Property.of(name, type));
        }

        public Builder orderBy(@NotNull String property, @NotNull SortOrder sortOrder) {
            order.add(new OrderColumn(property, sortOrder));
            return this;
        }

        public Model build() {
            PropertySet set = new PropertySet(name);
            for (Property property : properties.values()) set.add(property);
            for (OrderColumn column : order) set.require(column.property());

            Model model = new Model(name, registry, repositoryName, null, factory, set, order);
            registry.registerModel(model);
            return model;
        }
    }
}
