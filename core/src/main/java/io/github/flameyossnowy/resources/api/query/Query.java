package io.github.flameyossnowy.resources.api.query;

import io.github.flameyossnowy.resources.api.meta.Model;
import io.github.flameyossnowy.resources.api.meta.Property;
import io.github.flameyossnowy.resources.api.meta.PropertySet;
import io.github.flameyossnowy.resources.api.relationship.Relationship;
import io.github.flameyossnowy.resources.api.repository.Repository;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.UnmodifiableView;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Describes what a repository should fetch: the fields to load, the links to eager
 * load, the filters, the order and the window.
 * <p>
 * The query is backend-agnostic. It is mutable only through {@link #update(Map)},
 * which is how callsites widen a query in place.
 */
public final class Query {
    private final Repository repository;
    private final Model model;
    private final PropertySet properties;

    private final List<Property> fields = new ArrayList<>();
    private final List<Relationship> links = new ArrayList<>();
    private final List<Condition> conditions = new ArrayList<>();
    private final List<Direction> order = new ArrayList<>();
    private int limit = -1;
    private int offset;
    private boolean reload;

    /**
     * Creates a query; without a {@link QueryOption#FIELDS} entry it loads the
     * model's default (non-lazy) properties.
     *
     * @throws IllegalArgumentException if an option is malformed or names an unknown field or link
     */
    public Query(@NotNull Repository repository, @NotNull Model model, @NotNull Map<QueryOption, ?> options) {
        this.repository = repository;
        this.model = model;
        this.properties = model.properties(repository.name());

        if (!options.containsKey(QueryOption.FIELDS)) {
            fields.addAll(properties.defaults());
        }
        update(options);
    }

    public Query(@NotNull Repository repository, @NotNull Model model) {
        this(repository, model, Map.of());
    }

    private Query(Query other) {
        this.repository = other.repository;
        this.model = other.model;
        this.properties = other.properties;
        this.fields.addAll(other.fields);
        this.links.addAll(other.links);
        this.conditions.addAll(other.conditions);
        this.order.addAll(other.order);
        this.limit = other.limit;
        this.offset = other.offset;
        this.reload = other.reload;
    }

    public static @NotNull Builder builder(@NotNull Repository repository, @NotNull Model model) {
        return new Builder(repository, model);
    }

    /**
     * Merges the options into this query in place. Fields and links are unioned,
     * conditions are appended, order, limit, offset and reload are replaced.
     *
     * @return this query
     */
    @Contract("_ -> this")
    public @NotNull Query update(@NotNull Map<QueryOption, ?> options) {
        for (Map.Entry<QueryOption, ?> entry : options.entrySet()) {
            Object value = entry.getValue();
            switch (entry.getKey()) {
                case FIELDS -> {
                    for (Object field : asCollection(QueryOption.FIELDS, value)) {
                        Property property = toProperty(field);
                        if (!fields.contains(property)) fields.add(property);
                    }
                }
                case LINKS -> {
                    for (Object link : asCollection(QueryOption.LINKS, value)) {
                        Relationship relationship = toRelationship(link);
                        if (!links.contains(relationship)) links.add(relationship);
                    }
                }
                case CONDITIONS -> {
                    for (Object condition : asCollection(QueryOption.CONDITIONS, value)) {
                        if (!(condition instanceof Condition c)) {
                            throw new IllegalArgumentException("Not a condition: " + condition);
                        }
                        conditions.add(c);
                    }
                }
                case ORDER -> {
                    List<Direction> directions = new ArrayList<>();
                    for (Object direction : asCollection(QueryOption.ORDER, value)) {
                        if (!(direction instanceof Direction d)) {
                            throw new IllegalArgumentException("Not a direction: " + direction);
                        }
                        directions.add(d);
                    }
                    order.clear();
                    order.addAll(directions);
                }
                case LIMIT -> limit = asInt(QueryOption.LIMIT, value);
                case OFFSET -> offset = asInt(QueryOption.OFFSET, value);
                case RELOAD -> {
                    if (!(value instanceof Boolean b)) {
                        throw new IllegalArgumentException("RELOAD expects a boolean, got " + value);
                    }
                    reload = b;
                }
            }
        }
        return this;
    }

    /**
     * A copy of this query with the options merged in; this query is left untouched.
     */
    public @NotNull Query merge(@NotNull Map<QueryOption, ?> options) {
        return copy().update(options);
    }

    public @NotNull Query copy() {
        return new Query(this);
    }

    public @NotNull Repository repository() {
        return repository;
    }

    public @NotNull Model model() {
        return model;
    }

    public @UnmodifiableView @NotNull List<Property> fields() {
        return Collections.unmodifiableList(fields);
    }

    public @NotNull List<String> fieldNames() {
        List<String> names = new ArrayList<>(fields.size());
        for (Property field : fields) names.add(field.name());
        return names;
    }

    public @UnmodifiableView @NotNull List<Relationship> links() {
        return Collections.unmodifiableList(links);
    }

    public @UnmodifiableView @NotNull List<Condition> conditions() {
        return Collections.unmodifiableList(conditions);
    }

    public @UnmodifiableView @NotNull List<Direction> order() {
        return Collections.unmodifiableList(order);
    }

    public int limit() {
        return limit;
    }

    public int offset() {
        return offset;
    }

    public boolean isReload() {
        return reload;
    }

    private Property toProperty(Object field) {
        if (field instanceof Property property) {
            if (!properties.contains(property)) {
                throw new IllegalArgumentException("Property '" + property.name() + "' does not belong to " + model);
            }
            return property;
        }
        if (field instanceof String name) {
            return properties.require(name);
        }
        throw new IllegalArgumentException("Not a field: " + field);
    }

    private Relationship toRelationship(Object link) {
        if (link instanceof Relationship relationship) {
            return relationship;
        }
        if (link instanceof String name) {
            Relationship relationship = model.relationships(repository.name()).get(name);
            if (relationship == null) {
                throw new IllegalArgumentException("Unknown relationship '" + name + "' in " + model);
            }
            return relationship;
        }
        throw new IllegalArgumentException("Not a link: " + link);
    }

    private static Collection<?> asCollection(QueryOption option, Object value) {
        if (value instanceof Collection<?> collection) return collection;
        throw new IllegalArgumentException(option + " expects a collection, got " + value);
    }

    private static int asInt(QueryOption option, Object value) {
        if (value instanceof Integer i) return i;
        throw new IllegalArgumentException(option + " expects an integer, got " + value);
    }

    @Override
    public String toString() {
        return "Query{model=" + model
            + ", repository=" + repository.name()
            + ", fields=" + fieldNames()
            + ", links=" + links.stream().map(Relationship::name).toList()
            + ", conditions=" + conditions
            + ", order=" + order
            + ", limit=" + limit
            + ", offset=" + offset
            + ", reload=" + reload + '}';
    }

    /**
     * Fluent builder for {@link Query}.
     *
     * <pre>{@code
     * Query.builder(repository, product)
     *   .fields("id", "name")
     *   .where("active", Operator.EQ, true)
     *   .orderBy("name", SortOrder.ASC)
     *   .limit(20)
     *   .build();
     * }</pre>
     */
    public static final class Builder {
        private final Repository repository;
        private final Model model;
        private final Map<QueryOption, Object> options = new EnumMap<>(QueryOption.class);
        private final List<Object> fields = new ArrayList<>();
        private final List<Object> links = new ArrayList<>();
        private final List<Condition> conditions = new ArrayList<>();
        private final List<Direction> order = new ArrayList<>();

        private Builder(Repository repository, Model model) {
            this.repository = repository;
            this.model = model;
        }

        public Builder fields(String... names) {
            Collections.addAll(fields, (Object[]) names);
            return this;
        }

        public Builder links(String... names) {
            Collections.addAll(links, (Object[]) names);
            return this;
        }

        public Builder where(String field, Operator operator, Object value) {
            conditions.add(new Condition(model.properties(repository.name()).require(field), operator, value));
            return this;
        }

        public Builder where(Condition condition) {
            conditions.add(condition);
            return this;
        }

        public Builder orderBy(String field, SortOrder sortOrder) {
            order.add(new Direction(model.properties(repository.name()).require(field), sortOrder));
            return this;
        }

        public Builder limit(int limit) {
            options.put(QueryOption.LIMIT, limit);
            return this;
        }

        public Builder offset(int offset) {
            options.put(QueryOption.OFFSET, offset);
            return this;
        }

        public Builder reload(boolean reload) {
            options.put(QueryOption.RELOAD, reload);
            return this;
        }

        public Query build() {
            Map<QueryOption, Object> all = new EnumMap<>(options);
            if (!fields.isEmpty()) all.put(QueryOption.FIELDS, fields);
            if (!links.isEmpty()) all.put(QueryOption.LINKS, links);
            if (!conditions.isEmpty()) all.put(QueryOption.CONDITIONS, conditions);
            if (!order.isEmpty()) all.put(QueryOption.ORDER, order);
            return new Query(repository, model, all);
        }
    }
}
