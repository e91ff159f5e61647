package io.github.flameyossnowy.resources.api.relationship;

import io.github.flameyossnowy.resources.api.cache.Slot;
import io.github.flameyossnowy.resources.api.exceptions.UnsavedParentException;
import io.github.flameyossnowy.resources.api.meta.Model;
import io.github.flameyossnowy.resources.api.meta.Property;
import io.github.flameyossnowy.resources.api.meta.PropertySet;
import io.github.flameyossnowy.resources.api.query.Condition;
import io.github.flameyossnowy.resources.api.query.Query;
import io.github.flameyossnowy.resources.api.query.QueryOption;
import io.github.flameyossnowy.resources.api.repository.Repository;
import io.github.flameyossnowy.resources.api.repository.RepositoryRegistry;
import io.github.flameyossnowy.resources.api.resource.Resource;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * An association declared on a model.
 * <p>
 * The parent side owns the key; the child side carries the child key pointing at
 * it. For {@link OneToOne}, {@link OneToMany} and {@link ManyToMany} the declaring
 * model is the parent, for {@link ManyToOne} it is the child. Values are held per
 * resource in an association slot and loaded on first access.
 */
public abstract sealed class Relationship permits OneToOne, OneToMany, ManyToMany, ManyToOne {
    protected final String name;
    protected final ModelReference parentModel;
    protected final ModelReference childModel;
    protected final Cardinality cardinality;
    protected final @Nullable Relationship through;
    protected final String parentRepositoryName;
    protected final String childRepositoryName;
    protected final @Nullable List<String> parentKeyNames;
    protected final @Nullable List<String> childKeyNames;
    protected final RepositoryRegistry registry;

    protected Relationship(@NotNull Definition definition) {
        this.name = definition.name();
        this.parentModel = definition.parentModel();
        this.childModel = definition.childModel();
        this.cardinality = definition.cardinality();
        this.through = definition.through();
        this.parentRepositoryName = definition.parentRepositoryName();
        this.childRepositoryName = definition.childRepositoryName();
        this.parentKeyNames = definition.parentKeyNames();
        this.childKeyNames = definition.childKeyNames();
        this.registry = definition.registry();
    }

    /**
     * Builds another relationship of the same variant from a definition.
     */
    protected abstract @NotNull Relationship create(@NotNull Definition definition);

    /**
     * Reads the far side for a resource that has nothing loaded yet.
     */
    protected abstract @Nullable Object load(@NotNull Resource resource);

    public abstract boolean isCollection();

    public @NotNull String name() {
        return name;
    }

    public @NotNull Model parentModel() {
        return parentModel.resolve(registry);
    }

    public @NotNull Model childModel() {
        return childModel.resolve(registry);
    }

    public @NotNull Cardinality cardinality() {
        return cardinality;
    }

    public int min() {
        return cardinality.min();
    }

    public int max() {
        return cardinality.max();
    }

    public @Nullable Relationship through() {
        return through;
    }

    public @NotNull String parentRepositoryName() {
        return parentRepositoryName;
    }

    public @NotNull String childRepositoryName() {
        return childRepositoryName;
    }

    public @NotNull Repository parentRepository() {
        return registry.repository(parentRepositoryName);
    }

    public @NotNull Repository childRepository() {
        return registry.repository(childRepositoryName);
    }

    /**
     * The parent properties the child key points at; the parent model's key unless
     * overridden.
     */
    public @NotNull List<Property> parentKey() {
        PropertySet properties = parentModel().properties(parentRepositoryName);
        if (parentKeyNames == null) {
            return properties.key();
        }
        List<Property> key = new ArrayList<>(parentKeyNames.size());
        for (String keyName : parentKeyNames) key.add(properties.require(keyName));
        return key;
    }

    /**
     * The child properties holding the parent key. Unless overridden they are named
     * {@code <prefix>_<parent key name>}.
     *
     * @throws IllegalStateException if the child model does not declare them
     */
    public @NotNull List<Property> childKey() {
        PropertySet properties = childModel().properties(childRepositoryName);
        List<String> names = childKeyNames != null ? childKeyNames : defaultChildKeyNames();

        List<Property> key = new ArrayList<>(names.size());
        for (String keyName : names) {
            Property property = properties.get(keyName);
            if (property == null) {
                throw new IllegalStateException(
                    "Child key property '" + keyName + "' of relationship '" + name + "' is not declared in " + childModel());
            }
            key.add(property);
        }
        return key;
    }

    private List<String> defaultChildKeyNames() {
        List<String> names = new ArrayList<>();
        for (Property property : parentKey()) names.add(childKeyPrefix() + '_' + property.name());
        return names;
    }

    protected @NotNull String childKeyPrefix() {
        return underscore(parentModel.name());
    }

    /**
     * The associated value, loading it on first access.
     */
    public @Nullable Object get(@NotNull Resource resource) {
        Slot<Object> slot = resource.associationSlot(this);
        if (slot.isLoaded()) {
            return slot.value();
        }

        resource.trackLink(this);
        Object value = load(resource);
        resource.putAssociation(this, Slot.of(value));
        return value;
    }

    /**
     * The associated value without loading; {@code null} when not loaded.
     */
    public @Nullable Object getLoaded(@NotNull Resource resource) {
        return resource.associationSlot(this).value();
    }

    public void set(@NotNull Resource resource, @Nullable Object value) {
        resource.putAssociation(this, Slot.of(value));
    }

    public boolean isLoaded(@NotNull Resource resource) {
        return resource.associationSlot(this).isLoaded();
    }

    /**
     * Saves whatever this relationship holds for a just-saved parent.
     *
     * @return whether every child saved
     */
    public boolean saveChildren(@NotNull Resource parent) {
        return true;
    }

    /**
     * Loads this relationship for every source that does not have it yet.
     */
    public void eagerLoad(@NotNull List<Resource> sources) {
        for (Resource source : sources) {
            if (!isLoaded(source)) get(source);
        }
    }

    /**
     * The query selecting a parent's children.
     *
     * @throws UnsavedParentException if the parent was never saved
     */
    public @NotNull Query query(@NotNull Resource parent) {
        if (parent.isNew()) {
            throw new UnsavedParentException(this, parent);
        }

        List<Property> parentKey = parentKey();
        List<Property> childKey = childKey();
        List<Condition> conditions = new ArrayList<>(childKey.size());
        for (int i = 0; i < childKey.size(); i++) {
            conditions.add(Condition.eq(childKey.get(i), parentKey.get(i).get(parent)));
        }
        return childModel().query(childRepository(), Map.of(QueryOption.CONDITIONS, conditions));
    }

    /**
     * Copies the parent's key values into the child key.
     */
    protected void assignChildKey(@NotNull Resource parent, @NotNull Resource child) {
        List<Property> parentKey = parentKey();
        List<Property> childKey = childKey();
        for (int i = 0; i < childKey.size(); i++) {
            Object value = parentKey.get(i).get(parent);
            if (value != null) {
                childKey.get(i).set(child, value);
            }
        }
    }

    /**
     * A copy for a subclass of {@code ancestor}: every reference to the ancestor
     * points at the subclass instead.
     */
    public @NotNull Relationship cloneFor(@NotNull Model subclass, @NotNull Model ancestor, @Nullable Relationship through) {
        // children keep pointing at the ancestor's key columns
        List<String> inheritedChildKey = childKeyNames == null && parentModel.refersTo(ancestor)
            ? defaultChildKeyNames()
            : childKeyNames;
        return create(new Definition(
            name,
            parentModel.refersTo(ancestor) ? ModelReference.of(subclass) : parentModel,
            childModel.refersTo(ancestor) ? ModelReference.of(subclass) : childModel,
            cardinality,
            through,
            parentRepositoryName,
            childRepositoryName,
            parentKeyNames,
            inheritedChildKey,
            registry
        ));
    }

    static @NotNull String underscore(@NotNull String name) {
        StringBuilder builder = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0) builder.append('_');
                builder.append(Character.toLowerCase(c));
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + '{' + parentModel + " -> " + childModel + " as " + name + ", " + cardinality + '}';
    }

    protected record Definition(
        @NotNull String name,
        @NotNull ModelReference parentModel,
        @NotNull ModelReference childModel,
        @NotNull Cardinality cardinality,
        @Nullable Relationship through,
        @NotNull String parentRepositoryName,
        @NotNull String childRepositoryName,
        @Nullable List<String> parentKeyNames,
        @Nullable List<String> childKeyNames,
        @NotNull RepositoryRegistry registry
    ) {
    }
}
