package io.github.flameyossnowy.resources.api.resource;

import io.github.flameyossnowy.resources.api.cache.Slot;
import io.github.flameyossnowy.resources.api.callsite.Callsite;
import io.github.flameyossnowy.resources.api.identity.IdentityMap;
import io.github.flameyossnowy.resources.api.identity.Key;
import io.github.flameyossnowy.resources.api.meta.Model;
import io.github.flameyossnowy.resources.api.meta.Property;
import io.github.flameyossnowy.resources.api.meta.PropertySet;
import io.github.flameyossnowy.resources.api.query.Direction;
import io.github.flameyossnowy.resources.api.query.Query;
import io.github.flameyossnowy.resources.api.relationship.ManyToOne;
import io.github.flameyossnowy.resources.api.relationship.Relationship;
import io.github.flameyossnowy.resources.api.repository.Repository;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.UnmodifiableView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One record of a {@link Model}, either new or bound to a persisted row.
 * <p>
 * Attribute values live in per-property {@link Slot}s, so "not loaded" and
 * "loaded as null" are told apart. The first change of an attribute records its
 * previous value in {@link #originalValues()}; the attribute is dirty until the
 * change is persisted or reverted.
 * <p>
 * A resource is meant to be used by one unit of work at a time and is not
 * thread-safe.
 */
public class Resource implements Comparable<Resource> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Resource.class);

    private final Model model;
    private final Map<Property, Slot<Object>> values = new HashMap<>();
    private final Map<Property, Object> originalValues = new LinkedHashMap<>();
    private final Map<Relationship, Slot<Object>> associations = new HashMap<>();

    private boolean saved;
    private Slot<Key> key = Slot.unloaded();
    private Slot<Repository> repository = Slot.unloaded();
    private @Nullable ResourceCollection collection;

    public Resource(@NotNull Model model) {
        this.model = Objects.requireNonNull(model, "Model cannot be null");
    }

    public final @NotNull Model model() {
        return model;
    }

    /**
     * The repository this resource was persisted to, or the model's repository
     * while it is new.
     */
    public @NotNull Repository repository() {
        Repository bound = repository.value();
        return bound != null ? bound : model.repository();
    }

    public @NotNull String repositoryName() {
        return repository().name();
    }

    protected @NotNull PropertySet properties() {
        return model.properties(repositoryName());
    }

    protected @NotNull Map<String, Relationship> relationships() {
        return model.relationships(repositoryName());
    }

    private IdentityMap identityMap() {
        return repository().identityMap(model);
    }

    public @Nullable Object attributeGet(@NotNull String name) {
        return properties().require(name).get(this);
    }

    public void attributeSet(@NotNull String name, @Nullable Object value) {
        properties().require(name).set(this, value);
    }

    /**
     * The values of every accessible property, loading them when needed.
     */
    public @NotNull Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (Property property : properties()) {
            if (property.isAccessible()) {
                attributes.put(property.name(), property.get(this));
            }
        }
        return attributes;
    }

    /**
     * Mass assignment of properties and associations.
     *
     * @throws IllegalArgumentException if a name is unknown or its property is not accessible
     */
    public void setAttributes(@NotNull Map<String, ?> attributes) {
        PropertySet properties = properties();
        for (Map.Entry<String, ?> entry : attributes.entrySet()) {
            String name = entry.getKey();
            Property property = properties.get(name);
            if (property != null && property.isAccessible()) {
                property.set(this, entry.getValue());
                continue;
            }

            Relationship relationship = property == null ? relationships().get(name) : null;
            if (relationship == null) {
                throw new IllegalArgumentException("The property '" + name + "' is not accessible in " + model);
            }
            relationship.set(this, entry.getValue());
        }
    }

    /**
     * Assigns the attributes and persists them.
     *
     * @return whether the update was stored
     */
    public boolean update(@NotNull Map<String, ?> attributes) {
        setAttributes(attributes);
        return updateRecord();
    }

    /**
     * The value of a relationship, loading it on first access.
     *
     * @throws IllegalArgumentException if the model has no such relationship
     */
    public @Nullable Object association(@NotNull String name) {
        return requireRelationship(name).get(this);
    }

    public void setAssociation(@NotNull String name, @Nullable Object value) {
        requireRelationship(name).set(this, value);
    }

    private Relationship requireRelationship(String name) {
        Relationship relationship = relationships().get(name);
        if (relationship == null) {
            throw new IllegalArgumentException("Unknown relationship '" + name + "' in " + model);
        }
        return relationship;
    }

    /**
     * Creates or updates the record, then saves every loaded child association.
     *
     * @return whether the record and all of its loaded children were stored
     */
    public boolean save() {
        boolean stored = isNew() ? createRecord() : updateRecord();
        if (!stored) {
            return false;
        }

        for (Relationship relationship : relationships().values()) {
            if (relationship instanceof ManyToOne || !relationship.isLoaded(this)) continue;
            if (!relationship.saveChildren(this)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Deletes the record.
     *
     * @return whether exactly one row was removed
     */
    public boolean destroy() {
        if (!saved) {
            return false;
        }

        int deleted = repository().delete(toQuery());
        if (deleted != 1) {
            LOGGER.debug("Destroying {} {} removed {} rows", model, key(), deleted);
            return false;
        }
        LOGGER.debug("Destroyed {} {}", model, key());
        reset();
        return true;
    }

    /**
     * Marks the resource new again, drops it from the identity map and forgets
     * pending changes.
     */
    public void reset() {
        Key current = key();
        saved = false;
        key = Slot.unloaded();
        if (current != null) {
            identityMap().remove(current, this);
        }
        originalValues.clear();
    }

    /**
     * Re-reads every loaded attribute and reloads loaded child associations.
     */
    @Contract("-> this")
    public @NotNull Resource reload() {
        if (!saved) {
            return this;
        }

        reloadAttributes(loadedAttributes());
        for (Relationship relationship : relationships().values()) {
            if (relationship instanceof ManyToOne || !relationship.isLoaded(this)) continue;
            Object association = relationship.getLoaded(this);
            if (association instanceof ResourceCollection children) {
                if (children.isLoaded()) children.reload();
            } else if (association instanceof Resource child) {
                child.reload();
            }
        }
        return this;
    }

    /**
     * Re-reads the given attributes for this resource and the rest of its collection.
     */
    @Contract("_ -> this")
    public @NotNull Resource reloadAttributes(@NotNull Collection<Property> properties) {
        if (properties.isEmpty() || isNew()) {
            return this;
        }

        ResourceCollection members = Objects.requireNonNull(collection());
        PropertySet readable = members.query().model().properties(repositoryName());
        if (!readable.asList().containsAll(properties) || members.stream().noneMatch(member -> member == this)) {
            // subclass-only properties cannot be read through a base model query
            members = new ResourceCollection(toQuery(), List.of(this), null);
        }
        members.reloadAttributes(properties);
        return this;
    }

    /**
     * Loads a lazy property together with the unloaded rest of its lazy group. The
     * group is fetched for every member of this resource's collection at once.
     */
    @ApiStatus.Internal
    public void lazyLoad(@NotNull Property property) {
        List<Property> fields = new ArrayList<>();
        if (property.isLazy()) {
            for (Property candidate : properties().lazyContext(property.lazyGroup())) {
                if (!candidate.isLoaded(this)) fields.add(candidate);
            }
        }
        if (!fields.contains(property)) {
            fields.add(property);
        }

        ResourceCollection members = collection();
        LOGGER.debug("Lazy loading {} of {} for {} resources", fields, model, members == null ? 0 : members.size());
        if (members != null) {
            members.trackFields(fields);
        }
        reloadAttributes(fields);
    }

    /**
     * The collection this resource was read with; a saved resource read on its own
     * gets a collection of just itself.
     */
    public @Nullable ResourceCollection collection() {
        if (collection == null && saved) {
            collection = new ResourceCollection(toQuery(), List.of(this), null);
        }
        return collection;
    }

    @ApiStatus.Internal
    public void setCollection(@Nullable ResourceCollection collection) {
        this.collection = collection;
    }

    /**
     * A query selecting exactly this resource.
     *
     * @throws IllegalStateException if the key is not complete
     */
    public @NotNull Query toQuery() {
        Key current = key();
        if (current == null) {
            throw new IllegalStateException("Cannot build a query for " + model + " without a complete key");
        }
        return model.toQuery(repository(), current);
    }

    /**
     * The key, built from original values where the key was changed and not yet
     * saved. {@code null} while any key value is missing.
     */
    public @Nullable Key key() {
        Key cached = key.value();
        if (cached != null) {
            return cached;
        }

        List<Property> keyProperties = model.key(repositoryName());
        List<Object> keyValues = new ArrayList<>(keyProperties.size());
        for (Property property : keyProperties) {
            Object value = originalValues.get(property);
            if (value == null) value = property.getLoaded(this);
            if (value == null) return null;
            keyValues.add(value);
        }

        Key computed = new Key(keyValues);
        if (saved) {
            key = Slot.of(computed);
        }
        return computed;
    }

    /**
     * Whether saving would write anything: a changed attribute, or a new resource of a
     * model with a serial key or a defaulted property.
     */
    public boolean isDirty() {
        if (!originalValues.isEmpty()) {
            return true;
        }
        if (isNew()) {
            if (model.identityField() != null) return true;
            for (Property property : properties()) {
                if (property.hasDefault()) return true;
            }
        }
        return false;
    }

    public boolean isNew() {
        return !saved;
    }

    public boolean isSaved() {
        return saved;
    }

    /**
     * Pre-mutation values of the changed attributes.
     */
    public @UnmodifiableView @NotNull Map<Property, Object> originalValues() {
        return Collections.unmodifiableMap(originalValues);
    }

    /**
     * Current values of the changed attributes.
     */
    public @NotNull Map<Property, Object> dirtyAttributes() {
        Map<Property, Object> dirty = new LinkedHashMap<>();
        for (Property property : originalValues.keySet()) {
            dirty.put(property, property.getLoaded(this));
        }
        return dirty;
    }

    public boolean isAttributeDirty(@NotNull String name) {
        return originalValues.containsKey(properties().require(name));
    }

    public boolean isAttributeLoaded(@NotNull String name) {
        return properties().require(name).isLoaded(this);
    }

    public @NotNull List<Property> loadedAttributes() {
        List<Property> loaded = new ArrayList<>();
        for (Property property : properties()) {
            if (property.isLoaded(this)) loaded.add(property);
        }
        return loaded;
    }

    /**
     * Inserts the record. Unloaded non-serial properties receive their defaults first.
     *
     * @return whether exactly one row was created
     */
    protected boolean createRecord() {
        if (saved || !isDirty()) {
            return false;
        }

        propagateParentKeys();
        for (Property property : properties()) {
            if (!property.isSerial() && !property.isLoaded(this)) {
                property.set(this, property.defaultFor(this));
            }
        }

        Repository target = repository();
        int created = target.create(List.of(this));
        if (created != 1) {
            LOGGER.debug("Creating {} affected {} rows", model, created);
            return false;
        }

        repository = Slot.of(target);
        saved = true;
        originalValues.clear();
        key = Slot.unloaded();

        Key current = key();
        if (current != null) {
            identityMap().set(current, this);
        }
        LOGGER.debug("Created {} {} in {}", model, current, target.name());
        return true;
    }

    /**
     * Writes the dirty attributes. A changed key moves the identity map entry from
     * the old key to the new one.
     *
     * @return {@code true} if nothing was dirty or exactly one row was updated,
     *         {@code false} for a new resource, a non-nullable attribute set to
     *         {@code null}, or any other row count
     */
    protected boolean updateRecord() {
        if (!saved) {
            return false;
        }

        propagateParentKeys();
        Map<Property, Object> dirty = dirtyAttributes();
        if (dirty.isEmpty()) {
            return true;
        }
        for (Map.Entry<Property, Object> entry : dirty.entrySet()) {
            if (!entry.getKey().isNullable() && entry.getValue() == null) {
                LOGGER.debug("Not updating {} {}: '{}' cannot be null", model, key(), entry.getKey().name());
                return false;
            }
        }

        Key previous = key();
        int updated = repository().update(dirty, toQuery());
        if (updated != 1) {
            LOGGER.debug("Updating {} {} affected {} rows", model, previous, updated);
            return false;
        }

        originalValues.clear();
        key = Slot.unloaded();
        Key current = key();

        IdentityMap identityMap = identityMap();
        if (previous != null && !previous.equals(current)) {
            identityMap.remove(previous, this);
        }
        if (current != null) {
            identityMap.set(current, this);
        }
        LOGGER.debug("Updated {} {} ({})", model, current, dirty.keySet());
        return true;
    }

    private void propagateParentKeys() {
        for (Relationship relationship : relationships().values()) {
            if (relationship instanceof ManyToOne manyToOne) {
                manyToOne.propagateKey(this);
            }
        }
    }

    @ApiStatus.Internal
    public @NotNull Slot<Object> slot(@NotNull Property property) {
        return values.getOrDefault(property, Slot.unloaded());
    }

    @ApiStatus.Internal
    public void putSlot(@NotNull Property property, @NotNull Slot<Object> slot) {
        values.put(property, slot);
    }

    /**
     * Records the value an attribute had before its first change; changing it back to
     * that value makes it clean again.
     */
    @ApiStatus.Internal
    public void trackOriginal(@NotNull Property property, @Nullable Object original, @Nullable Object value) {
        if (originalValues.containsKey(property)) {
            if (Objects.equals(originalValues.get(property), value)) {
                originalValues.remove(property);
            }
        } else if (!Objects.equals(original, value)) {
            originalValues.put(property, original);
        }
    }

    /**
     * Takes a value read from the repository. Dirty attributes keep their pending
     * value; loaded ones are overwritten only on reload.
     */
    @ApiStatus.Internal
    public void loadAttribute(@NotNull Property property, @Nullable Object value, boolean reload) {
        if (originalValues.containsKey(property)) {
            return;
        }
        if (reload || !property.isLoaded(this)) {
            property.setLoaded(this, value);
        }
    }

    /**
     * Marks the resource as read from the repository.
     */
    @ApiStatus.Internal
    public void bindPersisted(@NotNull Repository repository) {
        this.repository = Slot.of(repository);
        this.saved = true;
        this.key = Slot.unloaded();
    }

    @ApiStatus.Internal
    public @NotNull Slot<Object> associationSlot(@NotNull Relationship relationship) {
        return associations.getOrDefault(relationship, Slot.unloaded());
    }

    @ApiStatus.Internal
    public void putAssociation(@NotNull Relationship relationship, @NotNull Slot<Object> slot) {
        associations.put(relationship, slot);
    }

    /**
     * Tells the callsite this resource was read through that the relationship was
     * traversed.
     */
    @ApiStatus.Internal
    public void trackLink(@NotNull Relationship relationship) {
        Callsite callsite = collection == null ? null : collection.callsite();
        if (callsite != null) {
            callsite.trackLink(relationship.name());
        }
    }

    /**
     * Same model, same key, and either both clean in the same repository or equal in
     * every non-key property.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Resource resource) || resource.model != model) {
            return false;
        }
        return compareAttributes(resource);
    }

    /**
     * Like {@link #equals(Object)}, but accepts any model of the same inheritance tree.
     */
    public boolean isEquivalent(@Nullable Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Resource resource) || resource.model.baseModel() != model.baseModel()) {
            return false;
        }
        return compareAttributes(resource);
    }

    private boolean compareAttributes(Resource other) {
        if (!Objects.equals(key(), other.key())) {
            return false;
        }
        if (repository().equals(other.repository()) && !isDirty() && !other.isDirty()) {
            return true;
        }

        PropertySet otherProperties = other.properties();
        List<Property> loaded = new ArrayList<>();
        List<Property> unloaded = new ArrayList<>();
        for (Property property : properties()) {
            if (property.isKey() || !otherProperties.contains(property)) continue;
            if (property.isLoaded(this) && property.isLoaded(other)) {
                loaded.add(property);
            } else {
                unloaded.add(property);
            }
        }
        loaded.addAll(unloaded);

        for (Property property : loaded) {
            if (!Objects.equals(property.get(this), property.get(other))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Orders by the model's default order, using loaded values only.
     *
     * @throws IllegalArgumentException if {@code other} is not of this model
     */
    @Override
    public int compareTo(@NotNull Resource other) {
        if (!other.model.isA(model)) {
            throw new IllegalArgumentException("Cannot compare a " + other.model + " instance with a " + model + " instance");
        }

        for (Direction direction : model.defaultOrder(repositoryName())) {
            Property property = direction.property();
            int cmp = direction.compare(property.getLoaded(this), property.getLoaded(other));
            if (cmp != 0) return cmp;
        }
        return 0;
    }

    @Override
    public int hashCode() {
        return model.hashCode() * 31 + Objects.hashCode(key());
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(model.name()).append('{');
        boolean first = true;
        for (Property property : properties()) {
            if (!first) builder.append(", ");
            first = false;

            builder.append(property.name()).append('=');
            if (property.isLoaded(this)) {
                Object value = property.getLoaded(this);
                builder.append(value instanceof Model m ? m.name() : value);
            } else {
                builder.append(saved ? "<not loaded>" : "null");
            }
        }
        return builder.append('}').toString();
    }
}
