package io.github.flameyossnowy.resources.api.callsite;

import io.github.flameyossnowy.resources.api.cache.Slot;
import io.github.flameyossnowy.resources.api.meta.Model;
import io.github.flameyossnowy.resources.api.meta.Property;
import io.github.flameyossnowy.resources.api.meta.PropertySet;
import io.github.flameyossnowy.resources.api.query.Query;
import io.github.flameyossnowy.resources.api.query.QueryOption;
import io.github.flameyossnowy.resources.api.resource.ResourceCollection;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The fields and links one place in the code needs when it reads a model.
 * <p>
 * A callsite starts with the model's default fields and no links. Collections read
 * through it report the lazy fields and associations their members end up using,
 * so the next read from the same place fetches them upfront. Get instances from a
 * {@link CallsiteRegistry}; there is one per model, repository and signature.
 */
public final class Callsite {
    private static final Logger LOGGER = LoggerFactory.getLogger(Callsite.class);

    private final Model model;
    private final String repositoryName;
    private final String signature;
    private final Object lock = new Object();

    private Set<String> fields;
    private Set<String> links;
    private volatile Slot<String> identityField = Slot.unloaded();
    private volatile Slot<String> inheritanceField = Slot.unloaded();

    Callsite(@NotNull Model model, @NotNull String repositoryName, @NotNull String signature) {
        this.model = model;
        this.repositoryName = repositoryName;
        this.signature = signature;
        LOGGER.debug("New callsite {} for model {}, instantiated from repository {}", signature, model, repositoryName);
    }

    public @NotNull Model model() {
        return model;
    }

    public @NotNull String repositoryName() {
        return repositoryName;
    }

    public @NotNull String signature() {
        return signature;
    }

    private PropertySet properties() {
        return model.properties(repositoryName);
    }

    /**
     * Names of the fields to fetch; the model's non-lazy properties plus whatever was
     * tracked since.
     */
    public @NotNull Set<String> fields() {
        synchronized (lock) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(initFields()));
        }
    }

    public @NotNull Set<String> links() {
        synchronized (lock) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(initLinks()));
        }
    }

    public boolean hasLinks() {
        synchronized (lock) {
            return !initLinks().isEmpty();
        }
    }

    private Set<String> initFields() {
        if (fields == null) {
            fields = new LinkedHashSet<>();
            for (Property property : properties().defaults()) fields.add(property.name());
        }
        return fields;
    }

    private Set<String> initLinks() {
        if (links == null) {
            links = new LinkedHashSet<>();
        }
        return links;
    }

    /**
     * Adds a field to fetch from now on.
     *
     * @return whether the field was new to this callsite
     * @throws IllegalArgumentException if the model has no such property
     */
    public boolean trackField(@NotNull String name) {
        properties().require(name);
        synchronized (lock) {
            return initFields().add(name);
        }
    }

    /**
     * Adds an association to eager load from now on.
     *
     * @return whether the link was new to this callsite
     * @throws IllegalArgumentException if the model has no such relationship
     */
    public boolean trackLink(@NotNull String name) {
        if (!model.relationships(repositoryName).containsKey(name)) {
            throw new IllegalArgumentException("Unknown relationship '" + name + "' in " + model);
        }
        synchronized (lock) {
            return initLinks().add(name);
        }
    }

    /**
     * The serial key's name, or {@code null} when the model has none.
     */
    public @Nullable String identityField() {
        Slot<String> slot = identityField;
        if (!slot.isLoaded()) {
            Property property = model.identityField();
            slot = Slot.of(property == null ? null : property.name());
            identityField = slot;
        }
        return slot.value();
    }

    /**
     * The discriminator's name, or {@code null} when the model is not part of an
     * inheritance tree.
     */
    public @Nullable String inheritanceField() {
        Slot<String> slot = inheritanceField;
        if (!slot.isLoaded()) {
            Property property = properties().discriminator();
            slot = Slot.of(property == null ? null : property.name());
            inheritanceField = slot;
        }
        return slot.value();
    }

    public boolean isInheritable() {
        return inheritanceField() != null;
    }

    /**
     * The options a query from this callsite is widened with: {@code FIELDS}, and
     * {@code LINKS} only when links were tracked.
     */
    public @NotNull Map<QueryOption, List<String>> toHash() {
        Map<QueryOption, List<String>> hash = new EnumMap<>(QueryOption.class);
        synchronized (lock) {
            hash.put(QueryOption.FIELDS, List.copyOf(initFields()));
            if (!initLinks().isEmpty()) {
                hash.put(QueryOption.LINKS, List.copyOf(links));
            }
        }
        return hash;
    }

    /**
     * Merges what this callsite learned into the query in place.
     *
     * @return the same query
     */
    @Contract("_ -> param1")
    public @NotNull Query optimize(@NotNull Query query) {
        return query.update(toHash());
    }

    public @NotNull Query toQuery() {
        return model.query(model.registry().repository(repositoryName), toHash());
    }

    /**
     * Reads the callsite's own query; members report back what they load later.
     */
    public @NotNull ResourceCollection all() {
        return model.all(toQuery(), this);
    }

    public @NotNull ResourceCollection all(@NotNull Query query) {
        return model.all(optimize(query), this);
    }

    @Override
    public String toString() {
        return "Callsite{" + signature + ", model=" + model + ", repository=" + repositoryName + '}';
    }
}
