package io.github.flameyossnowy.resources.api.resource;

import io.github.flameyossnowy.resources.api.callsite.Callsite;
import io.github.flameyossnowy.resources.api.identity.Key;
import io.github.flameyossnowy.resources.api.meta.Model;
import io.github.flameyossnowy.resources.api.meta.Property;
import io.github.flameyossnowy.resources.api.query.Condition;
import io.github.flameyossnowy.resources.api.query.Query;
import io.github.flameyossnowy.resources.api.query.QueryOption;
import io.github.flameyossnowy.resources.api.relationship.Relationship;
import io.github.flameyossnowy.resources.api.repository.Repository;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * An ordered set of resources read by one query.
 * <p>
 * Members remember the collection they were read with; a lazy load on any of them
 * reloads the missing fields for every member in one query. A collection that
 * holds an association is read on first use.
 */
public class ResourceCollection implements Iterable<Resource> {
    private final @Nullable Query query;
    private final @Nullable Resource source;
    private final @Nullable Relationship relationship;
    private final @Nullable Callsite callsite;
    private final List<Resource> members = new ArrayList<>();
    private boolean loaded;

    public ResourceCollection(@NotNull Query query, @NotNull List<Resource> members, @Nullable Callsite callsite) {
        this.query = query;
        this.source = null;
        this.relationship = null;
        this.callsite = callsite;
        this.members.addAll(members);
        this.loaded = true;
    }

    private ResourceCollection(Resource source, Relationship relationship, @Nullable List<Resource> members) {
        this.query = null;
        this.source = source;
        this.relationship = relationship;
        this.callsite = null;
        if (members != null) {
            this.members.addAll(members);
            this.loaded = true;
        }
    }

    /**
     * The not yet loaded children of {@code source} along {@code relationship}.
     */
    @ApiStatus.Internal
    public static @NotNull ResourceCollection association(@NotNull Resource source, @NotNull Relationship relationship) {
        return new ResourceCollection(source, relationship, null);
    }

    @ApiStatus.Internal
    public static @NotNull ResourceCollection loadedAssociation(
        @NotNull Resource source,
        @NotNull Relationship relationship,
        @NotNull List<Resource> members
    ) {
        return new ResourceCollection(source, relationship, members);
    }

    /**
     * The query this collection reads; for an association, the query selecting the
     * source's children.
     */
    public @NotNull Query query() {
        if (query != null) {
            return query;
        }
        return relationship.query(source);
    }

    public @Nullable Callsite callsite() {
        return callsite;
    }

    public @Nullable Resource source() {
        return source;
    }

    public @Nullable Relationship relationship() {
        return relationship;
    }

    public boolean isLoaded() {
        return loaded;
    }

    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        Query childQuery = query();
        members.addAll(childQuery.model().all(childQuery).asList());
        loaded = true;
    }

    public int size() {
        ensureLoaded();
        return members.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public @NotNull Resource get(int index) {
        ensureLoaded();
        return members.get(index);
    }

    public @Nullable Resource first() {
        return isEmpty() ? null : members.get(0);
    }

    /**
     * Appends a member. Adding to the association of an unsaved parent starts the
     * collection empty instead of reading it.
     */
    public boolean add(@NotNull Resource resource) {
        if (!loaded && source != null && source.isNew()) {
            loaded = true;
        }
        ensureLoaded();
        for (Resource member : members) {
            if (member == resource) return false;
        }
        return members.add(resource);
    }

    /**
     * Removes a member from this collection; its row is left untouched.
     */
    public boolean remove(@NotNull Resource resource) {
        ensureLoaded();
        return members.removeIf(member -> member == resource);
    }

    public @NotNull List<Resource> asList() {
        ensureLoaded();
        return Collections.unmodifiableList(members);
    }

    @Override
    public @NotNull Iterator<Resource> iterator() {
        return asList().iterator();
    }

    public @NotNull Stream<Resource> stream() {
        return asList().stream();
    }

    public @NotNull ResourceCollection reload() {
        return reload(Map.of());
    }

    /**
     * Reads the query again with the options merged in and overwrites the clean
     * attributes of the members with what was read. Rows the read returns as other
     * instances are copied into the existing members with the same key. Membership
     * follows the query, so members that no longer match it are dropped.
     */
    public @NotNull ResourceCollection reload(@NotNull Map<QueryOption, ?> options) {
        Query reloadQuery = query().merge(options).update(Map.of(QueryOption.RELOAD, true));
        List<Resource> fresh = reloadQuery.repository().read(reloadQuery);

        Map<Key, Resource> existing = new HashMap<>();
        for (Resource member : members) {
            Key key = member.key();
            if (key != null) existing.put(key, member);
        }

        List<Resource> reloaded = new ArrayList<>(fresh.size());
        for (Resource resource : fresh) {
            Resource member = existing.get(resource.key());
            if (member == null) {
                resource.setCollection(this);
            } else if (member != resource) {
                for (Property property : resource.loadedAttributes()) {
                    member.loadAttribute(property, property.getLoaded(resource), true);
                }
                resource = member;
            }
            reloaded.add(resource);
        }

        members.clear();
        members.addAll(reloaded);
        loaded = true;
        return this;
    }

    /**
     * Re-reads the given fields for the saved members, selecting them by their current
     * keys rather than by this collection's query. Membership is left untouched.
     */
    @ApiStatus.Internal
    public void reloadAttributes(@NotNull Collection<Property> fields) {
        Map<Key, Resource> byKey = new LinkedHashMap<>();
        for (Resource member : members) {
            Key key = member.isSaved() ? member.key() : null;
            if (key != null) byKey.put(key, member);
        }
        if (byKey.isEmpty()) {
            return;
        }

        Query scope = query();
        Model model = scope.model();
        Repository repository = scope.repository();
        List<Property> keyProperties = model.key(repository.name());

        List<Query> reads = new ArrayList<>();
        if (keyProperties.size() == 1) {
            List<Object> values = new ArrayList<>(byKey.size());
            for (Key key : byKey.keySet()) values.add(key.get(0));
            reads.add(model.query(repository, Map.of(
                QueryOption.FIELDS, List.copyOf(fields),
                QueryOption.CONDITIONS, List.of(Condition.in(keyProperties.get(0), values)),
                QueryOption.RELOAD, true
            )));
        } else {
            for (Key key : byKey.keySet()) {
                reads.add(model.toQuery(repository, key).update(Map.of(
                    QueryOption.FIELDS, List.copyOf(fields),
                    QueryOption.RELOAD, true
                )));
            }
        }

        for (Query read : reads) {
            for (Resource fresh : repository.read(read)) {
                Resource member = byKey.get(fresh.key());
                if (member != null && member != fresh) {
                    for (Property property : fresh.loadedAttributes()) {
                        member.loadAttribute(property, property.getLoaded(fresh), true);
                    }
                }
            }
        }
    }

    /**
     * Saves every loaded member; an association also receives the source's key first.
     *
     * @return whether every member saved
     */
    public boolean save() {
        if (!loaded) {
            return true;
        }
        if (source != null && relationship != null) {
            return relationship.saveChildren(source);
        }

        boolean saved = true;
        for (Resource member : members) {
            saved &= member.save();
        }
        return saved;
    }

    /**
     * Reports fields loaded after the fact to the callsite this collection was read through.
     */
    @ApiStatus.Internal
    public void trackFields(@NotNull Collection<Property> fields) {
        if (callsite == null) {
            return;
        }
        for (Property field : fields) {
            callsite.trackField(field.name());
        }
    }

    @Override
    public String toString() {
        if (!loaded) {
            return "ResourceCollection{<not loaded>}";
        }
        return "ResourceCollection" + members;
    }
}
