package io.github.flameyossnowy.resources.api.identity;

import io.github.flameyossnowy.resources.api.resource.Resource;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps a persisted key to the single live resource for that key, scoped to one
 * repository and one base model.
 * <p>
 * Individual operations are atomic. The map is unbounded; it is never an LRU.
 */
public final class IdentityMap {
    private final ConcurrentHashMap<Key, Resource> resources = new ConcurrentHashMap<>(64);

    public @Nullable Resource get(@NotNull Key key) {
        return resources.get(key);
    }

    public void set(@NotNull Key key, @NotNull Resource resource) {
        resources.put(key, resource);
    }

    /**
     * Inserts the resource unless another instance already owns the key.
     *
     * @return the instance that owns the key after the call
     */
    public @NotNull Resource putIfAbsent(@NotNull Key key, @NotNull Resource resource) {
        Resource existing = resources.putIfAbsent(key, resource);
        return existing == null ? resource : existing;
    }

    public @Nullable Resource delete(@NotNull Key key) {
        return resources.remove(key);
    }

    /**
     * Removes the entry only while it still points at this very {@code resource};
     * an equal but distinct instance is left in place.
     */
    public boolean remove(@NotNull Key key, @NotNull Resource resource) {
        boolean[] removed = new boolean[1];
        resources.computeIfPresent(key, (ignored, current) -> {
            if (current != resource) return current;
            removed[0] = true;
            return null;
        });
        return removed[0];
    }

    public boolean containsKey(@NotNull Key key) {
        return resources.containsKey(key);
    }

    public @NotNull Set<Key> keys() {
        return Set.copyOf(resources.keySet());
    }

    public int size() {
        return resources.size();
    }

    public void clear() {
        resources.clear();
    }
}
