import io.github.flameyossnowy.resources.api.identity.IdentityMap;
import io.github.flameyossnowy.resources.api.identity.Key;
import io.github.flameyossnowy.resources.api.meta.Model;
import io.github.flameyossnowy.resources.api.meta.Property;
import io.github.flameyossnowy.resources.api.repository.Repository;
import io.github.flameyossnowy.resources.api.repository.RepositoryAdapter;
import io.github.flameyossnowy.resources.api.repository.RepositoryRegistry;
import io.github.flameyossnowy.resources.api.resource.Resource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class IdentityMapTest {
    Repository repository;
    Model product;

    @BeforeEach
    void setup() {
        RepositoryRegistry registry = new RepositoryRegistry();
        repository = registry.register(RepositoryRegistry.DEFAULT_REPOSITORY_NAME, mock(RepositoryAdapter.class));
        product = Model.builder("Product", registry)
            .property(Property.serial("id"))
            .property(Property.discriminator("type"))
            .build();
    }

    @Test
    void set_get_and_delete() {
        IdentityMap map = new IdentityMap();
        Resource resource = product.newResource();

        map.set(Key.of(1L), resource);

        assertSame(resource, map.get(Key.of(1L)));
        assertTrue(map.containsKey(Key.of(1L)));
        assertEquals(Set.of(Key.of(1L)), map.keys());
        assertSame(resource, map.delete(Key.of(1L)));
        assertNull(map.get(Key.of(1L)));
        assertEquals(0, map.size());
    }

    @Test
    void put_if_absent_returns_the_owner() {
        IdentityMap map = new IdentityMap();
        Resource first = product.newResource();
        Resource second = product.newResource();

        assertSame(first, map.putIfAbsent(Key.of(1L), first));
        assertSame(first, map.putIfAbsent(Key.of(1L), second));
    }

    @Test
    void conditional_remove_only_drops_the_given_instance() {
        IdentityMap map = new IdentityMap();
        Resource owner = product.newResource();
        map.set(Key.of(1L), owner);

        assertFalse(map.remove(Key.of(1L), product.newResource()));
        assertTrue(map.remove(Key.of(1L), owner));
        assertEquals(0, map.size());
    }

    @Test
    void subclasses_share_the_base_model_map() {
        Model book = product.extend("Book");

        assertSame(repository.identityMap(product), repository.identityMap(book));
    }

    @Test
    void keys_are_value_tuples() {
        assertEquals(Key.of("a", 1), new Key(List.of("a", 1)));
        assertNotEquals(Key.of("a", 1), Key.of(1, "a"));
        assertThrows(IllegalArgumentException.class, Key::of);
        assertEquals("7", Key.of(7).toString());
    }
}
