import io.github.flameyossnowy.resources.api.identity.Key;
import io.github.flameyossnowy.resources.api.meta.Model;
import io.github.flameyossnowy.resources.api.meta.Property;
import io.github.flameyossnowy.resources.api.query.Condition;
import io.github.flameyossnowy.resources.api.query.Query;
import io.github.flameyossnowy.resources.api.query.SortOrder;
import io.github.flameyossnowy.resources.api.repository.Repository;
import io.github.flameyossnowy.resources.api.repository.RepositoryAdapter;
import io.github.flameyossnowy.resources.api.repository.RepositoryRegistry;
import io.github.flameyossnowy.resources.api.resource.Resource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class ResourceTest {
    RepositoryAdapter adapter;
    Repository repository;
    Model product;
    Model note;
    Property id;
    Property name;

    @BeforeEach
    void setup() {
        adapter = mock(RepositoryAdapter.class);
        RepositoryRegistry registry = new RepositoryRegistry();
        repository = registry.register(RepositoryRegistry.DEFAULT_REPOSITORY_NAME, adapter);

        id = Property.serial("id");
        name = Property.builder("name", String.class).nullable(false).lazy(false).build();
        product = Model.builder("Product", registry)
            .property(id)
            .property(Property.discriminator("type"))
            .property(name)
            .property("price", Integer.class)
            .property("category_id", Long.class)
            .property(Property.builder("description", String.class).lazyGroup("details").build())
            .orderBy("name", SortOrder.ASC)
            .build();

        note = Model.builder("Note", registry)
            .property(Property.builder("slug", String.class).key().build())
            .property(Property.builder("body", String.class).lazy(false).build())
            .property(Property.builder("secret", String.class).privateAccess().build())
            .build();

        AtomicLong sequence = new AtomicLong();
        when(adapter.create(anyList())).thenAnswer(invocation -> {
            List<Resource> resources = invocation.getArgument(0);
            for (Resource resource : resources) {
                if (resource.model().isA(product)) id.setLoaded(resource, sequence.incrementAndGet());
            }
            return resources.size();
        });
    }

    private Resource persisted(Model model, Map<String, Object> loaded) {
        Resource resource = model.newResource();
        resource.bindPersisted(repository);
        for (Map.Entry<String, Object> entry : loaded.entrySet()) {
            model.properties().require(entry.getKey()).setLoaded(resource, entry.getValue());
        }
        return resource;
    }

    @Test
    void new_resource_without_identity_or_defaults_does_not_save() {
        Resource resource = note.newResource();

        assertFalse(resource.isDirty());
        assertFalse(resource.save());
        assertTrue(resource.isNew());
        assertEquals(0, repository.identityMap(note).size());
        verify(adapter, never()).create(anyList());
    }

    @Test
    void create_binds_the_resource_and_registers_its_key() {
        Resource resource = product.newResource(Map.of("name", "Widget"));
        assertTrue(resource.isDirty());

        assertTrue(resource.save());

        assertTrue(resource.isSaved());
        assertFalse(resource.isDirty());
        assertEquals(Key.of(1L), resource.key());
        assertSame(resource, repository.identityMap(product).get(Key.of(1L)));
        assertSame(repository, resource.repository());
        assertTrue(resource.isAttributeLoaded("price"));
        assertNull(resource.attributeGet("price"));
    }

    @Test
    void update_with_a_null_non_nullable_attribute_fails_without_writing() {
        Resource resource = product.create(Map.of("name", "Widget"));

        resource.attributeSet("name", null);

        assertFalse(resource.save());
        assertFalse(resource.originalValues().isEmpty());
        verify(adapter, never()).update(any(), any());
    }

    @Test
    void update_writes_only_dirty_attributes_against_the_persisted_key() {
        Resource resource = product.create(Map.of("name", "Widget"));
        when(adapter.update(any(), any())).thenReturn(1);

        assertTrue(resource.update(Map.of("price", 12)));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<Property, Object>> attributes = ArgumentCaptor.forClass(Map.class);
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(adapter).update(attributes.capture(), query.capture());
        assertEquals(Map.of(product.properties().require("price"), 12), attributes.getValue());
        assertEquals(List.of(Condition.eq(id, 1L)), query.getValue().conditions());
        assertFalse(resource.isDirty());
    }

    @Test
    void update_without_changes_succeeds_without_writing() {
        Resource resource = product.create(Map.of("name", "Widget"));

        assertTrue(resource.save());
        verify(adapter, never()).update(any(), any());
    }

    @Test
    void update_affecting_another_row_count_fails() {
        Resource resource = product.create(Map.of("name", "Widget"));
        when(adapter.update(any(), any())).thenReturn(0);

        assertFalse(resource.update(Map.of("name", "Gadget")));
        assertTrue(resource.isAttributeDirty("name"));
    }

    @Test
    void update_on_a_new_resource_fails() {
        assertFalse(product.newResource().update(Map.of("name", "Widget")));
    }

    @Test
    void key_change_moves_the_identity_map_entry() {
        Resource resource = persisted(note, Map.of("slug", "first", "body", "text"));
        repository.identityMap(note).set(Key.of("first"), resource);
        when(adapter.update(any(), any())).thenReturn(1);

        resource.attributeSet("slug", "second");
        assertEquals(Key.of("first"), resource.key());
        assertTrue(resource.save());

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(adapter).update(any(), query.capture());
        assertEquals("first", query.getValue().conditions().get(0).value());
        assertEquals(Key.of("second"), resource.key());
        assertNull(repository.identityMap(note).get(Key.of("first")));
        assertSame(resource, repository.identityMap(note).get(Key.of("second")));
    }

    @Test
    void destroy_removes_the_resource() {
        Resource resource = product.create(Map.of("name", "Widget"));
        when(adapter.delete(any())).thenReturn(1);

        assertTrue(resource.destroy());

        assertFalse(resource.isSaved());
        assertNull(repository.identityMap(product).get(Key.of(1L)));
    }

    @Test
    void destroy_needs_a_saved_resource_and_exactly_one_row() {
        assertFalse(product.newResource().destroy());

        Resource resource = product.create(Map.of("name", "Widget"));
        when(adapter.delete(any())).thenReturn(2);

        assertFalse(resource.destroy());
        assertTrue(resource.isSaved());
        assertSame(resource, repository.identityMap(product).get(Key.of(1L)));
    }

    @Test
    void get_rejects_key_values_of_the_wrong_type_or_count() {
        assertThrows(IllegalArgumentException.class, () -> product.get(1));
        assertThrows(IllegalArgumentException.class, () -> product.get(1L, 2L));
        assertThrows(IllegalArgumentException.class, () -> note.get());
        verify(adapter, never()).read(any());
    }

    @Test
    void reset_forgets_the_cached_key() {
        Resource resource = product.create(Map.of("name", "Widget"));
        assertEquals(Key.of(1L), resource.key());

        resource.reset();
        id.setLoaded(resource, 9L);

        assertTrue(resource.isNew());
        assertEquals(Key.of(9L), resource.key());
        assertNull(repository.identityMap(product).get(Key.of(1L)));
    }

    @Test
    void clean_resources_with_the_same_key_are_equal_without_loading() {
        Resource left = persisted(product, Map.of("id", 7L));
        Resource right = persisted(product, Map.of("id", 7L));

        assertEquals(left, right);
        assertTrue(left.isEquivalent(right));
        assertEquals(left.hashCode(), right.hashCode());
        verify(adapter, never()).read(any());
    }

    @Test
    void dirty_resources_compare_attributes() {
        Resource left = persisted(note, Map.of("slug", "a", "body", "old", "secret", "s"));
        Resource right = persisted(note, Map.of("slug", "a", "body", "new", "secret", "s"));

        left.attributeSet("body", "new");
        assertEquals(left, right);

        left.attributeSet("body", "other");
        assertNotEquals(left, right);
    }

    @Test
    void equality_needs_the_same_model_but_equivalence_the_same_tree() {
        Model book = product.extend("Book");
        Resource plain = persisted(product, Map.of("id", 7L));
        Resource bound = persisted(book, Map.of("id", 7L));

        assertNotEquals(plain, bound);
        assertTrue(plain.isEquivalent(bound));
        assertFalse(plain.isEquivalent(persisted(note, Map.of("slug", "7"))));
    }

    @Test
    void ordering_follows_the_default_order() {
        Resource apple = persisted(product, Map.of("id", 1L, "name", "Apple"));
        Resource banana = persisted(product, Map.of("id", 2L, "name", "Banana"));

        assertTrue(apple.compareTo(banana) < 0);
        assertTrue(banana.compareTo(apple) > 0);
        assertThrows(IllegalArgumentException.class, () -> apple.compareTo(note.newResource()));
    }

    @Test
    void to_string_marks_unloaded_attributes() {
        Resource resource = persisted(product, Map.of("id", 1L, "name", "Widget"));

        assertEquals("Product{id=1, type=<not loaded>, name=Widget, price=<not loaded>, "
            + "category_id=<not loaded>, description=<not loaded>}", resource.toString());
        assertTrue(product.newResource().toString().contains("price=null"));
    }

    @Test
    void mass_assignment_rejects_private_and_unknown_properties() {
        Resource resource = note.newResource();

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
            () -> resource.setAttributes(Map.of("secret", "x")));
        assertEquals("The property 'secret' is not accessible in Note", error.getMessage());
        assertThrows(IllegalArgumentException.class, () -> resource.setAttributes(Map.of("colour", "red")));
        assertFalse(resource.attributes().containsKey("secret"));
    }

    @Test
    void lazy_load_fetches_the_unloaded_group() {
        Resource fresh = persisted(product, Map.of("id", 1L, "name", "Widget"));
        repository.identityMap(product).set(Key.of(1L), fresh);

        Map<String, Object> row = new HashMap<>();
        row.put("id", 1L);
        row.put("type", "Product");
        row.put("price", 12);
        row.put("category_id", 3L);
        when(adapter.read(any())).thenReturn(List.of(row));

        assertEquals(12, fresh.attributeGet("price"));

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(adapter).read(query.capture());
        assertTrue(query.getValue().fieldNames().containsAll(List.of("id", "type", "price", "category_id")));
        assertFalse(query.getValue().fieldNames().contains("description"));
        assertEquals(List.of(Condition.in(id, List.of(1L))), query.getValue().conditions());
        assertEquals(3L, fresh.attributeGet("category_id"));
        assertFalse(fresh.isAttributeLoaded("description"));
        assertFalse(fresh.isDirty());
    }
}
