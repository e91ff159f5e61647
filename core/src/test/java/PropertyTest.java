import io.github.flameyossnowy.resources.api.meta.Model;
import io.github.flameyossnowy.resources.api.meta.Property;
import io.github.flameyossnowy.resources.api.repository.RepositoryAdapter;
import io.github.flameyossnowy.resources.api.repository.RepositoryRegistry;
import io.github.flameyossnowy.resources.api.resource.Resource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PropertyTest {
    Model product;
    Property name;
    Property active;

    @BeforeEach
    void setup() {
        RepositoryRegistry registry = new RepositoryRegistry();
        registry.register(RepositoryRegistry.DEFAULT_REPOSITORY_NAME, mock(RepositoryAdapter.class));

        name = Property.of("name", String.class);
        active = Property.builder("active", boolean.class).defaultValue(true).build();
        product = Model.builder("Product", registry)
            .property(Property.serial("id"))
            .property(Property.discriminator("type"))
            .property(name)
            .property(active)
            .property(Property.builder("description", String.class).lazyGroup("details").build())
            .build();
    }

    @Test
    void declarations_normalise_flags() {
        Property id = product.properties().require("id");

        assertEquals(Boolean.class, active.type());
        assertTrue(id.isKey());
        assertTrue(id.isSerial());
        assertFalse(id.isNullable());
        assertFalse(id.isLazy());
        assertTrue(name.isLazy());
        assertEquals(Property.DEFAULT_LAZY_GROUP, name.lazyGroup());
        assertEquals("details", product.properties().require("description").lazyGroup());
        assertFalse(product.properties().require("type").isLazy());
        assertEquals(List.of("id", "type"), product.properties().defaults().stream().map(Property::name).toList());
    }

    @Test
    void invalid_declarations_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> Property.builder("id", String.class).serial());
        assertThrows(IllegalArgumentException.class, () -> Property.builder("type", String.class).discriminator());
        assertThrows(IllegalArgumentException.class, () -> Property.builder("id", Long.class).key().lazy(true).build());
        assertThrows(IllegalArgumentException.class, () -> Property.builder("count", Integer.class).defaultValue("three"));
        assertThrows(IllegalArgumentException.class, () -> Property.of(" ", String.class));
    }

    @Test
    void set_records_the_original_value_once() {
        Resource resource = product.newResource();
        name.setLoaded(resource, "Widget");

        name.set(resource, "Gadget");
        name.set(resource, "Gizmo");

        assertEquals("Gizmo", name.get(resource));
        assertEquals(Map.of(name, "Widget"), resource.originalValues());
    }

    @Test
    void setting_the_original_back_makes_the_attribute_clean() {
        Resource resource = product.newResource();
        name.setLoaded(resource, "Widget");

        name.set(resource, "Gadget");
        name.set(resource, "Widget");

        assertTrue(resource.originalValues().isEmpty());
        assertFalse(resource.isAttributeDirty("name"));
    }

    @Test
    void setting_an_equal_loaded_value_is_a_no_op() {
        Resource resource = product.newResource();
        name.setLoaded(resource, "Widget");

        name.set(resource, "Widget");

        assertTrue(resource.originalValues().isEmpty());
    }

    @Test
    void first_change_of_an_unloaded_attribute_records_null() {
        Resource resource = product.newResource();

        name.set(resource, "Widget");

        assertTrue(resource.originalValues().containsKey(name));
        assertNull(resource.originalValues().get(name));
    }

    @Test
    void wrong_types_are_rejected() {
        Resource resource = product.newResource();

        assertThrows(IllegalArgumentException.class, () -> name.set(resource, 42));
        assertThrows(IllegalArgumentException.class, () -> active.setLoaded(resource, "yes"));
    }

    @Test
    void get_on_a_new_resource_applies_the_default() {
        Resource resource = product.newResource();

        assertEquals(true, active.get(resource));
        assertSame(product, product.properties().require("type").get(resource));
        assertTrue(resource.isAttributeDirty("active"));

        assertNull(name.get(resource));
        assertTrue(name.isLoaded(resource));
        assertFalse(resource.isAttributeDirty("name"));
    }

    @Test
    void get_loaded_never_loads() {
        Resource resource = product.newResource();

        assertNull(active.getLoaded(resource));
        assertFalse(active.isLoaded(resource));
    }
}
