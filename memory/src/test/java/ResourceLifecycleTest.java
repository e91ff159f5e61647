import io.github.flameyossnowy.resources.api.callsite.Callsite;
import io.github.flameyossnowy.resources.api.exceptions.UnsavedParentException;
import io.github.flameyossnowy.resources.api.identity.Key;
import io.github.flameyossnowy.resources.api.meta.Property;
import io.github.flameyossnowy.resources.api.query.Operator;
import io.github.flameyossnowy.resources.api.query.Query;
import io.github.flameyossnowy.resources.api.query.QueryOption;
import io.github.flameyossnowy.resources.api.relationship.Relationship;
import io.github.flameyossnowy.resources.api.resource.Resource;
import io.github.flameyossnowy.resources.api.resource.ResourceCollection;
import io.github.flameyossnowy.resources.memory.InMemoryRepositoryAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ResourceLifecycleTest {
    InMemoryRepositoryAdapter adapter;
    Catalog catalog;

    @BeforeEach
    void setup() {
        adapter = spy(InMemoryRepositoryAdapter.builder().build());
        catalog = new Catalog(adapter);
    }

    private Resource product(String name, int price) {
        return catalog.product.create(Map.of("name", name, "price", price));
    }

    @Test
    void create_applies_defaults_and_registers_the_resource() {
        Resource widget = product("Widget", 5);

        assertTrue(widget.isSaved());
        assertFalse(widget.isDirty());
        assertEquals(true, widget.attributeGet("active"));
        assertSame(catalog.product, widget.attributeGet("type"));
        assertSame(widget, catalog.repository.identityMap(catalog.product).get(Key.of(1L)));
        assertSame(widget, catalog.product.get(1L));
    }

    @Test
    void updates_are_persisted() {
        Resource widget = product("Widget", 5);

        assertTrue(widget.update(Map.of("name", "Sprocket", "price", 8)));
        catalog.forget();

        Resource reread = catalog.product.get(1L);
        assertNotSame(widget, reread);
        assertEquals("Sprocket", reread.attributeGet("name"));
        assertEquals(8, reread.attributeGet("price"));
    }

    @Test
    void changing_a_natural_key_follows_the_row() {
        Resource setting = catalog.setting.create(Map.of("code", "theme", "value", "dark"));

        setting.attributeSet("code", "colour-scheme");
        assertTrue(setting.save());

        assertNull(catalog.setting.get("theme"));
        assertSame(setting, catalog.setting.get("colour-scheme"));
        catalog.forget();
        assertEquals("dark", catalog.setting.get("colour-scheme").attributeGet("value"));
    }

    @Test
    void lazy_load_reaches_members_that_stopped_matching_the_query() {
        product("Widget", 5);
        product("Gadget", 7);
        catalog.forget();

        ResourceCollection active = catalog.product.all(
            Query.builder(catalog.repository, catalog.product).where("active", Operator.EQ, true).build());
        Resource widget = active.stream()
            .filter(resource -> "Widget".equals(resource.attributeGet("name")))
            .findFirst()
            .orElseThrow();
        widget.attributeSet("active", false);
        assertTrue(widget.save());

        assertEquals(5, widget.attributeGet("price"));
        assertEquals(2, active.size());
    }

    @Test
    void lazy_load_after_a_key_change_reads_the_new_key() {
        catalog.setting.create(Map.of("code", "a", "value", "v", "note", "hello"));
        catalog.forget();

        Resource setting = catalog.setting.get("a");
        assertFalse(catalog.setting.properties().require("note").isLoaded(setting));
        setting.attributeSet("code", "b");
        assertTrue(setting.save());

        assertEquals("hello", setting.attributeGet("note"));
    }

    @Test
    void destroy_deletes_the_row() {
        Resource widget = product("Widget", 5);

        assertTrue(widget.destroy());

        assertFalse(widget.isSaved());
        assertEquals(0, adapter.count("Product"));
        assertNull(catalog.product.get(1L));
        assertFalse(widget.destroy());
    }

    @Test
    void lazy_groups_load_on_first_access() {
        catalog.product.create(Map.of("name", "Widget", "price", 5, "description", "A widget"));
        catalog.forget();

        Resource widget = catalog.product.get(1L);
        assertTrue(widget.isAttributeLoaded("name"));
        assertFalse(widget.isAttributeLoaded("price"));

        assertEquals(5, widget.attributeGet("price"));
        assertTrue(widget.isAttributeLoaded("active"));
        assertFalse(widget.isAttributeLoaded("description"));

        assertEquals("A widget", widget.attributeGet("description"));
    }

    @Test
    void lazy_load_fetches_for_the_whole_collection_at_once() {
        product("Widget", 5);
        product("Gadget", 7);
        product("Gizmo", 9);
        catalog.forget();

        ResourceCollection all = catalog.product.all();
        clearInvocations(adapter);

        assertEquals(5, all.get(2).attributeGet("price"));

        for (Resource member : all) {
            assertTrue(member.isAttributeLoaded("price"));
        }
        assertEquals(7, all.get(0).attributeGet("price"));
        verify(adapter, times(1)).read(any());
    }

    @Test
    void reload_overwrites_clean_attributes_and_keeps_dirty_ones() {
        Resource widget = product("Widget", 5);
        Property name = catalog.product.properties().require("name");
        adapter.update(Map.of(name, "Renamed"), widget.toQuery());

        widget.attributeSet("price", 6);
        widget.reload();

        assertEquals("Renamed", widget.attributeGet("name"));
        assertEquals(6, widget.attributeGet("price"));
        assertTrue(widget.isAttributeDirty("price"));
    }

    @Test
    void separately_read_instances_are_equal_without_loading() {
        product("Widget", 5);
        catalog.forget();
        Resource first = catalog.product.get(1L);
        catalog.forget();
        Resource second = catalog.product.get(1L);
        clearInvocations(adapter);

        assertNotSame(first, second);
        assertEquals(first, second);
        verify(adapter, never()).read(any());
    }

    @Test
    void saving_a_parent_saves_its_new_children() {
        Resource toys = catalog.category.newResource(Map.of("name", "Toys"));
        Resource widget = catalog.product.newResource(Map.of("name", "Widget"));
        Resource gadget = catalog.product.newResource(Map.of("name", "Gadget"));

        ResourceCollection products = (ResourceCollection) toys.association("products");
        products.add(widget);
        products.add(gadget);

        assertTrue(toys.save());
        assertTrue(widget.isSaved());
        assertTrue(gadget.isSaved());
        assertEquals(toys.attributeGet("id"), widget.attributeGet("category_id"));

        catalog.forget();
        ResourceCollection reread = (ResourceCollection) catalog.category.get(1L).association("products");
        assertEquals(List.of("Gadget", "Widget"), reread.stream().map(p -> p.attributeGet("name")).toList());
    }

    @Test
    void many_to_one_copies_the_parent_key() {
        Resource widget = product("Widget", 5);
        Resource review = catalog.review.newResource(Map.of("body", "Great"));

        review.setAssociation("product", widget);
        assertEquals(1L, review.attributeGet("product_id"));
        assertTrue(review.save());

        catalog.forget();
        Resource reread = catalog.review.get(1L);
        Resource parent = (Resource) reread.association("product");
        assertEquals("Widget", parent.attributeGet("name"));
    }

    @Test
    void many_to_one_picks_up_a_parent_saved_later() {
        Resource toys = catalog.category.newResource(Map.of("name", "Toys"));
        Resource widget = catalog.product.newResource(Map.of("name", "Widget"));

        widget.setAssociation("category", toys);
        assertNull(widget.attributeGet("category_id"));

        assertTrue(toys.save());
        assertTrue(widget.save());
        assertEquals(toys.attributeGet("id"), widget.attributeGet("category_id"));
    }

    @Test
    void many_to_many_goes_through_the_join_model() {
        Resource widget = product("Widget", 5);
        Resource sale = catalog.tag.create(Map.of("name", "sale"));
        Resource fresh = catalog.tag.create(Map.of("name", "new"));
        catalog.tag.create(Map.of("name", "unused"));
        for (Resource tag : List.of(sale, fresh)) {
            Resource join = catalog.productTag.newResource();
            join.setAssociation("product", widget);
            join.setAssociation("tag", tag);
            assertTrue(join.save());
        }
        catalog.forget();

        ResourceCollection tags = (ResourceCollection) catalog.product.get(1L).association("tags");

        assertEquals(Set.of("sale", "new"), Set.copyOf(tags.stream().map(t -> t.attributeGet("name")).toList()));
        assertThrows(UnsupportedOperationException.class, () -> widget.setAssociation("tags", List.of()));
    }

    @Test
    void unsaved_parents_cannot_be_traversed() {
        Resource widget = catalog.product.newResource(Map.of("name", "Widget"));

        ResourceCollection reviews = (ResourceCollection) widget.association("reviews");
        assertThrows(UnsavedParentException.class, reviews::size);
        assertThrows(UnsavedParentException.class, () -> widget.association("tags"));
    }

    @Test
    void subclasses_share_a_table_and_materialise_as_themselves() {
        Resource dune = catalog.book.create(Map.of("name", "Dune", "isbn", "978-0441013593"));
        Resource widget = product("Widget", 5);
        catalog.forget();

        ResourceCollection everything = catalog.product.all();
        assertEquals(2, everything.size());
        assertSame(catalog.book, everything.get(0).model());
        assertSame(catalog.product, everything.get(1).model());
        assertEquals("978-0441013593", everything.get(0).attributeGet("isbn"));

        ResourceCollection books = catalog.book.all();
        assertEquals(1, books.size());
        assertNull(catalog.book.get(widget.attributeGet("id")));
        assertEquals(dune.attributeGet("id"), books.get(0).attributeGet("id"));
        assertTrue(((ResourceCollection) books.get(0).association("reviews")).isEmpty());
    }

    @Test
    void callsites_learn_fields_and_links_used_after_the_read() {
        Resource widget = product("Widget", 5);
        Resource review = catalog.review.newResource(Map.of("body", "Great"));
        review.setAssociation("product", widget);
        review.save();
        catalog.forget();

        Callsite callsite = catalog.callsites.callsite(catalog.product, "default", "listing");
        assertEquals(Set.of("id", "type", "name"), callsite.fields());

        Resource first = callsite.all().get(0);
        first.attributeGet("description");
        ((ResourceCollection) first.association("reviews")).size();

        assertTrue(callsite.fields().contains("description"));
        assertEquals(Set.of("reviews"), callsite.links());
        assertEquals(List.of("reviews"), callsite.toHash().get(QueryOption.LINKS));

        catalog.forget();
        Resource again = callsite.all().get(0);
        Relationship reviews = catalog.product.relationships("default").get("reviews");
        assertTrue(again.isAttributeLoaded("description"));
        assertTrue(reviews.isLoaded(again));
        assertEquals(1, ((ResourceCollection) reviews.getLoaded(again)).size());
    }

    @Test
    void query_links_eager_load_parents() {
        Resource toys = catalog.category.create(Map.of("name", "Toys"));
        for (String name : List.of("Widget", "Gadget")) {
            Resource product = catalog.product.newResource(Map.of("name", name));
            product.setAssociation("category", toys);
            product.save();
        }
        catalog.forget();

        Query query = Query.builder(catalog.repository, catalog.product).links("category").build();
        ResourceCollection products = catalog.product.all(query);
        Relationship category = catalog.product.relationships("default").get("category");

        for (Resource product : products) {
            assertTrue(category.isLoaded(product));
            assertEquals("Toys", ((Resource) category.getLoaded(product)).attributeGet("name"));
        }
        assertSame(category.getLoaded(products.get(0)), category.getLoaded(products.get(1)));
    }
}
