import io.github.flameyossnowy.resources.api.callsite.Callsite;
import io.github.flameyossnowy.resources.api.callsite.CallsiteRegistry;
import io.github.flameyossnowy.resources.api.meta.Model;
import io.github.flameyossnowy.resources.api.meta.Property;
import io.github.flameyossnowy.resources.api.repository.RepositoryAdapter;
import io.github.flameyossnowy.resources.api.repository.RepositoryRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CallsiteRegistryTest {

    @Test
    void concurrent_first_lookups_converge_on_one_instance() throws Exception {
        RepositoryRegistry registry = new RepositoryRegistry();
        registry.register(RepositoryRegistry.DEFAULT_REPOSITORY_NAME, mock(RepositoryAdapter.class));
        Model product = Model.builder("Product", registry).property(Property.serial("id")).build();

        CallsiteRegistry callsites = new CallsiteRegistry();
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Callsite>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return callsites.callsite(product, "default", "1234");
                }));
            }
            start.countDown();

            Callsite first = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<Callsite> future : futures) {
                assertSame(first, future.get(5, TimeUnit.SECONDS));
            }
            assertEquals(1, callsites.size());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void repository_name_is_part_of_the_identity() {
        RepositoryRegistry registry = new RepositoryRegistry();
        registry.register(RepositoryRegistry.DEFAULT_REPOSITORY_NAME, mock(RepositoryAdapter.class));
        Model product = Model.builder("Product", registry).property(Property.serial("id")).build();
        CallsiteRegistry callsites = new CallsiteRegistry();

        Callsite main = callsites.callsite(product, "default", "1234");
        Callsite archive = callsites.callsite(product, "archive", "1234");

        assertNotSame(main, archive);
        assertSame(archive, callsites.get(product, "archive", "1234"));

        callsites.clear();
        assertEquals(0, callsites.size());
        assertNull(callsites.get(product, "default", "1234"));
    }
}
