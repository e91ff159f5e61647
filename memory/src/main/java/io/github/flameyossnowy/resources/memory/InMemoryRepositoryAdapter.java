package io.github.flameyossnowy.resources.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.flameyossnowy.resources.api.exceptions.RepositoryException;
import io.github.flameyossnowy.resources.api.meta.Model;
import io.github.flameyossnowy.resources.api.meta.Property;
import io.github.flameyossnowy.resources.api.query.Condition;
import io.github.flameyossnowy.resources.api.query.Direction;
import io.github.flameyossnowy.resources.api.query.Query;
import io.github.flameyossnowy.resources.api.repository.RepositoryAdapter;
import io.github.flameyossnowy.resources.api.resource.Resource;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

/**
 * Keeps rows in memory as Jackson {@link ObjectNode}s, one table per storage name.
 * <p>
 * Every model of an inheritance tree shares its base model's table. Discriminator
 * values are stored as model names. Serial columns are numbered per table starting
 * at 1. Tables can be written to and read back from a directory of JSON files.
 */
public class InMemoryRepositoryAdapter implements RepositoryAdapter {
    private static final String FILE_EXTENSION = ".json";

    private final Logger logger = LoggerFactory.getLogger(InMemoryRepositoryAdapter.class);

    private final String name;
    private final ObjectMapper objectMapper;
    private final Map<String, MemoryTable> tables = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    InMemoryRepositoryAdapter(String name, ObjectMapper objectMapper) {
        this.name = name;
        this.objectMapper = objectMapper;
    }

    public static @NotNull InMemoryRepositoryAdapterBuilder builder() {
        return new InMemoryRepositoryAdapterBuilder();
    }

    public @NotNull String name() {
        return name;
    }

    /**
     * Inserts one row per resource. A resource whose key is already taken is skipped
     * and not counted.
     */
    @Override
    public int create(@NotNull List<? extends Resource> resources) {
        lock.writeLock().lock();
        try {
            int created = 0;
            for (Resource resource : resources) {
                if (insert(resource)) created++;
            }
            return created;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private boolean insert(Resource resource) {
        Model model = resource.model();
        MemoryTable table = table(model.storageName());
        List<Property> properties = model.properties(resource.repositoryName()).asList();

        ObjectNode row = objectMapper.createObjectNode();
        List<Runnable> serialAssignments = new ArrayList<>();
        for (Property property : properties) {
            Object value = property.getLoaded(resource);
            if (property.isSerial()) {
                if (value == null) {
                    long next = table.nextSerial(property.name());
                    Object serial = objectMapper.convertValue(next, property.type());
                    serialAssignments.add(() -> property.setLoaded(resource, serial));
                    value = serial;
                } else {
                    table.observeSerial(property.name(), ((Number) value).longValue());
                }
            }
            row.set(property.name(), toNode(value));
        }

        List<Property> key = model.key(resource.repositoryName());
        for (ObjectNode existing : table.rows()) {
            if (sameKey(existing, row, key)) {
                logger.debug("Duplicate key for {} in {}", model, name);
                return false;
            }
        }

        table.rows().add(row);
        serialAssignments.forEach(Runnable::run);
        return true;
    }

    private static boolean sameKey(ObjectNode left, ObjectNode right, List<Property> key) {
        for (Property property : key) {
            if (!Objects.equals(left.get(property.name()), right.get(property.name()))) return false;
        }
        return true;
    }

    /**
     * Rows matching every condition, in the query's order, windowed by offset and
     * limit, holding only the query's fields.
     */
    @Override
    public @NotNull List<Map<String, Object>> read(@NotNull Query query) {
        lock.readLock().lock();
        try {
            List<ObjectNode> matches = matching(query);
            if (!query.order().isEmpty()) {
                matches.sort((left, right) -> {
                    for (Direction direction : query.order()) {
                        Property property = direction.property();
                        int cmp = direction.compare(readValue(query, property, left), readValue(query, property, right));
                        if (cmp != 0) return cmp;
                    }
                    return 0;
                });
            }

            Stream<ObjectNode> window = matches.stream().skip(query.offset());
            if (query.limit() >= 0) {
                window = window.limit(query.limit());
            }

            List<Map<String, Object>> rows = new ArrayList<>();
            window.forEach(node -> {
                Map<String, Object> row = new LinkedHashMap<>();
                for (Property field : query.fields()) {
                    row.put(field.name(), readValue(query, field, node));
                }
                rows.add(row);
            });
            return rows;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int update(@NotNull Map<Property, Object> attributes, @NotNull Query query) {
        lock.writeLock().lock();
        try {
            List<ObjectNode> matches = matching(query);
            for (ObjectNode row : matches) {
                for (Map.Entry<Property, Object> entry : attributes.entrySet()) {
                    row.set(entry.getKey().name(), toNode(entry.getValue()));
                }
            }
            return matches.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int delete(@NotNull Query query) {
        lock.writeLock().lock();
        try {
            MemoryTable table = tables.get(query.model().storageName());
            if (table == null) {
                return 0;
            }

            int deleted = 0;
            for (Iterator<ObjectNode> iterator = table.rows().iterator(); iterator.hasNext(); ) {
                if (matches(query, iterator.next())) {
                    iterator.remove();
                    deleted++;
                }
            }
            return deleted;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * The number of rows stored under a storage name.
     */
    public int count(@NotNull String storageName) {
        lock.readLock().lock();
        try {
            MemoryTable table = tables.get(storageName);
            return table == null ? 0 : table.rows().size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            tables.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Writes every table to {@code <storage name>.json} in the directory.
     *
     * @throws RepositoryException if a file cannot be written
     */
    public void dump(@NotNull Path directory) {
        lock.readLock().lock();
        try {
            Files.createDirectories(directory);
            for (MemoryTable table : tables.values()) {
                ObjectNode document = objectMapper.createObjectNode();
                document.set("sequences", objectMapper.valueToTree(table.sequences()));
                ArrayNode rows = document.putArray("rows");
                table.rows().forEach(row -> rows.add(row.deepCopy()));
                objectMapper.writeValue(directory.resolve(table.name() + FILE_EXTENSION).toFile(), document);
            }
            logger.debug("Dumped {} tables of {} to {}", tables.size(), name, directory);
        } catch (IOException e) {
            throw new RepositoryException("Failed to dump to " + directory, e, name);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces every table with the ones dumped to the directory.
     *
     * @throws RepositoryException if the directory or a file cannot be read
     */
    public void restore(@NotNull Path directory) {
        lock.writeLock().lock();
        try (Stream<Path> files = Files.list(directory)) {
            Map<String, MemoryTable> restored = new LinkedHashMap<>();
            for (Path file : (Iterable<Path>) files::iterator) {
                String fileName = file.getFileName().toString();
                if (!Files.isRegularFile(file) || !fileName.endsWith(FILE_EXTENSION)) continue;

                String storageName = fileName.substring(0, fileName.length() - FILE_EXTENSION.length());
                MemoryTable table = new MemoryTable(storageName);
                JsonNode document = objectMapper.readTree(file.toFile());
                document.path("sequences").fields().forEachRemaining(
                    entry -> table.observeSerial(entry.getKey(), entry.getValue().asLong()));
                for (JsonNode row : document.path("rows")) {
                    if (row instanceof ObjectNode object) table.rows().add(object);
                }
                restored.put(storageName, table);
            }

            tables.clear();
            tables.putAll(restored);
            logger.debug("Restored {} tables of {} from {}", restored.size(), name, directory);
        } catch (IOException e) {
            throw new RepositoryException("Failed to restore from " + directory, e, name);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private MemoryTable table(String storageName) {
        return tables.computeIfAbsent(storageName, MemoryTable::new);
    }

    private List<ObjectNode> matching(Query query) {
        MemoryTable table = tables.get(query.model().storageName());
        List<ObjectNode> matches = new ArrayList<>();
        if (table == null) {
            return matches;
        }
        for (ObjectNode row : table.rows()) {
            if (matches(query, row)) matches.add(row);
        }
        return matches;
    }

    private boolean matches(Query query, ObjectNode row) {
        for (Condition condition : query.conditions()) {
            if (!condition.matches(readValue(query, condition.property(), row))) return false;
        }
        return true;
    }

    private JsonNode toNode(@Nullable Object value) {
        if (value instanceof Model model) {
            return objectMapper.getNodeFactory().textNode(model.name());
        }
        return objectMapper.valueToTree(value);
    }

    /**
     * The stored value converted to the property's type; discriminators come back as
     * models of the query's inheritance tree.
     */
    private @Nullable Object readValue(Query query, Property property, ObjectNode row) {
        JsonNode node = row.get(property.name());
        if (node == null || node.isNull()) {
            return null;
        }
        if (property.isDiscriminator()) {
            return query.model().baseModel().descendant(node.asText());
        }
        try {
            return objectMapper.treeToValue(node, property.type());
        } catch (JsonProcessingException e) {
            throw new RepositoryException("Cannot read '" + property.name() + "' as " + property.type().getSimpleName(), e, name);
        }
    }
}
