package io.github.flameyossnowy.resources.memory;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows of one storage name, plus the last value handed out per serial column.
 * Not thread-safe; the adapter guards access.
 */
final class MemoryTable {
    private final String name;
    private final List<ObjectNode> rows = new ArrayList<>();
    private final Map<String, Long> sequences = new HashMap<>();

    MemoryTable(String name) {
        this.name = name;
    }

    String name() {
        return name;
    }

    List<ObjectNode> rows() {
        return rows;
    }

    Map<String, Long> sequences() {
        return sequences;
    }

    long nextSerial(String column) {
        return sequences.merge(column, 1L, Long::sum);
    }

    /**
     * Moves the sequence past a value written explicitly.
     */
    void observeSerial(String column, long value) {
        sequences.merge(column, value, Math::max);
    }
}
