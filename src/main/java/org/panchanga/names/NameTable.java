package org.panchanga.names;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, loaded-once element name table.
 *
 * <p>The JSON layout is one object per {@link NameCategory#tableKey()} mapping decimal index strings
 * to names, plus an optional {@code karanaCycle} array holding the seven repeating karana names.
 * The table is a value handed to {@link TableNameResolver}; nothing reads it through global state.</p>
 */
public final class NameTable {
    public static final String DEFAULT_RESOURCE = "panchanga-names.json";
    static final String KARANA_CYCLE_KEY = "karanaCycle";

    private static final Logger LOGGER = LoggerFactory.getLogger(NameTable.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final NameTable EMPTY = new NameTable(new EnumMap<>(NameCategory.class), List.of());

    private final Map<NameCategory, Int2ObjectMap<String>> namesByCategory;
    private final List<String> karanaCycle;

    private NameTable(Map<NameCategory, Int2ObjectMap<String>> namesByCategory, List<String> karanaCycle) {
        EnumMap<NameCategory, Int2ObjectMap<String>> copy = new EnumMap<>(NameCategory.class);
        for (Map.Entry<NameCategory, Int2ObjectMap<String>> entry : namesByCategory.entrySet()) {
            copy.put(entry.getKey(), Int2ObjectMaps.unmodifiable(new Int2ObjectOpenHashMap<>(entry.getValue())));
        }
        this.namesByCategory = Collections.unmodifiableMap(copy);
        this.karanaCycle = List.copyOf(karanaCycle);
    }

    /**
     * Returns a table with no names; every lookup falls back.
     */
    public static NameTable empty() {
        return EMPTY;
    }

    /**
     * Loads the bundled default table, falling back to {@link #empty()} when it cannot be read.
     */
    public static NameTable defaults() {
        try {
            return fromClasspath(DEFAULT_RESOURCE);
        } catch (IllegalArgumentException | UncheckedIOException ex) {
            LOGGER.warn("Name table {} unavailable, using fallback names: {}", DEFAULT_RESOURCE, ex.getMessage());
            return EMPTY;
        }
    }

    /**
     * Loads a table from a classpath resource.
     *
     * @param resourceName resource path relative to the classpath root.
     * @return loaded table.
     * @throws IllegalArgumentException when the resource is missing or malformed.
     * @throws UncheckedIOException when the resource cannot be read.
     */
    public static NameTable fromClasspath(String resourceName) {
        Objects.requireNonNull(resourceName, "resourceName");
        ClassLoader loader = NameTable.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new IllegalArgumentException("name table resource not found: " + resourceName);
            }
            NameTable table = fromJson(MAPPER.readTree(in));
            LOGGER.info("Loaded {} element names from {}", table.size(), resourceName);
            return table;
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to read name table " + resourceName, ex);
        }
    }

    /**
     * Builds a table from a parsed JSON tree.
     *
     * @throws IllegalArgumentException when the tree does not follow the documented layout.
     */
    public static NameTable fromJson(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("name table root must be a JSON object");
        }
        EnumMap<NameCategory, Int2ObjectMap<String>> names = new EnumMap<>(NameCategory.class);
        for (NameCategory category : NameCategory.values()) {
            JsonNode node = root.get(category.tableKey());
            if (node == null || node.isNull()) {
                continue;
            }
            names.put(category, parseCategory(category, node));
        }

        List<String> cycle = new ArrayList<>();
        JsonNode cycleNode = root.get(KARANA_CYCLE_KEY);
        if (cycleNode != null && !cycleNode.isNull()) {
            if (!cycleNode.isArray()) {
                throw new IllegalArgumentException(KARANA_CYCLE_KEY + " must be a JSON array");
            }
            for (JsonNode element : cycleNode) {
                cycle.add(requireText(element, KARANA_CYCLE_KEY));
            }
        }
        return new NameTable(names, cycle);
    }

    /**
     * Returns the table name for one index, or {@code null} when absent.
     */
    public String name(NameCategory category, int index) {
        Int2ObjectMap<String> names = namesByCategory.get(Objects.requireNonNull(category, "category"));
        if (names == null) {
            return null;
        }
        return names.get(index);
    }

    /**
     * Returns the repeating karana name cycle (possibly empty).
     */
    public List<String> karanaCycle() {
        return karanaCycle;
    }

    /**
     * Returns total number of indexed names across categories.
     */
    public int size() {
        int size = 0;
        for (Int2ObjectMap<String> names : namesByCategory.values()) {
            size += names.size();
        }
        return size;
    }

    private static Int2ObjectMap<String> parseCategory(NameCategory category, JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException(category.tableKey() + " must be a JSON object");
        }
        Int2ObjectOpenHashMap<String> names = new Int2ObjectOpenHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            int index;
            try {
                index = Integer.parseInt(field.getKey().trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException(
                        category.tableKey() + " has non-numeric index: " + field.getKey(), ex);
            }
            names.put(index, requireText(field.getValue(), category.tableKey() + "." + field.getKey()));
        }
        return names;
    }

    private static String requireText(JsonNode node, String fieldName) {
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new IllegalArgumentException(fieldName + " must be a non-blank string");
        }
        return node.asText();
    }
}
