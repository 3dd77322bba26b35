package fr.lapetina.config.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable key/value snapshot held by a provider.
 *
 * Keys are matched case-insensitively while the casing of the first key seen for an
 * entry is kept for enumeration. Providers replace their whole snapshot on reload,
 * so readers never observe a partially loaded key space.
 */
public final class ConfigurationData {

    private static final ConfigurationData EMPTY = new ConfigurationData(Collections.emptyMap());

    private final Map<String, Entry> entries;

    private ConfigurationData(Map<String, Entry> entries) {
        this.entries = entries;
    }

    public static ConfigurationData empty() {
        return EMPTY;
    }

    /**
     * Creates a snapshot from a map, dropping {@code null} values.
     */
    public static ConfigurationData of(Map<String, String> values) {
        Builder builder = builder();
        values.forEach(builder::put);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a value by key, ignoring case.
     */
    public Optional<String> get(String key) {
        Entry entry = entries.get(ConfigurationPath.normalize(key));
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    /**
     * Tests whether the snapshot defines the key, ignoring case.
     */
    public boolean containsKey(String key) {
        return entries.containsKey(ConfigurationPath.normalize(key));
    }

    /**
     * Returns the distinct immediate child segments under a path, in key order.
     *
     * @param parentPath the parent path, or {@code null} for the root
     */
    public List<String> childKeys(String parentPath) {
        Map<String, String> children = new LinkedHashMap<>();
        for (Entry entry : entries.values()) {
            String segment = ConfigurationPath.childSegment(entry.key(), parentPath);
            if (segment != null) {
                children.putIfAbsent(ConfigurationPath.normalize(segment), segment);
            }
        }
        List<String> result = new ArrayList<>(children.values());
        result.sort(ConfigurationKeyComparator.INSTANCE);
        return result;
    }

    public Collection<Entry> entries() {
        return entries.values();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConfigurationData)) return false;
        return entries.equals(((ConfigurationData) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "ConfigurationData{size=" + entries.size() + "}";
    }

    /**
     * A stored key with its value.
     */
    public record Entry(String key, String value) {
        public Entry {
            Objects.requireNonNull(key, "key is required");
            Objects.requireNonNull(value, "value is required");
        }
    }

    /**
     * Accumulates entries before freezing them into a snapshot.
     */
    public static final class Builder {
        private final Map<String, Entry> entries = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Sets a value. An existing entry keeps its original key casing.
         * A {@code null} value is ignored.
         */
        public Builder put(String key, String value) {
            Objects.requireNonNull(key, "key");
            if (value == null) {
                return this;
            }
            entries.compute(ConfigurationPath.normalize(key),
                    (k, existing) -> new Entry(existing == null ? key : existing.key(), value));
            return this;
        }

        /**
         * Adds a value only if the key is not defined yet.
         *
         * @return {@code false} when the key was already present
         */
        public boolean putIfAbsent(String key, String value) {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
            return entries.putIfAbsent(ConfigurationPath.normalize(key), new Entry(key, value)) == null;
        }

        public Builder putAll(Map<String, String> values) {
            values.forEach(this::put);
            return this;
        }

        public boolean containsKey(String key) {
            return entries.containsKey(ConfigurationPath.normalize(key));
        }

        public ConfigurationData build() {
            if (entries.isEmpty()) {
                return EMPTY;
            }
            return new ConfigurationData(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
        }
    }
}
