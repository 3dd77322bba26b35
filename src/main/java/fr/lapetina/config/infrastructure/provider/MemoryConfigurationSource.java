package fr.lapetina.config.infrastructure.provider;

import fr.lapetina.config.ConfigurationBuilder;
import fr.lapetina.config.domain.provider.ConfigurationProvider;
import fr.lapetina.config.domain.provider.ConfigurationSource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Source of in-memory key/value pairs. Entries with a {@code null} value are ignored.
 */
public final class MemoryConfigurationSource implements ConfigurationSource {

    private final Map<String, String> values;

    public MemoryConfigurationSource(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(values, "values")));
    }

    public Map<String, String> getValues() {
        return values;
    }

    @Override
    public ConfigurationProvider build(ConfigurationBuilder builder) {
        return new MemoryConfigurationProvider(values);
    }
}
