package fr.lapetina.config.infrastructure.provider;

import fr.lapetina.config.ConfigurationBuilder;
import fr.lapetina.config.domain.provider.ConfigurationProvider;
import fr.lapetina.config.domain.provider.ConfigurationSource;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Source of environment variables, captured once when the source is created.
 */
public final class EnvironmentVariablesConfigurationSource implements ConfigurationSource {

    private final String prefix;
    private final Map<String, String> variables;

    public EnvironmentVariablesConfigurationSource(String prefix, Map<String, String> variables) {
        this.prefix = prefix == null ? "" : prefix;
        this.variables = Map.copyOf(Objects.requireNonNull(variables, "variables"));
    }

    /**
     * Captures the environment of the current process.
     */
    public static EnvironmentVariablesConfigurationSource fromSystem(String prefix) {
        return new EnvironmentVariablesConfigurationSource(prefix, new TreeMap<>(System.getenv()));
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public ConfigurationProvider build(ConfigurationBuilder builder) {
        return new EnvironmentVariablesConfigurationProvider(prefix, new TreeMap<>(variables));
    }
}
