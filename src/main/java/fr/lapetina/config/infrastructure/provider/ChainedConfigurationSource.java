package fr.lapetina.config.infrastructure.provider;

import fr.lapetina.config.ConfigurationBuilder;
import fr.lapetina.config.domain.provider.ConfigurationProvider;
import fr.lapetina.config.domain.provider.ConfigurationSource;
import fr.lapetina.config.tree.Configuration;

import java.util.Objects;

/**
 * Source wrapping an existing configuration.
 */
public final class ChainedConfigurationSource implements ConfigurationSource {

    private final Configuration configuration;

    public ChainedConfigurationSource(Configuration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    @Override
    public ConfigurationProvider build(ConfigurationBuilder builder) {
        return new ChainedConfigurationProvider(configuration);
    }
}
