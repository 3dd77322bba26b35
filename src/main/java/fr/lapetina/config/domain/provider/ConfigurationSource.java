package fr.lapetina.config.domain.provider;

import fr.lapetina.config.ConfigurationBuilder;

/**
 * Creates the provider for one configuration source.
 */
@FunctionalInterface
public interface ConfigurationSource {

    /**
     * Builds the provider. Shared state is available through {@link ConfigurationBuilder#getProperties()}.
     */
    ConfigurationProvider build(ConfigurationBuilder builder);
}
