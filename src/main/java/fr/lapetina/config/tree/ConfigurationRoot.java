package fr.lapetina.config.tree;

import fr.lapetina.config.domain.exception.ReloadException;
import fr.lapetina.config.domain.provider.ConfigurationProvider;

import java.util.List;

/**
 * The root of a merged configuration, owning its providers and the reload protocol.
 */
public interface ConfigurationRoot extends Configuration, AutoCloseable {

    /**
     * Reloads every provider in priority order.
     *
     * @throws ReloadException if one or more providers failed; the others keep their fresh data
     * @throws IllegalStateException if the root was closed
     */
    void reload();

    /**
     * Returns the providers, lowest priority first.
     */
    List<ConfigurationProvider> getProviders();

    /**
     * Renders the resolved tree with the provider of each value.
     */
    String getDebugView();

    /**
     * Closes every provider.
     */
    @Override
    void close();
}
