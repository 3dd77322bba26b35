package fr.lapetina.config.infrastructure.provider;

import fr.lapetina.config.domain.provider.ConfigurationProvider;
import fr.lapetina.config.domain.token.ChangeToken;
import fr.lapetina.config.tree.Configuration;
import fr.lapetina.config.tree.ConfigurationSection;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Provider exposing another configuration.
 *
 * The wrapped configuration is not owned: loading and closing this provider leave it
 * untouched, and its reload token is forwarded as is.
 */
public final class ChainedConfigurationProvider implements ConfigurationProvider {

    private final Configuration configuration;

    public ChainedConfigurationProvider(Configuration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    @Override
    public String getName() {
        return "Chained";
    }

    @Override
    public Optional<String> get(String key) {
        return configuration.get(key);
    }

    @Override
    public List<String> getChildKeys(String parentPath) {
        List<ConfigurationSection> children = parentPath == null
                ? configuration.getChildren()
                : configuration.getSection(parentPath).getChildren();
        return children.stream().map(ConfigurationSection::getKey).toList();
    }

    @Override
    public ChangeToken getReloadToken() {
        return configuration.getReloadToken();
    }

    @Override
    public void load() {
    }

    public Configuration getConfiguration() {
        return configuration;
    }
}
