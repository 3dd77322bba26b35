package fr.lapetina.config.tree;

import fr.lapetina.config.domain.model.ConfigurationPath;
import fr.lapetina.config.domain.model.PathMode;
import fr.lapetina.config.domain.token.ChangeToken;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Section view delegating every query to its root with the section path as prefix.
 */
public final class DefaultConfigurationSection implements ConfigurationSection {

    private final DefaultConfigurationRoot root;
    private final String path;

    DefaultConfigurationSection(DefaultConfigurationRoot root, String path) {
        this.root = Objects.requireNonNull(root, "root");
        this.path = Objects.requireNonNull(path, "path");
    }

    @Override
    public String getKey() {
        return ConfigurationPath.sectionKey(path);
    }

    @Override
    public String getPath() {
        return path;
    }

    @Override
    public Optional<String> getValue() {
        return root.get(path);
    }

    @Override
    public boolean exists() {
        return getValue().isPresent() || root.hasChildren(path);
    }

    @Override
    public Optional<String> get(String key) {
        return root.get(ConfigurationPath.child(path, key));
    }

    @Override
    public ConfigurationSection getSection(String key) {
        return new DefaultConfigurationSection(root, ConfigurationPath.child(path, key));
    }

    @Override
    public List<ConfigurationSection> getChildren() {
        return root.getChildren(path);
    }

    @Override
    public ChangeToken getReloadToken() {
        return root.getReloadToken();
    }

    @Override
    public Iterable<Map.Entry<String, String>> iterate(PathMode mode) {
        return () -> new ConfigurationIterator(this, mode);
    }

    @Override
    public String toString() {
        return "ConfigurationSection{path='" + path + "'}";
    }
}
