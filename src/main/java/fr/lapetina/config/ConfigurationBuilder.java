package fr.lapetina.config;

import fr.lapetina.config.domain.exception.ConfigurationException;
import fr.lapetina.config.domain.exception.ReloadException;
import fr.lapetina.config.domain.provider.ConfigurationProvider;
import fr.lapetina.config.domain.provider.ConfigurationSource;
import fr.lapetina.config.infrastructure.file.FileConfigurationSource;
import fr.lapetina.config.infrastructure.file.FileSource;
import fr.lapetina.config.infrastructure.file.IniConfigurationProvider;
import fr.lapetina.config.infrastructure.file.JsonConfigurationProvider;
import fr.lapetina.config.infrastructure.file.XmlConfigurationProvider;
import fr.lapetina.config.infrastructure.file.YamlConfigurationProvider;
import fr.lapetina.config.infrastructure.metrics.ConfigurationMetrics;
import fr.lapetina.config.infrastructure.provider.ChainedConfigurationSource;
import fr.lapetina.config.infrastructure.provider.CommandLineConfigurationSource;
import fr.lapetina.config.infrastructure.provider.EnvironmentVariablesConfigurationSource;
import fr.lapetina.config.infrastructure.provider.MemoryConfigurationSource;
import fr.lapetina.config.tree.Configuration;
import fr.lapetina.config.tree.ConfigurationRoot;
import fr.lapetina.config.tree.DefaultConfigurationRoot;
import fr.lapetina.config.tree.ReloadObserver;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Assembles configuration sources into a {@link ConfigurationRoot}.
 *
 * Sources are kept in insertion order; a source added later has a higher priority
 * and overrides the values of earlier ones.
 *
 * <pre>{@code
 * ConfigurationRoot config = new ConfigurationBuilder()
 *         .addInMemory(Map.of("Server:Port", "8080"))
 *         .addJsonFile(Path.of("appsettings.json"))
 *         .addEnvironmentVariables("APP_")
 *         .addCommandLine(args)
 *         .build();
 * }</pre>
 */
public final class ConfigurationBuilder {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationBuilder.class);

    private final List<ConfigurationSource> sources = new ArrayList<>();
    private final Map<String, Object> properties = new HashMap<>();
    private boolean reloadOnChange;
    private ReloadObserver reloadObserver = ReloadObserver.NONE;

    /**
     * Appends a source with the highest priority so far.
     */
    public ConfigurationBuilder add(ConfigurationSource source) {
        sources.add(Objects.requireNonNull(source, "source"));
        return this;
    }

    /**
     * Appends an already constructed provider.
     */
    public ConfigurationBuilder addProvider(ConfigurationProvider provider) {
        Objects.requireNonNull(provider, "provider");
        return add(builder -> provider);
    }

    public ConfigurationBuilder addInMemory(Map<String, String> values) {
        return add(new MemoryConfigurationSource(values));
    }

    /**
     * Adds the current process environment, restricted to keys starting with the prefix.
     */
    public ConfigurationBuilder addEnvironmentVariables(String prefix) {
        return add(EnvironmentVariablesConfigurationSource.fromSystem(prefix));
    }

    public ConfigurationBuilder addEnvironmentVariables(String prefix, Map<String, String> variables) {
        return add(new EnvironmentVariablesConfigurationSource(prefix, variables));
    }

    public ConfigurationBuilder addCommandLine(String[] args) {
        return add(new CommandLineConfigurationSource(args, Map.of()));
    }

    /**
     * Adds command line arguments with short switch aliases.
     *
     * @throws ConfigurationException if a switch mapping is malformed or duplicated
     */
    public ConfigurationBuilder addCommandLine(String[] args, Map<String, String> switchMappings) {
        return add(new CommandLineConfigurationSource(args, switchMappings));
    }

    public ConfigurationBuilder addJsonFile(Path path) {
        return addJsonFile(FileSource.of(path));
    }

    public ConfigurationBuilder addJsonFile(FileSource file) {
        return add(new FileConfigurationSource(file, JsonConfigurationProvider::new));
    }

    public ConfigurationBuilder addYamlFile(Path path) {
        return addYamlFile(FileSource.of(path));
    }

    public ConfigurationBuilder addYamlFile(FileSource file) {
        return add(new FileConfigurationSource(file, YamlConfigurationProvider::new));
    }

    public ConfigurationBuilder addIniFile(Path path) {
        return addIniFile(FileSource.of(path));
    }

    public ConfigurationBuilder addIniFile(FileSource file) {
        return add(new FileConfigurationSource(file, IniConfigurationProvider::new));
    }

    public ConfigurationBuilder addXmlFile(Path path) {
        return addXmlFile(FileSource.of(path));
    }

    public ConfigurationBuilder addXmlFile(FileSource file) {
        return add(new FileConfigurationSource(file, XmlConfigurationProvider::new));
    }

    /**
     * Adds an existing configuration as a source.
     */
    public ConfigurationBuilder addConfiguration(Configuration configuration) {
        return add(new ChainedConfigurationSource(configuration));
    }

    /**
     * Reloads the configuration as soon as a provider signals a change. Disabled by
     * default: changes are then picked up by the next explicit reload.
     */
    public ConfigurationBuilder reloadOnChange(boolean reloadOnChange) {
        this.reloadOnChange = reloadOnChange;
        return this;
    }

    public ConfigurationBuilder reloadObserver(ReloadObserver reloadObserver) {
        this.reloadObserver = Objects.requireNonNull(reloadObserver, "reloadObserver");
        return this;
    }

    /**
     * Records reload metrics in the given registry.
     */
    public ConfigurationBuilder meterRegistry(MeterRegistry registry) {
        return reloadObserver(new ConfigurationMetrics(registry));
    }

    /**
     * Returns the sources added so far, lowest priority first.
     */
    public List<ConfigurationSource> getSources() {
        return Collections.unmodifiableList(sources);
    }

    /**
     * Returns the properties shared with sources while building.
     */
    public Map<String, Object> getProperties() {
        return properties;
    }

    /**
     * Builds the providers and performs the initial load.
     *
     * @throws ReloadException if a provider fails to load
     * @throws ConfigurationException if a source is invalid
     */
    public ConfigurationRoot build() {
        List<ConfigurationProvider> providers = new ArrayList<>(sources.size());
        for (ConfigurationSource source : sources) {
            providers.add(source.build(this));
        }

        DefaultConfigurationRoot root = new DefaultConfigurationRoot(providers, reloadOnChange, reloadObserver);
        try {
            root.reload();
        } catch (ReloadException e) {
            root.close();
            throw e;
        }

        log.info("Configuration built from {} provider(s)", providers.size());
        return root;
    }
}
