package fr.lapetina.config.infrastructure.file;

import fr.lapetina.config.ConfigurationBuilder;
import fr.lapetina.config.domain.provider.ConfigurationProvider;
import fr.lapetina.config.domain.provider.ConfigurationSource;

import java.util.Objects;
import java.util.function.Function;

/**
 * Source of a configuration file in a given format.
 */
public final class FileConfigurationSource implements ConfigurationSource {

    private final FileSource file;
    private final Function<FileSource, ? extends FileConfigurationProvider> providerFactory;

    public FileConfigurationSource(FileSource file,
                                   Function<FileSource, ? extends FileConfigurationProvider> providerFactory) {
        this.file = Objects.requireNonNull(file, "file");
        this.providerFactory = Objects.requireNonNull(providerFactory, "providerFactory");
    }

    public FileSource getFile() {
        return file;
    }

    @Override
    public ConfigurationProvider build(ConfigurationBuilder builder) {
        return providerFactory.apply(file);
    }
}
