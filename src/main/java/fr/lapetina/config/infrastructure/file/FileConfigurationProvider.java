package fr.lapetina.config.infrastructure.file;

import fr.lapetina.config.domain.exception.ProviderLoadException;
import fr.lapetina.config.domain.model.ConfigurationData;
import fr.lapetina.config.domain.provider.AbstractConfigurationProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Base class for providers reading a configuration file.
 *
 * Supports:
 * - Required and optional files
 * - Watching the file and reloading it when it changes
 *
 * When the watched file changes, the provider reads it again and fires its reload token.
 * A file that became unreadable keeps the current data. A file deleted while being
 * watched yields empty data.
 */
public abstract class FileConfigurationProvider extends AbstractConfigurationProvider {

    private static final Logger log = LoggerFactory.getLogger(FileConfigurationProvider.class);

    private final FileSource source;
    private FileChangeWatcher watcher;

    protected FileConfigurationProvider(String format, FileSource source) {
        super(format + "File(" + Objects.requireNonNull(source, "source").path().getFileName() + ")");
        this.source = source;
    }

    /**
     * Parses the file content.
     *
     * @throws ProviderLoadException if the content is not valid for the format
     */
    protected abstract ConfigurationData parse(Reader reader) throws IOException;

    @Override
    public void load() {
        super.load();
        if (source.reloadOnChange()) {
            startWatching();
        }
    }

    @Override
    protected ConfigurationData loadData() {
        return read(false);
    }

    private ConfigurationData read(boolean changed) {
        Path path = source.path();
        if (!Files.exists(path)) {
            if (source.optional() || changed) {
                log.debug("Configuration file not found, using empty data: {}", path);
                return ConfigurationData.empty();
            }
            throw new ProviderLoadException("The configuration file '" + path
                    + "' was not found and is not optional.", path, null);
        }

        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            log.debug("Loading configuration from file: {}", path);
            return parse(reader);
        } catch (IOException | RuntimeException e) {
            throw new ProviderLoadException("Failed to load configuration file '" + path + "': "
                    + e.getMessage(), path, e);
        }
    }

    private synchronized void startWatching() {
        if (watcher == null) {
            watcher = new FileChangeWatcher(source.path(), source.reloadDelay(), this::onFileChanged);
            watcher.start();
        }
    }

    private void onFileChanged() {
        try {
            setData(read(true));
        } catch (ProviderLoadException e) {
            log.error("Failed to reload configuration file, keeping current data", e);
            return;
        }
        onReload();
    }

    public FileSource getSource() {
        return source;
    }

    @Override
    public synchronized void close() {
        if (watcher != null) {
            watcher.close();
            watcher = null;
        }
    }
}
