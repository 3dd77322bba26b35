package fr.lapetina.config.domain.exception;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Exception thrown when a single provider cannot load its data.
 */
public class ProviderLoadException extends RuntimeException {

    private final Path path;

    public ProviderLoadException(String message) {
        this(message, null, null);
    }

    public ProviderLoadException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public ProviderLoadException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /**
     * Returns the file the failure relates to, when the provider is file based.
     */
    public Optional<Path> getPath() {
        return Optional.ofNullable(path);
    }
}
