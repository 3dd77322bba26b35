package fr.lapetina.config.domain.provider;

import fr.lapetina.config.domain.exception.ProviderLoadException;
import fr.lapetina.config.domain.token.ChangeToken;

import java.util.List;
import java.util.Optional;

/**
 * A single source of configuration key/value pairs.
 *
 * Providers are queried by the configuration root in priority order. Implementations
 * must replace their data atomically on {@link #load()} so concurrent readers see either
 * the previous or the new snapshot.
 */
public interface ConfigurationProvider extends AutoCloseable {

    /**
     * Returns a name used in diagnostics.
     */
    String getName();

    /**
     * Looks up a value by key, ignoring case.
     */
    Optional<String> get(String key);

    /**
     * Returns the distinct immediate child segments under a path.
     *
     * @param parentPath the parent path, or {@code null} for the root
     */
    List<String> getChildKeys(String parentPath);

    /**
     * Returns the token fired when the underlying source changes.
     */
    ChangeToken getReloadToken();

    /**
     * Loads or reloads the provider data.
     *
     * @throws ProviderLoadException if the data cannot be loaded
     */
    void load();

    /**
     * Releases resources such as file watchers.
     */
    @Override
    default void close() {
    }
}
