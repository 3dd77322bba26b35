package fr.lapetina.config.tree;

import fr.lapetina.config.domain.model.PathMode;
import fr.lapetina.config.domain.token.ChangeToken;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A queryable hierarchical view over merged configuration providers.
 */
public interface Configuration {

    /**
     * Looks up a value by key relative to this configuration, ignoring case.
     * A missing key yields an empty result.
     */
    Optional<String> get(String key);

    /**
     * Returns the sub-section at a relative key. Never fails: a section with nothing
     * defined under it is empty but still queryable.
     */
    ConfigurationSection getSection(String key);

    /**
     * Returns the immediate child sections, deduplicated across every provider.
     */
    List<ConfigurationSection> getChildren();

    /**
     * Returns the token fired after a reload that picked up a provider change.
     */
    ChangeToken getReloadToken();

    /**
     * Enumerates every key holding a value under this configuration, depth first.
     * Each call to {@code iterator()} walks the current state again.
     */
    Iterable<Map.Entry<String, String>> iterate(PathMode mode);

    default Iterable<Map.Entry<String, String>> iterate() {
        return iterate(PathMode.ABSOLUTE);
    }

    /**
     * Collects {@link #iterate(PathMode)} into an ordered map.
     */
    default Map<String, String> asMap(PathMode mode) {
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : iterate(mode)) {
            result.put(entry.getKey(), entry.getValue());
        }
        return result;
    }
}
