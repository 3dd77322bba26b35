package fr.lapetina.config.tree;

import java.util.Optional;

/**
 * A view of the configuration rooted at a path.
 *
 * A section can hold a value and children at the same time.
 */
public interface ConfigurationSection extends Configuration {

    /**
     * Returns the last segment of the path.
     */
    String getKey();

    /**
     * Returns the full path from the root.
     */
    String getPath();

    /**
     * Returns the value stored at exactly this path.
     */
    Optional<String> getValue();

    /**
     * Returns whether the section has a value or at least one child.
     */
    boolean exists();
}
