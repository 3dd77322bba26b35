package fr.lapetina.config.domain.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Utility methods for hierarchical configuration keys.
 *
 * A key is a list of segments joined by {@link #KEY_DELIMITER}. Segments may be empty,
 * so {@code "Key1:"} and {@code ":Key2"} are valid keys.
 */
public final class ConfigurationPath {

    /**
     * The delimiter between key segments.
     */
    public static final String KEY_DELIMITER = ":";

    private static final char DELIMITER = ':';

    private ConfigurationPath() {
    }

    /**
     * Joins segments with exactly one delimiter between each pair.
     */
    public static String combine(String... segments) {
        Objects.requireNonNull(segments, "segments");
        return String.join(KEY_DELIMITER, segments);
    }

    /**
     * Joins segments with exactly one delimiter between each pair.
     */
    public static String combine(Iterable<String> segments) {
        Objects.requireNonNull(segments, "segments");
        return String.join(KEY_DELIMITER, segments);
    }

    /**
     * Returns the path of a child under a parent.
     *
     * @param parentPath the parent path, or {@code null} for the root
     * @param key the child segment
     */
    public static String child(String parentPath, String key) {
        return parentPath == null ? key : parentPath + KEY_DELIMITER + key;
    }

    /**
     * Extracts the last segment of a path.
     */
    public static String sectionKey(String path) {
        int index = path.lastIndexOf(DELIMITER);
        return index < 0 ? path : path.substring(index + 1);
    }

    /**
     * Extracts the path of the parent, or {@code null} when the path has a single segment.
     */
    public static String parentPath(String path) {
        int index = path.lastIndexOf(DELIMITER);
        return index < 0 ? null : path.substring(0, index);
    }

    /**
     * Returns the canonical form used for case-insensitive key comparison.
     */
    public static String normalize(String key) {
        return key.toUpperCase(Locale.ROOT);
    }

    /**
     * Tests whether two keys designate the same entry.
     */
    public static boolean equalsIgnoreCase(String left, String right) {
        return normalize(left).equals(normalize(right));
    }

    /**
     * Returns the immediate child segment of {@code key} under {@code parentPath}, or
     * {@code null} when the key is not a strict descendant of it.
     *
     * @param parentPath the parent path, or {@code null} for the root
     */
    public static String childSegment(String key, String parentPath) {
        int start;
        if (parentPath == null) {
            start = 0;
        } else {
            int length = parentPath.length();
            if (key.length() <= length
                    || key.charAt(length) != DELIMITER
                    || !key.regionMatches(true, 0, parentPath, 0, length)) {
                return null;
            }
            start = length + 1;
        }
        int end = key.indexOf(DELIMITER, start);
        return end < 0 ? key.substring(start) : key.substring(start, end);
    }
}
