package fr.lapetina.config.domain.model;

import java.util.Comparator;

/**
 * Orders configuration keys segment by segment.
 *
 * Ordering rules per segment:
 * - Two unsigned integers compare numerically
 * - An integer sorts before text
 * - Text compares case-insensitively
 *
 * When one key is a prefix of the other, the shorter key sorts first.
 */
public final class ConfigurationKeyComparator implements Comparator<String> {

    public static final ConfigurationKeyComparator INSTANCE = new ConfigurationKeyComparator();

    private ConfigurationKeyComparator() {
    }

    @Override
    public int compare(String left, String right) {
        String[] leftParts = left.split(ConfigurationPath.KEY_DELIMITER, -1);
        String[] rightParts = right.split(ConfigurationPath.KEY_DELIMITER, -1);
        int common = Math.min(leftParts.length, rightParts.length);

        for (int i = 0; i < common; i++) {
            int result = compareSegments(leftParts[i], rightParts[i]);
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(leftParts.length, rightParts.length);
    }

    private static int compareSegments(String left, String right) {
        boolean leftNumeric = isUnsignedInteger(left);
        boolean rightNumeric = isUnsignedInteger(right);

        if (leftNumeric && rightNumeric) {
            return compareUnsignedIntegers(left, right);
        }
        if (leftNumeric) {
            return -1;
        }
        if (rightNumeric) {
            return 1;
        }
        return ConfigurationPath.normalize(left).compareTo(ConfigurationPath.normalize(right));
    }

    /**
     * Tests whether a segment is made only of ASCII digits.
     */
    public static boolean isUnsignedInteger(String segment) {
        if (segment.isEmpty()) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    /**
     * Compares two digit strings by numeric value without overflow.
     */
    public static int compareUnsignedIntegers(String left, String right) {
        String a = stripLeadingZeros(left);
        String b = stripLeadingZeros(right);
        if (a.length() != b.length()) {
            return Integer.compare(a.length(), b.length());
        }
        return a.compareTo(b);
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }
}
