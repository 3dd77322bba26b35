package fr.lapetina.config.binder;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reversible string encoding of map keys.
 *
 * Encodings:
 * - Strings are used as is
 * - Integers carry a width suffix ({@code -32_i32}, {@code 7_i64}, {@code 1_i16}, {@code 2_i8})
 *   so they are not mistaken for sequence indices; plain integers are accepted when decoding
 * - Booleans are {@code true} or {@code false}
 * - Enums use the constant name
 * - Other types go through {@link ValueParsers}
 */
public final class MapKeyCodec {

    private static final Map<Class<?>, String> INTEGER_SUFFIXES = Map.of(
            Byte.class, "_i8",
            Short.class, "_i16",
            Integer.class, "_i32",
            Long.class, "_i64"
    );

    private final ValueParsers valueParsers;

    public MapKeyCodec(ValueParsers valueParsers) {
        this.valueParsers = Objects.requireNonNull(valueParsers, "valueParsers");
    }

    /**
     * Encodes a map key as a configuration key segment.
     */
    public String encode(Object key) {
        Objects.requireNonNull(key, "key");
        String suffix = INTEGER_SUFFIXES.get(key.getClass());
        if (suffix != null) {
            return key + suffix;
        }
        if (key instanceof Enum<?>) {
            return ((Enum<?>) key).name();
        }
        return key.toString();
    }

    /**
     * Decodes a configuration key segment into a map key.
     *
     * @throws IllegalArgumentException if the segment is not valid for the key type
     */
    public Object decode(String segment, Class<?> keyType) {
        Class<?> type = ValueParsers.wrap(keyType);
        if (type == String.class || type == Object.class) {
            return segment;
        }

        String suffix = INTEGER_SUFFIXES.get(type);
        if (suffix != null) {
            String digits = segment.toLowerCase(Locale.ROOT).endsWith(suffix)
                    ? segment.substring(0, segment.length() - suffix.length())
                    : segment;
            return valueParsers.parse(type, digits);
        }
        return valueParsers.parse(type, segment);
    }
}
