package fr.lapetina.config.binder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.Period;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of scalar value parsers keyed by target type.
 *
 * Built-in types:
 * - Strings, characters, booleans ({@code true}/{@code false}, any case) and every numeric type
 * - {@link BigInteger}, {@link BigDecimal}
 * - {@link Duration} and {@link Period} in ISO-8601 form, {@link Instant} and local date/time types
 * - {@link URI}, {@link Path}, {@link UUID}, {@link Charset}, {@link Locale}
 * - Any enum, matched by constant name ignoring case
 *
 * Additional types can be registered with {@link #register(Class, ValueParser)}.
 */
public final class ValueParsers {

    private static final Logger log = LoggerFactory.getLogger(ValueParsers.class);

    private static final Map<Class<?>, Class<?>> PRIMITIVES = Map.of(
            boolean.class, Boolean.class,
            char.class, Character.class,
            byte.class, Byte.class,
            short.class, Short.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class
    );

    private final Map<Class<?>, ValueParser<?>> parsers = new ConcurrentHashMap<>();

    private ValueParsers() {
    }

    /**
     * Creates a registry holding the built-in parsers.
     */
    public static ValueParsers defaults() {
        ValueParsers registry = new ValueParsers();
        registry.register(String.class, value -> value);
        registry.register(Boolean.class, ValueParsers::parseBoolean);
        registry.register(Character.class, ValueParsers::parseCharacter);
        registry.register(Byte.class, value -> Byte.parseByte(value.trim()));
        registry.register(Short.class, value -> Short.parseShort(value.trim()));
        registry.register(Integer.class, value -> Integer.parseInt(value.trim()));
        registry.register(Long.class, value -> Long.parseLong(value.trim()));
        registry.register(Float.class, value -> Float.parseFloat(value.trim()));
        registry.register(Double.class, value -> Double.parseDouble(value.trim()));
        registry.register(BigInteger.class, value -> new BigInteger(value.trim()));
        registry.register(BigDecimal.class, value -> new BigDecimal(value.trim()));
        registry.register(Duration.class, value -> Duration.parse(value.trim()));
        registry.register(Period.class, value -> Period.parse(value.trim()));
        registry.register(Instant.class, value -> Instant.parse(value.trim()));
        registry.register(LocalDate.class, value -> LocalDate.parse(value.trim()));
        registry.register(LocalTime.class, value -> LocalTime.parse(value.trim()));
        registry.register(LocalDateTime.class, value -> LocalDateTime.parse(value.trim()));
        registry.register(URI.class, value -> URI.create(value.trim()));
        registry.register(Path.class, value -> Path.of(value));
        registry.register(UUID.class, value -> UUID.fromString(value.trim()));
        registry.register(Charset.class, value -> Charset.forName(value.trim()));
        registry.register(Locale.class, value -> Locale.forLanguageTag(value.trim()));
        return registry;
    }

    /**
     * Registers or replaces the parser of a type.
     */
    public <T> ValueParsers register(Class<T> type, ValueParser<? extends T> parser) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(parser, "parser");
        if (parsers.put(wrap(type), parser) != null) {
            log.debug("Replaced value parser for {}", type.getName());
        }
        return this;
    }

    /**
     * Returns whether values of the type can be parsed.
     */
    public boolean supports(Class<?> type) {
        return type.isEnum() || parsers.containsKey(wrap(type));
    }

    /**
     * Parses a value.
     *
     * @throws IllegalArgumentException if the type is not supported or the value is invalid
     */
    public Object parse(Class<?> type, String value) {
        Objects.requireNonNull(value, "value");
        if (type.isEnum()) {
            return parseEnum(type, value);
        }
        ValueParser<?> parser = parsers.get(wrap(type));
        if (parser == null) {
            throw new IllegalArgumentException("No value parser registered for " + type.getName());
        }
        return parser.parse(value);
    }

    /**
     * Returns the wrapper class of a primitive type, or the type itself.
     */
    static Class<?> wrap(Class<?> type) {
        return type.isPrimitive() ? PRIMITIVES.get(type) : type;
    }

    private static Boolean parseBoolean(String value) {
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true")) {
            return Boolean.TRUE;
        }
        if (trimmed.equalsIgnoreCase("false")) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("'" + value + "' is not a valid boolean");
    }

    private static Character parseCharacter(String value) {
        if (value.length() != 1) {
            throw new IllegalArgumentException("'" + value + "' is not a single character");
        }
        return value.charAt(0);
    }

    private static Object parseEnum(Class<?> type, String value) {
        String trimmed = value.trim();
        for (Object constant : type.getEnumConstants()) {
            if (((Enum<?>) constant).name().equalsIgnoreCase(trimmed)) {
                return constant;
            }
        }
        throw new IllegalArgumentException("'" + value + "' is not a constant of " + type.getSimpleName());
    }
}
