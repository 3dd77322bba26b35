package fr.lapetina.config.binder;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.charset.Charset;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Locale;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueParsersTest {

    enum Level { LOW, HIGH }

    private ValueParsers parsers;

    @BeforeEach
    void setUp() {
        parsers = ValueParsers.defaults();
    }

    @Test
    @DisplayName("should parse primitives through their wrapper parsers")
    void shouldParsePrimitives() {
        assertThat(parsers.parse(int.class, " 42 ")).isEqualTo(42);
        assertThat(parsers.parse(long.class, "9000000000")).isEqualTo(9_000_000_000L);
        assertThat(parsers.parse(boolean.class, "TRUE")).isEqualTo(true);
        assertThat(parsers.parse(char.class, "x")).isEqualTo('x');
    }

    @Test
    @DisplayName("should parse common value types")
    void shouldParseValueTypes() {
        assertThat(parsers.parse(Duration.class, "PT1M")).isEqualTo(Duration.ofMinutes(1));
        assertThat(parsers.parse(LocalDate.class, "2024-02-29")).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(parsers.parse(URI.class, "http://localhost:8080")).isEqualTo(URI.create("http://localhost:8080"));
        assertThat(parsers.parse(BigDecimal.class, "1.50")).isEqualTo(new BigDecimal("1.50"));
        assertThat(parsers.parse(Charset.class, "utf-8")).isEqualTo(StandardCharsets.UTF_8);
        assertThat(parsers.parse(Locale.class, "fr-FR")).isEqualTo(Locale.FRANCE);
        assertThat(parsers.parse(UUID.class, "123e4567-e89b-12d3-a456-426614174000"))
                .isEqualTo(UUID.fromString("123e4567-e89b-12d3-a456-426614174000"));
    }

    @Test
    @DisplayName("should match enum constants ignoring case")
    void shouldParseEnums() {
        assertThat(parsers.supports(Level.class)).isTrue();
        assertThat(parsers.parse(Level.class, "high")).isEqualTo(Level.HIGH);
        assertThatThrownBy(() -> parsers.parse(Level.class, "medium"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a constant of Level");
    }

    @Test
    @DisplayName("should only accept true or false as booleans")
    void shouldRejectLooseBooleans() {
        assertThatThrownBy(() -> parsers.parse(Boolean.class, "1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parsers.parse(Boolean.class, "on"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should reject unsupported types")
    void shouldRejectUnsupportedTypes() {
        assertThat(parsers.supports(Thread.class)).isFalse();
        assertThatThrownBy(() -> parsers.parse(Thread.class, "main"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No value parser registered for java.lang.Thread");
    }

    @Test
    @DisplayName("should use registered parsers")
    void shouldUseRegisteredParsers() {
        parsers.register(StringBuilder.class, StringBuilder::new)
                .register(Integer.class, value -> Integer.decode(value.trim()));

        assertThat(parsers.supports(StringBuilder.class)).isTrue();
        assertThat(parsers.parse(StringBuilder.class, "abc").toString()).isEqualTo("abc");
        assertThat(parsers.parse(int.class, "0x10")).isEqualTo(16);
    }
}
