package fr.lapetina.config.infrastructure.provider;

import fr.lapetina.config.domain.exception.ConfigurationException;
import fr.lapetina.config.domain.model.ConfigurationData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandLineConfigurationProviderTest {

    private static ConfigurationData load(Map<String, String> mappings, String... args) {
        CommandLineConfigurationProvider provider = new CommandLineConfigurationProvider(List.of(args), mappings);
        provider.load();
        return provider.getData();
    }

    private static ConfigurationData load(String... args) {
        return load(Map.of(), args);
    }

    @Nested
    @DisplayName("Argument forms")
    class ArgumentFormTests {

        @Test
        @DisplayName("should read key=value forms with any prefix")
        void shouldReadInlineValues() {
            ConfigurationData data = load("Key1=Value1", "--Key2=Value2", "/Key3=Value3");

            assertThat(data.get("Key1")).contains("Value1");
            assertThat(data.get("Key2")).contains("Value2");
            assertThat(data.get("Key3")).contains("Value3");
        }

        @Test
        @DisplayName("should read the value from the next argument")
        void shouldReadSeparateValues() {
            ConfigurationData data = load("--Key1", "Value1", "/Key2", "Value2");

            assertThat(data.get("Key1")).contains("Value1");
            assertThat(data.get("Key2")).contains("Value2");
        }

        @Test
        @DisplayName("should keep hierarchical keys and empty values")
        void shouldKeepHierarchicalKeys() {
            ConfigurationData data = load("--Server:Port=8080", "--Server:Host=");

            assertThat(data.get("server:port")).contains("8080");
            assertThat(data.get("Server:Host")).contains("");
        }

        @Test
        @DisplayName("should let a later occurrence override an earlier one")
        void shouldOverrideRepeatedKeys() {
            ConfigurationData data = load("--Key=first", "--key=second");

            assertThat(data.get("Key")).contains("second");
            assertThat(data.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("should ignore bare words, unmapped short switches and trailing switches")
        void shouldIgnoreMalformedArguments() {
            ConfigurationData data = load("bare", "-x", "value", "--Key=v", "--Dangling");

            assertThat(data.entries()).extracting(ConfigurationData.Entry::key).containsExactly("Key");
        }

        @Test
        @DisplayName("should join dash separated names in Pascal case")
        void shouldConvertToPascalCase() {
            ConfigurationData data = load("--max-pool-size=8");

            assertThat(data.get("MaxPoolSize")).contains("8");
            assertThat(CommandLineConfigurationProvider.toPascalCase("already")).isEqualTo("Already");
        }
    }

    @Nested
    @DisplayName("Switch mappings")
    class SwitchMappingTests {

        @Test
        @DisplayName("should translate mapped switches")
        void shouldTranslateMappedSwitches() {
            CommandLineConfigurationSource source = new CommandLineConfigurationSource(
                    new String[] {"-p", "8080", "--HOST=example.org"},
                    Map.of("-p", "Server:Port", "--host", "Server:Host"));
            CommandLineConfigurationProvider provider = (CommandLineConfigurationProvider) source.build(null);
            provider.load();

            assertThat(provider.get("Server:Port")).contains("8080");
            assertThat(provider.get("Server:Host")).contains("example.org");
        }

        @Test
        @DisplayName("should reject mappings without a dash")
        void shouldRejectInvalidMapping() {
            assertThatThrownBy(() -> new CommandLineConfigurationSource(new String[0], Map.of("p", "Port")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("'p' is invalid");
        }

        @Test
        @DisplayName("should reject mappings differing only by case")
        void shouldRejectDuplicateMapping() {
            assertThatThrownBy(() -> new CommandLineConfigurationSource(new String[0],
                    Map.of("--Port", "A", "--port", "B")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("duplicated");
        }
    }
}
