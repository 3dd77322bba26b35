package fr.lapetina.config;

import fr.lapetina.config.domain.exception.ConfigurationException;
import fr.lapetina.config.infrastructure.file.FileConfigurationSource;
import fr.lapetina.config.infrastructure.provider.MemoryConfigurationProvider;
import fr.lapetina.config.infrastructure.provider.MemoryConfigurationSource;
import fr.lapetina.config.tree.ConfigurationRoot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigurationBuilderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should layer sources in the order they were added")
    void shouldLayerSources() throws IOException {
        Path json = tempDir.resolve("appsettings.json");
        Files.writeString(json, "{ \"Server\": { \"Host\": \"json\", \"Port\": \"80\" } }");
        Path yaml = tempDir.resolve("appsettings.yaml");
        Files.writeString(yaml, "Server:\n  Port: 8080\n");

        try (ConfigurationRoot root = new ConfigurationBuilder()
                .addInMemory(Map.of("Server:Host", "memory", "Server:Timeout", "PT5S"))
                .addJsonFile(json)
                .addYamlFile(yaml)
                .addEnvironmentVariables("APP_", Map.of("APP_Server__Host", "env"))
                .addCommandLine(new String[] {"--Server:Timeout=PT1S"})
                .build()) {

            assertThat(root.get("Server:Host")).contains("env");
            assertThat(root.get("Server:Port")).contains("8080");
            assertThat(root.get("Server:Timeout")).contains("PT1S");
            assertThat(root.getProviders()).extracting(provider -> provider.getName()).containsExactly(
                    "Memory", "JsonFile(appsettings.json)", "YamlFile(appsettings.yaml)",
                    "EnvironmentVariables", "CommandLine");
        }
    }

    @Test
    @DisplayName("should expose the added sources")
    void shouldExposeSources() {
        ConfigurationBuilder builder = new ConfigurationBuilder()
                .addInMemory(Map.of())
                .addIniFile(tempDir.resolve("settings.ini"));

        assertThat(builder.getSources()).hasSize(2);
        assertThat(builder.getSources().get(0)).isInstanceOf(MemoryConfigurationSource.class);
        assertThat(builder.getSources().get(1)).isInstanceOf(FileConfigurationSource.class);
        assertThatThrownBy(() -> builder.getSources().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("should share properties with sources")
    void shouldShareProperties() {
        ConfigurationBuilder builder = new ConfigurationBuilder();
        builder.getProperties().put("BasePath", tempDir);

        ConfigurationRoot root = builder
                .add(b -> new MemoryConfigurationProvider(
                        Map.of("BasePath", b.getProperties().get("BasePath").toString())))
                .build();

        assertThat(root.get("BasePath")).contains(tempDir.toString());
    }

    @Test
    @DisplayName("should reject invalid switch mappings when adding the source")
    void shouldRejectInvalidSwitchMappings() {
        ConfigurationBuilder builder = new ConfigurationBuilder();

        assertThatThrownBy(() -> builder.addCommandLine(new String[0], Map.of("port", "Port")))
                .isInstanceOf(ConfigurationException.class);
        assertThat(builder.getSources()).isEmpty();
    }

    @Test
    @DisplayName("should build an empty configuration without sources")
    void shouldBuildEmptyConfiguration() {
        ConfigurationRoot root = new ConfigurationBuilder().build();

        assertThat(root.getChildren()).isEmpty();
        assertThat(root.getDebugView()).isEmpty();
    }
}
