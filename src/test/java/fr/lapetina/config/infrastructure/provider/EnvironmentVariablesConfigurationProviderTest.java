package fr.lapetina.config.infrastructure.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EnvironmentVariablesConfigurationProviderTest {

    @Test
    @DisplayName("should keep prefixed variables and strip the prefix ignoring case")
    void shouldFilterByPrefix() {
        EnvironmentVariablesConfigurationProvider provider = new EnvironmentVariablesConfigurationProvider("app_",
                Map.of("APP_Name", "demo", "OTHER_Name", "other", "App_Port", "80"));

        provider.load();

        assertThat(provider.get("Name")).contains("demo");
        assertThat(provider.get("Port")).contains("80");
        assertThat(provider.getData().size()).isEqualTo(2);
    }

    @Test
    @DisplayName("should read a double underscore as the key delimiter")
    void shouldMapDoubleUnderscore() {
        EnvironmentVariablesConfigurationProvider provider = new EnvironmentVariablesConfigurationProvider("",
                Map.of("Logging__LogLevel__Default", "Debug"));

        provider.load();

        assertThat(provider.get("Logging:LogLevel:Default")).contains("Debug");
        assertThat(provider.getChildKeys(null)).containsExactly("Logging");
    }

    @Test
    @DisplayName("should ignore a variable equal to the prefix")
    void shouldIgnoreBarePrefix() {
        EnvironmentVariablesConfigurationProvider provider = new EnvironmentVariablesConfigurationProvider("APP_",
                Map.of("APP_", "nothing"));

        provider.load();

        assertThat(provider.getData().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("should capture the process environment")
    void shouldCaptureSystemEnvironment() {
        EnvironmentVariablesConfigurationSource source = EnvironmentVariablesConfigurationSource.fromSystem(null);

        assertThat(source.getPrefix()).isEmpty();
        assertThat(source.build(null).getName()).isEqualTo("EnvironmentVariables");
    }
}
