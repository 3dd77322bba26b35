package fr.lapetina.config.tree;

import fr.lapetina.config.ConfigurationBuilder;
import fr.lapetina.config.domain.exception.ReloadException;
import fr.lapetina.config.domain.model.ProviderFailure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigurationReloadTest {

    private StubConfigurationProvider defaults;
    private StubConfigurationProvider overrides;

    @BeforeEach
    void setUp() {
        defaults = new StubConfigurationProvider("Defaults", Map.of("Key", "a", "Other", "x"));
        overrides = new StubConfigurationProvider("Overrides", Map.of("Key", "b"));
    }

    @Nested
    @DisplayName("Change notification")
    class ChangeNotificationTests {

        @Test
        @DisplayName("should not fire the root token on a reload without changes")
        void shouldNotFireWithoutChanges() {
            DefaultConfigurationRoot root = new DefaultConfigurationRoot(List.of(defaults, overrides));
            root.reload();
            AtomicInteger fired = new AtomicInteger();
            root.getReloadToken().registerChangeCallback(fired::incrementAndGet);

            root.reload();

            assertThat(fired).hasValue(0);
            assertThat(root.getReloadToken().hasChanged()).isFalse();
        }

        @Test
        @DisplayName("should record a pending change without reloading by default")
        void shouldRecordPendingChange() {
            DefaultConfigurationRoot root = new DefaultConfigurationRoot(List.of(defaults, overrides));
            root.reload();
            overrides.setValues(Map.of("Key", "c"));

            overrides.signalChange();

            assertThat(root.hasPendingChange()).isTrue();
            assertThat(root.get("Key")).contains("b");
            assertThat(overrides.getLoadCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should fire the root token once after a signaled change is reloaded")
        void shouldFireOnceAfterReload() {
            DefaultConfigurationRoot root = new DefaultConfigurationRoot(List.of(defaults, overrides));
            root.reload();
            AtomicInteger fired = new AtomicInteger();
            root.getReloadToken().registerChangeCallback(fired::incrementAndGet);
            overrides.setValues(Map.of("Key", "c"));

            overrides.signalChange();
            root.reload();
            root.reload();

            assertThat(fired).hasValue(1);
            assertThat(root.get("Key")).contains("c");
            assertThat(root.hasPendingChange()).isFalse();
        }

        @Test
        @DisplayName("should keep listening to providers after a reload")
        void shouldResubscribeAfterReload() {
            DefaultConfigurationRoot root = new DefaultConfigurationRoot(List.of(defaults, overrides));
            root.reload();

            defaults.signalChange();
            root.reload();
            AtomicInteger fired = new AtomicInteger();
            root.getReloadToken().registerChangeCallback(fired::incrementAndGet);
            defaults.signalChange();
            root.reload();

            assertThat(fired).hasValue(1);
        }

        @Test
        @DisplayName("should reload on the signaling thread when automatic reload is enabled")
        void shouldReloadAutomatically() {
            ConfigurationRoot root = new ConfigurationBuilder()
                    .addProvider(defaults)
                    .addProvider(overrides)
                    .reloadOnChange(true)
                    .build();
            AtomicInteger fired = new AtomicInteger();
            root.getReloadToken().registerChangeCallback(fired::incrementAndGet);
            overrides.setValues(Map.of("Key", "auto"));

            overrides.signalChange();

            assertThat(fired).hasValue(1);
            assertThat(root.get("Key")).contains("auto");
            assertThat(overrides.getLoadCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should propagate the root token to sections")
        void shouldShareTokenWithSections() {
            DefaultConfigurationRoot root = new DefaultConfigurationRoot(List.of(defaults));
            root.reload();

            assertThat(root.getSection("Key").getReloadToken()).isSameAs(root.getReloadToken());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("should keep reloading other providers when one fails")
        void shouldReloadBestEffort() {
            DefaultConfigurationRoot root = new DefaultConfigurationRoot(List.of(defaults, overrides));
            root.reload();
            defaults.failWith("disk unavailable");
            defaults.setValues(Map.of("Other", "lost"));
            overrides.setValues(Map.of("Key", "fresh"));

            assertThatThrownBy(root::reload)
                    .isInstanceOf(ReloadException.class)
                    .hasMessage("disk unavailable (Defaults)");

            assertThat(root.get("Key")).contains("fresh");
            assertThat(root.get("Other")).contains("x");
        }

        @Test
        @DisplayName("should aggregate every failure in provider order")
        void shouldAggregateFailures() {
            DefaultConfigurationRoot root = new DefaultConfigurationRoot(List.of(defaults, overrides));
            defaults.failWith("first");
            overrides.failWith("second");

            assertThatThrownBy(root::reload)
                    .isInstanceOfSatisfying(ReloadException.class, e -> {
                        assertThat(e.getProviderNames()).containsExactly("Defaults", "Overrides");
                        assertThat(e.getSuppressed()).hasSize(2);
                    })
                    .hasMessage("One or more load errors occurred:"
                            + "\n  [1]: first (Defaults)"
                            + "\n  [2]: second (Overrides)");
        }

        @Test
        @DisplayName("should recover on the next reload")
        void shouldRecover() {
            DefaultConfigurationRoot root = new DefaultConfigurationRoot(List.of(defaults));
            defaults.failWith("temporary");
            assertThatThrownBy(root::reload).isInstanceOf(ReloadException.class);

            defaults.recover();
            root.reload();

            assertThat(root.get("Other")).contains("x");
        }

        @Test
        @DisplayName("should close the providers when the initial load fails")
        void shouldCloseOnBuildFailure() {
            defaults.failWith("broken");
            ConfigurationBuilder builder = new ConfigurationBuilder()
                    .addProvider(defaults)
                    .addProvider(overrides);

            assertThatThrownBy(builder::build)
                    .isInstanceOf(ReloadException.class)
                    .hasMessageContaining("broken (Defaults)");

            assertThat(defaults.isClosed()).isTrue();
            assertThat(overrides.isClosed()).isTrue();
        }

        @Test
        @DisplayName("should report every reload to the observer")
        void shouldNotifyObserver() {
            List<List<ProviderFailure>> reports = new ArrayList<>();
            List<Integer> providerCounts = new ArrayList<>();
            DefaultConfigurationRoot root = new DefaultConfigurationRoot(List.of(defaults, overrides), false,
                    (duration, count, failures) -> {
                        providerCounts.add(count);
                        reports.add(failures);
                    });

            root.reload();
            overrides.failWith("nope");
            assertThatThrownBy(root::reload).isInstanceOf(ReloadException.class);

            assertThat(providerCounts).containsExactly(2, 2);
            assertThat(reports.get(0)).isEmpty();
            assertThat(reports.get(1)).extracting(ProviderFailure::providerName).containsExactly("Overrides");
        }
    }

    @Nested
    @DisplayName("Close")
    class CloseTests {

        @Test
        @DisplayName("should close providers and stop listening")
        void shouldCloseProviders() {
            DefaultConfigurationRoot root = new DefaultConfigurationRoot(List.of(defaults, overrides));
            root.reload();

            root.close();
            overrides.signalChange();

            assertThat(defaults.isClosed()).isTrue();
            assertThat(overrides.isClosed()).isTrue();
            assertThat(root.hasPendingChange()).isFalse();
        }

        @Test
        @DisplayName("should ignore a second close")
        void shouldCloseOnce() {
            DefaultConfigurationRoot root = new DefaultConfigurationRoot(List.of(defaults));
            root.reload();

            root.close();
            root.close();

            assertThat(defaults.isClosed()).isTrue();
        }

        @Test
        @DisplayName("should reject a reload after close without touching providers")
        void shouldRejectReloadAfterClose() {
            DefaultConfigurationRoot root = new DefaultConfigurationRoot(List.of(defaults, overrides));
            root.reload();
            root.close();

            assertThatThrownBy(root::reload)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("configuration root is closed");

            assertThat(defaults.getLoadCount()).isEqualTo(1);
            assertThat(overrides.getLoadCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should not reload automatically once closed")
        void shouldNotAutoReloadAfterClose() {
            DefaultConfigurationRoot root = new DefaultConfigurationRoot(List.of(defaults, overrides), true,
                    ReloadObserver.NONE);
            root.reload();
            root.close();

            overrides.signalChange();

            assertThat(overrides.getLoadCount()).isEqualTo(1);
        }
    }
}
