package fr.lapetina.config.tree;

import fr.lapetina.config.ConfigurationBuilder;
import fr.lapetina.config.domain.model.PathMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultConfigurationRootTest {

    @Nested
    @DisplayName("Lookup")
    class LookupTests {

        @Test
        @DisplayName("should let the last added provider win")
        void shouldApplyPriorityOrder() {
            ConfigurationRoot root = new ConfigurationBuilder()
                    .addInMemory(Map.of("MyKey", "MyValue"))
                    .addInMemory(Map.of("MyKey", "Override"))
                    .build();

            assertThat(root.get("MyKey")).contains("Override");
        }

        @Test
        @DisplayName("should fall back to lower priority providers")
        void shouldFallBackToLowerPriority() {
            ConfigurationRoot root = new ConfigurationBuilder()
                    .addInMemory(Map.of("Only:In:First", "1", "Shared", "first"))
                    .addInMemory(Map.of("Shared", "second"))
                    .addInMemory(Map.of("Other", "third"))
                    .build();

            assertThat(root.get("Only:In:First")).contains("1");
            assertThat(root.get("Shared")).contains("second");
            assertThat(root.get("Other")).contains("third");
        }

        @Test
        @DisplayName("should ignore case in keys")
        void shouldIgnoreCase() {
            ConfigurationRoot root = new ConfigurationBuilder()
                    .addInMemory(Map.of("Position:Title", "Editor"))
                    .build();

            assertThat(root.get("position:title")).isEqualTo(root.get("Position:Title"));
            assertThat(root.get("POSITION:TITLE")).contains("Editor");
        }

        @Test
        @DisplayName("should return empty for missing keys")
        void shouldReturnEmptyForMissingKey() {
            ConfigurationRoot root = new ConfigurationBuilder().addInMemory(Map.of("a", "1")).build();

            assertThat(root.get("b")).isEmpty();
        }

        @Test
        @DisplayName("should distinguish empty values from absent ones")
        void shouldKeepEmptyValues() {
            ConfigurationRoot root = new ConfigurationBuilder()
                    .addInMemory(Map.of("Key", "Value"))
                    .addInMemory(Map.of("Key", ""))
                    .build();

            assertThat(root.get("Key")).contains("");
        }
    }

    @Nested
    @DisplayName("Sections")
    class SectionTests {

        private ConfigurationRoot root;

        @BeforeEach
        void setUp() {
            Map<String, String> values = new LinkedHashMap<>();
            values.put("Logging:LogLevel:Default", "Information");
            values.put("Logging:LogLevel:Microsoft", "Warning");
            values.put("Logging", "enabled");
            root = new ConfigurationBuilder().addInMemory(values).build();
        }

        @Test
        @DisplayName("should resolve keys through nested sections")
        void shouldResolveNestedSections() {
            ConfigurationSection section = root.getSection("Logging").getSection("LogLevel");

            assertThat(section.get("Default")).contains("Information");
            assertThat(section.getKey()).isEqualTo("LogLevel");
            assertThat(section.getPath()).isEqualTo("Logging:LogLevel");
        }

        @Test
        @DisplayName("should expose both value and children of a section")
        void shouldExposeValueAndChildren() {
            ConfigurationSection logging = root.getSection("logging");

            assertThat(logging.getValue()).contains("enabled");
            assertThat(logging.getChildren()).extracting(ConfigurationSection::getKey).containsExactly("LogLevel");
            assertThat(logging.exists()).isTrue();
        }

        @Test
        @DisplayName("should return an empty section for unknown paths")
        void shouldReturnEmptySection() {
            ConfigurationSection missing = root.getSection("Missing").getSection("Deeper");

            assertThat(missing.exists()).isFalse();
            assertThat(missing.getValue()).isEmpty();
            assertThat(missing.getChildren()).isEmpty();
            assertThat(missing.get("Anything")).isEmpty();
        }

        @Test
        @DisplayName("should treat a section with only children as existing")
        void shouldExistWithChildrenOnly() {
            assertThat(root.getSection("Logging:LogLevel").exists()).isTrue();
            assertThat(root.getSection("Logging:LogLevel").getValue()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Children")
    class ChildrenTests {

        @Test
        @DisplayName("should union children of every provider with first seen casing")
        void shouldUnionChildren() {
            ConfigurationRoot root = new ConfigurationBuilder()
                    .addInMemory(Map.of("Alpha:x", "1"))
                    .addInMemory(Map.of("Beta:y", "2", "ALPHA:z", "3"))
                    .build();

            assertThat(root.getChildren()).extracting(ConfigurationSection::getKey).containsExactly("Alpha", "Beta");
            assertThat(root.getSection("alpha").getChildren())
                    .extracting(ConfigurationSection::getPath)
                    .containsExactly("alpha:x", "alpha:z");
        }

        @Test
        @DisplayName("should order numeric children numerically")
        void shouldOrderNumericChildren() {
            ConfigurationRoot root = new ConfigurationBuilder()
                    .addInMemory(Map.of("List:10", "k", "List:2", "c", "List:name", "n"))
                    .build();

            assertThat(root.getSection("List").getChildren())
                    .extracting(ConfigurationSection::getKey)
                    .containsExactly("2", "10", "name");
        }
    }

    @Nested
    @DisplayName("Empty segments")
    class EmptySegmentTests {

        @Test
        @DisplayName("should address keys with a trailing delimiter")
        void shouldAddressTrailingDelimiter() {
            ConfigurationRoot root = new ConfigurationBuilder()
                    .addInMemory(Map.of("Key1:", "value", "Key1::Key3", "deep"))
                    .build();

            ConfigurationSection empty = root.getSection("Key1").getSection("");

            assertThat(root.getSection("Key1").getChildren()).extracting(ConfigurationSection::getKey).containsExactly("");
            assertThat(empty.getPath()).isEqualTo("Key1:");
            assertThat(empty.getValue()).contains("value");
            assertThat(empty.get("Key3")).contains("deep");
        }

        @Test
        @DisplayName("should address keys with a leading delimiter")
        void shouldAddressLeadingDelimiter() {
            ConfigurationRoot root = new ConfigurationBuilder()
                    .addInMemory(Map.of(":Key2", "value"))
                    .build();

            assertThat(root.getChildren()).extracting(ConfigurationSection::getKey).containsExactly("");
            assertThat(root.getSection("").get("Key2")).contains("value");
        }
    }

    @Nested
    @DisplayName("Iteration")
    class IterationTests {

        private ConfigurationRoot root;

        @BeforeEach
        void setUp() {
            Map<String, String> values = new LinkedHashMap<>();
            values.put("Mem1", "Value1");
            values.put("Mem1:", "NoKeyValue1");
            values.put("Mem1:KeyInMem1", "ValueInMem1");
            values.put("Mem1:KeyInMem1:Deep1", "ValueDeep1");
            values.put("Mem2", "Value2");
            root = new ConfigurationBuilder()
                    .addInMemory(values)
                    .addInMemory(Map.of("Mem2", "Override2"))
                    .build();
        }

        @Test
        @DisplayName("should enumerate resolved values depth first")
        void shouldEnumerateResolvedValues() {
            Map<String, String> all = root.asMap(PathMode.ABSOLUTE);

            assertThat(all.keySet()).containsExactly(
                    "Mem1", "Mem1:", "Mem1:KeyInMem1", "Mem1:KeyInMem1:Deep1", "Mem2");
            assertThat(all).containsEntry("Mem2", "Override2");
        }

        @Test
        @DisplayName("should strip the section path in relative mode")
        void shouldStripSectionPath() {
            Map<String, String> relative = root.getSection("Mem1").asMap(PathMode.RELATIVE);

            assertThat(relative).containsExactly(
                    Map.entry("", "NoKeyValue1"),
                    Map.entry("KeyInMem1", "ValueInMem1"),
                    Map.entry("KeyInMem1:Deep1", "ValueDeep1"));
        }

        @Test
        @DisplayName("should include the section value first in absolute mode")
        void shouldIncludeSectionValue() {
            Map<String, String> absolute = root.getSection("Mem1").asMap(PathMode.ABSOLUTE);

            assertThat(absolute.keySet()).containsExactly(
                    "Mem1", "Mem1:", "Mem1:KeyInMem1", "Mem1:KeyInMem1:Deep1");
        }

        @Test
        @DisplayName("should restart iteration on every call")
        void shouldRestartIteration() {
            Iterable<Map.Entry<String, String>> entries = root.iterate();

            List<Map.Entry<String, String>> first = new ArrayList<>();
            entries.forEach(first::add);
            List<Map.Entry<String, String>> second = new ArrayList<>();
            entries.forEach(second::add);

            assertThat(second).isEqualTo(first).hasSize(5);
        }
    }
}
