package fr.lapetina.config.infrastructure.provider;

import fr.lapetina.config.ConfigurationBuilder;
import fr.lapetina.config.domain.exception.ConfigurationException;
import fr.lapetina.config.domain.model.ConfigurationPath;
import fr.lapetina.config.domain.provider.ConfigurationProvider;
import fr.lapetina.config.domain.provider.ConfigurationSource;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Source of command line arguments with optional switch mappings.
 *
 * A switch mapping turns a short switch such as {@code -p} into a configuration key
 * such as {@code Server:Port}. Mappings are validated when the source is created.
 */
public final class CommandLineConfigurationSource implements ConfigurationSource {

    private final List<String> args;
    private final Map<String, String> switchMappings;

    /**
     * @throws ConfigurationException if a mapping does not start with a dash, or if two
     *                                mappings differ only by case
     */
    public CommandLineConfigurationSource(String[] args, Map<String, String> switchMappings) {
        this.args = List.copyOf(Arrays.asList(Objects.requireNonNull(args, "args")));
        this.switchMappings = validateMappings(Objects.requireNonNull(switchMappings, "switchMappings"));
    }

    private static Map<String, String> validateMappings(Map<String, String> mappings) {
        Map<String, String> validated = new HashMap<>();
        for (Map.Entry<String, String> mapping : mappings.entrySet()) {
            String name = mapping.getKey();
            if (name == null || !name.startsWith("-") || name.replace("-", "").isEmpty()) {
                throw new ConfigurationException("The switch mapping '" + name
                        + "' is invalid. A switch must start with '-' or '--' and have a name.");
            }
            if (mapping.getValue() == null || mapping.getValue().isEmpty()) {
                throw new ConfigurationException("The switch mapping '" + name + "' has no target key.");
            }
            if (validated.putIfAbsent(ConfigurationPath.normalize(name), mapping.getValue()) != null) {
                throw new ConfigurationException("The switch mapping '" + name
                        + "' is duplicated. Switches are case-insensitive.");
            }
        }
        return validated;
    }

    public List<String> getArgs() {
        return args;
    }

    @Override
    public ConfigurationProvider build(ConfigurationBuilder builder) {
        return new CommandLineConfigurationProvider(args, switchMappings);
    }
}
