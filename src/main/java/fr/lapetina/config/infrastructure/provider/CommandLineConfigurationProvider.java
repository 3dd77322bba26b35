package fr.lapetina.config.infrastructure.provider;

import fr.lapetina.config.domain.model.ConfigurationData;
import fr.lapetina.config.domain.model.ConfigurationPath;
import fr.lapetina.config.domain.provider.AbstractConfigurationProvider;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Provider reading command line arguments.
 *
 * Accepted forms:
 * - {@code --key=value}, {@code /key=value} and {@code key=value}
 * - {@code --key value} and {@code /key value}
 * - {@code -k value} and {@code -k=value} when {@code -k} has a switch mapping
 *
 * Bare words, unmapped single dash switches and switches without a value are ignored.
 * A later occurrence of a key overrides an earlier one. Dash separated key parts are
 * joined in Pascal case, so {@code --max-size} is read as {@code MaxSize}.
 */
public final class CommandLineConfigurationProvider extends AbstractConfigurationProvider {

    private final List<String> args;
    private final Map<String, String> switchMappings;

    /**
     * @param switchMappings switch aliases keyed by their normalized form
     */
    CommandLineConfigurationProvider(List<String> args, Map<String, String> switchMappings) {
        super("CommandLine");
        this.args = List.copyOf(Objects.requireNonNull(args, "args"));
        this.switchMappings = Map.copyOf(Objects.requireNonNull(switchMappings, "switchMappings"));
    }

    @Override
    protected ConfigurationData loadData() {
        ConfigurationData.Builder data = ConfigurationData.builder();
        int i = 0;

        while (i < args.size()) {
            String arg = args.get(i++);
            int keyStart = 0;
            if (arg.startsWith("--")) {
                keyStart = 2;
            } else if (arg.startsWith("-")) {
                keyStart = 1;
            } else if (arg.startsWith("/")) {
                arg = "--" + arg.substring(1);
                keyStart = 2;
            }

            String key;
            String value;
            int separator = arg.indexOf('=');

            if (separator < 0) {
                if (keyStart == 0) {
                    continue;
                }
                String mapped = switchMappings.get(ConfigurationPath.normalize(arg));
                if (mapped != null) {
                    key = mapped;
                } else if (keyStart == 1) {
                    continue;
                } else {
                    key = arg.substring(keyStart);
                }
                if (i >= args.size()) {
                    continue;
                }
                value = args.get(i++);
            } else {
                String mapped = switchMappings.get(ConfigurationPath.normalize(arg.substring(0, separator)));
                if (mapped != null) {
                    key = mapped;
                } else if (keyStart == 1) {
                    continue;
                } else {
                    key = arg.substring(keyStart, separator);
                }
                value = arg.substring(separator + 1);
            }

            key = toPascalCase(key);
            if (!key.isEmpty()) {
                data.put(key, value);
            }
        }
        return data.build();
    }

    /**
     * Joins dash separated parts, upper-casing the first letter of each part.
     */
    static String toPascalCase(String key) {
        StringBuilder result = new StringBuilder(key.length());
        for (String part : key.split("-")) {
            if (!part.isEmpty()) {
                result.append(Character.toUpperCase(part.charAt(0))).append(part, 1, part.length());
            }
        }
        return result.toString();
    }
}
