package fr.lapetina.config.infrastructure.provider;

import fr.lapetina.config.domain.model.ConfigurationData;
import fr.lapetina.config.domain.model.ConfigurationPath;
import fr.lapetina.config.domain.provider.AbstractConfigurationProvider;

import java.util.Map;
import java.util.Objects;

/**
 * Provider reading a snapshot of environment variables.
 *
 * Variables whose name starts with the prefix (ignoring case) are kept with the prefix
 * removed, and {@code __} in names is read as the key delimiter, so
 * {@code APP_Logging__Level} becomes {@code Logging:Level} for the prefix {@code APP_}.
 */
public final class EnvironmentVariablesConfigurationProvider extends AbstractConfigurationProvider {

    static final String SEPARATOR_ALIAS = "__";

    private final String prefix;
    private final Map<String, String> variables;

    public EnvironmentVariablesConfigurationProvider(String prefix, Map<String, String> variables) {
        super("EnvironmentVariables");
        this.prefix = prefix == null ? "" : prefix;
        this.variables = Objects.requireNonNull(variables, "variables");
    }

    @Override
    protected ConfigurationData loadData() {
        String normalizedPrefix = ConfigurationPath.normalize(prefix);
        ConfigurationData.Builder data = ConfigurationData.builder();

        for (Map.Entry<String, String> variable : variables.entrySet()) {
            String name = variable.getKey();
            if (!ConfigurationPath.normalize(name).startsWith(normalizedPrefix)) {
                continue;
            }
            String key = name.substring(prefix.length())
                    .replace(SEPARATOR_ALIAS, ConfigurationPath.KEY_DELIMITER);
            if (!key.isEmpty()) {
                data.put(key, variable.getValue());
            }
        }
        return data.build();
    }

    public String getPrefix() {
        return prefix;
    }
}
