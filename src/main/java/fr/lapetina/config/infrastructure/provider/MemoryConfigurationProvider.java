package fr.lapetina.config.infrastructure.provider;

import fr.lapetina.config.domain.model.ConfigurationData;
import fr.lapetina.config.domain.provider.AbstractConfigurationProvider;

import java.util.Map;

/**
 * Provider serving a fixed set of in-memory values.
 */
public final class MemoryConfigurationProvider extends AbstractConfigurationProvider {

    private final ConfigurationData initialData;

    public MemoryConfigurationProvider(Map<String, String> values) {
        super("Memory");
        this.initialData = ConfigurationData.of(values);
    }

    @Override
    protected ConfigurationData loadData() {
        return initialData;
    }
}
