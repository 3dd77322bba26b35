package fr.lapetina.config.tree;

import fr.lapetina.config.domain.exception.ProviderLoadException;
import fr.lapetina.config.domain.model.ConfigurationData;
import fr.lapetina.config.domain.provider.AbstractConfigurationProvider;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provider whose data, failures and change signals are driven by a test.
 */
public final class StubConfigurationProvider extends AbstractConfigurationProvider {

    private final AtomicInteger loadCount = new AtomicInteger();
    private volatile Map<String, String> values;
    private volatile String failure;
    private volatile boolean closed;

    public StubConfigurationProvider(String name, Map<String, String> values) {
        super(name);
        this.values = values;
    }

    @Override
    protected ConfigurationData loadData() {
        loadCount.incrementAndGet();
        if (failure != null) {
            throw new ProviderLoadException(failure);
        }
        return ConfigurationData.of(values);
    }

    public void setValues(Map<String, String> values) {
        this.values = values;
    }

    public void failWith(String message) {
        this.failure = message;
    }

    public void recover() {
        this.failure = null;
    }

    /**
     * Fires the reload token as a watched source would.
     */
    public void signalChange() {
        onReload();
    }

    public int getLoadCount() {
        return loadCount.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }
}
