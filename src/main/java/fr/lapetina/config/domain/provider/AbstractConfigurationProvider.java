package fr.lapetina.config.domain.provider;

import fr.lapetina.config.domain.model.ConfigurationData;
import fr.lapetina.config.domain.token.ChangeToken;
import fr.lapetina.config.domain.token.SingleChangeToken;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class for providers backed by a {@link ConfigurationData} snapshot.
 *
 * Subclasses produce a complete snapshot in {@link #loadData()}; this class swaps it in
 * and issues a fresh reload token when the current one has already fired.
 */
public abstract class AbstractConfigurationProvider implements ConfigurationProvider {

    private final String name;
    private final AtomicReference<SingleChangeToken> reloadToken = new AtomicReference<>(new SingleChangeToken());
    private volatile ConfigurationData data = ConfigurationData.empty();

    protected AbstractConfigurationProvider(String name) {
        this.name = Objects.requireNonNull(name, "name is required");
    }

    /**
     * Produces the complete data of the source.
     */
    protected abstract ConfigurationData loadData();

    @Override
    public void load() {
        data = loadData();
        reloadToken.updateAndGet(token -> token.hasChanged() ? new SingleChangeToken() : token);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Optional<String> get(String key) {
        return data.get(key);
    }

    @Override
    public List<String> getChildKeys(String parentPath) {
        return data.childKeys(parentPath);
    }

    @Override
    public ChangeToken getReloadToken() {
        return reloadToken.get();
    }

    /**
     * Returns the current snapshot.
     */
    public ConfigurationData getData() {
        return data;
    }

    /**
     * Replaces the current snapshot without firing the reload token.
     */
    protected final void setData(ConfigurationData data) {
        this.data = Objects.requireNonNull(data, "data");
    }

    /**
     * Signals a change of the underlying source: a fresh token is installed, then the
     * previous one fires.
     */
    protected final void onReload() {
        SingleChangeToken previous = reloadToken.getAndSet(new SingleChangeToken());
        previous.notifyChanged();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + name + "'}";
    }
}
