package fr.lapetina.config.tree;

import fr.lapetina.config.domain.exception.ProviderLoadException;
import fr.lapetina.config.domain.exception.ReloadException;
import fr.lapetina.config.domain.model.ConfigurationKeyComparator;
import fr.lapetina.config.domain.model.ConfigurationPath;
import fr.lapetina.config.domain.model.PathMode;
import fr.lapetina.config.domain.model.ProviderFailure;
import fr.lapetina.config.domain.provider.ConfigurationProvider;
import fr.lapetina.config.domain.token.ChangeToken;
import fr.lapetina.config.domain.token.ChangeTokenRegistration;
import fr.lapetina.config.domain.token.SingleChangeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Configuration root merging an ordered list of providers.
 *
 * Lookup rules:
 * - Providers are queried from the last added to the first added; the first value wins
 * - Child keys are the union of every provider's child keys
 *
 * Reload protocol:
 * - The root listens to the current token of every provider
 * - A firing provider token marks a pending change, and triggers a reload when
 *   automatic reloading is enabled
 * - {@link #reload()} reloads every provider, subscribes to their fresh tokens, then
 *   fires the root token only if a change was pending
 */
public final class DefaultConfigurationRoot implements ConfigurationRoot {

    private static final Logger log = LoggerFactory.getLogger(DefaultConfigurationRoot.class);

    private final List<ConfigurationProvider> providers;
    private final boolean reloadOnChange;
    private final ReloadObserver reloadObserver;

    private final Object reloadLock = new Object();
    private final AtomicReference<SingleChangeToken> reloadToken = new AtomicReference<>(new SingleChangeToken());
    private final AtomicBoolean pendingChange = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final List<ChangeTokenRegistration> subscriptions = new ArrayList<>();

    public DefaultConfigurationRoot(List<ConfigurationProvider> providers) {
        this(providers, false, ReloadObserver.NONE);
    }

    public DefaultConfigurationRoot(List<ConfigurationProvider> providers, boolean reloadOnChange,
                                    ReloadObserver reloadObserver) {
        this.providers = List.copyOf(Objects.requireNonNull(providers, "providers"));
        this.reloadOnChange = reloadOnChange;
        this.reloadObserver = Objects.requireNonNull(reloadObserver, "reloadObserver");
    }

    @Override
    public Optional<String> get(String key) {
        Objects.requireNonNull(key, "key");
        for (int i = providers.size() - 1; i >= 0; i--) {
            Optional<String> value = providers.get(i).get(key);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    @Override
    public ConfigurationSection getSection(String key) {
        return new DefaultConfigurationSection(this, Objects.requireNonNull(key, "key"));
    }

    @Override
    public List<ConfigurationSection> getChildren() {
        return getChildren(null);
    }

    /**
     * Returns the children of a path, or of the root when the path is {@code null}.
     */
    List<ConfigurationSection> getChildren(String path) {
        Map<String, String> keys = new LinkedHashMap<>();
        for (ConfigurationProvider provider : providers) {
            for (String key : provider.getChildKeys(path)) {
                keys.putIfAbsent(ConfigurationPath.normalize(key), key);
            }
        }

        List<String> sorted = new ArrayList<>(keys.values());
        sorted.sort(ConfigurationKeyComparator.INSTANCE);

        List<ConfigurationSection> children = new ArrayList<>(sorted.size());
        for (String key : sorted) {
            children.add(new DefaultConfigurationSection(this, ConfigurationPath.child(path, key)));
        }
        return children;
    }

    boolean hasChildren(String path) {
        for (ConfigurationProvider provider : providers) {
            if (!provider.getChildKeys(path).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public ChangeToken getReloadToken() {
        return reloadToken.get();
    }

    @Override
    public Iterable<Map.Entry<String, String>> iterate(PathMode mode) {
        Objects.requireNonNull(mode, "mode");
        return () -> new ConfigurationIterator(this, mode);
    }

    @Override
    public void reload() {
        synchronized (reloadLock) {
            if (closed.get()) {
                throw new IllegalStateException("configuration root is closed");
            }
            long start = System.nanoTime();
            boolean changed = pendingChange.getAndSet(false);
            List<ProviderFailure> failures = new ArrayList<>();

            for (ConfigurationProvider provider : providers) {
                try {
                    provider.load();
                    log.debug("Loaded configuration provider: {}", provider.getName());
                } catch (ProviderLoadException e) {
                    log.debug("Configuration provider {} failed to load", provider.getName(), e);
                    failures.add(new ProviderFailure(provider.getName(), e));
                } catch (RuntimeException e) {
                    failures.add(new ProviderFailure(provider.getName(),
                            new ProviderLoadException(String.valueOf(e.getMessage()), e)));
                }
            }

            subscribe();

            if (changed) {
                SingleChangeToken previous = reloadToken.getAndSet(new SingleChangeToken());
                log.info("Configuration reloaded with changes from {} provider(s)", providers.size());
                previous.notifyChanged();
            }

            reloadObserver.onReloadCompleted(Duration.ofNanos(System.nanoTime() - start),
                    providers.size(), List.copyOf(failures));

            if (!failures.isEmpty()) {
                throw new ReloadException(failures);
            }
        }
    }

    private void subscribe() {
        subscriptions.forEach(ChangeTokenRegistration::close);
        subscriptions.clear();
        if (closed.get()) {
            return;
        }
        for (ConfigurationProvider provider : providers) {
            subscriptions.add(provider.getReloadToken().registerChangeCallback(() -> onProviderChanged(provider)));
        }
    }

    private void onProviderChanged(ConfigurationProvider provider) {
        if (closed.get()) {
            return;
        }
        pendingChange.set(true);
        log.debug("Configuration provider {} signaled a change", provider.getName());

        if (reloadOnChange && !Thread.holdsLock(reloadLock)) {
            try {
                reload();
            } catch (ReloadException e) {
                log.error("Automatic configuration reload failed", e);
            } catch (IllegalStateException e) {
                log.debug("Skipped automatic reload of closed configuration root");
            }
        }
    }

    /**
     * Returns whether a provider signaled a change not yet picked up by a reload.
     */
    public boolean hasPendingChange() {
        return pendingChange.get();
    }

    @Override
    public List<ConfigurationProvider> getProviders() {
        return providers;
    }

    @Override
    public String getDebugView() {
        return ConfigurationDebugView.format(this);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        synchronized (reloadLock) {
            subscriptions.forEach(ChangeTokenRegistration::close);
            subscriptions.clear();
        }
        for (ConfigurationProvider provider : providers) {
            try {
                provider.close();
            } catch (Exception e) {
                log.warn("Error closing configuration provider {}", provider.getName(), e);
            }
        }
    }

    @Override
    public String toString() {
        return "DefaultConfigurationRoot{providers=" + providers + "}";
    }
}
