package fr.lapetina.config.infrastructure.metrics;

import fr.lapetina.config.domain.model.ProviderFailure;
import fr.lapetina.config.tree.ReloadObserver;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reload metrics recorded with Micrometer.
 *
 * Provides:
 * - Reload counters by outcome
 * - Failure counters per provider
 * - Reload duration timer
 * - Provider count gauge
 */
public final class ConfigurationMetrics implements ReloadObserver {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationMetrics.class);

    public static final String DEFAULT_PREFIX = "config";

    private final MeterRegistry registry;
    private final String prefix;

    private final Counter successfulReloads;
    private final Counter failedReloads;
    private final Timer reloadTimer;
    private final AtomicInteger providerCount = new AtomicInteger(0);

    // Cache for per-provider meters
    private final ConcurrentHashMap<String, Counter> failureCounters = new ConcurrentHashMap<>();

    public ConfigurationMetrics(MeterRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    public ConfigurationMetrics(MeterRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.prefix = Objects.requireNonNull(prefix, "prefix");

        this.successfulReloads = Counter.builder(prefix + "_reloads_total")
                .description("Configuration reloads")
                .tag("outcome", "success")
                .register(registry);

        this.failedReloads = Counter.builder(prefix + "_reloads_total")
                .description("Configuration reloads")
                .tag("outcome", "failure")
                .register(registry);

        this.reloadTimer = Timer.builder(prefix + "_reload_duration")
                .description("Time spent reloading every provider")
                .register(registry);

        Gauge.builder(prefix + "_providers", providerCount, AtomicInteger::get)
                .description("Number of configuration providers")
                .register(registry);

        log.info("ConfigurationMetrics initialized with prefix: {}", prefix);
    }

    @Override
    public void onReloadCompleted(Duration duration, int providers, List<ProviderFailure> failures) {
        reloadTimer.record(duration);
        providerCount.set(providers);

        if (failures.isEmpty()) {
            successfulReloads.increment();
            return;
        }

        failedReloads.increment();
        for (ProviderFailure failure : failures) {
            failureCounters.computeIfAbsent(failure.providerName(), name ->
                    Counter.builder(prefix + "_reload_failures_total")
                            .description("Provider load failures")
                            .tag("provider", name)
                            .register(registry)
            ).increment();
        }
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
