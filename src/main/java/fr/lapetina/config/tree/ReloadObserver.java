package fr.lapetina.config.tree;

import fr.lapetina.config.domain.model.ProviderFailure;

import java.time.Duration;
import java.util.List;

/**
 * Callback invoked after every reload of a configuration root.
 */
@FunctionalInterface
public interface ReloadObserver {

    ReloadObserver NONE = (duration, providerCount, failures) -> { };

    void onReloadCompleted(Duration duration, int providerCount, List<ProviderFailure> failures);
}
