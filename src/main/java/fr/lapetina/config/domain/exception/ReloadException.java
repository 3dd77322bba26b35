package fr.lapetina.config.domain.exception;

import fr.lapetina.config.domain.model.ProviderFailure;

import java.util.List;

/**
 * Exception thrown when one or more providers failed during a reload.
 *
 * Providers that did load keep their fresh data; the failures are reported together
 * once every provider has been visited.
 */
public final class ReloadException extends RuntimeException {

    private final List<ProviderFailure> failures;

    public ReloadException(List<ProviderFailure> failures) {
        super(formatMessage(failures));
        if (failures.isEmpty()) {
            throw new IllegalArgumentException("At least one failure is required");
        }
        this.failures = List.copyOf(failures);
        failures.forEach(failure -> addSuppressed(failure.cause()));
    }

    public List<ProviderFailure> getFailures() {
        return failures;
    }

    /**
     * Returns the names of the providers that failed, in provider order.
     */
    public List<String> getProviderNames() {
        return failures.stream().map(ProviderFailure::providerName).toList();
    }

    private static String formatMessage(List<ProviderFailure> failures) {
        if (failures.size() == 1) {
            return failures.get(0).describe();
        }
        StringBuilder message = new StringBuilder("One or more load errors occurred:");
        for (int i = 0; i < failures.size(); i++) {
            message.append("\n  [").append(i + 1).append("]: ").append(failures.get(i).describe());
        }
        return message.toString();
    }
}
