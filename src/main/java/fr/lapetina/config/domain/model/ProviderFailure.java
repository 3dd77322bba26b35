package fr.lapetina.config.domain.model;

import fr.lapetina.config.domain.exception.ProviderLoadException;

import java.util.Objects;

/**
 * A provider that failed to load, with the reason.
 */
public record ProviderFailure(String providerName, ProviderLoadException cause) {

    public ProviderFailure {
        Objects.requireNonNull(providerName, "providerName is required");
        Objects.requireNonNull(cause, "cause is required");
    }

    /**
     * Formats the failure as {@code "<message> (<provider>)"}.
     */
    public String describe() {
        return cause.getMessage() + " (" + providerName + ")";
    }
}
