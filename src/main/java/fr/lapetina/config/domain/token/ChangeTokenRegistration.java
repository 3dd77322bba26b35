package fr.lapetina.config.domain.token;

/**
 * Handle returned when registering a change callback.
 */
@FunctionalInterface
public interface ChangeTokenRegistration extends AutoCloseable {

    ChangeTokenRegistration NONE = () -> { };

    /**
     * Unregisters the callback. Closing twice has no effect.
     */
    @Override
    void close();
}
