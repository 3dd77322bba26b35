package fr.lapetina.config.domain.token;

/**
 * A notification that underlying data may have changed.
 *
 * A token fires at most once. Producers replace a fired token with a fresh one, so
 * consumers that want further notifications must fetch the current token again.
 */
public interface ChangeToken {

    /**
     * Returns whether the token has fired.
     */
    boolean hasChanged();

    /**
     * Registers a callback run when the token fires. A callback registered on a token
     * that already fired runs immediately on the calling thread.
     *
     * @return a registration that removes the callback when closed
     */
    ChangeTokenRegistration registerChangeCallback(Runnable callback);
}
