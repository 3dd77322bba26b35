package fr.lapetina.config.domain.token;

/**
 * Token for data that never changes.
 */
public final class NeverChangeToken implements ChangeToken {

    public static final NeverChangeToken INSTANCE = new NeverChangeToken();

    private NeverChangeToken() {
    }

    @Override
    public boolean hasChanged() {
        return false;
    }

    @Override
    public ChangeTokenRegistration registerChangeCallback(Runnable callback) {
        return ChangeTokenRegistration.NONE;
    }
}
