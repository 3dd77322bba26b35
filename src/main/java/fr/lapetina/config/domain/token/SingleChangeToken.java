package fr.lapetina.config.domain.token;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Change token fired explicitly by its owner, exactly once.
 *
 * Callbacks run on the thread calling {@link #notifyChanged()}. A callback that throws
 * is logged and does not prevent the others from running.
 */
public final class SingleChangeToken implements ChangeToken {

    private static final Logger log = LoggerFactory.getLogger(SingleChangeToken.class);

    private final AtomicBoolean changed = new AtomicBoolean();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    @Override
    public boolean hasChanged() {
        return changed.get();
    }

    @Override
    public ChangeTokenRegistration registerChangeCallback(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        if (changed.get()) {
            invoke(callback);
            return ChangeTokenRegistration.NONE;
        }

        callbacks.add(callback);

        // fired while registering: the callback may have been missed by notifyChanged
        if (changed.get() && callbacks.remove(callback)) {
            invoke(callback);
            return ChangeTokenRegistration.NONE;
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Fires the token. Only the first call has an effect.
     *
     * @return {@code true} if this call fired the token
     */
    public boolean notifyChanged() {
        if (!changed.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                invoke(callback);
            }
        }
        return true;
    }

    private static void invoke(Runnable callback) {
        try {
            callback.run();
        } catch (Exception e) {
            log.error("Error notifying change callback", e);
        }
    }
}
