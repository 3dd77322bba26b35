package fr.lapetina.config.domain.token;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Token that fires when any of its member tokens fires.
 *
 * A callback registered on the composite runs once, however many members fire.
 */
public final class CompositeChangeToken implements ChangeToken {

    private final List<ChangeToken> tokens;

    public CompositeChangeToken(List<? extends ChangeToken> tokens) {
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
    }

    public List<ChangeToken> getTokens() {
        return tokens;
    }

    @Override
    public boolean hasChanged() {
        return tokens.stream().anyMatch(ChangeToken::hasChanged);
    }

    @Override
    public ChangeTokenRegistration registerChangeCallback(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        AtomicBoolean fired = new AtomicBoolean();
        Runnable once = () -> {
            if (fired.compareAndSet(false, true)) {
                callback.run();
            }
        };

        List<ChangeTokenRegistration> registrations = new ArrayList<>(tokens.size());
        for (ChangeToken token : tokens) {
            registrations.add(token.registerChangeCallback(once));
        }
        return () -> registrations.forEach(ChangeTokenRegistration::close);
    }
}
