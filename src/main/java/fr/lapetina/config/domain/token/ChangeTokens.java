package fr.lapetina.config.domain.token;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Helpers for consuming change tokens.
 */
public final class ChangeTokens {

    private static final Logger log = LoggerFactory.getLogger(ChangeTokens.class);

    private ChangeTokens() {
    }

    /**
     * Runs {@code consumer} every time the token produced by {@code producer} fires,
     * fetching a fresh token after each notification. Notifications stop, with a warning,
     * if the producer hands out a token that already fired.
     *
     * @return a registration that stops further notifications when closed
     */
    public static ChangeTokenRegistration onChange(Supplier<? extends ChangeToken> producer, Runnable consumer) {
        Objects.requireNonNull(producer, "producer");
        Objects.requireNonNull(consumer, "consumer");
        return new ChangeSubscription(producer, consumer).start();
    }

    private static final class ChangeSubscription {
        private final Supplier<? extends ChangeToken> producer;
        private final Runnable consumer;
        private final AtomicReference<ChangeTokenRegistration> current = new AtomicReference<>();
        private final AtomicBoolean closed = new AtomicBoolean();

        private ChangeSubscription(Supplier<? extends ChangeToken> producer, Runnable consumer) {
            this.producer = producer;
            this.consumer = consumer;
        }

        private ChangeTokenRegistration start() {
            subscribe();
            return () -> {
                if (closed.compareAndSet(false, true)) {
                    ChangeTokenRegistration registration = current.getAndSet(null);
                    if (registration != null) {
                        registration.close();
                    }
                }
            };
        }

        private void subscribe() {
            if (closed.get()) {
                return;
            }
            ChangeToken token = producer.get();
            if (token.hasChanged()) {
                log.warn("Change token was already fired on subscription, change notifications stopped");
                return;
            }
            ChangeTokenRegistration registration = token.registerChangeCallback(this::onChanged);
            ChangeTokenRegistration previous = current.getAndSet(registration);
            if (previous != null) {
                previous.close();
            }
        }

        private void onChanged() {
            if (closed.get()) {
                return;
            }
            try {
                consumer.run();
            } finally {
                subscribe();
            }
        }
    }
}
