package fr.lapetina.config.binder;

/**
 * Converts a configuration string into a scalar value.
 *
 * Implementations signal invalid input by throwing a runtime exception; the binder
 * reports it with the key being bound.
 */
@FunctionalInterface
public interface ValueParser<T> {

    T parse(String value);
}
