package fr.lapetina.config.domain.model;

/**
 * How keys are reported when a configuration is enumerated.
 */
public enum PathMode {
    /** Full keys, including the path of the enumerated section. */
    ABSOLUTE,
    /** Keys relative to the enumerated section. */
    RELATIVE
}
