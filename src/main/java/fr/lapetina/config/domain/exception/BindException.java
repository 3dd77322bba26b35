package fr.lapetina.config.domain.exception;

/**
 * Exception thrown when configuration values cannot be bound to a target type.
 *
 * A failed bind never leaves the target half updated: staged assignments are
 * discarded when this exception is raised.
 */
public final class BindException extends RuntimeException {

    private final BindFailure failure;
    private final String path;

    public BindException(BindFailure failure, String path, String details) {
        this(failure, path, details, null);
    }

    public BindException(BindFailure failure, String path, String details, Throwable cause) {
        super(failure.getMessage() + " at '" + path + "': " + details, cause);
        this.failure = failure;
        this.path = path;
    }

    public BindFailure getFailure() {
        return failure;
    }

    /**
     * Returns the configuration path being bound when the failure occurred.
     */
    public String getPath() {
        return path;
    }

    public enum BindFailure {
        PARSE_FAILURE("Value cannot be converted"),
        MISSING_REQUIRED_VALUE("Required value is missing"),
        AMBIGUOUS_KEY("Several keys map to the same entry"),
        UNSUPPORTED_TYPE("Type cannot be bound"),
        INSTANTIATION_FAILURE("Instance cannot be created");

        private final String message;

        BindFailure(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
