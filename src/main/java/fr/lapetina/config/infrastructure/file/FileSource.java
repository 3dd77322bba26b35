package fr.lapetina.config.infrastructure.file;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Description of a configuration file.
 *
 * @param path the file location
 * @param optional whether a missing file yields empty data instead of a load failure
 * @param reloadOnChange whether the file is watched for changes
 * @param reloadDelay time waited after a change before the file is read again
 */
public record FileSource(Path path, boolean optional, boolean reloadOnChange, Duration reloadDelay) {

    public static final Duration DEFAULT_RELOAD_DELAY = Duration.ofMillis(250);

    public FileSource {
        Objects.requireNonNull(path, "path is required");
        Objects.requireNonNull(reloadDelay, "reloadDelay is required");
        if (reloadDelay.isNegative()) {
            throw new IllegalArgumentException("reloadDelay must not be negative");
        }
    }

    /**
     * A required file, not watched.
     */
    public static FileSource of(Path path) {
        return builder(path).build();
    }

    public static Builder builder(Path path) {
        return new Builder(path);
    }

    public static final class Builder {
        private final Path path;
        private boolean optional;
        private boolean reloadOnChange;
        private Duration reloadDelay = DEFAULT_RELOAD_DELAY;

        private Builder(Path path) {
            this.path = Objects.requireNonNull(path, "path");
        }

        public Builder optional() {
            this.optional = true;
            return this;
        }

        public Builder optional(boolean optional) {
            this.optional = optional;
            return this;
        }

        public Builder reloadOnChange() {
            this.reloadOnChange = true;
            return this;
        }

        public Builder reloadOnChange(boolean reloadOnChange) {
            this.reloadOnChange = reloadOnChange;
            return this;
        }

        public Builder reloadDelay(Duration reloadDelay) {
            this.reloadDelay = reloadDelay;
            return this;
        }

        public FileSource build() {
            return new FileSource(path, optional, reloadOnChange, reloadDelay);
        }
    }
}
