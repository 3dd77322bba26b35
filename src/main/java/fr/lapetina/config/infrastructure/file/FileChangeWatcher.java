package fr.lapetina.config.infrastructure.file;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Watches a single file and runs a callback when it changes.
 *
 * The parent directory is registered with a {@link WatchService} polled by a daemon
 * thread. Events for the file are debounced on its last modified time, and the callback
 * runs once the reload delay has elapsed, so a burst of writes triggers one callback.
 */
public final class FileChangeWatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FileChangeWatcher.class);

    static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

    private final Path file;
    private final Duration reloadDelay;
    private final Duration pollInterval;
    private final Runnable onChange;
    private final AtomicBoolean changeScheduled = new AtomicBoolean();

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public FileChangeWatcher(Path file, Duration reloadDelay, Runnable onChange) {
        this(file, reloadDelay, DEFAULT_POLL_INTERVAL, onChange);
    }

    public FileChangeWatcher(Path file, Duration reloadDelay, Duration pollInterval, Runnable onChange) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath();
        this.reloadDelay = Objects.requireNonNull(reloadDelay, "reloadDelay");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.onChange = Objects.requireNonNull(onChange, "onChange");
    }

    /**
     * Starts watching. The file itself may not exist yet, but its directory must.
     *
     * @return {@code false} if watching could not be enabled
     */
    public synchronized boolean start() {
        if (watchExecutor != null) {
            return true;
        }
        Path directory = file.getParent();
        if (directory == null || !Files.isDirectory(directory)) {
            log.warn("Directory of configuration file does not exist, hot reload disabled: {}", file);
            return false;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            directory.register(watchService,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY,
                    StandardWatchEventKinds.ENTRY_DELETE);
        } catch (IOException e) {
            log.error("Failed to start configuration file watcher for: {}", file, e);
            closeWatchService();
            return false;
        }

        lastModified = readLastModified();
        watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "config-watcher-" + file.getFileName());
            t.setDaemon(true);
            return t;
        });
        long period = pollInterval.toMillis();
        watchExecutor.scheduleWithFixedDelay(this::checkForChanges, period, period, TimeUnit.MILLISECONDS);

        log.info("Configuration hot-reload enabled for: {}", file);
        return true;
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }

            boolean touched = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                Object context = event.context();
                if (context instanceof Path && context.equals(file.getFileName())) {
                    touched = true;
                }
            }
            key.reset();

            // Debounce - check if file actually changed
            if (touched && hasChanged() && changeScheduled.compareAndSet(false, true)) {
                watchExecutor.schedule(this::notifyChange, reloadDelay.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (Exception e) {
            log.error("Error checking for configuration file changes: {}", file, e);
        }
    }

    private boolean hasChanged() {
        long current = readLastModified();
        if (current != lastModified) {
            lastModified = current;
            return true;
        }
        return false;
    }

    private long readLastModified() {
        try {
            return Files.exists(file) ? Files.getLastModifiedTime(file).toMillis() : -1L;
        } catch (IOException e) {
            log.debug("Cannot read last modified time of {}", file, e);
            return -1L;
        }
    }

    private void notifyChange() {
        changeScheduled.set(false);
        // pick up writes made during the delay
        lastModified = readLastModified();
        log.info("Configuration file changed: {}", file);
        try {
            onChange.run();
        } catch (Exception e) {
            log.error("Error handling configuration file change: {}", file, e);
        }
    }

    public boolean isRunning() {
        return watchExecutor != null && !watchExecutor.isShutdown();
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        closeWatchService();
    }

    private void closeWatchService() {
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }
}
