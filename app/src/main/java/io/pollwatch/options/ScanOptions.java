package io.pollwatch.options;

import io.pollwatch.event.EventKind;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * Settings shared between the caller and a running notifier.
 *
 * <p>Every field is its own atomic cell, so any setter may be called from any thread while a scan is in
 * progress, and two setters never block each other. Readers always see a whole value. Setters return this
 * instance for chaining:
 *
 * <pre>{@code
 * var options = new ScanOptions()
 *         .setMaxWorkers(4)
 *         .setScanInterval(Duration.ofMillis(500))
 *         .setExcludePaths(Pattern.compile("/\\.git/"));
 * }</pre>
 *
 * <p>The notifier reads fresh values on every decision. The only exceptions are the queue size, which is
 * used once when the queues are allocated, and the worker count, which is read once at the start of each
 * pass.
 */
public final class ScanOptions {
    public static final int DEFAULT_QUEUE_SIZE = 10;
    public static final int DEFAULT_MAX_WORKERS = 1;
    public static final Duration DEFAULT_SCAN_INTERVAL = Duration.ofSeconds(1);

    private final AtomicInteger queueSize = new AtomicInteger();
    private final AtomicInteger maxWorkers = new AtomicInteger();
    private final AtomicReference<@Nullable Duration> scanInterval = new AtomicReference<>();
    private final AtomicReference<@Nullable Pattern> includePaths = new AtomicReference<>();
    private final AtomicReference<@Nullable Pattern> excludePaths = new AtomicReference<>();

    private final AtomicBoolean ignoreErrors = new AtomicBoolean();
    private final AtomicBoolean ignoreNoChange = new AtomicBoolean(true);
    private final AtomicBoolean ignoreDelete = new AtomicBoolean();
    private final AtomicBoolean ignoreCreate = new AtomicBoolean();
    private final AtomicBoolean ignoreModify = new AtomicBoolean();
    private final AtomicBoolean ignorePerm = new AtomicBoolean();
    private final AtomicBoolean ignoreFile = new AtomicBoolean();
    private final AtomicBoolean ignoreFolder = new AtomicBoolean();
    private final AtomicBoolean ignoreSymlink = new AtomicBoolean();
    private final AtomicBoolean ignoreFolderContent = new AtomicBoolean();

    /** Options with every event enabled except NOCHANGE; sizes and interval fall back to defaults. */
    public ScanOptions() {}

    /** Shorthand for options that only carry path patterns. Empty patterns count as unset. */
    public static ScanOptions withPatterns(@Nullable Pattern exclude, @Nullable Pattern include) {
        return new ScanOptions().setExcludePaths(exclude).setIncludePaths(include);
    }

    /**
     * Fills the fields the caller left unset with defaults. Called once when a notifier is created.
     *
     * @return this instance
     */
    public ScanOptions applyDefaults() {
        queueSize.compareAndSet(0, DEFAULT_QUEUE_SIZE);
        if (queueSize.get() < 0) {
            queueSize.set(DEFAULT_QUEUE_SIZE);
        }
        maxWorkers.compareAndSet(0, DEFAULT_MAX_WORKERS);
        scanInterval.compareAndSet(null, DEFAULT_SCAN_INTERVAL);
        return this;
    }

    public ScanOptions setQueueSize(int value) {
        queueSize.set(value);
        return this;
    }

    /** Values below one are ignored. Takes effect at the start of the next pass. */
    public ScanOptions setMaxWorkers(int value) {
        if (value <= 0) {
            return this;
        }
        maxWorkers.set(value);
        return this;
    }

    public ScanOptions setScanInterval(Duration value) {
        if (value.isNegative()) {
            throw new IllegalArgumentException("scan interval must not be negative, got: " + value);
        }
        scanInterval.set(value);
        return this;
    }

    public ScanOptions setIncludePaths(@Nullable Pattern pattern) {
        includePaths.set(normalize(pattern));
        return this;
    }

    public ScanOptions setExcludePaths(@Nullable Pattern pattern) {
        excludePaths.set(normalize(pattern));
        return this;
    }

    public ScanOptions setIgnoreErrors(boolean value) {
        ignoreErrors.set(value);
        return this;
    }

    public ScanOptions setIgnoreNoChangeEvent(boolean value) {
        ignoreNoChange.set(value);
        return this;
    }

    public ScanOptions setIgnoreDeleteEvent(boolean value) {
        ignoreDelete.set(value);
        return this;
    }

    public ScanOptions setIgnoreCreateEvent(boolean value) {
        ignoreCreate.set(value);
        return this;
    }

    public ScanOptions setIgnoreModifyEvent(boolean value) {
        ignoreModify.set(value);
        return this;
    }

    public ScanOptions setIgnorePermEvent(boolean value) {
        ignorePerm.set(value);
        return this;
    }

    public ScanOptions setIgnoreFileEvent(boolean value) {
        ignoreFile.set(value);
        return this;
    }

    public ScanOptions setIgnoreFolderEvent(boolean value) {
        ignoreFolder.set(value);
        return this;
    }

    public ScanOptions setIgnoreSymlinkEvent(boolean value) {
        ignoreSymlink.set(value);
        return this;
    }

    /** Suppresses everything below a directory. The directory itself is governed by the folder flag. */
    public ScanOptions setIgnoreFolderContentEvent(boolean value) {
        ignoreFolderContent.set(value);
        return this;
    }

    public int getQueueSize() {
        var size = queueSize.get();
        return size > 0 ? size : DEFAULT_QUEUE_SIZE;
    }

    public int getMaxWorkers() {
        var workers = maxWorkers.get();
        return workers > 0 ? workers : DEFAULT_MAX_WORKERS;
    }

    public Duration getScanInterval() {
        var interval = scanInterval.get();
        return interval != null ? interval : DEFAULT_SCAN_INTERVAL;
    }

    public @Nullable Pattern getIncludePaths() {
        return includePaths.get();
    }

    public @Nullable Pattern getExcludePaths() {
        return excludePaths.get();
    }

    public boolean isIgnoreErrors() {
        return ignoreErrors.get();
    }

    public boolean isIgnoreFile() {
        return ignoreFile.get();
    }

    public boolean isIgnoreFolder() {
        return ignoreFolder.get();
    }

    public boolean isIgnoreSymlink() {
        return ignoreSymlink.get();
    }

    public boolean isIgnoreFolderContent() {
        return ignoreFolderContent.get();
    }

    /** Whether emission of the given kind is currently suppressed. */
    public boolean isSuppressed(EventKind kind) {
        return switch (kind) {
            case CREATE -> ignoreCreate.get();
            case MODIFY -> ignoreModify.get();
            case DELETE -> ignoreDelete.get();
            case PERM -> ignorePerm.get();
            case ERROR -> ignoreErrors.get();
            case NOCHANGE -> ignoreNoChange.get();
        };
    }

    /** Sets the suppression flag of the given kind. */
    public ScanOptions setSuppressed(EventKind kind, boolean value) {
        return switch (kind) {
            case CREATE -> setIgnoreCreateEvent(value);
            case MODIFY -> setIgnoreModifyEvent(value);
            case DELETE -> setIgnoreDeleteEvent(value);
            case PERM -> setIgnorePermEvent(value);
            case ERROR -> setIgnoreErrors(value);
            case NOCHANGE -> setIgnoreNoChangeEvent(value);
        };
    }

    private static @Nullable Pattern normalize(@Nullable Pattern pattern) {
        if (pattern == null || pattern.pattern().isEmpty()) {
            return null;
        }
        return pattern;
    }

    @Override
    public String toString() {
        return "ScanOptions{queueSize=" + getQueueSize() + ", maxWorkers=" + getMaxWorkers() + ", scanInterval="
                + getScanInterval() + ", include=" + getIncludePaths() + ", exclude=" + getExcludePaths() + '}';
    }
}
