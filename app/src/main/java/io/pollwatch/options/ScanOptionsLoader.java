package io.pollwatch.options;

import io.pollwatch.event.EventKind;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Properties;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Builds {@link ScanOptions} from properties.
 *
 * <p>Sources, later ones overriding earlier ones:
 * <ol>
 *   <li>{@code pollwatch.properties} on the classpath, if present
 *   <li>an explicit properties file, if given
 *   <li>JVM system properties
 * </ol>
 *
 * Recognized keys: {@code pollwatch.queueSize}, {@code pollwatch.maxWorkers}, {@code pollwatch.scanInterval}
 * (ISO-8601 such as {@code PT0.5S}, or plain milliseconds), {@code pollwatch.includePaths},
 * {@code pollwatch.excludePaths}, and {@code pollwatch.ignore.<name>} booleans where name is one of
 * {@code errors, nochange, delete, create, modify, perm, file, folder, symlink, foldercontent}.
 * Invalid values are logged and skipped.
 */
public final class ScanOptionsLoader {
    private static final Logger logger = LogManager.getLogger(ScanOptionsLoader.class);

    public static final String CLASSPATH_RESOURCE = "pollwatch.properties";
    static final String PREFIX = "pollwatch.";
    static final String QUEUE_SIZE = PREFIX + "queueSize";
    static final String MAX_WORKERS = PREFIX + "maxWorkers";
    static final String SCAN_INTERVAL = PREFIX + "scanInterval";
    static final String INCLUDE_PATHS = PREFIX + "includePaths";
    static final String EXCLUDE_PATHS = PREFIX + "excludePaths";
    static final String IGNORE_PREFIX = PREFIX + "ignore.";

    private ScanOptionsLoader() {}

    /** Loads the classpath defaults, then system properties. */
    public static ScanOptions load() {
        return load(null);
    }

    /** Loads the classpath defaults, then the given file (if not null), then system properties. */
    public static ScanOptions load(@Nullable Path file) {
        var merged = new Properties();
        merged.putAll(readClasspath());
        if (file != null) {
            merged.putAll(readFile(file));
        }
        for (var name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                merged.setProperty(name, System.getProperty(name));
            }
        }
        return apply(new ScanOptions(), merged);
    }

    /**
     * Applies every recognized key of {@code props} to {@code options}.
     *
     * @return the same options instance
     */
    public static ScanOptions apply(ScanOptions options, Properties props) {
        var queueSize = parseInt(props, QUEUE_SIZE);
        if (queueSize != null) {
            options.setQueueSize(queueSize);
        }
        var maxWorkers = parseInt(props, MAX_WORKERS);
        if (maxWorkers != null) {
            options.setMaxWorkers(maxWorkers);
        }
        var interval = props.getProperty(SCAN_INTERVAL);
        if (interval != null && !interval.isBlank()) {
            var parsed = parseDuration(interval.trim());
            if (parsed != null) {
                options.setScanInterval(parsed);
            } else {
                logger.warn("Ignoring invalid {}: {}", SCAN_INTERVAL, interval);
            }
        }
        var include = parsePattern(props, INCLUDE_PATHS);
        if (include != null) {
            options.setIncludePaths(include);
        }
        var exclude = parsePattern(props, EXCLUDE_PATHS);
        if (exclude != null) {
            options.setExcludePaths(exclude);
        }

        for (var kind : EventKind.values()) {
            var value = parseBoolean(props, IGNORE_PREFIX + kindKey(kind));
            if (value != null) {
                options.setSuppressed(kind, value);
            }
        }
        var ignoreFile = parseBoolean(props, IGNORE_PREFIX + "file");
        if (ignoreFile != null) {
            options.setIgnoreFileEvent(ignoreFile);
        }
        var ignoreFolder = parseBoolean(props, IGNORE_PREFIX + "folder");
        if (ignoreFolder != null) {
            options.setIgnoreFolderEvent(ignoreFolder);
        }
        var ignoreSymlink = parseBoolean(props, IGNORE_PREFIX + "symlink");
        if (ignoreSymlink != null) {
            options.setIgnoreSymlinkEvent(ignoreSymlink);
        }
        var ignoreFolderContent = parseBoolean(props, IGNORE_PREFIX + "foldercontent");
        if (ignoreFolderContent != null) {
            options.setIgnoreFolderContentEvent(ignoreFolderContent);
        }
        logger.debug("Loaded scan options: {}", options);
        return options;
    }

    /** Accepts ISO-8601 durations or a plain number of milliseconds. */
    public static @Nullable Duration parseDuration(String value) {
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                return Duration.ofMillis(Long.parseLong(value));
            }
            var parsed = Duration.parse(value.toUpperCase(Locale.ROOT));
            return parsed.isNegative() ? null : parsed;
        } catch (NumberFormatException | DateTimeParseException e) {
            return null;
        }
    }

    private static String kindKey(EventKind kind) {
        return kind == EventKind.ERROR ? "errors" : kind.name().toLowerCase(Locale.ROOT);
    }

    private static Properties readClasspath() {
        var props = new Properties();
        try (InputStream in = ScanOptionsLoader.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            logger.warn("Failed to read {} from classpath: {}", CLASSPATH_RESOURCE, e.getMessage());
        }
        return props;
    }

    private static Properties readFile(Path file) {
        var props = new Properties();
        try (var reader = Files.newBufferedReader(file)) {
            props.load(reader);
        } catch (IOException e) {
            logger.warn("Failed to read scan options from {}: {}", file, e.getMessage());
        }
        return props;
    }

    private static @Nullable Integer parseInt(Properties props, String key) {
        var value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid {}: {}", key, value);
            return null;
        }
    }

    private static @Nullable Boolean parseBoolean(Properties props, String key) {
        var value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        var trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true")) {
            return Boolean.TRUE;
        }
        if (trimmed.equalsIgnoreCase("false")) {
            return Boolean.FALSE;
        }
        logger.warn("Ignoring invalid {}: {}", key, value);
        return null;
    }

    private static @Nullable Pattern parsePattern(Properties props, String key) {
        var value = props.getProperty(key);
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Pattern.compile(value);
        } catch (PatternSyntaxException e) {
            logger.warn("Ignoring invalid {}: {}", key, e.getDescription());
            return null;
        }
    }
}
