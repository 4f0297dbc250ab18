package io.pollwatch.cli;

import io.pollwatch.ScanNotifier;
import io.pollwatch.ScanNotifierException;
import io.pollwatch.ScanNotifiers;
import io.pollwatch.event.Event;
import io.pollwatch.event.EventCodec;
import io.pollwatch.event.EventKind;
import io.pollwatch.options.ScanOptions;
import io.pollwatch.options.ScanOptionsLoader;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "pollwatch",
        mixinStandardHelpOptions = true,
        description = "Polls a directory tree and prints every change as it is detected.")
public final class PollWatchCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(PollWatchCli.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", description = "Directory to watch.")
    private Path root;

    @CommandLine.Option(
            names = "--config",
            description = "Properties file with pollwatch.* settings, applied before the options below.")
    @Nullable
    private Path configFile;

    @CommandLine.Option(
            names = "--interval",
            converter = DurationConverter.class,
            description = "Pause between passes, ISO-8601 (PT0.5S) or milliseconds.")
    @Nullable
    private Duration interval;

    @CommandLine.Option(names = "--workers", description = "Worker threads per pass.")
    @Nullable
    private Integer workers;

    @CommandLine.Option(names = "--queue-size", description = "Capacity of the intake and event queues.")
    @Nullable
    private Integer queueSize;

    @CommandLine.Option(names = "--include", description = "Only report paths in which this regex is found.")
    @Nullable
    private Pattern include;

    @CommandLine.Option(names = "--exclude", description = "Never report paths in which this regex is found.")
    @Nullable
    private Pattern exclude;

    @CommandLine.Option(
            names = "--ignore",
            split = ",",
            description = "Event kinds not to report. Can be repeated. Valid values: ${COMPLETION-CANDIDATES}.")
    private List<EventKind> ignoredKinds = new ArrayList<>();

    @CommandLine.Option(names = "--no-change", description = "Also report items that did not change.")
    private boolean reportNoChange;

    @CommandLine.Option(names = "--ignore-files", description = "Do not report regular files.")
    private boolean ignoreFiles;

    @CommandLine.Option(names = "--ignore-folders", description = "Do not report directories.")
    private boolean ignoreFolders;

    @CommandLine.Option(names = "--ignore-symlinks", description = "Do not report symbolic links.")
    private boolean ignoreSymlinks;

    @CommandLine.Option(names = "--ignore-folder-content", description = "Do not descend into subdirectories.")
    private boolean ignoreFolderContent;

    @CommandLine.Option(names = "--list-on-start", description = "Report every existing item as CREATE first.")
    private boolean listOnStart;

    @CommandLine.Option(names = "--json", description = "Print events as JSON lines.")
    private boolean json;

    @CommandLine.Option(
            names = "--duration",
            converter = DurationConverter.class,
            description = "Stop after this long instead of waiting for Ctrl-C.")
    @Nullable
    private Duration duration;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PollWatchCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    @Blocking
    public Integer call() throws Exception {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        ScanNotifier notifier;
        try {
            notifier = ScanNotifiers.create(root, buildOptions());
        } catch (ScanNotifierException e) {
            err.println(e.getMessage());
            return 2;
        }
        if (listOnStart) {
            notifier.flush();
        }

        var cancellation = new CompletableFuture<Void>();
        if (duration != null) {
            cancellation.orTimeout(duration.toMillis(), TimeUnit.MILLISECONDS);
        }
        var shutdownHook = new Thread(() -> cancellation.complete(null), "pollwatch-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        var printer = new Thread(() -> printEvents(notifier, out), "pollwatch-printer");
        printer.setDaemon(true);
        printer.start();

        try {
            notifier.start(cancellation);
        } catch (ScanNotifierException e) {
            err.println(e.getMessage());
            return 1;
        } finally {
            printer.join(TimeUnit.SECONDS.toMillis(5));
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                logger.debug("JVM is shutting down, hook stays registered");
            }
            out.flush();
        }
        return 0;
    }

    ScanOptions buildOptions() {
        var options = ScanOptionsLoader.load(configFile);
        if (interval != null) {
            options.setScanInterval(interval);
        }
        if (workers != null) {
            options.setMaxWorkers(workers);
        }
        if (queueSize != null) {
            options.setQueueSize(queueSize);
        }
        if (include != null) {
            options.setIncludePaths(include);
        }
        if (exclude != null) {
            options.setExcludePaths(exclude);
        }
        if (reportNoChange) {
            options.setIgnoreNoChangeEvent(false);
        }
        for (var kind : ignoredKinds) {
            options.setSuppressed(kind, true);
        }
        if (ignoreFiles) {
            options.setIgnoreFileEvent(true);
        }
        if (ignoreFolders) {
            options.setIgnoreFolderEvent(true);
        }
        if (ignoreSymlinks) {
            options.setIgnoreSymlinkEvent(true);
        }
        if (ignoreFolderContent) {
            options.setIgnoreFolderContentEvent(true);
        }
        return options;
    }

    private void printEvents(ScanNotifier notifier, PrintWriter out) {
        try {
            Event event;
            while ((event = notifier.queue().take()) != null) {
                out.println(json ? EventCodec.toJson(event) : event.toString());
                out.flush();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static final class DurationConverter implements CommandLine.ITypeConverter<Duration> {
        @Override
        public Duration convert(String value) {
            var parsed = ScanOptionsLoader.parseDuration(value.trim());
            if (parsed == null) {
                throw new CommandLine.TypeConversionException("Invalid duration: " + value);
            }
            return parsed;
        }
    }
}
