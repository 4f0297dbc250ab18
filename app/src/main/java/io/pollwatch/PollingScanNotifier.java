package io.pollwatch;

import io.pollwatch.cache.PathSnapshot;
import io.pollwatch.cache.PathStateCache;
import io.pollwatch.event.Event;
import io.pollwatch.event.EventKind;
import io.pollwatch.options.ScanOptions;
import io.pollwatch.queue.BoundedQueue;
import io.pollwatch.queue.EventQueue;
import io.pollwatch.queue.EventStream;
import io.pollwatch.scan.ChangeClassifier;
import io.pollwatch.scan.EntryFilter;
import io.pollwatch.scan.FileMetadata;
import io.pollwatch.scan.RawEntry;
import io.pollwatch.scan.TreeWalker;
import io.pollwatch.scan.WorkerPool;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Polling implementation of {@link ScanNotifier}.
 *
 * <p>Each pass walks the tree on the thread that called {@link #start}, feeding accepted entries into a
 * bounded intake queue drained by a pool of workers. The workers classify entries against the
 * {@link PathStateCache} and publish events to the output queue. Once the walk is done and every worker has
 * retired, a sweep over the cache reports paths that were not seen during the pass as deleted and resets the
 * visited marks of the others. Then the loop sleeps for the scan interval.
 *
 * <p>Lifecycle: created ready; {@link #start} moves to running; {@link #pause}/{@link #resume} toggle paused
 * while running; {@link #stop} (or completion of the cancellation future) moves to stopping, after which the
 * loop tears everything down and the instance cannot be started again.
 */
public final class PollingScanNotifier implements ScanNotifier {
    private static final Logger logger = LogManager.getLogger(PollingScanNotifier.class);
    private static final AtomicLong SEQ = new AtomicLong();
    private static final long WORKER_SHUTDOWN_SECONDS = 5;

    private final Path root;
    private final ScanOptions options;
    private final PathStateCache cache;
    private final EntryFilter filter;
    private final TreeWalker walker;
    private final BoundedQueue<RawEntry> intake;
    private final EventQueue events;
    private final ExecutorService workerExecutor;
    private final WorkerPool workerPool;

    private final AtomicBoolean ready = new AtomicBoolean();
    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicBoolean stopping = new AtomicBoolean();
    private final AtomicBoolean paused = new AtomicBoolean();
    private final AtomicBoolean tornDown = new AtomicBoolean();

    // wakes the loop out of its interval sleep
    private final ReentrantLock sleepLock = new ReentrantLock();
    private final Condition wakeUp = sleepLock.newCondition();

    private volatile CompletableFuture<?> cancellation = new CompletableFuture<>();

    private PollingScanNotifier(
            Path root, ScanOptions options, PathStateCache cache, FileMetadata.Reader metadataReader) {
        this.root = root;
        this.options = options;
        this.cache = cache;
        this.filter = new EntryFilter(root, options);
        this.walker = new TreeWalker(root, filter);
        this.intake = new BoundedQueue<>(options.getQueueSize());
        this.events = new EventQueue(options.getQueueSize());
        var id = SEQ.incrementAndGet();
        var threadSeq = new AtomicInteger();
        this.workerExecutor = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "pollwatch-" + id + "-worker-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        var classifier = new ChangeClassifier(cache, options, metadataReader, this::emit);
        this.workerPool = new WorkerPool(workerExecutor, intake, filter, classifier);
    }

    /** Seeds the cache from one walk of {@code root} and returns a ready notifier. */
    static PollingScanNotifier initialize(Path root, ScanOptions options) throws ScanNotifierException {
        return initialize(root, options, FileMetadata.DEFAULT_READER);
    }

    static PollingScanNotifier initialize(Path root, ScanOptions options, FileMetadata.Reader metadataReader)
            throws ScanNotifierException {
        var cache = new PathStateCache();
        var seedWalker = new TreeWalker(root, new EntryFilter(root, options));
        int seeded;
        try {
            seeded = seedWalker.walk(entry -> seed(cache, metadataReader, entry));
        } catch (IOException e) {
            throw new ScanNotifierException(ErrorCode.INITIALIZATION, e);
        }
        var notifier = new PollingScanNotifier(root, options, cache, metadataReader);
        notifier.ready.set(true);
        logger.debug("Initialized scan notifier for {} with {} entries ({})", root, seeded, options);
        return notifier;
    }

    private static void seed(PathStateCache cache, FileMetadata.Reader metadataReader, RawEntry entry)
            throws IOException {
        var error = entry.error();
        if (error != null) {
            throw error;
        }
        try {
            var metadata = metadataReader.read(entry.path());
            cache.store(
                    entry.path(),
                    new PathSnapshot(metadata.lastModifiedTime(), metadata.type(), metadata.permissions(), false));
        } catch (IOException e) {
            // vanished between listing and stat; the first pass reports it if it comes back
            logger.debug("Skipping {} while seeding: {}", entry.path(), e.toString());
        }
    }

    @Override
    public EventStream queue() {
        return events.readOnlyView();
    }

    @Override
    public void start(CompletableFuture<?> cancellation) throws ScanNotifierException {
        if (running.get()) {
            throw new ScanNotifierException(ErrorCode.ALREADY_STARTED);
        }
        if (stopping.get()) {
            throw new ScanNotifierException(ErrorCode.STOPPING);
        }
        if (!ready.get()) {
            throw new ScanNotifierException(ErrorCode.NOT_READY);
        }
        if (!running.compareAndSet(false, true)) {
            throw new ScanNotifierException(ErrorCode.ALREADY_STARTED);
        }
        this.cancellation = cancellation;
        cancellation.whenComplete((result, error) -> wakeLoop());

        logger.info("Starting scan notifier for {}", root);
        ScanNotifierException failure = null;
        try {
            scanLoop();
        } catch (ScanNotifierException e) {
            failure = e;
        } catch (RuntimeException e) {
            failure = new ScanNotifierException(ErrorCode.INTERNAL_ERROR, e);
        } finally {
            teardown();
        }
        if (failure != null) {
            logger.error("Scan notifier for {} failed", root, failure);
            throw failure;
        }
    }

    @Override
    public void stop() throws ScanNotifierException {
        if (stopping.get()) {
            throw new ScanNotifierException(ErrorCode.STOPPING);
        }
        if (!running.get()) {
            throw new ScanNotifierException(ErrorCode.NOT_RUNNING);
        }
        if (!stopping.compareAndSet(false, true)) {
            throw new ScanNotifierException(ErrorCode.STOPPING);
        }
        logger.info("Stopping scan notifier for {}", root);
        wakeLoop();
    }

    @Override
    public void pause() throws ScanNotifierException {
        if (stopping.get()) {
            throw new ScanNotifierException(ErrorCode.STOPPING);
        }
        if (!running.get()) {
            throw new ScanNotifierException(ErrorCode.NOT_RUNNING);
        }
        paused.set(true);
        logger.debug("Paused scan notifier for {}", root);
    }

    @Override
    public void resume() throws ScanNotifierException {
        if (stopping.get()) {
            throw new ScanNotifierException(ErrorCode.STOPPING);
        }
        if (paused.compareAndSet(true, false)) {
            logger.debug("Resumed scan notifier for {}", root);
            wakeLoop();
        }
    }

    @Override
    public void flush() {
        cache.clear();
        logger.debug("Flushed path cache of {}", root);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isPaused() {
        return paused.get();
    }

    PathStateCache cache() {
        return cache;
    }

    private void scanLoop() throws ScanNotifierException {
        while (!shouldExit()) {
            if (paused.get()) {
                sleepInterval(() -> !paused.get());
                continue;
            }
            runPass();
            sleepInterval(() -> false);
        }
    }

    private void runPass() throws ScanNotifierException {
        long startNanos = System.nanoTime();
        var pass = workerPool.begin(options.getMaxWorkers());
        int walked = 0;
        try {
            walked = walker.walk(entry -> {
                try {
                    if (!intake.put(entry, pass::isIdle)) {
                        throw new IOException("No worker left to process " + entry.path());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("Interrupted while queueing " + entry.path());
                }
            });
        } catch (IOException e) {
            logger.warn("Scan of {} ended early: {}", root, e.toString());
        } finally {
            pass.finishTraversal();
        }

        try {
            pass.awaitRetirement();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (ExecutionException e) {
            throw new ScanNotifierException(ErrorCode.INTERNAL_ERROR, e.getCause());
        }

        int deleted = sweep();
        logger.debug(
                "Pass over {} took {} ms: {} entries walked, {} processed by {} workers, {} deleted",
                root,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos),
                walked,
                pass.processedCount(),
                pass.workerCount(),
                deleted);
    }

    /**
     * Evicts snapshots not visited in this pass, emitting DELETE unless suppressed, and clears the visited mark
     * of the rest. Stops early on shutdown.
     *
     * @return the number of evicted paths
     */
    int sweep() {
        var evicted = new AtomicInteger();
        boolean deleteSuppressed = options.isSuppressed(EventKind.DELETE);
        cache.forEach((path, snapshot) -> {
            if (shouldExit()) {
                return false;
            }
            if (snapshot.visited()) {
                cache.replace(path, snapshot, snapshot.withVisited(false));
                return true;
            }
            cache.delete(path);
            evicted.incrementAndGet();
            if (!deleteSuppressed) {
                emit(Event.of(path, snapshot.type(), EventKind.DELETE));
            }
            return true;
        });
        return evicted.get();
    }

    /**
     * Publishes an event, waiting while the output queue is full. Gives up once shutdown has been requested so
     * that a consumer that stopped reading cannot block the loop.
     */
    private boolean emit(Event event) {
        if (!running.get()) {
            return false;
        }
        try {
            return events.put(event, this::shouldExit);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean shouldExit() {
        return stopping.get() || cancellation.isDone() || Thread.currentThread().isInterrupted();
    }

    private void sleepInterval(BooleanSupplier wakeEarly) {
        long nanos = options.getScanInterval().toNanos();
        sleepLock.lock();
        try {
            while (nanos > 0 && !shouldExit() && !wakeEarly.getAsBoolean()) {
                nanos = wakeUp.awaitNanos(nanos);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            sleepLock.unlock();
        }
    }

    private void wakeLoop() {
        sleepLock.lock();
        try {
            wakeUp.signalAll();
        } finally {
            sleepLock.unlock();
        }
        events.wakeAll();
    }

    private void teardown() {
        if (!tornDown.compareAndSet(false, true)) {
            return;
        }
        intake.close();
        events.close();
        workerExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(WORKER_SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Workers of {} did not finish within {} seconds", root, WORKER_SHUTDOWN_SECONDS);
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        cache.clear();
        ready.set(false);
        paused.set(false);
        running.set(false);
        stopping.set(false);
        logger.info("Scan notifier for {} stopped", root);
    }

    @Override
    public String toString() {
        return "PollingScanNotifier{root=" + root + ", running=" + running.get() + ", paused=" + paused.get()
                + ", stopping=" + stopping.get() + '}';
    }
}
