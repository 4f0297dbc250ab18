package io.pollwatch;

import io.pollwatch.queue.EventStream;
import java.util.concurrent.CompletableFuture;

/**
 * Periodically scans a directory tree and reports what changed since the previous pass.
 *
 * <p>Create instances with {@link ScanNotifiers#create}. {@link #start} blocks its caller for as long as the
 * notifier runs, so it is usually called from a dedicated thread; every other method returns promptly and
 * may be called from any thread.
 */
public interface ScanNotifier {

    /** The stream events are delivered on. It is closed when the notifier shuts down. */
    EventStream queue();

    /**
     * Runs the scan loop on the calling thread until {@link #stop()} is called or {@code cancellation}
     * completes in any way (including by {@link CompletableFuture#orTimeout}). Both are checked between
     * passes; a pass in progress always finishes.
     *
     * @throws ScanNotifierException with {@link ErrorCode#ALREADY_STARTED}, {@link ErrorCode#STOPPING} or
     *     {@link ErrorCode#NOT_READY} if the notifier cannot start, or {@link ErrorCode#INTERNAL_ERROR} if the
     *     loop failed unexpectedly (after shutting down)
     */
    void start(CompletableFuture<?> cancellation) throws ScanNotifierException;

    /** Asks the scan loop to exit. Returns without waiting for it. */
    void stop() throws ScanNotifierException;

    /** Stops walking the tree until {@link #resume()}; no changes are detected meanwhile. */
    void pause() throws ScanNotifierException;

    void resume() throws ScanNotifierException;

    /**
     * Forgets every known path. Each item still present is reported as CREATE on the next pass, and items
     * removed before that pass are never reported as DELETE. Calling this right after creation reports the
     * whole tree on the first pass.
     */
    void flush();

    boolean isRunning();

    boolean isPaused();
}
