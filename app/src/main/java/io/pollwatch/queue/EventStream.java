package io.pollwatch.queue;

import io.pollwatch.event.Event;
import java.util.Collection;
import java.util.concurrent.TimeUnit;
import org.jetbrains.annotations.Nullable;

/**
 * Read-only view of a notifier's output queue. The notifier closes it on teardown; events already queued
 * stay readable after that.
 */
public interface EventStream {

    /**
     * Waits up to the given time for the next event.
     *
     * @return the next event, or null on timeout or once the stream is closed and empty
     */
    @Nullable
    Event poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Waits for the next event.
     *
     * @return the next event, or null once the stream is closed and empty
     */
    @Nullable
    Event take() throws InterruptedException;

    /** Moves every queued event into {@code target} without waiting. */
    int drainTo(Collection<? super Event> target);

    boolean isClosed();
}
