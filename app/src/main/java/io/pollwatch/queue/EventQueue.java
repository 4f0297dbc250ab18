package io.pollwatch.queue;

import io.pollwatch.event.Event;
import java.util.Collection;
import java.util.concurrent.TimeUnit;
import org.jetbrains.annotations.Nullable;

/** The output queue of a notifier. Callers only get its {@link #readOnlyView()}. */
public final class EventQueue extends BoundedQueue<Event> {
    private final EventStream view = new ReadOnlyView(this);

    public EventQueue(int capacity) {
        super(capacity);
    }

    /** A stream over this queue that exposes no way to add events or close it. */
    public EventStream readOnlyView() {
        return view;
    }

    private static final class ReadOnlyView implements EventStream {
        private final EventQueue queue;

        ReadOnlyView(EventQueue queue) {
            this.queue = queue;
        }

        @Override
        public @Nullable Event poll(long timeout, TimeUnit unit) throws InterruptedException {
            return queue.poll(timeout, unit);
        }

        @Override
        public @Nullable Event take() throws InterruptedException {
            return queue.take();
        }

        @Override
        public int drainTo(Collection<? super Event> target) {
            return queue.drainTo(target);
        }

        @Override
        public boolean isClosed() {
            return queue.isClosed();
        }

        @Override
        public String toString() {
            return "EventStream{closed=" + queue.isClosed() + '}';
        }
    }
}
