package io.pollwatch.queue;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import org.jetbrains.annotations.Nullable;

/**
 * Bounded multi-producer, multi-consumer queue that can be closed.
 *
 * <p>Producers block while the queue is full; a blocked producer gives up when the queue is closed or when
 * its abandon condition turns true. Consumers block while the queue is empty and get null once the queue is
 * closed and drained. {@link #wakeAll()} makes every waiter re-check its condition, which is how an external
 * flag (stop requested, traversal finished) reaches threads parked here.
 */
public class BoundedQueue<T> {
    /** Upper bound on a single wait, so external conditions are re-read even without a wake-up. */
    static final long RECHECK_MILLIS = 50;

    private final int capacity;
    private final ArrayDeque<T> items;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    // guarded by lock
    private boolean closed;

    public BoundedQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        this.items = new ArrayDeque<>(capacity);
    }

    /**
     * Adds {@code item}, waiting for space.
     *
     * @return false if the item was dropped because the queue is closed or {@code abandon} became true
     */
    public boolean put(T item, BooleanSupplier abandon) throws InterruptedException {
        lock.lock();
        try {
            while (!closed && items.size() >= capacity) {
                if (abandon.getAsBoolean()) {
                    return false;
                }
                notFull.await(RECHECK_MILLIS, TimeUnit.MILLISECONDS);
            }
            if (closed) {
                return false;
            }
            items.addLast(item);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public @Nullable T poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (items.isEmpty()) {
                if (closed || nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return removeFirst();
        } finally {
            lock.unlock();
        }
    }

    public @Nullable T take() throws InterruptedException {
        lock.lock();
        try {
            while (items.isEmpty()) {
                if (closed) {
                    return null;
                }
                notEmpty.await();
            }
            return removeFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for the next item until the queue is empty and {@code finished} is true.
     *
     * @return the next item, or null when no more items will arrive
     */
    public @Nullable T pollUntil(BooleanSupplier finished) throws InterruptedException {
        lock.lock();
        try {
            while (items.isEmpty()) {
                if (closed || finished.getAsBoolean()) {
                    return null;
                }
                notEmpty.await(RECHECK_MILLIS, TimeUnit.MILLISECONDS);
            }
            return removeFirst();
        } finally {
            lock.unlock();
        }
    }

    public int drainTo(Collection<? super T> target) {
        lock.lock();
        try {
            int count = items.size();
            target.addAll(items);
            items.clear();
            notFull.signalAll();
            return count;
        } finally {
            lock.unlock();
        }
    }

    /** Wakes every waiting producer and consumer so they re-evaluate their conditions. */
    public void wakeAll() {
        lock.lock();
        try {
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Rejects further items. Queued items remain readable. */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    private T removeFirst() {
        var item = items.removeFirst();
        notFull.signal();
        return item;
    }
}
