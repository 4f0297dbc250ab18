package io.pollwatch.scan;

import io.pollwatch.queue.BoundedQueue;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Consumers that drain the intake queue during one pass. Each consumer re-checks an entry against the
 * {@link EntryFilter}, since options may have changed after the entry was queued, then classifies it.
 *
 * <p>Usage per pass:
 * <pre>{@code
 * var pass = pool.begin(options.getMaxWorkers());
 * try {
 *     walker.walk(entry -> intake.put(entry, pass::isIdle));
 * } finally {
 *     pass.finishTraversal();
 * }
 * pass.awaitRetirement();
 * }</pre>
 */
public final class WorkerPool {
    private static final Logger logger = LogManager.getLogger(WorkerPool.class);

    private final ExecutorService executor;
    private final BoundedQueue<RawEntry> intake;
    private final EntryFilter filter;
    private final ChangeClassifier classifier;

    public WorkerPool(
            ExecutorService executor, BoundedQueue<RawEntry> intake, EntryFilter filter, ChangeClassifier classifier) {
        this.executor = executor;
        this.intake = intake;
        this.filter = filter;
        this.classifier = classifier;
    }

    /** Starts {@code workers} consumers for a new pass. */
    public Pass begin(int workers) {
        var pass = new Pass();
        for (int i = 0; i < workers; i++) {
            pass.futures.add(executor.submit(pass::work));
        }
        logger.trace("Started {} workers", workers);
        return pass;
    }

    void process(RawEntry entry) {
        if (entry.hasError()) {
            if (!filter.isPathExcluded(entry.path())) {
                classifier.classify(entry);
            }
            return;
        }
        if (!filter.classify(entry.path(), entry.type()).isReported()) {
            logger.trace("Entry {} no longer passes the filter", entry.path());
            return;
        }
        classifier.classify(entry);
    }

    /** Consumers of one pass. */
    public final class Pass {
        private final AtomicBoolean traversalFinished = new AtomicBoolean();
        private final AtomicInteger processed = new AtomicInteger();
        private final List<Future<?>> futures = new ArrayList<>();

        private Void work() throws InterruptedException {
            RawEntry entry;
            while ((entry = intake.pollUntil(traversalFinished::get)) != null) {
                process(entry);
                processed.incrementAndGet();
            }
            return null;
        }

        /** No more entries will be queued for this pass; consumers retire once the queue is empty. */
        public void finishTraversal() {
            traversalFinished.set(true);
            intake.wakeAll();
        }

        /** True when every consumer has retired, normally or not. */
        public boolean isIdle() {
            return futures.stream().allMatch(Future::isDone);
        }

        /**
         * Waits for every consumer to retire.
         *
         * @throws ExecutionException with the first unexpected failure of a consumer
         */
        public void awaitRetirement() throws InterruptedException, ExecutionException {
            ExecutionException failure = null;
            for (var future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e.getCause());
                    }
                }
            }
            if (failure != null) {
                throw failure;
            }
        }

        public int processedCount() {
            return processed.get();
        }

        public int workerCount() {
            return futures.size();
        }
    }
}
