package io.pollwatch.options;

import static org.junit.jupiter.api.Assertions.*;

import io.pollwatch.event.EventKind;
import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class ScanOptionsTest {

    @Test
    void testDefaults() {
        var options = new ScanOptions().applyDefaults();

        assertEquals(ScanOptions.DEFAULT_QUEUE_SIZE, options.getQueueSize());
        assertEquals(ScanOptions.DEFAULT_MAX_WORKERS, options.getMaxWorkers());
        assertEquals(ScanOptions.DEFAULT_SCAN_INTERVAL, options.getScanInterval());
        assertTrue(options.isSuppressed(EventKind.NOCHANGE), "NOCHANGE is suppressed by default");
        for (var kind : new EventKind[] {
            EventKind.CREATE, EventKind.MODIFY, EventKind.DELETE, EventKind.PERM, EventKind.ERROR
        }) {
            assertFalse(options.isSuppressed(kind), kind + " should be enabled by default");
        }
        assertNull(options.getIncludePaths());
        assertNull(options.getExcludePaths());
    }

    @Test
    void testApplyDefaultsKeepsExplicitValues() {
        var options = new ScanOptions()
                .setQueueSize(3)
                .setMaxWorkers(5)
                .setScanInterval(Duration.ofMillis(20))
                .applyDefaults();

        assertEquals(3, options.getQueueSize());
        assertEquals(5, options.getMaxWorkers());
        assertEquals(Duration.ofMillis(20), options.getScanInterval());
    }

    @Test
    void testNegativeQueueSizeFallsBackToDefault() {
        var options = new ScanOptions().setQueueSize(-4).applyDefaults();

        assertEquals(ScanOptions.DEFAULT_QUEUE_SIZE, options.getQueueSize());
    }

    @Test
    void testNonPositiveWorkerCountIsIgnored() {
        var options = new ScanOptions().setMaxWorkers(4);

        options.setMaxWorkers(0).setMaxWorkers(-2);

        assertEquals(4, options.getMaxWorkers());
    }

    @Test
    void testNegativeIntervalIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ScanOptions().setScanInterval(Duration.ofSeconds(-1)));
    }

    @Test
    void testEmptyPatternsAreTreatedAsUnset() {
        var options = ScanOptions.withPatterns(Pattern.compile(""), Pattern.compile(""));

        assertNull(options.getExcludePaths());
        assertNull(options.getIncludePaths());

        options.setExcludePaths(Pattern.compile("\\.tmp$"));
        assertEquals("\\.tmp$", options.getExcludePaths().pattern());
        options.setExcludePaths(null);
        assertNull(options.getExcludePaths());
    }

    @Test
    void testSetSuppressedMapsToEachFlag() {
        var options = new ScanOptions();
        for (var kind : EventKind.values()) {
            options.setSuppressed(kind, true);
            assertTrue(options.isSuppressed(kind), kind.name());
            options.setSuppressed(kind, false);
            assertFalse(options.isSuppressed(kind), kind.name());
        }
    }

    @Test
    void testSettersChainOnSameInstance() {
        var options = new ScanOptions();

        assertSame(
                options,
                options.setIgnoreFileEvent(true)
                        .setIgnoreFolderEvent(true)
                        .setIgnoreSymlinkEvent(true)
                        .setIgnoreFolderContentEvent(true)
                        .setIgnorePermEvent(true));
        assertTrue(options.isIgnoreFile());
        assertTrue(options.isIgnoreFolder());
        assertTrue(options.isIgnoreSymlink());
        assertTrue(options.isIgnoreFolderContent());
        assertTrue(options.isSuppressed(EventKind.PERM));
    }

    @Test
    void testConcurrentWritersOnDifferentFields() throws Exception {
        var options = new ScanOptions();
        var startGate = new CountDownLatch(1);
        var threads = new ArrayList<Thread>();
        threads.add(new Thread(() -> {
            await(startGate);
            for (int i = 1; i <= 10_000; i++) {
                options.setMaxWorkers(i);
            }
        }));
        threads.add(new Thread(() -> {
            await(startGate);
            for (int i = 0; i < 10_000; i++) {
                options.setIgnoreModifyEvent(i % 2 == 0);
            }
        }));
        threads.add(new Thread(() -> {
            await(startGate);
            for (int i = 1; i <= 10_000; i++) {
                options.setScanInterval(Duration.ofMillis(i));
            }
        }));
        threads.forEach(Thread::start);
        startGate.countDown();
        for (var t : threads) {
            t.join(TimeUnit.SECONDS.toMillis(10));
        }

        assertEquals(10_000, options.getMaxWorkers());
        assertFalse(options.isSuppressed(EventKind.MODIFY));
        assertEquals(Duration.ofMillis(10_000), options.getScanInterval());
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
