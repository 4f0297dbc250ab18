package io.pollwatch.options;

import static org.junit.jupiter.api.Assertions.*;

import io.pollwatch.event.EventKind;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ScanOptionsLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty(ScanOptionsLoader.MAX_WORKERS);
        System.clearProperty(ScanOptionsLoader.QUEUE_SIZE);
    }

    @Test
    void testApplyReadsEveryKey() {
        var props = new Properties();
        props.setProperty(ScanOptionsLoader.QUEUE_SIZE, "64");
        props.setProperty(ScanOptionsLoader.MAX_WORKERS, "4");
        props.setProperty(ScanOptionsLoader.SCAN_INTERVAL, "PT0.25S");
        props.setProperty(ScanOptionsLoader.INCLUDE_PATHS, "\\.java$");
        props.setProperty(ScanOptionsLoader.EXCLUDE_PATHS, "/build/");
        props.setProperty(ScanOptionsLoader.IGNORE_PREFIX + "nochange", "false");
        props.setProperty(ScanOptionsLoader.IGNORE_PREFIX + "errors", "true");
        props.setProperty(ScanOptionsLoader.IGNORE_PREFIX + "delete", "TRUE");
        props.setProperty(ScanOptionsLoader.IGNORE_PREFIX + "symlink", "true");
        props.setProperty(ScanOptionsLoader.IGNORE_PREFIX + "foldercontent", "true");

        var options = ScanOptionsLoader.apply(new ScanOptions(), props);

        assertEquals(64, options.getQueueSize());
        assertEquals(4, options.getMaxWorkers());
        assertEquals(Duration.ofMillis(250), options.getScanInterval());
        assertEquals("\\.java$", options.getIncludePaths().pattern());
        assertEquals("/build/", options.getExcludePaths().pattern());
        assertFalse(options.isSuppressed(EventKind.NOCHANGE));
        assertTrue(options.isSuppressed(EventKind.ERROR));
        assertTrue(options.isSuppressed(EventKind.DELETE));
        assertFalse(options.isSuppressed(EventKind.CREATE));
        assertTrue(options.isIgnoreSymlink());
        assertTrue(options.isIgnoreFolderContent());
        assertFalse(options.isIgnoreFile());
    }

    @Test
    void testInvalidValuesAreSkipped() {
        var props = new Properties();
        props.setProperty(ScanOptionsLoader.QUEUE_SIZE, "many");
        props.setProperty(ScanOptionsLoader.SCAN_INTERVAL, "soon");
        props.setProperty(ScanOptionsLoader.EXCLUDE_PATHS, "([");
        props.setProperty(ScanOptionsLoader.IGNORE_PREFIX + "create", "yes");

        var options = ScanOptionsLoader.apply(new ScanOptions().setScanInterval(Duration.ofSeconds(3)), props);

        assertEquals(ScanOptions.DEFAULT_QUEUE_SIZE, options.getQueueSize());
        assertEquals(Duration.ofSeconds(3), options.getScanInterval());
        assertNull(options.getExcludePaths());
        assertFalse(options.isSuppressed(EventKind.CREATE));
    }

    @Test
    void testParseDuration() {
        assertEquals(Duration.ofMillis(1500), ScanOptionsLoader.parseDuration("1500"));
        assertEquals(Duration.ofSeconds(2), ScanOptionsLoader.parseDuration("PT2S"));
        assertEquals(Duration.ofMillis(500), ScanOptionsLoader.parseDuration("pt0.5s"));
        assertNull(ScanOptionsLoader.parseDuration("PT-1S"));
        assertNull(ScanOptionsLoader.parseDuration("1s"));
        assertNull(ScanOptionsLoader.parseDuration(""));
    }

    @Test
    void testLoadLayersClasspathFileAndSystemProperties() throws Exception {
        // test resources ship pollwatch.properties with a queue size of 32
        assertEquals(32, ScanOptionsLoader.load().getQueueSize());

        var file = tempDir.resolve("watch.properties");
        Files.writeString(file, "pollwatch.queueSize=8\npollwatch.maxWorkers=2\n");
        var fromFile = ScanOptionsLoader.load(file);
        assertEquals(8, fromFile.getQueueSize());
        assertEquals(2, fromFile.getMaxWorkers());

        System.setProperty(ScanOptionsLoader.MAX_WORKERS, "6");
        var withOverride = ScanOptionsLoader.load(file);
        assertEquals(8, withOverride.getQueueSize());
        assertEquals(6, withOverride.getMaxWorkers(), "system properties win over the file");
    }

    @Test
    void testMissingFileKeepsClasspathValues() {
        var options = ScanOptionsLoader.load(tempDir.resolve("absent.properties"));

        assertEquals(32, options.getQueueSize());
    }
}
