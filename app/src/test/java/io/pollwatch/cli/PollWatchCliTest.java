package io.pollwatch.cli;

import static org.junit.jupiter.api.Assertions.*;

import io.pollwatch.event.EventKind;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class PollWatchCliTest {

    @TempDir
    Path tempDir;

    private record Result(int exitCode, String out, String err) {}

    private static Result run(String... args) {
        var out = new StringWriter();
        var err = new StringWriter();
        var cmd = new CommandLine(new PollWatchCli());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        int exitCode = cmd.execute(args);
        return new Result(exitCode, out.toString(), err.toString());
    }

    @Test
    void testListOnStartPrintsJsonLines() throws Exception {
        var root = tempDir.toRealPath();
        Files.writeString(root.resolve("a.txt"), "a");
        Files.createDirectory(root.resolve("sub"));

        var result = run(root.toString(), "--interval", "50", "--duration", "PT0.5S", "--list-on-start", "--json");

        assertEquals(0, result.exitCode(), result.err());
        var lines = result.out().lines().toList();
        assertEquals(2, lines.size(), result.out());
        assertTrue(lines.stream().allMatch(l -> l.contains("\"kind\":\"CREATE\"")), result.out());
        assertTrue(
                lines.stream().anyMatch(l -> l.contains("a.txt") && l.contains("\"type\":\"FILE\"")), result.out());
        assertTrue(
                lines.stream().anyMatch(l -> l.contains("sub") && l.contains("\"type\":\"DIRECTORY\"")),
                result.out());
    }

    @Test
    void testPlainOutputAndIgnoredKinds() throws Exception {
        var root = tempDir.toRealPath();
        Files.writeString(root.resolve("a.txt"), "a");
        Files.createDirectory(root.resolve("sub"));

        var result = run(
                root.toString(), "--interval", "50", "--duration", "400", "--list-on-start", "--ignore-folders");

        assertEquals(0, result.exitCode(), result.err());
        assertEquals("CREATE FILE " + root.resolve("a.txt"), result.out().strip());
    }

    @Test
    void testInvalidRootExitsWithError() {
        var result = run(tempDir.resolve("missing").toString(), "--duration", "100");

        assertEquals(2, result.exitCode());
        assertTrue(result.err().contains("invalid root directory path"), result.err());
        assertTrue(result.out().isEmpty());
    }

    @Test
    void testInvalidDurationIsUsageError() {
        var result = run(tempDir.toString(), "--interval", "soon");

        assertEquals(CommandLine.ExitCode.USAGE, result.exitCode());
        assertTrue(result.err().contains("Invalid duration: soon"), result.err());
    }

    @Test
    void testOptionsMapping() throws Exception {
        var config = Files.writeString(tempDir.resolve("watch.properties"), "pollwatch.maxWorkers=3\n");
        var cli = new PollWatchCli();
        new CommandLine(cli)
                .parseArgs(
                        tempDir.toString(),
                        "--config", config.toString(),
                        "--queue-size", "7",
                        "--interval", "PT2S",
                        "--exclude", "\\.git/",
                        "--ignore", "create,perm",
                        "--no-change",
                        "--ignore-symlinks",
                        "--ignore-folder-content");

        var options = cli.buildOptions();

        assertEquals(3, options.getMaxWorkers(), "value from the config file");
        assertEquals(7, options.getQueueSize(), "command line wins over config");
        assertEquals(Duration.ofSeconds(2), options.getScanInterval());
        assertEquals("\\.git/", options.getExcludePaths().pattern());
        assertTrue(options.isSuppressed(EventKind.CREATE));
        assertTrue(options.isSuppressed(EventKind.PERM));
        assertFalse(options.isSuppressed(EventKind.MODIFY));
        assertFalse(options.isSuppressed(EventKind.NOCHANGE));
        assertTrue(options.isIgnoreSymlink());
        assertTrue(options.isIgnoreFolderContent());
        assertFalse(options.isIgnoreFile());
    }
}
