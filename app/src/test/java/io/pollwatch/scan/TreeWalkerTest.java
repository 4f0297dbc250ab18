package io.pollwatch.scan;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import io.pollwatch.event.PathType;
import io.pollwatch.options.ScanOptions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TreeWalkerTest {

    @TempDir
    Path tempDir;

    private Path root;

    @BeforeEach
    void setUp() throws IOException {
        root = tempDir.toRealPath();
        Files.writeString(root.resolve("a.txt"), "a");
        Files.createDirectories(root.resolve("dir/nested"));
        Files.writeString(root.resolve("dir/b.txt"), "b");
        Files.writeString(root.resolve("dir/nested/c.txt"), "c");
    }

    private Map<Path, PathType> walk(ScanOptions options) throws IOException {
        var entries = new ArrayList<RawEntry>();
        int count = new TreeWalker(root, new EntryFilter(root, options)).walk(entries::add);
        assertEquals(entries.size(), count);
        entries.forEach(e -> assertFalse(e.hasError(), "unexpected error entry " + e));
        return entries.stream().collect(Collectors.toMap(RawEntry::path, RawEntry::type));
    }

    @Test
    void testWalksWholeTreeWithoutRoot() throws IOException {
        var seen = walk(new ScanOptions());

        assertEquals(
                Map.of(
                        root.resolve("a.txt"), PathType.FILE,
                        root.resolve("dir"), PathType.DIRECTORY,
                        root.resolve("dir/b.txt"), PathType.FILE,
                        root.resolve("dir/nested"), PathType.DIRECTORY,
                        root.resolve("dir/nested/c.txt"), PathType.FILE),
                seen);
    }

    @Test
    void testFolderContentSkipsSubtrees() throws IOException {
        var seen = walk(new ScanOptions().setIgnoreFolderContentEvent(true));

        assertEquals(Map.of(root.resolve("a.txt"), PathType.FILE, root.resolve("dir"), PathType.DIRECTORY), seen);
    }

    @Test
    void testExcludedDirectoryStillWalkedForChildren() throws IOException {
        var seen = walk(ScanOptions.withPatterns(Pattern.compile("nested$"), null));

        assertFalse(seen.containsKey(root.resolve("dir/nested")));
        assertTrue(seen.containsKey(root.resolve("dir/nested/c.txt")));
    }

    @Test
    void testSymlinksAreReportedNotFollowed() throws IOException {
        var link = root.resolve("link");
        try {
            Files.createSymbolicLink(link, root.resolve("dir"));
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symbolic links not supported here");
        }

        var seen = walk(new ScanOptions());

        assertEquals(PathType.SYMLINK, seen.get(link));
        assertFalse(seen.containsKey(link.resolve("b.txt")), "link target must not be walked through the link");

        assertFalse(walk(new ScanOptions().setIgnoreSymlinkEvent(true)).containsKey(link));
    }

    @Test
    void testMissingRootFailsTheWalk() {
        var missing = root.resolve("missing");
        var walker = new TreeWalker(missing, new EntryFilter(missing, new ScanOptions()));
        List<RawEntry> entries = new ArrayList<>();

        assertThrows(NoSuchFileException.class, () -> walker.walk(entries::add));
        assertTrue(entries.isEmpty());
    }
}
