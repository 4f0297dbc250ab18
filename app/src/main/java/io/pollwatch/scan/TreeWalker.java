package io.pollwatch.scan;

import io.pollwatch.event.PathType;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.FileVisitor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Depth-first walk of the root that hands every entry passing the {@link EntryFilter} to a handler. Links are
 * reported, never followed. A path the walk cannot read becomes a failed {@link RawEntry}, unless it is the
 * root, in which case the walk fails.
 */
public final class TreeWalker {
    private static final Logger logger = LogManager.getLogger(TreeWalker.class);

    /** Receives accepted entries on the walking thread. */
    @FunctionalInterface
    public interface EntryHandler {
        void accept(RawEntry entry) throws IOException;
    }

    private final Path root;
    private final EntryFilter filter;

    public TreeWalker(Path root, EntryFilter filter) {
        this.root = root;
        this.filter = filter;
    }

    /**
     * Walks the whole tree.
     *
     * @return the number of entries handed to {@code handler}
     * @throws IOException if the root cannot be read or the handler fails
     */
    public int walk(EntryHandler handler) throws IOException {
        var visitor = new Visitor(handler);
        Files.walkFileTree(root, visitor);
        return visitor.accepted;
    }

    private final class Visitor implements FileVisitor<Path> {
        private final EntryHandler handler;
        private int accepted;

        Visitor(EntryHandler handler) {
            this.handler = handler;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
            var decision = filter.classify(dir, PathType.DIRECTORY);
            offer(dir, PathType.DIRECTORY, decision);
            return decision.shouldDescend() ? FileVisitResult.CONTINUE : FileVisitResult.SKIP_SUBTREE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
            var type = PathType.of(attrs);
            offer(file, type, filter.classify(file, type));
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            if (file.equals(root)) {
                throw exc;
            }
            fail(file, exc);
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, @Nullable IOException exc) throws IOException {
            if (exc != null) {
                if (dir.equals(root)) {
                    throw exc;
                }
                fail(dir, exc);
            }
            return FileVisitResult.CONTINUE;
        }

        private void offer(Path path, PathType type, FilterDecision decision) throws IOException {
            if (!decision.isReported()) {
                logger.trace("Filtered out {} {} ({})", type, path, decision);
                return;
            }
            handler.accept(RawEntry.of(path, type));
            accepted++;
        }

        private void fail(Path path, IOException exc) throws IOException {
            if (filter.isPathExcluded(path)) {
                return;
            }
            logger.debug("Could not read {}: {}", path, exc.toString());
            handler.accept(RawEntry.failed(path, exc));
            accepted++;
        }
    }
}
