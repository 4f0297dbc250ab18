package io.pollwatch.scan;

import io.pollwatch.cache.PathSnapshot;
import io.pollwatch.cache.PathStateCache;
import io.pollwatch.event.Event;
import io.pollwatch.event.EventKind;
import io.pollwatch.options.ScanOptions;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compares an accepted entry with its cached snapshot, updates the cache and emits the resulting events.
 *
 * <p>A path missing from the cache is a CREATE. For a known path, a permission change is a PERM and a
 * modification time change is a MODIFY; both may fire for the same entry. A known path with neither change
 * is a NOCHANGE. An entry whose metadata cannot be read is an ERROR. Unless the path is gone, its snapshot
 * and those of cached paths below it are marked visited and otherwise left alone, so an unreadable directory
 * is not swept as deleted. Suppressed kinds are still detected and cached, just not emitted.
 */
public final class ChangeClassifier {
    private static final Logger logger = LogManager.getLogger(ChangeClassifier.class);

    /** Destination of emitted events. Returns false when the event was dropped. */
    @FunctionalInterface
    public interface EventSink {
        boolean emit(Event event);
    }

    private final PathStateCache cache;
    private final ScanOptions options;
    private final FileMetadata.Reader metadataReader;
    private final EventSink sink;

    public ChangeClassifier(
            PathStateCache cache, ScanOptions options, FileMetadata.Reader metadataReader, EventSink sink) {
        this.cache = cache;
        this.options = options;
        this.metadataReader = metadataReader;
        this.sink = sink;
    }

    public void classify(RawEntry entry) {
        var error = entry.error();
        if (error != null) {
            reportError(entry, error);
            keepSubtree(entry.path());
            return;
        }
        FileMetadata metadata;
        try {
            metadata = metadataReader.read(entry.path());
        } catch (NoSuchFileException e) {
            // gone since it was listed; the sweep reports the delete
            reportError(entry, e);
            return;
        } catch (IOException e) {
            reportError(entry, e);
            keepSubtree(entry.path());
            return;
        }
        classify(entry, metadata);
    }

    void classify(RawEntry entry, FileMetadata metadata) {
        var path = entry.path();
        var previous = cache.lookup(path).orElse(null);
        if (previous == null) {
            var created =
                    new PathSnapshot(metadata.lastModifiedTime(), metadata.type(), metadata.permissions(), true);
            if (cache.storeIfAbsent(path, created)) {
                emit(Event.of(path, entry.type(), EventKind.CREATE));
            }
            return;
        }

        boolean permChanged = previous.permissions() != metadata.permissions();
        boolean modChanged = !previous.lastModifiedTime().equals(metadata.lastModifiedTime());
        var current = previous.withVisited(true);
        if (previous.type() != metadata.type()) {
            current = current.withType(metadata.type());
        }
        if (permChanged) {
            current = current.withPermissions(metadata.permissions());
        }
        if (modChanged) {
            current = current.withLastModifiedTime(metadata.lastModifiedTime());
        }
        if (!cache.replace(path, previous, current)) {
            // flushed or swept concurrently; the next pass sees the path as new
            logger.trace("Snapshot of {} changed while classifying, skipping", path);
            return;
        }

        if (permChanged) {
            emit(Event.of(path, entry.type(), EventKind.PERM));
        }
        if (modChanged) {
            emit(Event.of(path, entry.type(), EventKind.MODIFY));
        }
        if (!permChanged && !modChanged) {
            emit(Event.of(path, entry.type(), EventKind.NOCHANGE));
        }
    }

    /** Marks {@code path} and every cached path below it as seen in this pass. */
    private void keepSubtree(Path path) {
        cache.forEach((cached, snapshot) -> {
            if (!snapshot.visited() && cached.startsWith(path)) {
                cache.replace(cached, snapshot, snapshot.withVisited(true));
            }
            return true;
        });
    }

    private void reportError(RawEntry entry, Exception cause) {
        logger.warn("Failed to read {}: {}", entry.path(), cause.toString());
        emit(Event.error(entry.path(), entry.type(), cause));
    }

    private void emit(Event event) {
        if (options.isSuppressed(event.kind())) {
            return;
        }
        if (!sink.emit(event)) {
            logger.debug("Dropped {}", event);
        }
    }
}
