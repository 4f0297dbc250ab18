package io.pollwatch.cache;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Concurrent map from absolute path to its last observed {@link PathSnapshot}.
 *
 * <p>Lookups and stores from many workers on different paths run concurrently. Each per-path operation is
 * atomic; there is no ordering across paths. {@link #forEach} is meant for the end-of-pass sweep, which
 * runs after every worker of the pass has retired.
 */
public final class PathStateCache {

    /** Visits one cache entry. Returning false stops the iteration. */
    @FunctionalInterface
    public interface Visitor {
        boolean visit(Path path, PathSnapshot snapshot);
    }

    private final Map<Path, PathSnapshot> snapshots = new ConcurrentHashMap<>();

    public Optional<PathSnapshot> lookup(Path path) {
        return Optional.ofNullable(snapshots.get(path));
    }

    public void store(Path path, PathSnapshot snapshot) {
        snapshots.put(path, snapshot);
    }

    /** @return true if no snapshot existed for {@code path} and {@code snapshot} was stored */
    public boolean storeIfAbsent(Path path, PathSnapshot snapshot) {
        return snapshots.putIfAbsent(path, snapshot) == null;
    }

    /**
     * Replaces the snapshot of {@code path} only if it is still {@code expected}. Fails when a concurrent
     * flush or sweep removed the entry in between.
     */
    public boolean replace(Path path, PathSnapshot expected, PathSnapshot updated) {
        return snapshots.replace(path, expected, updated);
    }

    public void delete(Path path) {
        snapshots.remove(path);
    }

    public boolean contains(Path path) {
        return snapshots.containsKey(path);
    }

    /**
     * Calls {@code visitor} for every entry until it returns false. The visitor may {@link #store} over or
     * {@link #delete} the entry it is given.
     *
     * @return false if the visitor stopped the iteration early
     */
    public boolean forEach(Visitor visitor) {
        for (var entry : snapshots.entrySet()) {
            if (!visitor.visit(entry.getKey(), entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    /** Forgets every path, so each one is reported as new on its next sighting. */
    public void clear() {
        snapshots.clear();
    }

    public int size() {
        return snapshots.size();
    }
}
