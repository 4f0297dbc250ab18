package io.pollwatch.scan;

import io.pollwatch.event.PathType;
import io.pollwatch.options.ScanOptions;
import java.nio.file.Path;

/**
 * Decides which walk entries are reported. Reads the options on every call, so the same entry gets the same
 * answer at seeding time and at scan time as long as the options are unchanged.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>unsupported type: skip
 *   <li>the root itself: skip
 *   <li>exclude pattern found in the path: skip
 *   <li>include pattern set and not found in the path: skip
 *   <li>file while file events are ignored: skip
 *   <li>directory while folder content is ignored: skip the subtree, and the directory too if folder events
 *       are ignored
 *   <li>directory while folder events are ignored: skip
 *   <li>symlink while symlink events are ignored: skip
 *   <li>otherwise: accept
 * </ol>
 */
public final class EntryFilter {
    private final Path root;
    private final ScanOptions options;

    public EntryFilter(Path root, ScanOptions options) {
        this.root = root;
        this.options = options;
    }

    public FilterDecision classify(Path path, PathType type) {
        if (type == PathType.UNSUPPORTED) {
            return FilterDecision.SKIP;
        }
        if (isPathExcluded(path)) {
            return FilterDecision.SKIP;
        }
        return switch (type) {
            case FILE -> options.isIgnoreFile() ? FilterDecision.SKIP : FilterDecision.ACCEPT;
            case DIRECTORY -> {
                if (options.isIgnoreFolderContent()) {
                    yield options.isIgnoreFolder() ? FilterDecision.SKIP_SUBTREE : FilterDecision.ACCEPT_SKIP_SUBTREE;
                }
                yield options.isIgnoreFolder() ? FilterDecision.SKIP : FilterDecision.ACCEPT;
            }
            case SYMLINK -> options.isIgnoreSymlink() ? FilterDecision.SKIP : FilterDecision.ACCEPT;
            case UNSUPPORTED -> FilterDecision.SKIP;
        };
    }

    /**
     * Path-only rules (root, exclude, include). Entries whose type could not be read are checked with these
     * alone.
     */
    public boolean isPathExcluded(Path path) {
        if (path.equals(root)) {
            return true;
        }
        var text = path.toString();
        var exclude = options.getExcludePaths();
        if (exclude != null && exclude.matcher(text).find()) {
            return true;
        }
        var include = options.getIncludePaths();
        return include != null && !include.matcher(text).find();
    }
}
