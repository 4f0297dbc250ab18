package io.pollwatch.cache;

import io.pollwatch.event.PathType;
import java.nio.file.attribute.FileTime;

/**
 * Last observed state of one path. Immutable; the cache replaces a snapshot instead of mutating it.
 *
 * @param lastModifiedTime modification time at the last observation
 * @param type the path's type
 * @param permissions permission bits in the usual octal layout ({@code 0644} and so on)
 * @param visited whether the path was seen during the current pass
 */
public record PathSnapshot(FileTime lastModifiedTime, PathType type, int permissions, boolean visited) {

    public PathSnapshot withVisited(boolean value) {
        return value == visited ? this : new PathSnapshot(lastModifiedTime, type, permissions, value);
    }

    public PathSnapshot withType(PathType value) {
        return new PathSnapshot(lastModifiedTime, value, permissions, visited);
    }

    public PathSnapshot withPermissions(int value) {
        return new PathSnapshot(lastModifiedTime, type, value, visited);
    }

    public PathSnapshot withLastModifiedTime(FileTime value) {
        return new PathSnapshot(value, type, permissions, visited);
    }
}
