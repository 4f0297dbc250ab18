package io.pollwatch.event;

import java.nio.file.attribute.BasicFileAttributes;

public enum PathType {
    FILE,
    DIRECTORY,
    SYMLINK,
    UNSUPPORTED;

    /**
     * Resolves the type from attributes read without following links, so a link to a directory is a
     * {@link #SYMLINK}.
     */
    public static PathType of(BasicFileAttributes attrs) {
        if (attrs.isDirectory()) {
            return DIRECTORY;
        }
        if (attrs.isRegularFile()) {
            return FILE;
        }
        if (attrs.isSymbolicLink()) {
            return SYMLINK;
        }
        return UNSUPPORTED;
    }
}
