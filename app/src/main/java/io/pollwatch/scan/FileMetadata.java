package io.pollwatch.scan;

import io.pollwatch.event.PathType;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Set;

/**
 * Modification time, type and permission bits of a path, read without following links.
 *
 * @param permissions octal permission bits; on file systems without POSIX attributes only the owner bits are
 *     filled, from the readable, writable and executable checks
 */
public record FileMetadata(FileTime lastModifiedTime, PathType type, int permissions) {

    /** Reads metadata from the default file system. */
    @FunctionalInterface
    public interface Reader {
        FileMetadata read(Path path) throws IOException;
    }

    public static final Reader DEFAULT_READER = FileMetadata::read;

    public static FileMetadata read(Path path) throws IOException {
        if (path.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            var attrs = Files.readAttributes(path, PosixFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            return new FileMetadata(attrs.lastModifiedTime(), PathType.of(attrs), toBits(attrs.permissions()));
        }
        var attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        int bits = 0;
        if (Files.isReadable(path)) {
            bits |= 0400;
        }
        if (Files.isWritable(path)) {
            bits |= 0200;
        }
        if (Files.isExecutable(path)) {
            bits |= 0100;
        }
        return new FileMetadata(attrs.lastModifiedTime(), PathType.of(attrs), bits);
    }

    static int toBits(Set<PosixFilePermission> permissions) {
        int bits = 0;
        for (var permission : permissions) {
            bits |= switch (permission) {
                case OWNER_READ -> 0400;
                case OWNER_WRITE -> 0200;
                case OWNER_EXECUTE -> 0100;
                case GROUP_READ -> 040;
                case GROUP_WRITE -> 020;
                case GROUP_EXECUTE -> 010;
                case OTHERS_READ -> 04;
                case OTHERS_WRITE -> 02;
                case OTHERS_EXECUTE -> 01;
            };
        }
        return bits;
    }
}
