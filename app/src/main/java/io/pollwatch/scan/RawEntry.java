package io.pollwatch.scan;

import io.pollwatch.event.PathType;
import java.io.IOException;
import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/**
 * One item produced by the directory walk, handed to exactly one worker.
 *
 * @param error set when the walk could not read this path; the type is then {@link PathType#UNSUPPORTED}
 */
public record RawEntry(Path path, PathType type, @Nullable IOException error) {

    public static RawEntry of(Path path, PathType type) {
        return new RawEntry(path, type, null);
    }

    public static RawEntry failed(Path path, IOException error) {
        return new RawEntry(path, PathType.UNSUPPORTED, error);
    }

    public boolean hasError() {
        return error != null;
    }
}
