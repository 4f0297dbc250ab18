package io.pollwatch;

import io.pollwatch.options.ScanOptions;
import io.pollwatch.options.ScanOptionsLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/** Factory for {@link ScanNotifier} instances. */
public final class ScanNotifiers {

    private ScanNotifiers() {}

    /**
     * Creates a notifier for {@code root}, walking it once to learn the current state of the tree. Nothing is
     * reported for that initial state.
     *
     * <p>{@code options} stays shared with the caller: later changes to it apply to the running notifier.
     * Unset sizes and interval are filled with defaults.
     *
     * @throws ScanNotifierException with {@link ErrorCode#INVALID_ROOT_DIR_PATH} if {@code root} is not an
     *     accessible directory, or {@link ErrorCode#INITIALIZATION} if the initial walk fails
     */
    public static ScanNotifier create(Path root, ScanOptions options) throws ScanNotifierException {
        Path normalized;
        try {
            normalized = root.toAbsolutePath().normalize();
            // the walk does not follow links, so a linked root is replaced by its target
            if (Files.isSymbolicLink(normalized)) {
                normalized = normalized.toRealPath();
            }
            var attrs = Files.readAttributes(normalized, BasicFileAttributes.class);
            if (!attrs.isDirectory()) {
                throw new NotDirectoryException(normalized.toString());
            }
        } catch (IOException | SecurityException e) {
            throw new ScanNotifierException(ErrorCode.INVALID_ROOT_DIR_PATH, e);
        }
        return PollingScanNotifier.initialize(normalized, options.applyDefaults());
    }

    /** Creates a notifier with options from {@link ScanOptionsLoader#load()}. */
    public static ScanNotifier create(Path root) throws ScanNotifierException {
        return create(root, ScanOptionsLoader.load());
    }
}
