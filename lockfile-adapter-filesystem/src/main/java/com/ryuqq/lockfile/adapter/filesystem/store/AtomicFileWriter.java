package com.ryuqq.lockfile.adapter.filesystem.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Set;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Replaces files through write-to-temporary then atomic rename.
 *
 * <p>The temporary file lives in the target's directory so the rename never crosses
 * a filesystem boundary. A concurrent reader therefore sees either the previous
 * content or the new content, never a partial write.</p>
 *
 * <p><strong>Behavior:</strong></p>
 * <ul>
 *   <li>Missing parent directories are created</li>
 *   <li>POSIX permissions of an existing target are carried over to the replacement</li>
 *   <li>The temporary file is deleted when any step fails</li>
 * </ul>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
public class AtomicFileWriter {

    private static final String TEMP_SUFFIX = ".tmp";

    /**
     * Atomically replaces {@code target} with {@code content}.
     *
     * @param target the file to replace (need not exist)
     * @param content the complete new content
     * @throws IOException if the content cannot be written or moved into place
     */
    public void write(Path target, byte[] content) throws IOException {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }

        Path directory = target.toAbsolutePath().getParent();
        Files.createDirectories(directory);

        Path temp = Files.createTempFile(directory, target.getFileName().toString(), TEMP_SUFFIX);
        try {
            Files.write(temp, content);
            copyPermissions(target, temp);
            Files.move(temp, target, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanupFailure) {
                e.addSuppressed(cleanupFailure);
            }
            throw e;
        }
    }

    private static void copyPermissions(Path source, Path destination) throws IOException {
        if (!Files.exists(source)) {
            return;
        }
        PosixFileAttributeView sourceView = Files.getFileAttributeView(source, PosixFileAttributeView.class);
        PosixFileAttributeView destinationView = Files.getFileAttributeView(destination, PosixFileAttributeView.class);
        if (sourceView == null || destinationView == null) {
            return;
        }
        Set<PosixFilePermission> permissions = sourceView.readAttributes().permissions();
        destinationView.setPermissions(permissions);
    }
}
