package com.ryuqq.lockfile.core.spi;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Marker file storage SPI used by the lock primitive.
 *
 * <p>A marker's <em>existence</em> is the lock state and its <em>content</em>
 * is the decimal identifier of the process that created it.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>{@link #createExclusive} must be a single atomic operation that fails when the
 *       marker already exists. A check-then-create pair is not acceptable.</li>
 *   <li>A concurrent reader must never observe a marker without its full content.</li>
 *   <li>Thread-safe: all methods must be safely callable from multiple threads</li>
 * </ul>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
public interface MarkerStore {

    /**
     * Atomically creates the marker with the given content.
     *
     * @param marker the marker path
     * @param content the content to write (decimal process identifier)
     * @return true if the marker was created, false if it already existed
     * @throws IOException if the marker could not be created for any other reason
     */
    boolean createExclusive(Path marker, String content) throws IOException;

    /**
     * Reads the marker content.
     *
     * @param marker the marker path
     * @return the content, or empty if the marker does not exist
     * @throws IOException if the marker exists but cannot be read
     */
    Optional<String> read(Path marker) throws IOException;

    /**
     * Deletes the marker if its current content still equals {@code expectedContent}.
     *
     * <p>Used to reclaim malformed or stale markers without removing a marker that a
     * competitor created after the caller inspected it.</p>
     *
     * @param marker the marker path
     * @param expectedContent the content observed by the caller
     * @return true if a marker was deleted
     * @throws IOException if deletion fails
     */
    boolean deleteIfContentEquals(Path marker, String expectedContent) throws IOException;

    /**
     * Unconditionally deletes the marker.
     *
     * <p>Only the owner of a marker may call this.</p>
     *
     * @param marker the marker path
     * @return true if a marker was deleted, false if none existed
     * @throws IOException if deletion fails
     */
    boolean delete(Path marker) throws IOException;
}
