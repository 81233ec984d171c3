package com.ryuqq.lockfile.core.spi;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent document SPI for the atomic store.
 *
 * <p>A document is a mapping of string keys to JSON-representable values
 * ({@code null}, {@link Boolean}, {@link Number}, {@link String}, {@link java.util.List}
 * and nested {@link Map}).</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>{@link #write} must replace the document atomically: a concurrent reader sees
 *       either the previous document or the new one, never a partial write</li>
 *   <li>{@link #read} must not modify the stored document, even when it is corrupt</li>
 *   <li>{@link #write} returns the document as a subsequent {@link #read} would yield it,
 *       sharing no mutable state with the caller's argument</li>
 * </ul>
 *
 * <p>Callers serialize access through the lock primitive; implementations do not lock.</p>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
public interface DocumentRepository {

    /**
     * Reads and parses the document.
     *
     * @param path the backing document path
     * @return the parsed document, or empty if the document does not exist or is blank
     * @throws com.ryuqq.lockfile.core.store.DocumentParseException if the content is not a valid document
     * @throws IOException if reading fails
     */
    Optional<Map<String, Object>> read(Path path) throws IOException;

    /**
     * Atomically replaces the document.
     *
     * @param path the backing document path
     * @param document the full document to persist
     * @return the persisted document in its stored form (for example numbers narrowed and
     *         nested values copied), equal to what {@link #read} returns next
     * @throws IOException if writing fails
     */
    Map<String, Object> write(Path path, Map<String, Object> document) throws IOException;

    /**
     * Checks whether a document exists.
     *
     * @param path the backing document path
     * @return true if the document exists
     */
    boolean exists(Path path);
}
