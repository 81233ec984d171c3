package com.ryuqq.lockfile.core.store;

import java.nio.file.Path;

/**
 * Runtime exception thrown when a backing document exists but is not a valid JSON object.
 *
 * <p>The document is left untouched.</p>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
public class DocumentParseException extends RuntimeException {

    private final Path path;

    public DocumentParseException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public DocumentParseException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    /**
     * Returns the path of the corrupt document.
     *
     * @return the document path
     */
    public Path getPath() {
        return path;
    }
}
