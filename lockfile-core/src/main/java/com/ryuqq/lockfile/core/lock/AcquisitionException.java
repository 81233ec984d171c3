package com.ryuqq.lockfile.core.lock;

/**
 * Runtime exception thrown when a blocking acquire cannot obtain the marker
 * within the configured timeout.
 *
 * <p>Never thrown by a non-blocking acquire.</p>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
public class AcquisitionException extends RuntimeException {

    public AcquisitionException(String message) {
        super(message);
    }

    public AcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
