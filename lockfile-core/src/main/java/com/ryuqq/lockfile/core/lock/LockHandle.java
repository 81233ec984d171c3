package com.ryuqq.lockfile.core.lock;

/**
 * Scoped ownership of a {@link MarkerLock}.
 *
 * <p>Returned by {@link MarkerLock#lock()}. Closing the handle releases the marker,
 * so try-with-resources guarantees release on every exit path:</p>
 * <pre>
 * try (LockHandle ignored = lock.lock()) {
 *     // read-modify-write the target file
 * }
 * </pre>
 *
 * <p>{@link #close()} is idempotent.</p>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
public final class LockHandle implements AutoCloseable {

    private final MarkerLock lock;
    private boolean closed;

    LockHandle(MarkerLock lock) {
        this.lock = lock;
    }

    /**
     * Returns the lock this handle was obtained from.
     *
     * @return the owning lock
     */
    public MarkerLock lock() {
        return lock;
    }

    /**
     * Releases the marker if it has not been released through this handle yet.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        lock.release();
    }
}
