package com.ryuqq.lockfile.adapter.filesystem;

import com.ryuqq.lockfile.adapter.filesystem.marker.FileMarkerStore;
import com.ryuqq.lockfile.adapter.filesystem.marker.ProcessHandleLivenessOracle;
import com.ryuqq.lockfile.adapter.filesystem.store.JacksonDocumentRepository;
import com.ryuqq.lockfile.core.lock.LockConfig;
import com.ryuqq.lockfile.core.lock.MarkerLock;
import com.ryuqq.lockfile.core.store.AtomicStore;
import com.ryuqq.lockfile.core.store.StoreConfig;

import java.nio.file.Path;
import java.util.Map;

/**
 * Entry point wiring the core lock and store to the filesystem adapters.
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * try (LockHandle ignored = Lockfiles.lock(Path.of("journal.txt")).lock()) {
 *     Files.writeString(journal, line, APPEND);
 * }
 *
 * AtomicStore settings = Lockfiles.store(Path.of("settings.json"), Map.of("theme", "dark"));
 * settings.set("fontSize", 14);
 * </pre>
 *
 * <p>The stateless adapters are shared between all locks and stores created here.</p>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
public final class Lockfiles {

    private static final FileMarkerStore MARKER_STORE = new FileMarkerStore();
    private static final ProcessHandleLivenessOracle LIVENESS_ORACLE = new ProcessHandleLivenessOracle();
    private static final JacksonDocumentRepository DOCUMENT_REPOSITORY = new JacksonDocumentRepository();

    private Lockfiles() {
    }

    /**
     * Creates a lock on {@code target} with the default configuration.
     *
     * @param target the path to protect
     * @return a new lock owned by the running process
     */
    public static MarkerLock lock(Path target) {
        return lock(target, new LockConfig());
    }

    /**
     * Creates a lock on {@code target}.
     *
     * @param target the path to protect
     * @param config the lock configuration
     * @return a new lock owned by the running process
     */
    public static MarkerLock lock(Path target, LockConfig config) {
        return new MarkerLock(target, config, MARKER_STORE, LIVENESS_ORACLE);
    }

    /**
     * Opens a store on {@code backingPath} without defaults.
     *
     * @param backingPath the JSON document location
     * @return an initialized store
     */
    public static AtomicStore store(Path backingPath) {
        return store(backingPath, null);
    }

    /**
     * Opens a store on {@code backingPath}, writing {@code defaults} if the document does not exist.
     *
     * @param backingPath the JSON document location
     * @param defaults the initial document (may be null)
     * @return an initialized store
     */
    public static AtomicStore store(Path backingPath, Map<String, Object> defaults) {
        return store(backingPath, defaults, new StoreConfig());
    }

    /**
     * Opens a store on {@code backingPath}.
     *
     * @param backingPath the JSON document location
     * @param defaults the initial document (may be null)
     * @param config the store configuration
     * @return an initialized store
     */
    public static AtomicStore store(Path backingPath, Map<String, Object> defaults, StoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new AtomicStore(backingPath, defaults, DOCUMENT_REPOSITORY, lock(backingPath, config.lockConfig()));
    }
}
