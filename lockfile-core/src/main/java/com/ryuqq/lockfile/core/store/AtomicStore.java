package com.ryuqq.lockfile.core.store;

import com.ryuqq.lockfile.core.lock.AcquisitionException;
import com.ryuqq.lockfile.core.lock.MarkerLock;
import com.ryuqq.lockfile.core.spi.DocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Persistent key-value store whose every mutation is serialized across processes.
 *
 * <p>Each mutating call runs a full read-modify-write cycle while holding the
 * {@link MarkerLock} of the backing document:</p>
 * <pre>
 * 1. acquire lock (blocking, configured timeout)
 * 2. re-read the on-disk document (never the in-memory mirror)
 * 3. apply the mutation to the fresh document
 * 4. write the document back atomically
 * 5. refresh the in-memory mirror from the persisted form of the document
 * 6. release lock
 * </pre>
 *
 * <p>Starting every mutation from the freshest committed document is what prevents
 * lost updates between store instances living in different processes.</p>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <ul>
 *   <li>Backing document missing and defaults non-empty: defaults are written immediately</li>
 *   <li>Backing document present: its content is loaded and defaults are ignored</li>
 *   <li>Missing or blank document read later: treated as a copy of the defaults</li>
 * </ul>
 *
 * <p><strong>Failure Policy:</strong></p>
 * <ul>
 *   <li>Lock timeout: {@link AcquisitionException}, mirror unchanged</li>
 *   <li>Corrupt document: {@link DocumentParseException}, document untouched</li>
 *   <li>I/O failure: {@link UncheckedIOException}</li>
 * </ul>
 *
 * <p><strong>Reads:</strong> {@link #get}, {@link #containsKey}, {@link #size}, {@link #keys} and
 * {@link #asMap} read the in-memory mirror without locking. Use {@link #load()} to refresh it.
 * The mirror holds what the repository persisted, so after a write it equals what a fresh
 * store on the same document would load, and later changes to values passed in do not leak into it.</p>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
public class AtomicStore {

    private static final Logger log = LoggerFactory.getLogger(AtomicStore.class);

    private final Path backingPath;
    private final Map<String, Object> defaults;
    private final DocumentRepository repository;
    private final MarkerLock lock;

    /**
     * Unmodifiable snapshot of the last document read or written under the lock.
     */
    private volatile Map<String, Object> data;

    /**
     * Creates a store and initializes the backing document.
     *
     * @param backingPath the JSON document location
     * @param defaults initial document used when the backing document does not exist (may be null)
     * @param repository the document repository
     * @param lock the lock bound to {@code backingPath}
     * @throws IllegalArgumentException if a dependency is null or the lock guards another path
     * @throws AcquisitionException if the lock cannot be acquired within its timeout
     * @throws DocumentParseException if the existing document is corrupt
     */
    public AtomicStore(Path backingPath, Map<String, Object> defaults, DocumentRepository repository, MarkerLock lock) {
        if (backingPath == null) {
            throw new IllegalArgumentException("backingPath cannot be null");
        }
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (lock == null) {
            throw new IllegalArgumentException("lock cannot be null");
        }
        if (!lock.getTargetPath().equals(backingPath)) {
            throw new IllegalArgumentException(
                "lock must guard the backing path (lock: " + lock.getTargetPath() + ", backing: " + backingPath + ")"
            );
        }
        this.backingPath = backingPath;
        this.defaults = defaults == null ? Map.of() : snapshot(defaults);
        this.repository = repository;
        this.lock = lock;
        this.data = Map.of();
        initialize();
    }

    private void initialize() {
        lock.runLocked(() -> {
            if (!repository.exists(backingPath) && !defaults.isEmpty()) {
                data = snapshot(writeDocument(new LinkedHashMap<>(defaults)));
                log.info("Initialized {} with {} default keys", backingPath, defaults.size());
            } else {
                data = snapshot(readDocument());
            }
        });
    }

    /**
     * Reloads the document from disk under the lock.
     *
     * @return an unmodifiable snapshot of the document
     * @throws AcquisitionException if the lock cannot be acquired within its timeout
     * @throws DocumentParseException if the document is corrupt
     */
    public Map<String, Object> load() {
        return lock.withLock(() -> {
            Map<String, Object> loaded = snapshot(readDocument());
            data = loaded;
            return loaded;
        });
    }

    /**
     * Stores a value.
     *
     * @param key the key
     * @param value a JSON-representable value (may be null)
     * @throws IllegalArgumentException if key is null
     */
    public void set(String key, Object value) {
        requireKey(key);
        mutate(document -> document.put(key, value));
    }

    /**
     * Removes a key.
     *
     * @param key the key
     * @return true if the key was present in the on-disk document
     * @throws IllegalArgumentException if key is null
     */
    public boolean delete(String key) {
        requireKey(key);
        return mutate(document -> {
            if (!document.containsKey(key)) {
                return false;
            }
            document.remove(key);
            return true;
        });
    }

    /**
     * Stores every entry of {@code entries} in a single read-modify-write cycle.
     *
     * @param entries the entries to store
     * @throws IllegalArgumentException if entries is null or contains a null key
     */
    public void update(Map<String, ?> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        for (String key : entries.keySet()) {
            requireKey(key);
        }
        Map<String, Object> copy = new LinkedHashMap<>(entries);
        mutate(document -> {
            document.putAll(copy);
            return null;
        });
    }

    /**
     * Stores {@code value} only if {@code key} is absent from the on-disk document.
     *
     * @param key the key
     * @param value the value to store when absent
     * @return the value associated with {@code key} after the call
     * @throws IllegalArgumentException if key is null
     */
    public Object setDefault(String key, Object value) {
        requireKey(key);
        return mutate(document -> {
            if (document.containsKey(key)) {
                return document.get(key);
            }
            document.put(key, value);
            return value;
        });
    }

    /**
     * Persists the in-memory mirror.
     *
     * <p>The on-disk document is re-read under the lock and the mirror's entries are laid
     * over it, so keys written by other processes since the last refresh are kept.</p>
     */
    public void save() {
        Map<String, Object> mirror = data;
        mutate(document -> {
            document.putAll(mirror);
            return null;
        });
    }

    public Object get(String key) {
        return data.get(key);
    }

    public Object getOrDefault(String key, Object fallback) {
        return data.getOrDefault(key, fallback);
    }

    public boolean containsKey(String key) {
        return data.containsKey(key);
    }

    public int size() {
        return data.size();
    }

    public boolean isEmpty() {
        return data.isEmpty();
    }

    public Set<String> keys() {
        return data.keySet();
    }

    /**
     * Returns the in-memory mirror.
     *
     * @return an unmodifiable snapshot
     */
    public Map<String, Object> asMap() {
        return data;
    }

    public Path getBackingPath() {
        return backingPath;
    }

    public MarkerLock getLock() {
        return lock;
    }

    private <T> T mutate(Function<Map<String, Object>, T> mutation) {
        return lock.withLock(() -> {
            Map<String, Object> document = readDocument();
            T result = mutation.apply(document);
            data = snapshot(writeDocument(document));
            return result;
        });
    }

    private Map<String, Object> readDocument() {
        try {
            return repository.read(backingPath)
                .<Map<String, Object>>map(LinkedHashMap::new)
                .orElseGet(() -> new LinkedHashMap<>(defaults));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + backingPath, e);
        }
    }

    private Map<String, Object> writeDocument(Map<String, Object> document) {
        try {
            return repository.write(backingPath, document);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + backingPath, e);
        }
    }

    private static Map<String, Object> snapshot(Map<String, ?> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<String, Object>(source));
    }

    private static void requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }

    @Override
    public String toString() {
        return "AtomicStore{" + backingPath + ", size=" + data.size() + '}';
    }
}
