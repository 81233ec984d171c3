package com.ryuqq.lockfile.adapter.inmemory.store;

import com.ryuqq.lockfile.core.spi.DocumentRepository;
import com.ryuqq.lockfile.core.store.DocumentParseException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link DocumentRepository} SPI for testing and reference purposes.
 *
 * <p>Each write replaces the stored copy with a fresh snapshot, so readers always see a
 * complete document, mirroring the atomic-rename guarantee of the filesystem adapter.
 * Nested maps and lists are copied on write and on read, so neither the writer's arguments
 * nor a reader's result share mutable state with the stored document.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Scalar values are stored as given, without JSON number narrowing</li>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
public class InMemoryDocumentRepository implements DocumentRepository {

    /**
     * Document path → private deep copy of the last written document.
     */
    private final ConcurrentHashMap<Path, Map<String, Object>> documents;

    /**
     * Paths whose content is simulated as unparseable.
     */
    private final Set<Path> corrupted;

    /**
     * Creates a new InMemoryDocumentRepository with no documents.
     */
    public InMemoryDocumentRepository() {
        this.documents = new ConcurrentHashMap<>();
        this.corrupted = ConcurrentHashMap.newKeySet();
    }

    @Override
    public Optional<Map<String, Object>> read(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (corrupted.contains(path)) {
            throw new DocumentParseException(path, "Invalid JSON document");
        }
        Map<String, Object> stored = documents.get(path);
        return stored == null ? Optional.empty() : Optional.of(copyMap(stored));
    }

    @Override
    public Map<String, Object> write(Path path, Map<String, Object> document) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        Map<String, Object> stored = copyMap(document);
        documents.put(path, stored);
        corrupted.remove(path);
        return copyMap(stored);
    }

    @Override
    public boolean exists(Path path) {
        return documents.containsKey(path) || corrupted.contains(path);
    }

    /**
     * Makes subsequent reads of {@code path} fail as if its content were not valid JSON.
     *
     * @param path the document path
     */
    public void corrupt(Path path) {
        corrupted.add(path);
    }

    private static Map<String, Object> copyMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), copyValue(entry.getValue()));
        }
        return copy;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map) {
            return copyMap((Map<?, ?>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object element : (List<?>) value) {
                copy.add(copyValue(element));
            }
            return copy;
        }
        return value;
    }

    /**
     * Clears all documents.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        documents.clear();
        corrupted.clear();
    }
}
