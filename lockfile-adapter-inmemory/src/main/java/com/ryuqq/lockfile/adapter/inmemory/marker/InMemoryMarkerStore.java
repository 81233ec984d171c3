package com.ryuqq.lockfile.adapter.inmemory.marker;

import com.ryuqq.lockfile.core.spi.MarkerStore;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link MarkerStore} SPI for testing and reference purposes.
 *
 * <p>Markers live in a {@link ConcurrentHashMap} keyed by marker path.
 * {@link ConcurrentHashMap#putIfAbsent} provides the exclusive-create primitive and
 * {@link ConcurrentHashMap#remove(Object, Object)} provides compare-and-delete.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Visible to a single JVM only</li>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryMarkerStore markers = new InMemoryMarkerStore();
 * InMemoryProcessTable processes = new InMemoryProcessTable();
 *
 * MarkerLock first = new MarkerLock(target, config, markers, processes, processes.spawn());
 * MarkerLock second = new MarkerLock(target, config, markers, processes, processes.spawn());
 * </pre>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
public class InMemoryMarkerStore implements MarkerStore {

    /**
     * Marker path → content (decimal process identifier).
     */
    private final ConcurrentHashMap<Path, String> markers;

    /**
     * Creates a new InMemoryMarkerStore with no markers.
     */
    public InMemoryMarkerStore() {
        this.markers = new ConcurrentHashMap<>();
    }

    @Override
    public boolean createExclusive(Path marker, String content) {
        if (marker == null) {
            throw new IllegalArgumentException("marker cannot be null");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        return markers.putIfAbsent(marker, content) == null;
    }

    @Override
    public Optional<String> read(Path marker) {
        if (marker == null) {
            throw new IllegalArgumentException("marker cannot be null");
        }
        return Optional.ofNullable(markers.get(marker));
    }

    @Override
    public boolean deleteIfContentEquals(Path marker, String expectedContent) {
        if (marker == null) {
            throw new IllegalArgumentException("marker cannot be null");
        }
        if (expectedContent == null) {
            throw new IllegalArgumentException("expectedContent cannot be null");
        }
        return markers.remove(marker, expectedContent);
    }

    @Override
    public boolean delete(Path marker) {
        if (marker == null) {
            throw new IllegalArgumentException("marker cannot be null");
        }
        return markers.remove(marker) != null;
    }

    /**
     * Places a marker with arbitrary content, replacing any existing one.
     *
     * <p>This method is used to simulate corrupt or abandoned markers in tests.</p>
     *
     * @param marker the marker path
     * @param content the raw content
     */
    public void put(Path marker, String content) {
        markers.put(marker, content);
    }

    /**
     * Checks whether a marker exists.
     *
     * @param marker the marker path
     * @return true if the marker exists
     */
    public boolean exists(Path marker) {
        return markers.containsKey(marker);
    }

    /**
     * Returns the number of existing markers.
     *
     * @return the number of markers
     */
    public int size() {
        return markers.size();
    }

    /**
     * Clears all markers.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        markers.clear();
    }
}
