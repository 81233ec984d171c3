/**
 * In-memory marker adapter implementation package.
 *
 * <p>This package provides reference implementations of the lock-side SPIs
 * for testing and for simulating several processes inside one JVM.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.lockfile.adapter.inmemory.marker.InMemoryMarkerStore}:
 *       Thread-safe implementation of {@link com.ryuqq.lockfile.core.spi.MarkerStore}</li>
 *   <li>{@link com.ryuqq.lockfile.adapter.inmemory.marker.InMemoryProcessTable}:
 *       Controllable implementation of {@link com.ryuqq.lockfile.core.spi.ProcessLivenessOracle}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Markers are not visible to other processes</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.lockfile.core.lock.MarkerLock
 * @author Lockfile Team
 * @since 1.0.0
 */
package com.ryuqq.lockfile.adapter.inmemory.marker;
