/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to provide concrete functionality for the core SDK.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lockfile.core.spi.MarkerStore} - Exclusive creation, reading and deletion of marker files</li>
 *   <li>{@link com.ryuqq.lockfile.core.spi.ProcessLivenessOracle} - Process table query</li>
 *   <li>{@link com.ryuqq.lockfile.core.spi.DocumentRepository} - JSON document parsing and atomic replacement</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (lockfile-adapter-filesystem, lockfile-adapter-inmemory)
 * provide concrete implementations of these SPIs.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on the filesystem or on a JSON library</li>
 *   <li><strong>Pluggability:</strong> In-memory adapters for tests, filesystem adapters for production</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Lockfile Team
 */
package com.ryuqq.lockfile.core.spi;
