/**
 * Filesystem adapter package.
 *
 * <p>{@link com.ryuqq.lockfile.adapter.filesystem.Lockfiles} wires the core lock and store
 * to the production adapters in the {@code marker} and {@code store} subpackages.</p>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
package com.ryuqq.lockfile.adapter.filesystem;
