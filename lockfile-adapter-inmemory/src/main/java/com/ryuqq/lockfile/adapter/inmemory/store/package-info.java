/**
 * In-memory document adapter implementation package.
 *
 * <p>{@link com.ryuqq.lockfile.adapter.inmemory.store.InMemoryDocumentRepository} keeps one
 * unmodifiable snapshot per path and can simulate corrupt documents.</p>
 *
 * @see com.ryuqq.lockfile.core.store.AtomicStore
 * @author Lockfile Team
 * @since 1.0.0
 */
package com.ryuqq.lockfile.adapter.inmemory.store;
