/**
 * JSON document persistence on the local filesystem.
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
package com.ryuqq.lockfile.adapter.filesystem.store;
