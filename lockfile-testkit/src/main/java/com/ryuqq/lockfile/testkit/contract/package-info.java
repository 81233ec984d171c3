/**
 * Contract tests shared by all adapter implementations.
 *
 * <p>Each adapter module extends {@link com.ryuqq.lockfile.testkit.contract.LockContractTest}
 * and {@link com.ryuqq.lockfile.testkit.contract.StoreContractTest} in its own test sources,
 * so every adapter pair is held to the same lock and store behavior.</p>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
package com.ryuqq.lockfile.testkit.contract;
