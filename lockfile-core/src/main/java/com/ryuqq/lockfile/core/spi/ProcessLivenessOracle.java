package com.ryuqq.lockfile.core.spi;

import com.ryuqq.lockfile.core.model.ProcessId;

/**
 * Process liveness SPI.
 *
 * <p>Answers a single question: does a process with the given identifier currently exist.
 * Implementations query the platform process table.</p>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProcessLivenessOracle {

    /**
     * Checks whether a process with the given identifier is alive.
     *
     * @param processId the process identifier
     * @return true if a live process has this identifier
     */
    boolean isAlive(ProcessId processId);
}
