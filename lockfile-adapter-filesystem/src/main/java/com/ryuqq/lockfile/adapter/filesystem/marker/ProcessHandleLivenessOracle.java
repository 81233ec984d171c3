package com.ryuqq.lockfile.adapter.filesystem.marker;

import com.ryuqq.lockfile.core.model.ProcessId;
import com.ryuqq.lockfile.core.spi.ProcessLivenessOracle;

/**
 * {@link ProcessLivenessOracle} backed by the operating system process table.
 *
 * <p>An identifier is alive when {@link ProcessHandle#of(long)} finds a process and
 * that process has not terminated.</p>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
public class ProcessHandleLivenessOracle implements ProcessLivenessOracle {

    @Override
    public boolean isAlive(ProcessId processId) {
        if (processId == null) {
            throw new IllegalArgumentException("processId cannot be null");
        }
        return ProcessHandle.of(processId.getValue())
            .map(ProcessHandle::isAlive)
            .orElse(false);
    }
}
