package com.ryuqq.lockfile.adapter.inmemory.marker;

import com.ryuqq.lockfile.core.model.ProcessId;
import com.ryuqq.lockfile.core.spi.ProcessLivenessOracle;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Controllable in-memory {@link ProcessLivenessOracle}.
 *
 * <p>Simulates a process table so that one JVM can model several lock owners,
 * including owners that crash without cleaning up their markers.</p>
 *
 * <p><strong>Behavior:</strong></p>
 * <ul>
 *   <li>The running JVM's own identifier is alive from construction</li>
 *   <li>{@link #spawn()} registers and returns a fresh live identifier</li>
 *   <li>{@link #kill(ProcessId)} marks an identifier as exited</li>
 * </ul>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
public class InMemoryProcessTable implements ProcessLivenessOracle {

    /**
     * Simulated identifiers start far above typical PID ranges.
     */
    private static final long FIRST_SIMULATED_PID = 4_000_000L;

    private final Set<ProcessId> alive;
    private final AtomicLong nextPid;

    /**
     * Creates a process table containing only the running JVM.
     */
    public InMemoryProcessTable() {
        this.alive = ConcurrentHashMap.newKeySet();
        this.nextPid = new AtomicLong(FIRST_SIMULATED_PID);
        this.alive.add(ProcessId.current());
    }

    @Override
    public boolean isAlive(ProcessId processId) {
        if (processId == null) {
            throw new IllegalArgumentException("processId cannot be null");
        }
        return alive.contains(processId);
    }

    /**
     * Registers a new live process.
     *
     * @return the new process identifier
     */
    public ProcessId spawn() {
        ProcessId processId = ProcessId.of(nextPid.getAndIncrement());
        alive.add(processId);
        return processId;
    }

    /**
     * Marks a process as exited.
     *
     * @param processId the process identifier
     */
    public void kill(ProcessId processId) {
        alive.remove(processId);
    }

    /**
     * Returns an identifier that was never alive.
     *
     * @return an exited process identifier
     */
    public ProcessId exited() {
        ProcessId processId = spawn();
        kill(processId);
        return processId;
    }
}
