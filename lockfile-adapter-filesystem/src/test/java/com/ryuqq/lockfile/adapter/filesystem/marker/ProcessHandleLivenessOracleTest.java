package com.ryuqq.lockfile.adapter.filesystem.marker;

import com.ryuqq.lockfile.adapter.filesystem.process.ChildJvm;
import com.ryuqq.lockfile.adapter.filesystem.process.IdleMain;
import com.ryuqq.lockfile.core.model.ProcessId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ProcessHandleLivenessOracle 테스트.
 */
class ProcessHandleLivenessOracleTest {

    @TempDir
    Path tempDir;

    private final ProcessHandleLivenessOracle oracle = new ProcessHandleLivenessOracle();

    @Test
    void testCurrentProcess_IsAlive() {
        assertTrue(oracle.isAlive(ProcessId.current()));
    }

    @Test
    void testExitedProcess_IsNotAlive() {
        assertFalse(oracle.isAlive(ChildJvm.exitedProcessId()));
    }

    @Test
    void testRunningChild_AliveUntilDestroyed() throws Exception {
        // Given
        Process child = ChildJvm.start(tempDir.resolve("idle.log"), IdleMain.class);
        ProcessId childId = ProcessId.of(child.pid());

        try {
            // When & Then
            assertTrue(oracle.isAlive(childId));
        } finally {
            child.destroyForcibly();
            assertTrue(child.waitFor(30, TimeUnit.SECONDS));
        }

        assertFalse(oracle.isAlive(childId));
    }

    @Test
    void testNullProcessId_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> oracle.isAlive(null)
        );
        assertTrue(exception.getMessage().contains("processId cannot be null"));
    }
}
