package com.ryuqq.lockfile.adapter.filesystem.process;

import com.ryuqq.lockfile.core.model.ProcessId;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Launches child JVMs that share the test classpath.
 *
 * <p>Each child's combined stdout/stderr goes to a log file so a failing child can be
 * diagnosed from the assertion message.</p>
 */
public final class ChildJvm {

    private ChildJvm() {
    }

    public static Process start(Path logFile, Class<?> mainClass, String... args) throws IOException {
        List<String> command = new ArrayList<>();
        command.add(javaExecutable());
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(mainClass.getName());
        command.addAll(Arrays.asList(args));

        return new ProcessBuilder(command)
            .redirectErrorStream(true)
            .redirectOutput(logFile.toFile())
            .start();
    }

    /**
     * Waits for the child and returns its exit code.
     *
     * @throws IllegalStateException if the child does not exit in time
     */
    public static int await(Process process, Path logFile, long timeoutSeconds) throws Exception {
        if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
            process.destroyForcibly();
            throw new IllegalStateException("Child JVM " + process.pid() + " did not exit within "
                + timeoutSeconds + "s, output:\n" + output(logFile));
        }
        return process.exitValue();
    }

    public static String output(Path logFile) throws IOException {
        return Files.exists(logFile) ? Files.readString(logFile, StandardCharsets.UTF_8) : "";
    }

    /**
     * Runs a short-lived JVM to completion and returns its identifier.
     *
     * <p>The process has been reaped when this returns, so the identifier belongs to no live process.</p>
     */
    public static ProcessId exitedProcessId() {
        try {
            Process process = new ProcessBuilder(javaExecutable(), "-version")
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .start();
            if (!process.waitFor(30, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new IllegalStateException("java -version did not exit");
            }
            return ProcessId.of(process.pid());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to launch child JVM", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for child JVM", e);
        }
    }

    private static String javaExecutable() {
        return Paths.get(System.getProperty("java.home"), "bin", "java").toString();
    }
}
