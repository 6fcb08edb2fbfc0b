package org.checkpulse.runner;

import org.checkpulse.checkfile.CheckDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes a check command in its checkfile's directory and captures its output.
 * Never throws for process problems; those become {@link RunResult}s.
 */
public class CommandRunner {

    private static final Logger logger = LoggerFactory.getLogger(CommandRunner.class);

    private static final List<String> SHELL = List.of("/bin/sh", "-c");

    private final Path scriptsDir;
    private final long timeoutSeconds;
    private final ExecutorService streamReaders;

    /**
     * @param scriptsDir     prepended to PATH, may be null
     * @param timeoutSeconds 0 disables the timeout
     */
    public CommandRunner(Path scriptsDir, long timeoutSeconds) {
        this.scriptsDir = scriptsDir;
        this.timeoutSeconds = timeoutSeconds;
        AtomicInteger counter = new AtomicInteger();
        this.streamReaders = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "check-output-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public RunResult run(CheckDefinition definition) {
        String command = definition.command();
        Instant startedAt = Instant.now();
        long start = System.nanoTime();

        ProcessBuilder pb = new ProcessBuilder(commandLine(command))
                .directory(definition.workingDirectory().toFile());
        extendPath(pb.environment());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            logger.warn("Check '{}' could not start: {}", definition.name(), e.getMessage());
            return RunResult.spawnFailed(command, startedAt, elapsed(start), e.getMessage());
        }
        closeStdin(process, definition);

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), streamReaders);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), streamReaders);

        try {
            boolean finished;
            if (timeoutSeconds > 0) {
                finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            } else {
                process.waitFor();
                finished = true;
            }

            if (!finished) {
                killTree(process);
                String err = joinQuietly(stderr) + "\ntimed out after " + timeoutSeconds + " s";
                logger.warn("Check '{}' timed out after {}s", definition.name(), timeoutSeconds);
                return new RunResult(command, -1, joinQuietly(stdout), err.strip(), startedAt, elapsed(start),
                        RunResult.Termination.TIMED_OUT);
            }

            return new RunResult(command, process.exitValue(), stdout.get(), stderr.get(), startedAt, elapsed(start),
                    RunResult.Termination.EXITED);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            killTree(process);
            logger.warn("Check '{}' was interrupted while running", definition.name());
            return new RunResult(command, -1, joinQuietly(stdout), "interrupted", startedAt, elapsed(start),
                    RunResult.Termination.INTERRUPTED);
        } catch (ExecutionException e) {
            logger.warn("Failed to read output of check '{}': {}", definition.name(), e.getCause().getMessage());
            return new RunResult(command, process.exitValue(), "", "failed to read output: " + e.getCause().getMessage(),
                    startedAt, elapsed(start), RunResult.Termination.EXITED);
        }
    }

    List<String> commandLine(String command) {
        return List.of(SHELL.get(0), SHELL.get(1), command);
    }

    void extendPath(Map<String, String> env) {
        if (scriptsDir == null) return;
        String path = env.get("PATH");
        env.put("PATH", path == null || path.isEmpty()
                ? scriptsDir.toString()
                : scriptsDir + File.pathSeparator + path);
    }

    private static void closeStdin(Process process, CheckDefinition definition) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            logger.debug("Could not close stdin of check '{}': {}", definition.name(), e.getMessage());
        }
    }

    private static void killTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String joinQuietly(CompletableFuture<String> output) {
        try {
            return output.get(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (Exception e) {
            logger.debug("Output of a killed process was not available: {}", e.toString());
            return "";
        }
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
