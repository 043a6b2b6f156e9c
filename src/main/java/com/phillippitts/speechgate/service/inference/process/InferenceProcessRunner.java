package com.phillippitts.speechgate.service.inference.process;

import com.phillippitts.speechgate.exception.InferenceException;
import com.phillippitts.speechgate.exception.InferenceExceptionBuilder;
import com.phillippitts.speechgate.util.ProcessTimeouts;
import com.phillippitts.speechgate.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs one inference runtime invocation to completion and returns its stdout.
 *
 * <p>stdout and stderr are drained concurrently on daemon threads so the child never blocks on
 * a full pipe. There is no timeout: a call lasts as long as the runtime needs. If the waiting
 * thread is interrupted the child is destroyed and an {@link InferenceException} is raised.
 *
 * <p>Callers must serialize invocations; this class keeps no per-call state of its own.
 */
final class InferenceProcessRunner {

    private static final Logger LOG = LogManager.getLogger(InferenceProcessRunner.class);

    static final int STDERR_MAX_BYTES = 64 * 1024;
    static final int ERROR_SNIPPET_MAX_CHARS = 1000;

    private final ProcessFactory processFactory;
    private final Path workingDir;
    private final int maxStdoutBytes;

    InferenceProcessRunner(ProcessFactory processFactory, Path workingDir, int maxStdoutBytes) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.workingDir = workingDir;
        this.maxStdoutBytes = maxStdoutBytes;
    }

    /**
     * @param command   rendered command line
     * @param operation "recognize" or "synthesize", for diagnostics
     * @return captured stdout (possibly empty)
     * @throws InferenceException on start failure, non-zero exit or interruption
     */
    String run(List<String> command, String operation) {
        Objects.requireNonNull(command, "command");
        long start = System.nanoTime();
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process;
        try {
            process = processFactory.start(command, workingDir);
        } catch (IOException e) {
            throw failure("Failed to start " + operation + " runtime: " + e.getMessage(), operation, -1,
                    start, stderr, command, e);
        }

        Thread outGobbler = startGobbler(process.getInputStream(), stdout, operation + "-out", maxStdoutBytes);
        Thread errGobbler = startGobbler(process.getErrorStream(), stderr, operation + "-err", STDERR_MAX_BYTES);
        try {
            int exitCode = process.waitFor();
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            if (outGobbler.isAlive()) {
                LOG.warn("{} runtime exited but stdout was still being read after {} ms; output may be truncated",
                        operation, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT.toMillis());
            }
            if (exitCode != 0) {
                throw failure("Non-zero exit: " + exitCode, operation, exitCode, start, stderr, command, null);
            }
            LOG.debug("{} runtime finished in {} ms, stdout={} chars", operation,
                    TimeUtils.elapsedMillis(start), stdout.length());
            synchronized (stdout) {
                return stdout.toString();
            }
        } catch (InterruptedException e) {
            destroy(process);
            Thread.currentThread().interrupt();
            throw failure("Interrupted while waiting for " + operation + " runtime", operation, -1,
                    start, stderr, command, e);
        }
    }

    private static InferenceException failure(String message, String operation, int exitCode, long start,
                                              StringBuilder stderr, List<String> command, Throwable cause) {
        String snippet;
        synchronized (stderr) {
            snippet = stderr.substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, stderr.length()));
        }
        InferenceExceptionBuilder builder = InferenceExceptionBuilder.create(message)
                .operation(operation)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(start))
                .metadata("executable", command.isEmpty() ? "" : command.get(0));
        if (!snippet.isEmpty()) {
            builder.metadata("stderr", snippet);
        }
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }

    private static Thread startGobbler(InputStream in, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(in, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into the sink until the cap is reached, then keeps draining without storing.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream in;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream in, StringBuilder sink, String name, int maxBytes) {
            this.in = in;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            boolean capReached = false;
            try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (sink.length() > 0) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        sink.append(line, 0, Math.min(line.length(), Math.max(available, 0)));
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroy(Process process) {
        process.destroy();
        try {
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            if (!exited) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }
}
