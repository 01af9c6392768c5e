package com.phillippitts.peervoice.service.process;

import com.phillippitts.peervoice.exception.ProcessExecutionException;
import com.phillippitts.peervoice.util.ProcessTimeouts;
import com.phillippitts.peervoice.util.TimeUtils;
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
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs short-lived helper executables (whisper.cpp, espeak-ng, say) and collects their output.
 *
 * <p>Each call:
 * <ul>
 *   <li>starts the process via {@link ProcessFactory}</li>
 *   <li>drains stdout and stderr concurrently on daemon gobbler threads (stdout capped)</li>
 *   <li>enforces a timeout, destroying the process gracefully then forcibly</li>
 *   <li>raises {@link ProcessExecutionException} with exit code, duration and a stderr snippet</li>
 * </ul>
 *
 * <p>Calls are independent, so a partial and a final recognition may run at the same time.
 * {@link #close()} destroys every process still alive.
 */
public class ProcessRunner implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ProcessRunner.class);

    /** Cap on accumulated stderr; only used for diagnostics. */
    static final int STDERR_MAX_BYTES = 64 * 1024;

    /** Characters of stderr carried by exceptions. */
    static final int ERROR_SNIPPET_MAX_CHARS = 500;

    private final ProcessFactory processFactory;
    private final Set<Process> live = ConcurrentHashMap.newKeySet();

    public ProcessRunner() {
        this(new DefaultProcessFactory());
    }

    public ProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Runs {@code command} to completion.
     *
     * @param command        executable followed by its arguments
     * @param workingDir     working directory (may be null)
     * @param timeout        maximum run time
     * @param maxStdoutBytes cap on captured stdout
     * @return captured stdout (may be empty)
     * @throws ProcessExecutionException on start failure, timeout, non-zero exit or interruption
     */
    public String run(List<String> command, Path workingDir, Duration timeout, int maxStdoutBytes) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        String executable = command.get(0);
        long startTime = System.nanoTime();
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process = null;
        Thread outGobbler = null;
        Thread errGobbler = null;
        try {
            process = processFactory.start(command, workingDir);
            live.add(process);
            // Start gobblers before waiting to avoid pipe deadlock
            outGobbler = startGobbler(process.getInputStream(), stdout, threadName(executable, "out"), maxStdoutBytes);
            errGobbler = startGobbler(process.getErrorStream(), stderr, threadName(executable, "err"), STDERR_MAX_BYTES);

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyProcess(process);
                throw failure("Timeout after " + timeout.toMillis() + " ms", executable, -1, startTime, stderr, null);
            }
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw failure("Non-zero exit", executable, exitCode, startTime, stderr, null);
            }
            LOG.debug("{} finished in {} ms (stdout={} chars)",
                    executable, TimeUtils.elapsedMillis(startTime), stdout.length());
            return stdout.toString();
        } catch (IOException e) {
            throw failure("I/O failure: " + e.getMessage(), executable, -1, startTime, stderr, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                destroyProcess(process);
            }
            throw failure("Interrupted", executable, -1, startTime, stderr, e);
        } finally {
            if (process != null) {
                live.remove(process);
                if (process.isAlive()) {
                    destroyProcess(process);
                }
            }
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        }
    }

    /**
     * Number of processes currently running through this runner.
     */
    public int liveProcessCount() {
        return live.size();
    }

    /**
     * Destroys every process still running. Idempotent.
     */
    @Override
    public void close() {
        for (Process process : live) {
            destroyProcess(process);
        }
        live.clear();
    }

    private static String threadName(String executable, String stream) {
        String base = Path.of(executable).getFileName().toString();
        return base + "-" + stream;
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a sink until its cap, then keeps draining without accumulating.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
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
                        sink.append(line, 0, Math.min(line.length(), Math.max(0, available)));
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        }
    }

    private static ProcessExecutionException failure(String msg, String executable, int exitCode,
                                                     long startTime, StringBuilder stderr, Throwable cause) {
        String snippet;
        synchronized (stderr) {
            snippet = stderr.substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, stderr.length()));
        }
        return new ProcessExecutionException(msg, executable, exitCode,
                TimeUtils.elapsedMillis(startTime), snippet, cause);
    }
}
