package com.phillippitts.peervoice.exception;

/**
 * Thrown when an external helper process (recognizer or synthesizer binary) fails:
 * it could not start, exited non-zero, or exceeded its timeout.
 */
public class ProcessExecutionException extends PeerVoiceException {

    private final String executable;
    private final int exitCode;
    private final long durationMs;
    private final String stderrSnippet;

    public ProcessExecutionException(String message, String executable, int exitCode,
                                     long durationMs, String stderrSnippet, Throwable cause) {
        super(message + " (executable: " + executable + ", exit: " + exitCode + ", " + durationMs + " ms)", cause);
        this.executable = executable;
        this.exitCode = exitCode;
        this.durationMs = durationMs;
        this.stderrSnippet = stderrSnippet == null ? "" : stderrSnippet;
    }

    public String getExecutable() {
        return executable;
    }

    /**
     * @return process exit code, or -1 when the process timed out or never started
     */
    public int getExitCode() {
        return exitCode;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public String getStderrSnippet() {
        return stderrSnippet;
    }
}
