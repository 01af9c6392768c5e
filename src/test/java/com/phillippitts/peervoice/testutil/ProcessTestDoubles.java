package com.phillippitts.peervoice.testutil;

import com.phillippitts.peervoice.service.process.ProcessFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Fake processes for hermetic tests of process-based adapters, without spawning real binaries.
 */
public final class ProcessTestDoubles {

    private ProcessTestDoubles() {}

    /**
     * @param stdout            stdout content to return
     * @param stderr            stderr content to return
     * @param exitCode          process exit code
     * @param finishAfterMillis delay before process finishes (-1 means never finish)
     */
    public record ProcessBehavior(String stdout, String stderr, int exitCode, long finishAfterMillis) {

        public static ProcessBehavior success(String stdout) {
            return new ProcessBehavior(stdout, "", 0, 0);
        }
    }

    /**
     * Returns the same process for every start and records the commands it was asked to run.
     */
    public static final class StubProcessFactory implements ProcessFactory {
        private final Process process;
        private final IOException startFailure;
        public final List<List<String>> commands = new CopyOnWriteArrayList<>();

        public StubProcessFactory(Process process) {
            this.process = process;
            this.startFailure = null;
        }

        public StubProcessFactory(IOException startFailure) {
            this.process = null;
            this.startFailure = startFailure;
        }

        @Override
        public Process start(List<String> command, Path workingDir) throws IOException {
            commands.add(List.copyOf(command));
            if (startFailure != null) {
                throw startFailure;
            }
            return process;
        }
    }

    public static final class TestProcess extends Process {
        private final byte[] out;
        private final byte[] err;
        private final int exitCode;
        private final long finishAfterMillis;
        private volatile boolean alive;
        private volatile boolean destroyCalled;

        public TestProcess(ProcessBehavior behavior) {
            this.out = behavior.stdout().getBytes(StandardCharsets.UTF_8);
            this.err = behavior.stderr().getBytes(StandardCharsets.UTF_8);
            this.exitCode = behavior.exitCode();
            this.finishAfterMillis = behavior.finishAfterMillis();
            this.alive = finishAfterMillis != 0;
        }

        public boolean wasDestroyCalled() {
            return destroyCalled;
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(out);
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(err);
        }

        @Override
        public int waitFor() {
            alive = false;
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            long ms = unit.toMillis(timeout);
            if (!alive) {
                return true;
            }
            if (finishAfterMillis < 0 || finishAfterMillis > ms) {
                Thread.sleep(ms);
                return false;
            }
            Thread.sleep(finishAfterMillis);
            alive = false;
            return true;
        }

        @Override
        public int exitValue() {
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyCalled = true;
            alive = false;
        }

        @Override
        public Process destroyForcibly() {
            destroyCalled = true;
            alive = false;
            return this;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }
}
