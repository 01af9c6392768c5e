package com.phillippitts.peervoice.service.process;

import com.phillippitts.peervoice.exception.ProcessExecutionException;
import com.phillippitts.peervoice.testutil.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.peervoice.testutil.ProcessTestDoubles.StubProcessFactory;
import com.phillippitts.peervoice.testutil.ProcessTestDoubles.TestProcess;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessRunnerTest {

    private static final List<String> CMD = List.of("/usr/bin/whisper-cli", "-f", "in.wav");

    @Test
    void successReturnsStdout() {
        // Arrange
        StubProcessFactory factory = new StubProcessFactory(new TestProcess(ProcessBehavior.success("hello\nworld")));
        ProcessRunner runner = new ProcessRunner(factory);

        // Act
        String out = runner.run(CMD, null, Duration.ofSeconds(2), 1024);

        // Assert
        assertThat(out).isEqualTo("hello\nworld");
        assertThat(factory.commands).containsExactly(CMD);
        assertThat(runner.liveProcessCount()).isZero();
    }

    @Test
    void stdoutIsCappedAtLimit() {
        ProcessRunner runner = new ProcessRunner(
                new StubProcessFactory(new TestProcess(ProcessBehavior.success("abcdefghij\nklmnop"))));

        String out = runner.run(CMD, null, Duration.ofSeconds(2), 4);

        assertThat(out).isEqualTo("abcd");
    }

    @Test
    void nonZeroExitThrowsWithStderrSnippet() {
        ProcessRunner runner = new ProcessRunner(
                new StubProcessFactory(new TestProcess(new ProcessBehavior("", "model file corrupt", 2, 0))));

        assertThatThrownBy(() -> runner.run(CMD, null, Duration.ofSeconds(2), 1024))
                .isInstanceOf(ProcessExecutionException.class)
                .hasMessageContaining("Non-zero exit")
                .satisfies(e -> {
                    ProcessExecutionException pe = (ProcessExecutionException) e;
                    assertThat(pe.getExitCode()).isEqualTo(2);
                    assertThat(pe.getStderrSnippet()).contains("model file corrupt");
                    assertThat(pe.getExecutable()).isEqualTo("/usr/bin/whisper-cli");
                });
    }

    @Test
    void timeoutDestroysProcessAndThrows() {
        // Arrange
        TestProcess process = new TestProcess(new ProcessBehavior("", "", 0, -1));
        ProcessRunner runner = new ProcessRunner(new StubProcessFactory(process));

        // Act / Assert
        assertThatThrownBy(() -> runner.run(CMD, null, Duration.ofMillis(200), 1024))
                .isInstanceOf(ProcessExecutionException.class)
                .hasMessageContaining("Timeout after 200 ms");
        assertThat(process.wasDestroyCalled()).isTrue();
        assertThat(runner.liveProcessCount()).isZero();
    }

    @Test
    void startFailureIsReportedAsProcessExecutionException() {
        ProcessRunner runner = new ProcessRunner(new StubProcessFactory(new IOException("No such file")));

        assertThatThrownBy(() -> runner.run(CMD, null, Duration.ofSeconds(1), 1024))
                .isInstanceOf(ProcessExecutionException.class)
                .hasMessageContaining("I/O failure: No such file")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void rejectsEmptyCommand() {
        ProcessRunner runner = new ProcessRunner(new StubProcessFactory(new IOException("unused")));

        assertThatThrownBy(() -> runner.run(List.of(), null, Duration.ofSeconds(1), 1024))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
