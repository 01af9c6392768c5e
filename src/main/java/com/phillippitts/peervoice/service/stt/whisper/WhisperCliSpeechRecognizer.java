package com.phillippitts.peervoice.service.stt.whisper;

import com.phillippitts.peervoice.config.recognizer.WhisperProperties;
import com.phillippitts.peervoice.domain.TranscriptionResult;
import com.phillippitts.peervoice.exception.ModelNotFoundException;
import com.phillippitts.peervoice.exception.ProcessExecutionException;
import com.phillippitts.peervoice.exception.TranscriptionException;
import com.phillippitts.peervoice.service.audio.WavWriter;
import com.phillippitts.peervoice.service.process.ProcessRunner;
import com.phillippitts.peervoice.service.stt.AbstractSpeechRecognizer;
import com.phillippitts.peervoice.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recognizer backed by the whisper.cpp command-line binary.
 *
 * <p>Each request writes the samples to a temporary WAV file and runs:
 * <pre>
 * ${binary} -m ${model} -f ${wav} -l ${language} -t ${threads} -bs ${beam} (-oj | -otxt) -of stdout
 * </pre>
 * Final requests ({@code requestAlignment=true}) use JSON output and the final beam size; partials
 * use plain text and the partial beam size.
 *
 * <p>Never logs transcript text above DEBUG.
 */
public final class WhisperCliSpeechRecognizer extends AbstractSpeechRecognizer {

    private static final Logger LOG = LogManager.getLogger(WhisperCliSpeechRecognizer.class);
    static final String ENGINE = "whisper";

    private final WhisperProperties props;
    private final ProcessRunner runner;

    public WhisperCliSpeechRecognizer(WhisperProperties props, ProcessRunner runner) {
        this.props = Objects.requireNonNull(props, "props");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    protected void doInitialize() {
        if (props.validateOnStartup()) {
            requireFile(props.binaryPath());
            requireFile(props.modelPath());
        }
        LOG.info("Whisper recognizer initialized: bin={}, model={}, timeout={}s, lang={}, threads={}",
                props.binaryPath(), props.modelPath(), props.timeoutSeconds(), props.language(), props.threads());
    }

    @Override
    protected TranscriptionResult doRecognize(float[] samples, boolean requestAlignment) {
        Path wav = null;
        long startTime = System.nanoTime();
        try {
            wav = Files.createTempFile("peervoice-", ".wav");
            WavWriter.writeSamples(samples, wav);
            String stdout = runner.run(buildCommand(wav, requestAlignment), wav.getParent(),
                    Duration.ofSeconds(props.timeoutSeconds()), props.maxStdoutBytes());
            WhisperOutputParser.Parsed parsed = requestAlignment
                    ? WhisperOutputParser.parseJson(stdout)
                    : WhisperOutputParser.parseText(stdout);
            LOG.debug("Whisper {} transcription in {} ms (chars={})",
                    requestAlignment ? "final" : "partial", TimeUtils.elapsedMillis(startTime), parsed.text().length());
            return TranscriptionResult.of(parsed.text(), parsed.confidence(), requestAlignment, ENGINE);
        } catch (ProcessExecutionException e) {
            LOG.warn("whisper.cpp failed: exit={}, stderr='{}'", e.getExitCode(), e.getStderrSnippet());
            throw new TranscriptionException("whisper.cpp failed: " + e.getMessage(), ENGINE, e);
        } catch (IOException e) {
            throw new TranscriptionException("Cannot create temporary WAV file", ENGINE, e);
        } finally {
            deleteQuietly(wav);
        }
    }

    List<String> buildCommand(Path wav, boolean requestAlignment) {
        List<String> cmd = new ArrayList<>();
        cmd.add(resolvePath(props.binaryPath()).toString());
        cmd.add("-m");
        cmd.add(resolvePath(props.modelPath()).toString());
        cmd.add("-f");
        cmd.add(wav.toAbsolutePath().toString());
        cmd.add("-l");
        cmd.add(props.language());
        cmd.add("-t");
        cmd.add(String.valueOf(props.threads()));
        cmd.add("-bs");
        cmd.add(String.valueOf(requestAlignment ? props.finalBeamSize() : props.partialBeamSize()));
        if (requestAlignment) {
            cmd.add("-oj");
        } else {
            cmd.add("-otxt");
            cmd.add("-nt");
        }
        cmd.add("-of");
        cmd.add("stdout");
        return cmd;
    }

    @Override
    public String getEngineName() {
        return ENGINE;
    }

    @Override
    protected void doClose() {
        runner.close();
        LOG.info("Whisper recognizer closed");
    }

    private static void requireFile(String pathString) {
        if (!Files.exists(resolvePath(pathString))) {
            throw new ModelNotFoundException(pathString);
        }
    }

    private static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
    }

    private static void deleteQuietly(Path wav) {
        if (wav == null) {
            return;
        }
        try {
            Files.deleteIfExists(wav);
        } catch (IOException e) {
            LOG.debug("Could not delete temporary WAV {}: {}", wav, e.toString());
        }
    }
}
