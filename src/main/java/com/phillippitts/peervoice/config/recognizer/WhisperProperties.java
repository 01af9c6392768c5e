package com.phillippitts.peervoice.config.recognizer;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the whisper.cpp command-line recognizer.
 * Binds to properties prefixed with "recognizer.whisper".
 *
 * <p>Example application.properties:
 * <pre>
 * recognizer.whisper.binary-path=tools/whisper.cpp/whisper-cli
 * recognizer.whisper.model-path=models/ggml-small.bin
 * recognizer.whisper.language=fr
 * </pre>
 *
 * @param binaryPath        path to the whisper.cpp executable
 * @param modelPath         path to the GGML model file (.bin)
 * @param timeoutSeconds    maximum time one recognition may take
 * @param language          language code passed with {@code -l}
 * @param threads           CPU threads passed with {@code -t}
 * @param maxStdoutBytes    cap on captured stdout
 * @param partialBeamSize   beam size for partial (low-latency) requests
 * @param finalBeamSize     beam size for final (alignment) requests
 * @param validateOnStartup fail startup when the binary or model is missing
 */
@ConfigurationProperties(prefix = "recognizer.whisper")
@Validated
public record WhisperProperties(
        @NotBlank(message = "Whisper binary path must not be blank")
        String binaryPath,
        @NotBlank(message = "Whisper model path must not be blank")
        String modelPath,
        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,
        @NotBlank(message = "Language code must not be blank")
        String language,
        @Positive(message = "Thread count must be positive")
        int threads,
        @Positive(message = "Max stdout bytes must be positive")
        int maxStdoutBytes,
        @Positive
        int partialBeamSize,
        @Positive
        int finalBeamSize,
        boolean validateOnStartup
) {
    @ConstructorBinding
    public WhisperProperties {
    }

    public WhisperProperties() {
        this("tools/whisper.cpp/whisper-cli", "models/ggml-base.bin", 15, "en", 4, 1_048_576, 1, 5, true);
    }
}
