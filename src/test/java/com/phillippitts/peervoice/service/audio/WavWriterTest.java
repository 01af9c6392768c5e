package com.phillippitts.peervoice.service.audio;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.phillippitts.peervoice.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WavWriterTest {

    private static int readLeInt(byte[] b, int off) {
        return (b[off] & 0xFF) | ((b[off + 1] & 0xFF) << 8)
                | ((b[off + 2] & 0xFF) << 16) | ((b[off + 3] & 0xFF) << 24);
    }

    @Test
    void shouldWriteHeaderAndEncodedSamples() throws IOException {
        float[] samples = {0f, 0.5f, -0.5f, 1.5f};
        Path wav = Files.createTempFile("peervoice-wav-", ".wav");
        try {
            WavWriter.writeSamples(samples, wav);
            byte[] all = Files.readAllBytes(wav);

            assertThat(all.length).isEqualTo(WavWriter.HEADER_SIZE + samples.length * 2);
            assertThat(new String(all, 0, 4)).isEqualTo("RIFF");
            assertThat(new String(all, 8, 4)).isEqualTo("WAVE");
            assertThat(new String(all, 36, 4)).isEqualTo("data");
            assertThat(readLeInt(all, 24)).isEqualTo(REQUIRED_SAMPLE_RATE);
            assertThat(readLeInt(all, 40)).isEqualTo(samples.length * 2);

            // 1.5 is clipped to full scale
            short last = (short) ((all[WavWriter.HEADER_SIZE + 6] & 0xFF) | (all[WavWriter.HEADER_SIZE + 7] << 8));
            assertThat(last).isEqualTo((short) 32767);
        } finally {
            Files.deleteIfExists(wav);
        }
    }

    @Test
    void shouldWrapIoFailureInIllegalStateException() {
        Path missingDir = Path.of(System.getProperty("java.io.tmpdir"), "peervoice-missing-dir", "out.wav");

        assertThatThrownBy(() -> WavWriter.writeSamples(new float[1], missingDir))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to write WAV file");
    }
}
