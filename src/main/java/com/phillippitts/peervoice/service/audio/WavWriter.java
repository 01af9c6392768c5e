package com.phillippitts.peervoice.service.audio;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static com.phillippitts.peervoice.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.peervoice.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.peervoice.service.audio.AudioFormat.REQUIRED_BYTE_RATE;
import static com.phillippitts.peervoice.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.peervoice.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;

/**
 * Writes minimal PCM WAV files in the project audio format (16 kHz, 16-bit, mono, little-endian)
 * for recognizers that read audio from disk.
 */
public final class WavWriter {

    /** Size of the canonical PCM header. */
    public static final int HEADER_SIZE = 44;

    private WavWriter() {}

    /**
     * Encodes normalised samples and writes them as a WAV file.
     *
     * @param samples float samples in [-1, 1]
     * @param wavPath output file path (created or overwritten)
     */
    public static void writeSamples(float[] samples, Path wavPath) {
        Objects.requireNonNull(samples, "samples must not be null");
        writePcm16LeMono16kHz(PcmCodec.toPcm16Le(samples), wavPath);
    }

    /**
     * Writes a WAV file containing the given raw PCM16LE mono 16 kHz payload.
     *
     * @param pcm     raw PCM16LE mono audio at 16 kHz
     * @param wavPath output file path (created or overwritten)
     */
    public static void writePcm16LeMono16kHz(byte[] pcm, Path wavPath) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");

        try (OutputStream os = Files.newOutputStream(wavPath)) {
            int dataSize = pcm.length;
            os.write(new byte[] { 'R', 'I', 'F', 'F' });
            writeLEInt(os, 36 + dataSize);
            os.write(new byte[] { 'W', 'A', 'V', 'E' });

            os.write(new byte[] { 'f', 'm', 't', ' ' });
            writeLEInt(os, 16);                       // fmt chunk size for PCM
            writeLEShort(os, (short) 1);              // PCM
            writeLEShort(os, (short) REQUIRED_CHANNELS);
            writeLEInt(os, REQUIRED_SAMPLE_RATE);
            writeLEInt(os, REQUIRED_BYTE_RATE);
            writeLEShort(os, (short) REQUIRED_BLOCK_ALIGN);
            writeLEShort(os, (short) REQUIRED_BITS_PER_SAMPLE);

            os.write(new byte[] { 'd', 'a', 't', 'a' });
            writeLEInt(os, dataSize);
            os.write(pcm);
            os.flush();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write WAV file to " + wavPath + ": " + e.getMessage(), e);
        }
    }

    private static void writeLEShort(OutputStream os, short v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
