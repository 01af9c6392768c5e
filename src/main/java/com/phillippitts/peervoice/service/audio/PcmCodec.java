package com.phillippitts.peervoice.service.audio;

import java.util.Objects;

import static com.phillippitts.peervoice.service.audio.AudioFormat.PCM16_FULL_SCALE;

/**
 * Conversions between PCM16LE bytes, 16-bit samples and normalised float samples,
 * plus the RMS energy measure shared by voice activity detection and echo gating.
 */
public final class PcmCodec {

    private PcmCodec() {
        // Utility class
    }

    /**
     * Decodes little-endian 16-bit samples. A trailing odd byte is ignored.
     */
    public static short[] toShorts(byte[] pcm, int length) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        int n = Math.min(length, pcm.length) / 2;
        short[] out = new short[n];
        for (int i = 0; i < n; i++) {
            int lo = pcm[2 * i] & 0xFF;
            int hi = pcm[2 * i + 1];
            out[i] = (short) ((hi << 8) | lo);
        }
        return out;
    }

    public static float[] toFloats(short[] samples) {
        float[] out = new float[samples.length];
        for (int i = 0; i < samples.length; i++) {
            out[i] = samples[i] / PCM16_FULL_SCALE;
        }
        return out;
    }

    /**
     * Encodes float samples as PCM16LE, clipping to full scale.
     */
    public static byte[] toPcm16Le(float[] samples) {
        byte[] out = new byte[samples.length * 2];
        for (int i = 0; i < samples.length; i++) {
            float clamped = Math.max(-1f, Math.min(1f, samples[i]));
            int v = Math.round(clamped * (PCM16_FULL_SCALE - 1));
            out[2 * i] = (byte) (v & 0xFF);
            out[2 * i + 1] = (byte) ((v >> 8) & 0xFF);
        }
        return out;
    }

    /**
     * Root-mean-square of normalised samples; 0 for an empty array.
     */
    public static double rms(float[] samples) {
        if (samples == null || samples.length == 0) {
            return 0.0;
        }
        double sumSquares = 0.0;
        for (float s : samples) {
            sumSquares += (double) s * s;
        }
        return Math.sqrt(sumSquares / samples.length);
    }

    /**
     * Fraction of adjacent sample pairs whose sign differs; 0 for fewer than two samples.
     */
    public static double zeroCrossingRate(float[] samples) {
        if (samples == null || samples.length < 2) {
            return 0.0;
        }
        int crossings = 0;
        for (int i = 1; i < samples.length; i++) {
            if ((samples[i] >= 0) != (samples[i - 1] >= 0)) {
                crossings++;
            }
        }
        return (double) crossings / (samples.length - 1);
    }
}
