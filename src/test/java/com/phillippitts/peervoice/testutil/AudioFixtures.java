package com.phillippitts.peervoice.testutil;

import com.phillippitts.peervoice.domain.AudioFrame;
import com.phillippitts.peervoice.domain.AudioSegment;

import java.time.Instant;

/**
 * Builders for synthetic audio at 16 kHz.
 */
public final class AudioFixtures {

    public static final int SAMPLE_RATE = 16_000;
    /** 30 ms at 16 kHz. */
    public static final int FRAME_SAMPLES = 480;

    private AudioFixtures() {}

    /**
     * 200 Hz sine whose RMS equals {@code rms}; low zero-crossing rate, so it reads as voiced speech.
     */
    public static float[] sine(int samples, double rms) {
        float[] out = new float[samples];
        double amplitude = rms * Math.sqrt(2.0);
        for (int i = 0; i < samples; i++) {
            out[i] = (float) (amplitude * Math.sin(2 * Math.PI * 200.0 * i / SAMPLE_RATE));
        }
        return out;
    }

    public static AudioFrame sineFrame(int samples, double rms, Instant at) {
        float[] f = sine(samples, rms);
        short[] s = new short[samples];
        for (int i = 0; i < samples; i++) {
            s[i] = (short) Math.round(f[i] * 32767.0);
        }
        return new AudioFrame(s, SAMPLE_RATE, at);
    }

    public static AudioFrame silentFrame(int samples, Instant at) {
        return new AudioFrame(new short[samples], SAMPLE_RATE, at);
    }

    public static AudioSegment speech(int samples, Instant at) {
        return AudioSegment.of(sine(samples, 0.05), SAMPLE_RATE, at, true, 0.05);
    }

    public static AudioSegment silence(int samples, Instant at) {
        return AudioSegment.of(new float[samples], SAMPLE_RATE, at, false, 0.0);
    }
}
