package com.phillippitts.peervoice.service.interaction;

import com.phillippitts.peervoice.domain.AudioFrame;
import com.phillippitts.peervoice.domain.AudioSegment;
import com.phillippitts.peervoice.service.audio.capture.AudioFrameSource;
import com.phillippitts.peervoice.service.audio.segment.SegmentClassifier;
import com.phillippitts.peervoice.service.batch.SpeechBatcher;
import com.phillippitts.peervoice.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Capture loop: pulls frames from the source and, while the microphone gate is open, classifies
 * them and feeds the batcher. Frames read while the gate is closed are dropped unclassified.
 */
public class AudioPipeline {

    private static final Logger LOG = LogManager.getLogger(AudioPipeline.class);

    private final AudioFrameSource source;
    private final SegmentClassifier classifier;
    private final SpeechBatcher batcher;
    private final MicrophoneGate gate;
    private final Duration pollTimeout;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong framesClassified = new AtomicLong();
    private final AtomicLong framesDropped = new AtomicLong();
    private volatile Thread thread;

    public AudioPipeline(AudioFrameSource source, SegmentClassifier classifier, SpeechBatcher batcher,
                         MicrophoneGate gate, Duration pollTimeout) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.batcher = Objects.requireNonNull(batcher, "batcher must not be null");
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout must not be null");
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        source.start();
        Thread t = new Thread(this::runLoop, "audio-pipeline");
        t.setDaemon(true);
        thread = t;
        t.start();
        LOG.info("Audio pipeline started (vad={})", classifier.detectorName());
    }

    /**
     * Handles one frame. Package-private for tests.
     */
    void processFrame(AudioFrame frame) {
        if (!gate.isOpen()) {
            framesDropped.incrementAndGet();
            return;
        }
        AudioSegment segment = classifier.classify(frame);
        framesClassified.incrementAndGet();
        if (LOG.isTraceEnabled()) {
            LOG.trace("Segment speech={} energy={} p={}", segment.hasSpeech(),
                    String.format("%.4f", segment.energyLevel()),
                    String.format("%.2f", SegmentClassifier.speechProbability(segment)));
        }
        batcher.addSegment(segment);
    }

    private void runLoop() {
        while (running.get()) {
            try {
                Optional<AudioFrame> frame = source.captureFrame(pollTimeout);
                frame.ifPresent(this::processFrame);
            } catch (RuntimeException e) {
                LOG.warn("Audio pipeline dropped a frame: {}", e.toString());
            }
        }
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Thread t = thread;
        if (t != null) {
            try {
                t.join(ProcessTimeouts.LOOP_JOIN_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            thread = null;
        }
        source.close();
        LOG.info("Audio pipeline stopped (classified={}, dropped={})", framesClassified.get(), framesDropped.get());
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getFramesClassified() {
        return framesClassified.get();
    }

    public long getFramesDropped() {
        return framesDropped.get();
    }
}
