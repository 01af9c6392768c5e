package com.phillippitts.peervoice.service.audio.capture;

import com.phillippitts.peervoice.config.audio.AudioCaptureProperties;
import com.phillippitts.peervoice.domain.AudioFrame;
import com.phillippitts.peervoice.service.audio.AudioFormat;
import com.phillippitts.peervoice.service.audio.PcmCodec;
import com.phillippitts.peervoice.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static com.phillippitts.peervoice.service.audio.AudioFormat.REQUIRED_BYTE_RATE;

/**
 * Java Sound based microphone source producing PCM16LE mono frames at 16 kHz.
 *
 * <p>A daemon {@code audio-capture} thread reads the {@link TargetDataLine} one frame at a time
 * into a bounded queue. When the consumer falls behind the oldest frame is dropped so capture
 * itself never blocks on the consumer. Device failures publish a {@link CaptureErrorEvent}.
 */
public class JavaSoundAudioFrameSource implements AudioFrameSource {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioFrameSource.class);

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final AudioCaptureProperties props;
    private final ApplicationEventPublisher publisher;
    private final DataLineProvider provider;
    private final Clock clock;
    private final BlockingQueue<AudioFrame> frames;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong droppedFrames = new AtomicLong();

    private volatile Thread captureThread;
    private volatile TargetDataLine line;

    public JavaSoundAudioFrameSource(AudioCaptureProperties props,
                                     ApplicationEventPublisher publisher,
                                     Clock clock) {
        this(props, publisher, clock, defaultProvider());
    }

    // Package-private for tests
    JavaSoundAudioFrameSource(AudioCaptureProperties props,
                              ApplicationEventPublisher publisher,
                              Clock clock,
                              DataLineProvider provider) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.frames = new ArrayBlockingQueue<>(props.getQueueCapacity());
    }

    private static DataLineProvider defaultProvider() {
        return (format, device) -> {
            TargetDataLine opened = null;
            if (device.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        opened = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
            }
            if (opened == null) {
                opened = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            opened.open(format);
            return opened;
        };
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        int bytesPerFrame = (props.getFrameMillis() * REQUIRED_BYTE_RATE) / 1000;
        String device = props.getDeviceName() != null ? props.getDeviceName() : "default";
        LOG.info("Starting audio capture: device='{}', frame={}ms, queue={} frames",
                device, props.getFrameMillis(), props.getQueueCapacity());
        Thread t = new Thread(() -> doCapture(bytesPerFrame), "audio-capture");
        t.setDaemon(true);
        captureThread = t;
        t.start();
    }

    @Override
    public Optional<AudioFrame> captureFrame(Duration timeout) {
        try {
            return Optional.ofNullable(frames.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public void drain() {
        frames.clear();
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    public long getDroppedFrames() {
        return droppedFrames.get();
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        TargetDataLine current = line;
        if (current != null) {
            // Unblocks a pending read()
            current.stop();
        }
        joinThread(captureThread, ProcessTimeouts.CAPTURE_THREAD_STOP_TIMEOUT.toMillis());
        captureThread = null;
        frames.clear();
        LOG.info("Audio capture stopped (dropped frames={})", droppedFrames.get());
    }

    private void doCapture(int bytesPerFrame) {
        TargetDataLine opened = null;
        try {
            opened = provider.open(AudioFormat.javaSoundFormat(), Optional.ofNullable(props.getDeviceName()));
            line = opened;
            opened.start();
            byte[] buf = new byte[bytesPerFrame];
            while (running.get()) {
                int n = opened.read(buf, 0, buf.length);
                if (n <= 0) {
                    continue;
                }
                enqueue(new AudioFrame(PcmCodec.toShorts(buf, n), AudioFormat.REQUIRED_SAMPLE_RATE, clock.instant()));
            }
        } catch (LineUnavailableException e) {
            LOG.warn("Microphone unavailable: {}", e.getMessage());
            publisher.publishEvent(new CaptureErrorEvent("MIC_UNAVAILABLE", clock.instant()));
        } catch (SecurityException se) {
            LOG.warn("Microphone access denied: {}", se.getMessage());
            publisher.publishEvent(new CaptureErrorEvent("MIC_PERMISSION_DENIED", clock.instant()));
        } catch (RuntimeException e) {
            LOG.warn("Capture failed: {}", e.toString());
            publisher.publishEvent(new CaptureErrorEvent("CAPTURE_ERROR", clock.instant()));
        } finally {
            line = null;
            closeLine(opened);
            running.set(false);
        }
    }

    private void enqueue(AudioFrame frame) {
        while (!frames.offer(frame)) {
            if (frames.poll() != null) {
                long dropped = droppedFrames.incrementAndGet();
                if (dropped % 100 == 1) {
                    LOG.debug("Frame queue full; dropped {} frames so far", dropped);
                }
            }
        }
    }

    private static void closeLine(TargetDataLine l) {
        if (l == null) {
            return;
        }
        try {
            l.stop();
            l.close();
        } catch (RuntimeException e) {
            LOG.debug("Error closing capture line: {}", e.toString());
        }
    }

    private static void joinThread(Thread thread, long timeoutMs) {
        if (thread == null || !thread.isAlive() || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(timeoutMs);
            if (thread.isAlive()) {
                LOG.warn("Capture thread did not terminate within {}ms", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for capture thread to terminate");
        }
    }
}
