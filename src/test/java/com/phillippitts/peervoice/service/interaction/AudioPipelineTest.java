package com.phillippitts.peervoice.service.interaction;

import com.phillippitts.peervoice.domain.AudioFrame;
import com.phillippitts.peervoice.domain.AudioSegment;
import com.phillippitts.peervoice.service.audio.capture.AudioFrameSource;
import com.phillippitts.peervoice.service.audio.segment.EnergyVoiceActivityDetector;
import com.phillippitts.peervoice.service.audio.segment.SegmentClassifier;
import com.phillippitts.peervoice.service.audio.segment.VadAggressiveness;
import com.phillippitts.peervoice.service.batch.SpeechBatcher;
import com.phillippitts.peervoice.testutil.AudioFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AudioPipelineTest {

    private static final Instant AT = Instant.parse("2025-01-01T10:00:00Z");

    private AudioFrameSource source;
    private SpeechBatcher batcher;
    private MicrophoneGate gate;
    private AudioPipeline pipeline;

    @BeforeEach
    void setUp() {
        source = mock(AudioFrameSource.class);
        batcher = mock(SpeechBatcher.class);
        gate = new MicrophoneGate();
        SegmentClassifier classifier =
                new SegmentClassifier(new EnergyVoiceActivityDetector(VadAggressiveness.AGGRESSIVE), 0.01);
        pipeline = new AudioPipeline(source, classifier, batcher, gate, Duration.ofMillis(10));
    }

    @Test
    void shouldDropFramesWhileGateClosed() {
        pipeline.processFrame(AudioFixtures.sineFrame(480, 0.05, AT));

        verify(batcher, never()).addSegment(any());
        assertThat(pipeline.getFramesDropped()).isEqualTo(1);
        assertThat(pipeline.getFramesClassified()).isZero();
    }

    @Test
    void shouldClassifyAndForwardFramesWhileGateOpen() {
        // Arrange
        gate.activate();

        // Act
        pipeline.processFrame(AudioFixtures.sineFrame(480, 0.05, AT));

        // Assert
        ArgumentCaptor<AudioSegment> captor = ArgumentCaptor.forClass(AudioSegment.class);
        verify(batcher).addSegment(captor.capture());
        assertThat(captor.getValue().hasSpeech()).isTrue();
        assertThat(captor.getValue().timestamp()).isEqualTo(AT);
        assertThat(pipeline.getFramesClassified()).isEqualTo(1);
    }

    @Test
    void shouldPullFramesFromSourceUntilStopped() {
        // Arrange
        gate.activate();
        AudioFrame frame = AudioFixtures.silentFrame(480, AT);
        when(source.captureFrame(any())).thenReturn(Optional.of(frame));

        // Act
        pipeline.start();
        await().atMost(Duration.ofSeconds(2)).until(() -> pipeline.getFramesClassified() > 0);
        pipeline.stop();
        pipeline.stop();

        // Assert
        assertThat(pipeline.isRunning()).isFalse();
        verify(source).start();
        verify(source).close();
        verify(batcher, atLeastOnce()).addSegment(any());
    }

    @Test
    void shouldKeepRunningWhenSourceThrows() {
        // Arrange
        when(source.captureFrame(any()))
                .thenThrow(new IllegalStateException("device lost"))
                .thenReturn(Optional.empty());

        // Act
        pipeline.start();
        await().atMost(Duration.ofSeconds(2)).untilAsserted(
                () -> verify(source, atLeastOnce()).captureFrame(any()));

        // Assert
        assertThat(pipeline.isRunning()).isTrue();
        pipeline.stop();
    }
}
