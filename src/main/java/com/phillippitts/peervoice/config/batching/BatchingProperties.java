package com.phillippitts.peervoice.config.batching;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Pause heuristics and limits of the speech batcher.
 *
 * <p>The long-pause threshold adapts to the running batch length:
 * {@code longPauseBaseMs * min(longPauseMaxScale, batchMs / longPauseScaleReferenceMs)} once the
 * batch is longer than the reference, {@code longPauseBaseMs} otherwise. The curve is empirical;
 * tune it per deployment.
 */
@Validated
@ConfigurationProperties(prefix = "batching")
public class BatchingProperties {

    /** Silence that ends an utterance once the batch has enough content. */
    @Min(100)
    private long shortPauseMs = 1_000;

    /** Silence that ends a batch regardless of content, before adaptive scaling. */
    @Min(100)
    private long longPauseBaseMs = 3_000;

    @Min(100)
    private long longPauseScaleReferenceMs = 3_000;

    @DecimalMin("1.0")
    private double longPauseMaxScale = 1.5;

    /** A batch opens once held speech reaches this much audio; shorter speech is held and merged. */
    @Min(0)
    private long minSegmentMs = 30;

    /** Content required for the short-pause shortcut. */
    @Min(1)
    private int minSegmentsForFinal = 2;

    @Min(0)
    private long minContentMs = 500;

    /** Hard cap on accumulated audio per batch. */
    @Min(500)
    private long maxBatchMs = 9_500;

    /** A partial transcription is requested every this many appended segments. */
    @Min(1)
    private int partialInterval = 3;

    /** Audio covered by a partial transcription, counted back from the newest sample. */
    @Min(100)
    private long partialWindowMs = 2_000;

    @Min(100)
    private long recognitionTimeoutMs = 15_000;

    /** Queue poll timeout of the processing loop; pause checks run at least this often. */
    @Min(10)
    @Max(5_000)
    private long pollTimeoutMs = 300;

    /** Queued partial requests; finals are always queued. */
    @Min(1)
    private int requestQueueCapacity = 32;

    /** Queued events before partials give way; finals are always kept. */
    @Min(1)
    private int eventQueueCapacity = 64;

    @Min(1)
    private int completedHistorySize = 10;

    public long getShortPauseMs() { return shortPauseMs; }
    public void setShortPauseMs(long shortPauseMs) { this.shortPauseMs = shortPauseMs; }

    public long getLongPauseBaseMs() { return longPauseBaseMs; }
    public void setLongPauseBaseMs(long longPauseBaseMs) { this.longPauseBaseMs = longPauseBaseMs; }

    public long getLongPauseScaleReferenceMs() { return longPauseScaleReferenceMs; }
    public void setLongPauseScaleReferenceMs(long v) { this.longPauseScaleReferenceMs = v; }

    public double getLongPauseMaxScale() { return longPauseMaxScale; }
    public void setLongPauseMaxScale(double longPauseMaxScale) { this.longPauseMaxScale = longPauseMaxScale; }

    public long getMinSegmentMs() { return minSegmentMs; }
    public void setMinSegmentMs(long minSegmentMs) { this.minSegmentMs = minSegmentMs; }

    public int getMinSegmentsForFinal() { return minSegmentsForFinal; }
    public void setMinSegmentsForFinal(int minSegmentsForFinal) { this.minSegmentsForFinal = minSegmentsForFinal; }

    public long getMinContentMs() { return minContentMs; }
    public void setMinContentMs(long minContentMs) { this.minContentMs = minContentMs; }

    public long getMaxBatchMs() { return maxBatchMs; }
    public void setMaxBatchMs(long maxBatchMs) { this.maxBatchMs = maxBatchMs; }

    public int getPartialInterval() { return partialInterval; }
    public void setPartialInterval(int partialInterval) { this.partialInterval = partialInterval; }

    public long getPartialWindowMs() { return partialWindowMs; }
    public void setPartialWindowMs(long partialWindowMs) { this.partialWindowMs = partialWindowMs; }

    public long getRecognitionTimeoutMs() { return recognitionTimeoutMs; }
    public void setRecognitionTimeoutMs(long recognitionTimeoutMs) { this.recognitionTimeoutMs = recognitionTimeoutMs; }

    public long getPollTimeoutMs() { return pollTimeoutMs; }
    public void setPollTimeoutMs(long pollTimeoutMs) { this.pollTimeoutMs = pollTimeoutMs; }

    public int getRequestQueueCapacity() { return requestQueueCapacity; }
    public void setRequestQueueCapacity(int requestQueueCapacity) { this.requestQueueCapacity = requestQueueCapacity; }

    public int getEventQueueCapacity() { return eventQueueCapacity; }
    public void setEventQueueCapacity(int eventQueueCapacity) { this.eventQueueCapacity = eventQueueCapacity; }

    public int getCompletedHistorySize() { return completedHistorySize; }
    public void setCompletedHistorySize(int completedHistorySize) { this.completedHistorySize = completedHistorySize; }
}
