package com.phillippitts.peervoice.service.batch;

import java.time.Duration;

/**
 * Snapshot of batcher counters.
 *
 * @param segmentsProcessed          segments passed to {@code addSegment}
 * @param batchesCompleted           finalized batches
 * @param totalAudioDuration         audio in finalized batches
 * @param averageFinalTranscriptionMs mean duration of final recognizer calls, 0 when none ran
 */
public record BatcherStatistics(
        long segmentsProcessed,
        long batchesCompleted,
        Duration totalAudioDuration,
        double averageFinalTranscriptionMs
) {
}
