package com.phillippitts.peervoice.service.interaction;

import java.time.Instant;

/**
 * Snapshot of session counters.
 *
 * @param segmentsProcessed segments contained in completed batches
 * @param batchesCompleted  completed batches seen by the session
 * @param commandsProcessed dispatched commands (any outcome)
 * @param echoesSuppressed  transcriptions discarded as echo
 * @param sessionStart      when the session started, null before start
 */
public record SessionStats(
        long segmentsProcessed,
        long batchesCompleted,
        long commandsProcessed,
        long echoesSuppressed,
        Instant sessionStart
) {
}
