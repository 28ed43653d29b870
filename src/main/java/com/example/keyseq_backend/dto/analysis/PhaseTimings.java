package com.example.keyseq_backend.dto.analysis;

/**
 * Milliseconds elapsed since the session started, taken at the end of each phase.
 */
public record PhaseTimings(long retrievalMillis, long discoveryMillis, long scoringMillis) {
}
