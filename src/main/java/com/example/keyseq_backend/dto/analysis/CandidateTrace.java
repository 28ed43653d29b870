package com.example.keyseq_backend.dto.analysis;

import com.example.keyseq_backend.model.SequenceSlot;
import com.example.keyseq_backend.sequence.CandidateOutcome;

import java.util.List;

/**
 * What happened to one candidate during sequence discovery. Pivot fields are {@code null} when
 * pivot selection did not complete.
 */
public record CandidateTrace(long frameId,
                             String videoId,
                             int frameNumber,
                             double candidateSimilarity,
                             Integer pivotEvent,
                             Double pivotSimilarity,
                             int windowSize,
                             List<SequenceSlot> slots,
                             boolean valid,
                             String reason) {

    public static CandidateTrace from(CandidateOutcome outcome) {
        return new CandidateTrace(
                outcome.candidate().id(),
                outcome.candidate().videoId(),
                outcome.candidate().frameNumber(),
                outcome.candidate().similarity(),
                outcome.pivot() == null ? null : outcome.pivot().eventIndex(),
                outcome.pivot() == null ? null : outcome.pivot().similarity(),
                outcome.windowSize(),
                outcome.slots(),
                outcome.valid(),
                outcome.reason());
    }
}
