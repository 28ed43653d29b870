package com.example.keyseq_backend.dto.analysis;

import com.example.keyseq_backend.model.ScoreBreakdown;
import com.example.keyseq_backend.model.ScoredSequence;
import com.example.keyseq_backend.model.SequenceMetadata;

/**
 * @param pivotFrameId    candidate frame the scored sequence was built around.
 * @param score           final composite score.
 * @param breakdown       sub-scores.
 * @param metadata        derived sequence metadata.
 * @param passedThreshold whether {@code score >= scoreThreshold}.
 */
public record ScoringTrace(long pivotFrameId,
                           double score,
                           ScoreBreakdown breakdown,
                           SequenceMetadata metadata,
                           boolean passedThreshold) {

    public static ScoringTrace of(long pivotFrameId, ScoredSequence sequence, double scoreThreshold) {
        return new ScoringTrace(pivotFrameId, sequence.score(), sequence.breakdown(), sequence.metadata(),
                sequence.score() >= scoreThreshold);
    }
}
