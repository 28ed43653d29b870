package com.example.keyseq_backend.model;

import java.util.List;

/**
 * A finalized sequence together with its composite score.
 *
 * @param slots     assigned slots in event-index order.
 * @param score     weighted composite score, not normalized to {@code [0,1]}.
 * @param breakdown sub-scores used to compute {@code score}.
 * @param metadata  derived sequence metadata.
 */
public record ScoredSequence(List<SequenceSlot> slots,
                             double score,
                             ScoreBreakdown breakdown,
                             SequenceMetadata metadata) {

    public ScoredSequence {
        slots = List.copyOf(slots);
    }
}
