package com.example.keyseq_backend.sequence;

import com.example.keyseq_backend.model.Frame;
import com.example.keyseq_backend.model.PivotMatch;
import com.example.keyseq_backend.model.SequenceSlot;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Result of running one candidate through pivot selection, window expansion, building and validation.
 *
 * @param candidate  the candidate frame.
 * @param pivot      pivot match, {@code null} when pivot selection itself failed.
 * @param windowSize number of window frames the sequence was built from.
 * @param slots      assigned slots, empty when no sequence was built.
 * @param valid      whether the sequence passed validation.
 * @param reason     short human-readable outcome.
 */
public record CandidateOutcome(Frame candidate,
                               @Nullable PivotMatch pivot,
                               int windowSize,
                               List<SequenceSlot> slots,
                               boolean valid,
                               String reason) {

    public CandidateOutcome {
        slots = List.copyOf(slots);
    }

    static CandidateOutcome belowThreshold(Frame candidate, PivotMatch pivot, double threshold) {
        return new CandidateOutcome(candidate, pivot, 0, List.of(), false,
                "pivot similarity %.4f below threshold %.4f".formatted(pivot.similarity(), threshold));
    }

    static CandidateOutcome built(Frame candidate, PivotMatch pivot, int windowSize, List<SequenceSlot> slots,
                                  SequenceValidator.ValidationResult validation) {
        return new CandidateOutcome(candidate, pivot, windowSize, slots, validation.valid(), validation.reason());
    }

    public static CandidateOutcome failed(Frame candidate, String reason) {
        return new CandidateOutcome(candidate, null, 0, List.of(), false, reason);
    }
}
