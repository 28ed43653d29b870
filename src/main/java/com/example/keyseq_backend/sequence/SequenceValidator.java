package com.example.keyseq_backend.sequence;

import com.example.keyseq_backend.model.SequenceSlot;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Gatekeeper between building and scoring: a sequence must be non-empty, cover at least
 * {@code minSequenceCompleteness} of the events and have strictly increasing frame numbers.
 */
@Component
public class SequenceValidator {

    public ValidationResult validate(List<SequenceSlot> sequence, int eventCount, double minSequenceCompleteness) {
        List<SequenceSlot> assigned = sequence.stream().filter(SequenceSlot::assigned).toList();
        if (assigned.isEmpty()) {
            return ValidationResult.rejected("empty sequence");
        }
        double completeness = eventCount == 0 ? 0.0 : (double) assigned.size() / eventCount;
        if (completeness < minSequenceCompleteness) {
            return ValidationResult.rejected("completeness %.3f below minimum %.3f"
                    .formatted(completeness, minSequenceCompleteness));
        }
        for (int i = 1; i < assigned.size(); i++) {
            SequenceSlot prev = assigned.get(i - 1);
            SequenceSlot curr = assigned.get(i);
            if (curr.frameNumber() <= prev.frameNumber()) {
                return ValidationResult.rejected("order violated between event %d (keyframe %d) and event %d (keyframe %d)"
                        .formatted(prev.eventIndex(), prev.frameNumber(), curr.eventIndex(), curr.frameNumber()));
            }
        }
        return ValidationResult.ok();
    }

    public record ValidationResult(boolean valid, String reason) {

        public static ValidationResult ok() {
            return new ValidationResult(true, "valid");
        }

        public static ValidationResult rejected(String reason) {
            return new ValidationResult(false, reason);
        }
    }
}
