package com.example.keyseq_backend.sequence;

import com.example.keyseq_backend.model.Frame;
import com.example.keyseq_backend.model.SequenceSlot;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SequenceValidatorTest {

    private final SequenceValidator validator = new SequenceValidator();

    @Test
    void rejectsEmptySequence() {
        SequenceValidator.ValidationResult result = validator.validate(List.of(), 3, 0.1);

        assertThat(result.valid()).isFalse();
        assertThat(result.reason()).contains("empty");
    }

    @Test
    void singleSlotOfThreeDependsOnCompletenessFloor() {
        List<SequenceSlot> single = List.of(slot(1, 500, true));

        assertThat(validator.validate(single, 3, 0.3).valid()).isTrue();
        assertThat(validator.validate(single, 3, 0.5).valid()).isFalse();
        assertThat(validator.validate(single, 3, 0.5).reason()).contains("completeness");
    }

    @Test
    void rejectsNonIncreasingFrameNumbers() {
        List<SequenceSlot> equal = List.of(slot(0, 500, true), slot(1, 500, false));
        List<SequenceSlot> decreasing = List.of(slot(0, 500, true), slot(2, 480, false));

        assertThat(validator.validate(equal, 3, 0.1).valid()).isFalse();
        assertThat(validator.validate(decreasing, 3, 0.1).reason()).contains("order");
    }

    @Test
    void ignoresUnassignedSlotsWhenCheckingOrder() {
        List<SequenceSlot> slots = List.of(slot(0, 100, true), SequenceSlot.unassigned(1), slot(2, 300, false));

        assertThat(validator.validate(slots, 3, 0.5).valid()).isTrue();
    }

    private static SequenceSlot slot(int eventIndex, int frameNumber, boolean pivot) {
        Frame frame = new Frame(frameNumber, "v1", frameNumber, 0.0, 0.5, null);
        return pivot ? SequenceSlot.pivot(eventIndex, frame, 0.5) : SequenceSlot.matched(eventIndex, frame, 0.5);
    }
}
