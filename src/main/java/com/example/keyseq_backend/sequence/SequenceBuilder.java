package com.example.keyseq_backend.sequence;

import com.example.keyseq_backend.model.AlgorithmConfig;
import com.example.keyseq_backend.model.Event;
import com.example.keyseq_backend.model.Frame;
import com.example.keyseq_backend.model.PivotMatch;
import com.example.keyseq_backend.model.SequenceSlot;
import com.example.keyseq_backend.model.SimilarityMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Expands a pivot into a sequence. Earlier events are filled walking backwards from the pivot,
 * later events walking forwards; for each event the window frames on that side of the pivot are
 * tried best similarity first and the first one that keeps strict frame order against the nearest
 * placed neighbour towards the pivot is taken.
 */
@Component
public class SequenceBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(SequenceBuilder.class);

    /**
     * Builds the sequence around a pivot.
     *
     * @param pivot  pivot candidate and the event it matched.
     * @param events all events in index order.
     * @param window frames of the pivot's video inside the search window, ordered by frame number.
     * @param matrix event x window-frame similarities, columns aligned with {@code window}.
     * @param cfg    algorithm configuration.
     * @return assigned slots in event-index order; always contains the pivot slot.
     */
    public List<SequenceSlot> build(PivotMatch pivot,
                                    List<Event> events,
                                    List<Frame> window,
                                    SimilarityMatrix matrix,
                                    AlgorithmConfig cfg) {
        Frame pivotFrame = pivot.candidate();
        int pivotIndex = pivot.eventIndex();
        if (pivotIndex < 0 || pivotIndex >= events.size()) {
            throw new IllegalArgumentException("pivot event index out of range: " + pivotIndex);
        }
        SequenceSlot[] slots = new SequenceSlot[events.size()];
        for (int i = 0; i < slots.length; i++) {
            slots[i] = SequenceSlot.unassigned(i);
        }
        slots[pivotIndex] = SequenceSlot.pivot(pivotIndex, pivotFrame, pivotFrame.similarity());

        if (window.isEmpty()) {
            LOGGER.debug("empty window around pivot frame={} keyframe={}, pivot-only sequence",
                    pivotFrame.id(), pivotFrame.frameNumber());
            return assigned(slots);
        }

        List<Integer> earlier = new ArrayList<>();
        List<Integer> later = new ArrayList<>();
        for (int f = 0; f < window.size(); f++) {
            int frameNumber = window.get(f).frameNumber();
            if (frameNumber < pivotFrame.frameNumber()) {
                earlier.add(f);
            } else if (frameNumber > pivotFrame.frameNumber()) {
                later.add(f);
            }
        }

        // the two passes touch disjoint slots and only read the pivot slot they share
        fillBackward(slots, pivotIndex, earlier, window, matrix, cfg.similarityThreshold());
        fillForward(slots, pivotIndex, later, window, matrix, cfg.similarityThreshold());
        return assigned(slots);
    }

    private static void fillBackward(SequenceSlot[] slots, int pivotIndex, List<Integer> eligible,
                                     List<Frame> window, SimilarityMatrix matrix, double threshold) {
        for (int e = pivotIndex - 1; e >= 0; e--) {
            SequenceSlot bound = nearestAssigned(slots, e + 1, +1);
            SequenceSlot chosen = pick(e, eligible, window, matrix, threshold,
                    frame -> frame.frameNumber() < bound.frameNumber());
            if (chosen != null) {
                slots[e] = chosen;
            } else {
                LOGGER.trace("event={} left unassigned before keyframe={}", e, bound.frameNumber());
            }
        }
    }

    private static void fillForward(SequenceSlot[] slots, int pivotIndex, List<Integer> eligible,
                                    List<Frame> window, SimilarityMatrix matrix, double threshold) {
        for (int e = pivotIndex + 1; e < slots.length; e++) {
            SequenceSlot bound = nearestAssigned(slots, e - 1, -1);
            SequenceSlot chosen = pick(e, eligible, window, matrix, threshold,
                    frame -> frame.frameNumber() > bound.frameNumber());
            if (chosen != null) {
                slots[e] = chosen;
            } else {
                LOGGER.trace("event={} left unassigned after keyframe={}", e, bound.frameNumber());
            }
        }
    }

    private static SequenceSlot pick(int eventIndex, List<Integer> eligible, List<Frame> window,
                                     SimilarityMatrix matrix, double threshold,
                                     Predicate<Frame> keepsOrder) {
        for (Ranked candidate : rank(eventIndex, eligible, matrix)) {
            if (candidate.similarity() < threshold) {
                return null;
            }
            Frame frame = window.get(candidate.frameIndex());
            if (keepsOrder.test(frame)) {
                return SequenceSlot.matched(eventIndex, frame, candidate.similarity());
            }
        }
        return null;
    }

    // stable sort: equal similarities keep window order, i.e. lower frame number first
    private static List<Ranked> rank(int eventIndex, List<Integer> eligible, SimilarityMatrix matrix) {
        List<Ranked> ranked = new ArrayList<>(eligible.size());
        for (int frameIndex : eligible) {
            if (matrix.covers(eventIndex, frameIndex)) {
                ranked.add(new Ranked(frameIndex, matrix.get(eventIndex, frameIndex)));
            }
        }
        ranked.sort(Comparator.comparingDouble(Ranked::similarity).reversed());
        return ranked;
    }

    // walks from start in the given direction; the pivot slot guarantees a hit
    private static SequenceSlot nearestAssigned(SequenceSlot[] slots, int start, int step) {
        for (int i = start; i >= 0 && i < slots.length; i += step) {
            if (slots[i].assigned()) {
                return slots[i];
            }
        }
        throw new IllegalStateException("no placed slot found from index " + start);
    }

    private static List<SequenceSlot> assigned(SequenceSlot[] slots) {
        return Arrays.stream(slots).filter(SequenceSlot::assigned).toList();
    }

    private record Ranked(int frameIndex, double similarity) {
    }
}
