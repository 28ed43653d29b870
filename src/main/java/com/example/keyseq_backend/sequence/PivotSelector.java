package com.example.keyseq_backend.sequence;

import com.example.keyseq_backend.model.Event;
import com.example.keyseq_backend.model.Frame;
import com.example.keyseq_backend.model.PivotMatch;
import com.example.keyseq_backend.service.similarity.FrameSimilarityLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Determines which event a candidate frame matches best. The lowest event index wins ties.
 */
@Component
public class PivotSelector {
    private static final Logger LOGGER = LoggerFactory.getLogger(PivotSelector.class);

    private final FrameSimilarityLookup lookup;

    public PivotSelector(FrameSimilarityLookup lookup) {
        this.lookup = lookup;
    }

    public PivotMatch select(SearchSession session, Frame candidate, List<Event> events) {
        if (events.isEmpty()) {
            throw new IllegalArgumentException("events must not be empty");
        }
        int bestIndex = -1;
        double bestSimilarity = Double.NEGATIVE_INFINITY;
        for (Event event : events) {
            double similarity = lookup.similarity(session, candidate, event.description());
            if (similarity > bestSimilarity) {
                bestSimilarity = similarity;
                bestIndex = event.index();
            }
        }
        LOGGER.trace("pivot frame={} keyframe={} event={} similarity={}",
                candidate.id(), candidate.frameNumber(), bestIndex, bestSimilarity);
        return new PivotMatch(candidate, bestIndex, bestSimilarity);
    }

    /**
     * Early exit check applied before a sequence is built around the pivot.
     */
    public boolean accepts(PivotMatch pivot, double similarityThreshold) {
        return pivot.similarity() >= similarityThreshold;
    }
}
