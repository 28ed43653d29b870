package com.example.keyseq_backend.sequence;

import com.example.keyseq_backend.model.AlgorithmConfig;
import com.example.keyseq_backend.model.Event;
import com.example.keyseq_backend.model.Frame;
import com.example.keyseq_backend.model.PivotMatch;
import com.example.keyseq_backend.model.SequenceSlot;
import com.example.keyseq_backend.model.SimilarityMatrix;
import com.example.keyseq_backend.service.similarity.SimilarityMatrixProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Runs a single candidate through pivot selection, window expansion, the similarity matrix,
 * sequence building and validation. Scoring is left to the caller.
 */
@Component
public class SequenceDiscovery {
    private static final Logger LOGGER = LoggerFactory.getLogger(SequenceDiscovery.class);

    private final PivotSelector pivotSelector;
    private final WindowedCandidateExpander expander;
    private final SimilarityMatrixProvider matrixProvider;
    private final SequenceBuilder builder;
    private final SequenceValidator validator;

    public SequenceDiscovery(PivotSelector pivotSelector,
                             WindowedCandidateExpander expander,
                             SimilarityMatrixProvider matrixProvider,
                             SequenceBuilder builder,
                             SequenceValidator validator) {
        this.pivotSelector = pivotSelector;
        this.expander = expander;
        this.matrixProvider = matrixProvider;
        this.builder = builder;
        this.validator = validator;
    }

    public CandidateOutcome discover(SearchSession session, Frame candidate, List<Event> events) {
        AlgorithmConfig cfg = session.config();
        PivotMatch pivot = pivotSelector.select(session, candidate, events);
        if (!pivotSelector.accepts(pivot, cfg.similarityThreshold())) {
            LOGGER.trace("candidate frame={} rejected, pivot similarity={} threshold={}",
                    candidate.id(), pivot.similarity(), cfg.similarityThreshold());
            return CandidateOutcome.belowThreshold(candidate, pivot, cfg.similarityThreshold());
        }

        List<Frame> window = limit(session, candidate, expander.expand(session, candidate, cfg.searchWindow()));
        SimilarityMatrix matrix = matrixProvider.compute(session, events, window);
        List<SequenceSlot> slots = builder.build(pivot, events, window, matrix, cfg);
        SequenceValidator.ValidationResult validation =
                validator.validate(slots, events.size(), cfg.minSequenceCompleteness());

        LOGGER.debug("candidate session={} frame={} video={} keyframe={} pivotEvent={} window={} slots={} valid={}",
                session.id(), candidate.id(), candidate.videoId(), candidate.frameNumber(),
                pivot.eventIndex(), window.size(), slots.size(), validation.valid());
        return CandidateOutcome.built(candidate, pivot, window.size(), slots, validation);
    }

    // analysis sessions score only the best frames of a large window, still in frame order.
    // listed frames carry no retrieval score, so equal scores fall back to distance from the pivot
    private static List<Frame> limit(SearchSession session, Frame pivot, List<Frame> window) {
        int cap = session.frameLimit();
        if (!session.isAnalysis() || cap <= 0 || window.size() <= cap) {
            return window;
        }
        LOGGER.debug("analysis session={} limiting window from {} to {} frames", session.id(), window.size(), cap);
        return window.stream()
                .sorted(Comparator.comparingDouble(Frame::similarity).reversed()
                        .thenComparingLong(f -> Math.abs((long) f.frameNumber() - pivot.frameNumber())))
                .limit(cap)
                .sorted(Comparator.comparingInt(Frame::frameNumber))
                .toList();
    }
}
