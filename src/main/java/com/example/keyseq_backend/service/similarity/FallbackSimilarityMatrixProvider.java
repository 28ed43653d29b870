package com.example.keyseq_backend.service.similarity;

import com.example.keyseq_backend.model.Event;
import com.example.keyseq_backend.model.Frame;
import com.example.keyseq_backend.model.SimilarityMatrix;
import com.example.keyseq_backend.sequence.SearchSession;
import com.example.keyseq_backend.service.retrieval.RetrievalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Provider used by the engine: batch first, pairwise lookups when the batch path fails.
 */
@Primary
@Component
public class FallbackSimilarityMatrixProvider implements SimilarityMatrixProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(FallbackSimilarityMatrixProvider.class);

    private final SimilarityMatrixProvider primary;
    private final SimilarityMatrixProvider fallback;

    @Autowired
    public FallbackSimilarityMatrixProvider(BatchSimilarityMatrixProvider primary,
                                            PairwiseSimilarityMatrixProvider fallback) {
        this((SimilarityMatrixProvider) primary, fallback);
    }

    FallbackSimilarityMatrixProvider(SimilarityMatrixProvider primary, SimilarityMatrixProvider fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public SimilarityMatrix compute(SearchSession session, List<Event> events, List<Frame> frames) {
        if (frames.isEmpty()) {
            return SimilarityMatrix.empty(events.size());
        }
        try {
            return primary.compute(session, events, frames);
        } catch (RetrievalException ex) {
            LOGGER.warn("batch similarity failed session={} events={} frames={} status={}, falling back to pairwise lookups: {}",
                    session.id(), events.size(), frames.size(), ex.getStatus(), ex.getMessage());
            return fallback.compute(session, events, frames);
        }
    }
}
