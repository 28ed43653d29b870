package com.example.keyseq_backend.service.similarity;

import com.example.keyseq_backend.config.SimilarityProperties;
import com.example.keyseq_backend.model.Frame;
import com.example.keyseq_backend.sequence.SearchSession;
import com.example.keyseq_backend.service.retrieval.RetrievalClient;
import com.example.keyseq_backend.service.retrieval.RetrievalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Single-pair similarity lookups through the session cache. A failed lookup degrades to a
 * conservative value derived from the frame's own retrieval score and is not cached.
 */
@Component
public class FrameSimilarityLookup {
    private static final Logger LOGGER = LoggerFactory.getLogger(FrameSimilarityLookup.class);

    private final RetrievalClient retrievalClient;
    private final double degradeFactor;

    public FrameSimilarityLookup(RetrievalClient retrievalClient, SimilarityProperties props) {
        this.retrievalClient = retrievalClient;
        this.degradeFactor = props.getFallbackDegradeFactor();
    }

    public double similarity(SearchSession session, Frame frame, String eventText) {
        OptionalDouble cached = session.cache().get(frame.id(), eventText);
        if (cached.isPresent()) {
            return cached.getAsDouble();
        }
        try {
            double similarity = retrievalClient.frameTextSimilarity(frame.id(), eventText.trim(), session.callTimeout());
            session.cache().put(frame.id(), eventText, similarity);
            return similarity;
        } catch (RetrievalException ex) {
            double degraded = fallback(frame);
            LOGGER.warn("similarity lookup failed session={} frame={} text='{}' fallback={}: {}",
                    session.id(), frame.id(), eventText, degraded, ex.getMessage());
            return degraded;
        }
    }

    public double fallback(Frame frame) {
        return Math.min(frame.similarity() * degradeFactor, 1.0);
    }
}
