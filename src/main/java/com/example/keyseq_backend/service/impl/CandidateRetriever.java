package com.example.keyseq_backend.service.impl;

import com.example.keyseq_backend.model.Event;
import com.example.keyseq_backend.model.Frame;
import com.example.keyseq_backend.sequence.TemporalQueryComposer;
import com.example.keyseq_backend.service.SequenceSearchException;
import com.example.keyseq_backend.service.retrieval.RetrievalClient;
import com.example.keyseq_backend.service.retrieval.RetrievalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Initial phase shared by search and analysis: validates the event list, composes the temporal query
 * and retrieves the candidate frames. Every failure here is fatal.
 */
@Component
public class CandidateRetriever {
    private static final Logger LOGGER = LoggerFactory.getLogger(CandidateRetriever.class);

    static final int MIN_EVENTS = 2;

    private final TemporalQueryComposer composer;
    private final RetrievalClient retrievalClient;

    public CandidateRetriever(TemporalQueryComposer composer, RetrievalClient retrievalClient) {
        this.composer = composer;
        this.retrievalClient = retrievalClient;
    }

    public Candidates retrieve(List<Event> events, int topK, @Nullable String videoId, @Nullable Duration timeout) {
        if (events == null || events.size() < MIN_EVENTS) {
            throw new SequenceSearchException(SequenceSearchException.Reason.TOO_FEW_EVENTS,
                    "at least " + MIN_EVENTS + " events are required");
        }
        String query = composer.compose(events);
        List<Frame> frames;
        try {
            frames = retrievalClient.searchText(query, topK, videoId, timeout);
        } catch (RetrievalException ex) {
            LOGGER.error("candidate retrieval failed endpoint={} status={}: {}",
                    ex.getEndpoint(), ex.getStatus(), ex.getMessage());
            throw new SequenceSearchException(SequenceSearchException.Reason.CANDIDATE_RETRIEVAL_FAILED,
                    "candidate retrieval failed: " + ex.getMessage(), ex);
        }
        if (frames.isEmpty()) {
            throw new SequenceSearchException(SequenceSearchException.Reason.NO_CANDIDATES,
                    "no candidate frames for query");
        }
        LOGGER.debug("retrieved candidates={} topK={} videoId={}", frames.size(), topK, videoId);
        return new Candidates(query, frames);
    }

    public record Candidates(String query, List<Frame> frames) {

        public Candidates {
            frames = List.copyOf(frames);
        }
    }
}
