package com.example.keyseq_backend.service;

import com.example.keyseq_backend.model.AlgorithmConfig;
import com.example.keyseq_backend.model.Event;
import com.example.keyseq_backend.model.ScoredSequence;
import org.springframework.lang.Nullable;

import java.util.List;

public interface SequenceSearchService {

    /**
     * Finds the best temporally ordered frame sequences matching the events.
     *
     * @param events  two or more events in temporal order.
     * @param config  algorithm configuration for this search.
     * @param videoId optional restriction of the initial retrieval to one video.
     * @return sequences scoring at least {@code config.scoreThreshold()}, best first; possibly empty.
     * @throws SequenceSearchException on fewer than two events, a failed initial retrieval or no candidates.
     */
    List<ScoredSequence> search(List<Event> events, AlgorithmConfig config, @Nullable String videoId);

    /**
     * Drops every memoized similarity.
     */
    void clearCache();
}
