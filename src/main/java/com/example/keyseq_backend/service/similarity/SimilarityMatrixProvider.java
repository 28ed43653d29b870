package com.example.keyseq_backend.service.similarity;

import com.example.keyseq_backend.model.Event;
import com.example.keyseq_backend.model.Frame;
import com.example.keyseq_backend.model.SimilarityMatrix;
import com.example.keyseq_backend.sequence.SearchSession;

import java.util.List;

/**
 * Supplies the event x frame similarity matrix for one candidate window.
 */
public interface SimilarityMatrixProvider {

    /**
     * Computes similarities for every (event, frame) pair.
     *
     * @param session search session owning the cache handle.
     * @param events  events in index order, one matrix row each.
     * @param frames  window frames, one matrix column each in list order.
     * @return matrix of {@code events.size()} rows and {@code frames.size()} columns.
     * @throws com.example.keyseq_backend.service.retrieval.RetrievalException when the provider
     *         cannot produce the matrix at all.
     */
    SimilarityMatrix compute(SearchSession session, List<Event> events, List<Frame> frames);
}
