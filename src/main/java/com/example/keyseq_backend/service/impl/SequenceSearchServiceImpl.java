package com.example.keyseq_backend.service.impl;

import com.example.keyseq_backend.model.AlgorithmConfig;
import com.example.keyseq_backend.model.Event;
import com.example.keyseq_backend.model.Frame;
import com.example.keyseq_backend.model.ScoredSequence;
import com.example.keyseq_backend.sequence.CandidateOutcome;
import com.example.keyseq_backend.sequence.SearchSession;
import com.example.keyseq_backend.sequence.SequenceDiscovery;
import com.example.keyseq_backend.sequence.SequenceRanker;
import com.example.keyseq_backend.sequence.SequenceScorer;
import com.example.keyseq_backend.service.SequenceSearchService;
import com.example.keyseq_backend.service.similarity.SimilarityCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Default {@link SequenceSearchService}. Candidates are processed one after another; a candidate that
 * fails for any reason is skipped with a warning.
 */
@Service
public class SequenceSearchServiceImpl implements SequenceSearchService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SequenceSearchServiceImpl.class);

    private final CandidateRetriever candidateRetriever;
    private final SequenceDiscovery discovery;
    private final SequenceScorer scorer;
    private final SequenceRanker ranker;
    private final SimilarityCache cache;

    public SequenceSearchServiceImpl(CandidateRetriever candidateRetriever,
                                     SequenceDiscovery discovery,
                                     SequenceScorer scorer,
                                     SequenceRanker ranker,
                                     SimilarityCache cache) {
        this.candidateRetriever = candidateRetriever;
        this.discovery = discovery;
        this.scorer = scorer;
        this.ranker = ranker;
        this.cache = cache;
    }

    @Override
    public List<ScoredSequence> search(List<Event> events, AlgorithmConfig config, @Nullable String videoId) {
        long start = System.currentTimeMillis();
        SearchSession session = SearchSession.search(config, cache);
        CandidateRetriever.Candidates candidates = candidateRetriever.retrieve(events, config.topK(), videoId,
                session.callTimeout());

        List<ScoredSequence> scored = new ArrayList<>();
        int skipped = 0;
        for (Frame candidate : candidates.frames()) {
            try {
                CandidateOutcome outcome = discovery.discover(session, candidate, events);
                if (outcome.valid()) {
                    scored.add(scorer.score(outcome.slots(), events.size(), config));
                }
            } catch (RuntimeException ex) {
                skipped++;
                LOGGER.warn("candidate skipped session={} frame={} video={}: {}",
                        session.id(), candidate.id(), candidate.videoId(), ex.toString());
            }
        }

        List<ScoredSequence> ranked = ranker.rank(scored, config.scoreThreshold());
        LOGGER.info("sequence search session={} events={} candidates={} skipped={} scored={} returned={} cache={} in {} ms",
                session.id(), events.size(), candidates.frames().size(), skipped, scored.size(), ranked.size(),
                cache.size(), System.currentTimeMillis() - start);
        return ranked;
    }

    @Override
    public void clearCache() {
        int size = cache.size();
        cache.clear();
        LOGGER.info("similarity cache cleared entries={}", size);
    }
}
