package com.example.keyseq_backend.service.impl;

import com.example.keyseq_backend.config.SequenceSearchProperties;
import com.example.keyseq_backend.dto.analysis.AnalysisReport;
import com.example.keyseq_backend.dto.analysis.CandidateStats;
import com.example.keyseq_backend.dto.analysis.CandidateTrace;
import com.example.keyseq_backend.dto.analysis.PhaseTimings;
import com.example.keyseq_backend.dto.analysis.ScoringTrace;
import com.example.keyseq_backend.model.AlgorithmConfig;
import com.example.keyseq_backend.model.Event;
import com.example.keyseq_backend.model.Frame;
import com.example.keyseq_backend.model.ScoredSequence;
import com.example.keyseq_backend.sequence.CandidateOutcome;
import com.example.keyseq_backend.sequence.SearchSession;
import com.example.keyseq_backend.sequence.SequenceDiscovery;
import com.example.keyseq_backend.sequence.SequenceRanker;
import com.example.keyseq_backend.sequence.SequenceScorer;
import com.example.keyseq_backend.service.SequenceAnalysisService;
import com.example.keyseq_backend.service.similarity.SimilarityCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Service
public class SequenceAnalysisServiceImpl implements SequenceAnalysisService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SequenceAnalysisServiceImpl.class);

    private final CandidateRetriever candidateRetriever;
    private final SequenceDiscovery discovery;
    private final SequenceScorer scorer;
    private final SequenceRanker ranker;
    private final SimilarityCache cache;
    private final SequenceSearchProperties props;
    private final Clock clock;

    public SequenceAnalysisServiceImpl(CandidateRetriever candidateRetriever,
                                       SequenceDiscovery discovery,
                                       SequenceScorer scorer,
                                       SequenceRanker ranker,
                                       SimilarityCache cache,
                                       SequenceSearchProperties props,
                                       Clock clock) {
        this.candidateRetriever = candidateRetriever;
        this.discovery = discovery;
        this.scorer = scorer;
        this.ranker = ranker;
        this.cache = cache;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public AnalysisReport analyze(List<Event> events, AlgorithmConfig config, @Nullable String videoId) {
        long start = clock.millis();
        SearchSession session = SearchSession.analysis(config, cache, props.getAnalysisFrameLimit());
        LOGGER.info("analysis session={} started events={}", session.id(), events == null ? 0 : events.size());

        // phase 1: initial retrieval
        CandidateRetriever.Candidates candidates = candidateRetriever.retrieve(events, config.topK(), videoId,
                session.callTimeout());
        int cap = props.getAnalysisCandidateLimit() > 0 ? props.getAnalysisCandidateLimit() : candidates.frames().size();
        List<Frame> analysed = candidates.frames().subList(0, Math.min(cap, candidates.frames().size()));
        CandidateStats stats = CandidateStats.of(candidates.frames(), analysed.size());
        long retrievalDone = clock.millis() - start;

        // phase 2: sequence discovery
        List<CandidateTrace> traces = new ArrayList<>();
        List<CandidateOutcome> validOutcomes = new ArrayList<>();
        for (Frame candidate : analysed) {
            CandidateOutcome outcome;
            try {
                outcome = discovery.discover(session, candidate, events);
            } catch (RuntimeException ex) {
                LOGGER.warn("analysis session={} candidate frame={} failed: {}", session.id(), candidate.id(), ex.toString());
                outcome = CandidateOutcome.failed(candidate, "error: " + ex.getMessage());
            }
            traces.add(CandidateTrace.from(outcome));
            if (outcome.valid()) {
                validOutcomes.add(outcome);
            }
        }
        long discoveryDone = clock.millis() - start;

        // phase 3: scoring and ranking
        List<ScoringTrace> scoring = new ArrayList<>();
        List<ScoredSequence> scored = new ArrayList<>();
        for (CandidateOutcome outcome : validOutcomes) {
            ScoredSequence sequence = scorer.score(outcome.slots(), events.size(), config);
            scored.add(sequence);
            scoring.add(ScoringTrace.of(outcome.candidate().id(), sequence, config.scoreThreshold()));
        }
        List<ScoredSequence> ranked = ranker.rank(scored, config.scoreThreshold());
        long scoringDone = clock.millis() - start;

        LOGGER.info("analysis session={} candidates={}/{} valid={} returned={} cacheHits={} cacheMisses={} in {} ms",
                session.id(), analysed.size(), candidates.frames().size(), validOutcomes.size(), ranked.size(),
                cache.hits(), cache.misses(), scoringDone);
        return new AnalysisReport(
                session.id(),
                candidates.query(),
                events.stream().map(Event::description).toList(),
                config,
                stats,
                traces,
                scoring,
                ranked,
                new PhaseTimings(retrievalDone, discoveryDone, scoringDone));
    }
}
