package com.example.keyseq_backend.service.impl;

import com.example.keyseq_backend.config.SequenceSearchProperties;
import com.example.keyseq_backend.dto.analysis.AnalysisReport;
import com.example.keyseq_backend.dto.analysis.CandidateTrace;
import com.example.keyseq_backend.model.AlgorithmConfig;
import com.example.keyseq_backend.model.Event;
import com.example.keyseq_backend.model.Frame;
import com.example.keyseq_backend.sequence.SequenceRanker;
import com.example.keyseq_backend.sequence.SequenceScorer;
import com.example.keyseq_backend.service.SequenceSearchException;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

class SequenceAnalysisServiceImplTest {

    private static final List<Event> EVENTS = Event.fromDescriptions(List.of("person enters", "car arrives"));

    private final RetrievalFixture fixture = new RetrievalFixture();
    private final SequenceSearchProperties props = new SequenceSearchProperties();
    private final Clock clock = Mockito.mock(Clock.class);
    private final SequenceAnalysisServiceImpl service = new SequenceAnalysisServiceImpl(fixture.candidateRetriever(),
            fixture.discovery(), new SequenceScorer(), new SequenceRanker(), fixture.cache, props, clock);

    @Test
    void reportsEveryPhase() {
        when(clock.millis()).thenReturn(1_000L, 1_010L, 1_030L, 1_060L);
        Frame strong = fixture.frame(1, "v1", 500, 0.8);
        Frame later = fixture.frame(2, "v1", 620, 0.0);
        Frame weak = fixture.frame(3, "v2", 40, 0.2);
        fixture.similarity(strong, "person enters", 0.8).similarity(later, "car arrives", 0.7)
                .similarity(weak, "car arrives", 0.2)
                .candidates(strong, weak);

        AnalysisReport report = service.analyze(EVENTS, AlgorithmConfig.defaults().withSimilarityThreshold(0.5), null);

        assertThat(report.query()).isEqualTo("temporal sequence: first person enters, finally car arrives");
        assertThat(report.events()).containsExactly("person enters", "car arrives");
        assertThat(report.candidates().retrieved()).isEqualTo(2);
        assertThat(report.candidates().maxSimilarity()).isEqualTo(0.8);
        assertThat(report.candidates().minSimilarity()).isEqualTo(0.2);
        assertThat(report.candidates().avgSimilarity()).isCloseTo(0.5, within(1e-9));

        assertThat(report.discovery()).hasSize(2);
        CandidateTrace first = report.discovery().get(0);
        assertThat(first.valid()).isTrue();
        assertThat(first.pivotEvent()).isZero();
        assertThat(first.windowSize()).isEqualTo(2);
        CandidateTrace second = report.discovery().get(1);
        assertThat(second.valid()).isFalse();
        assertThat(second.reason()).contains("below threshold");

        assertThat(report.scoring()).hasSize(1);
        assertThat(report.scoring().get(0).pivotFrameId()).isEqualTo(1L);
        assertThat(report.scoring().get(0).passedThreshold()).isTrue();
        assertThat(report.results()).hasSize(1);
        assertThat(report.timings().retrievalMillis()).isEqualTo(10);
        assertThat(report.timings().discoveryMillis()).isEqualTo(30);
        assertThat(report.timings().scoringMillis()).isEqualTo(60);
    }

    @Test
    void capsCandidatesAndWindowFrames() {
        props.setAnalysisCandidateLimit(1);
        props.setAnalysisFrameLimit(2);
        Frame pivot = fixture.frame(1, "v1", 500, 0.9);
        fixture.frame(2, "v1", 520, 0.1);
        fixture.frame(3, "v1", 540, 0.7);
        fixture.frame(4, "v1", 560, 0.2);
        Frame other = fixture.frame(5, "v2", 10, 0.5);
        fixture.similarity(pivot, "person enters", 0.9).candidates(pivot, other);

        AnalysisReport report = service.analyze(EVENTS, AlgorithmConfig.defaults(), null);

        assertThat(report.candidates().retrieved()).isEqualTo(2);
        assertThat(report.candidates().analysed()).isEqualTo(1);
        assertThat(report.discovery()).hasSize(1);
        assertThat(report.discovery().get(0).windowSize()).isEqualTo(2);
    }

    @Test
    void startsFromAnEmptyCache() {
        Frame f = fixture.frame(1, "v1", 500, 0.9);
        fixture.similarity(f, "person enters", 0.9).candidates(f);
        fixture.cache.put(1, "person enters", 0.01);

        service.analyze(EVENTS, AlgorithmConfig.defaults(), null);

        assertThat(fixture.cache.get(1, "person enters")).hasValue(0.9);
    }

    @Test
    void fatalErrorsPropagate() {
        SequenceSearchException ex = assertThrows(SequenceSearchException.class,
                () -> service.analyze(EVENTS, AlgorithmConfig.defaults(), null));

        assertThat(ex.getReason()).isEqualTo(SequenceSearchException.Reason.NO_CANDIDATES);
    }
}
