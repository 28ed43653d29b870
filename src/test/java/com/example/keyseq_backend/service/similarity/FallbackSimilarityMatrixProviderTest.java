package com.example.keyseq_backend.service.similarity;

import com.example.keyseq_backend.model.AlgorithmConfig;
import com.example.keyseq_backend.model.Event;
import com.example.keyseq_backend.model.Frame;
import com.example.keyseq_backend.model.SimilarityMatrix;
import com.example.keyseq_backend.sequence.SearchSession;
import com.example.keyseq_backend.service.retrieval.RetrievalException;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FallbackSimilarityMatrixProviderTest {

    private final SimilarityMatrixProvider batch = Mockito.mock(SimilarityMatrixProvider.class);
    private final SimilarityMatrixProvider pairwise = Mockito.mock(SimilarityMatrixProvider.class);
    private final FallbackSimilarityMatrixProvider provider = new FallbackSimilarityMatrixProvider(batch, pairwise);
    private final SearchSession session = SearchSession.search(AlgorithmConfig.defaults(), new SimilarityCache());
    private final List<Event> events = Event.fromDescriptions(List.of("a", "b"));
    private final List<Frame> frames = List.of(new Frame(1, "v1", 10, 0.0, 0.5, null));

    @Test
    void usesBatchResultWhenAvailable() {
        SimilarityMatrix expected = SimilarityMatrix.of(new double[][]{{0.1}, {0.2}});
        when(batch.compute(session, events, frames)).thenReturn(expected);

        assertThat(provider.compute(session, events, frames)).isSameAs(expected);
        verify(pairwise, never()).compute(any(), any(), any());
    }

    @Test
    void fallsBackToPairwiseWhenBatchFails() {
        SimilarityMatrix expected = SimilarityMatrix.of(new double[][]{{0.3}, {0.4}});
        when(batch.compute(session, events, frames))
                .thenThrow(new RetrievalException("/similarity/batch-matrix", 500, "boom", null));
        when(pairwise.compute(session, events, frames)).thenReturn(expected);

        assertThat(provider.compute(session, events, frames)).isSameAs(expected);
    }

    @Test
    void emptyWindowNeedsNoProvider() {
        SimilarityMatrix matrix = provider.compute(session, events, List.of());

        assertThat(matrix.eventCount()).isEqualTo(2);
        assertThat(matrix.frameCount()).isZero();
        verify(batch, never()).compute(any(), any(), any());
    }
}
