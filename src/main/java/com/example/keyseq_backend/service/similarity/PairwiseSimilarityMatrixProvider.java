package com.example.keyseq_backend.service.similarity;

import com.example.keyseq_backend.config.SimilarityProperties;
import com.example.keyseq_backend.model.Event;
import com.example.keyseq_backend.model.Frame;
import com.example.keyseq_backend.model.SimilarityMatrix;
import com.example.keyseq_backend.sequence.SearchSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Slow path: one single-pair lookup per cell, issued in small concurrent groups with a pause
 * between groups. Never fails as a whole; failed cells degrade inside {@link FrameSimilarityLookup}.
 */
@Component
public class PairwiseSimilarityMatrixProvider implements SimilarityMatrixProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(PairwiseSimilarityMatrixProvider.class);

    private final FrameSimilarityLookup lookup;
    private final Executor executor;
    private final int groupSize;
    private final long groupDelayMillis;

    public PairwiseSimilarityMatrixProvider(FrameSimilarityLookup lookup,
                                            @Qualifier("similarityTaskExecutor") Executor executor,
                                            SimilarityProperties props) {
        this.lookup = lookup;
        this.executor = executor;
        this.groupSize = Math.max(1, props.getFallbackGroupSize());
        this.groupDelayMillis = Math.max(0, props.getFallbackGroupDelayMillis());
    }

    @Override
    public SimilarityMatrix compute(SearchSession session, List<Event> events, List<Frame> frames) {
        if (frames.isEmpty()) {
            return SimilarityMatrix.empty(events.size());
        }
        long start = System.nanoTime();
        double[][] values = new double[events.size()][frames.size()];
        for (Event event : events) {
            for (int groupStart = 0; groupStart < frames.size(); groupStart += groupSize) {
                int groupEnd = Math.min(frames.size(), groupStart + groupSize);
                List<CompletableFuture<Double>> group = new ArrayList<>(groupEnd - groupStart);
                for (Frame frame : frames.subList(groupStart, groupEnd)) {
                    group.add(CompletableFuture
                            .supplyAsync(() -> lookup.similarity(session, frame, event.description()), executor)
                            .exceptionally(ex -> {
                                LOGGER.warn("pairwise lookup crashed frame={} event={}: {}", frame.id(), event.index(), ex.getMessage());
                                return lookup.fallback(frame);
                            }));
                }
                for (int i = 0; i < group.size(); i++) {
                    values[event.index()][groupStart + i] = group.get(i).join();
                }
                if (groupEnd < frames.size()) {
                    pause();
                }
            }
            LOGGER.trace("pairwise row complete session={} event={} frames={}", session.id(), event.index(), frames.size());
        }
        LOGGER.debug("pairwise matrix session={} events={} frames={} in {} ms", session.id(), events.size(),
                frames.size(), (System.nanoTime() - start) / 1_000_000);
        return SimilarityMatrix.of(values);
    }

    private void pause() {
        if (groupDelayMillis == 0) {
            return;
        }
        try {
            Thread.sleep(groupDelayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("pairwise similarity interrupted", e);
        }
    }
}
