package com.example.keyseq_backend.service.similarity;

import com.example.keyseq_backend.config.SimilarityProperties;
import com.example.keyseq_backend.dto.retrieval.BatchMatrixResponse;
import com.example.keyseq_backend.model.Event;
import com.example.keyseq_backend.model.Frame;
import com.example.keyseq_backend.model.SimilarityMatrix;
import com.example.keyseq_backend.sequence.SearchSession;
import com.example.keyseq_backend.service.retrieval.RetrievalClient;
import com.example.keyseq_backend.service.retrieval.RetrievalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Fast path: computes the matrix with the batch endpoint, split into blocks of at most
 * {@code batchMaxQueries} x {@code batchMaxFrames}. Any failed block fails the whole matrix.
 */
@Component
public class BatchSimilarityMatrixProvider implements SimilarityMatrixProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchSimilarityMatrixProvider.class);

    private final RetrievalClient retrievalClient;
    private final int maxFrames;
    private final int maxQueries;

    public BatchSimilarityMatrixProvider(RetrievalClient retrievalClient, SimilarityProperties props) {
        this.retrievalClient = retrievalClient;
        this.maxFrames = Math.max(1, props.getBatchMaxFrames());
        this.maxQueries = Math.max(1, props.getBatchMaxQueries());
    }

    @Override
    public SimilarityMatrix compute(SearchSession session, List<Event> events, List<Frame> frames) {
        if (frames.isEmpty()) {
            return SimilarityMatrix.empty(events.size());
        }
        double[][] values = new double[events.size()][frames.size()];
        if (fillFromCache(session, events, frames, values)) {
            LOGGER.debug("batch matrix served from cache session={} events={} frames={}",
                    session.id(), events.size(), frames.size());
            return SimilarityMatrix.of(values);
        }

        int calls = 0;
        for (int qStart = 0; qStart < events.size(); qStart += maxQueries) {
            List<Event> queryBlock = events.subList(qStart, Math.min(events.size(), qStart + maxQueries));
            List<String> queries = queryBlock.stream().map(e -> e.description().trim()).toList();
            for (int fStart = 0; fStart < frames.size(); fStart += maxFrames) {
                List<Frame> frameBlock = frames.subList(fStart, Math.min(frames.size(), fStart + maxFrames));
                List<Long> frameIds = frameBlock.stream().map(Frame::id).toList();
                BatchMatrixResponse block = retrievalClient.batchMatrix(frameIds, queries, session.callTimeout());
                calls++;
                copyBlock(session, block, queryBlock, frameBlock, values, qStart, fStart);
            }
        }
        LOGGER.debug("batch matrix session={} events={} frames={} calls={}",
                session.id(), events.size(), frames.size(), calls);
        return SimilarityMatrix.of(values);
    }

    private static boolean fillFromCache(SearchSession session, List<Event> events, List<Frame> frames, double[][] values) {
        for (int e = 0; e < events.size(); e++) {
            for (int f = 0; f < frames.size(); f++) {
                OptionalDouble cached = session.cache().get(frames.get(f).id(), events.get(e).description());
                if (cached.isEmpty()) {
                    return false;
                }
                values[e][f] = cached.getAsDouble();
            }
        }
        return true;
    }

    private static void copyBlock(SearchSession session, BatchMatrixResponse block, List<Event> queryBlock,
                                  List<Frame> frameBlock, double[][] values, int qStart, int fStart) {
        List<List<Double>> rows = block.similarityMatrix();
        if (rows.size() != queryBlock.size()) {
            throw new RetrievalException("/similarity/batch-matrix",
                    "expected " + queryBlock.size() + " rows but got " + rows.size());
        }
        for (int q = 0; q < rows.size(); q++) {
            List<Double> row = rows.get(q);
            if (row == null || row.size() != frameBlock.size()) {
                throw new RetrievalException("/similarity/batch-matrix",
                        "expected " + frameBlock.size() + " columns in row " + q);
            }
            Event event = queryBlock.get(q);
            for (int f = 0; f < row.size(); f++) {
                Double value = row.get(f);
                if (value == null) {
                    throw new RetrievalException("/similarity/batch-matrix", "null similarity at [" + q + "," + f + "]");
                }
                values[qStart + q][fStart + f] = value;
                session.cache().put(frameBlock.get(f).id(), event.description(), value);
            }
        }
    }
}
