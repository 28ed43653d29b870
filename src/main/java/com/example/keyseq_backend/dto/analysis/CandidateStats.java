package com.example.keyseq_backend.dto.analysis;

import com.example.keyseq_backend.model.Frame;

import java.util.DoubleSummaryStatistics;
import java.util.List;

/**
 * @param retrieved     candidates returned by the initial retrieval.
 * @param analysed      candidates actually processed after the analysis cap.
 * @param minSimilarity lowest retrieval similarity among the retrieved candidates.
 * @param maxSimilarity highest retrieval similarity.
 * @param avgSimilarity mean retrieval similarity.
 */
public record CandidateStats(int retrieved,
                             int analysed,
                             double minSimilarity,
                             double maxSimilarity,
                             double avgSimilarity) {

    public static CandidateStats of(List<Frame> retrieved, int analysed) {
        if (retrieved.isEmpty()) {
            return new CandidateStats(0, 0, 0.0, 0.0, 0.0);
        }
        DoubleSummaryStatistics stats = retrieved.stream().mapToDouble(Frame::similarity).summaryStatistics();
        return new CandidateStats(retrieved.size(), analysed, stats.getMin(), stats.getMax(), stats.getAverage());
    }
}
