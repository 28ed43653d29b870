package com.example.keyseq_backend.sequence;

import com.example.keyseq_backend.model.AlgorithmConfig;
import com.example.keyseq_backend.model.ScoreBreakdown;
import com.example.keyseq_backend.model.ScoredSequence;
import com.example.keyseq_backend.model.SequenceMetadata;
import com.example.keyseq_backend.model.SequenceSlot;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Weighted composite score of a validated sequence.
 * <p>
 * {@code 0.4*base + temporalWeight*temporal + completenessWeight*completeness + 0.1*consistency + 0.1*order}.
 * The blend is not normalized; with the default weights a perfect sequence scores 1.1.
 */
@Component
public class SequenceScorer {

    static final double BASE_WEIGHT = 0.4;
    static final double CONSISTENCY_WEIGHT = 0.1;
    static final double ORDER_WEIGHT = 0.1;

    public ScoredSequence score(List<SequenceSlot> sequence, int eventCount, AlgorithmConfig cfg) {
        if (sequence.isEmpty()) {
            throw new IllegalArgumentException("cannot score an empty sequence");
        }
        double[] similarities = sequence.stream().mapToDouble(SequenceSlot::similarity).toArray();
        double base = mean(similarities);
        double temporal = temporal(sequence, cfg.maxTemporalGap());
        double ratio = eventCount == 0 ? 0.0 : (double) sequence.size() / eventCount;
        double completeness = ratio >= cfg.minSequenceCompleteness() ? ratio : ratio * 0.5;
        double consistency = Math.max(0.0, 1.0 - stddev(similarities, base));
        double order = order(sequence);

        double finalScore = BASE_WEIGHT * base
                + cfg.temporalWeight() * temporal
                + cfg.completenessWeight() * completeness
                + CONSISTENCY_WEIGHT * consistency
                + ORDER_WEIGHT * order;

        ScoreBreakdown breakdown = new ScoreBreakdown(base, temporal, completeness, consistency, order);
        return new ScoredSequence(sequence, finalScore, breakdown, metadata(sequence, ratio));
    }

    static double temporal(List<SequenceSlot> sequence, int maxTemporalGap) {
        if (sequence.size() < 2) {
            return 1.0;
        }
        double penalty = 0.0;
        for (int i = 1; i < sequence.size(); i++) {
            int gap = sequence.get(i).frameNumber() - sequence.get(i - 1).frameNumber();
            penalty += Math.min((double) gap / maxTemporalGap, 1.0);
        }
        return Math.max(0.0, 1.0 - penalty / (sequence.size() - 1));
    }

    static double order(List<SequenceSlot> sequence) {
        if (sequence.size() < 2) {
            return 1.0;
        }
        int increasing = 0;
        for (int i = 1; i < sequence.size(); i++) {
            if (sequence.get(i).frameNumber() > sequence.get(i - 1).frameNumber()) {
                increasing++;
            }
        }
        return (double) increasing / (sequence.size() - 1);
    }

    private static SequenceMetadata metadata(List<SequenceSlot> sequence, double completeness) {
        int start = Integer.MAX_VALUE;
        int end = Integer.MIN_VALUE;
        for (SequenceSlot slot : sequence) {
            start = Math.min(start, slot.frameNumber());
            end = Math.max(end, slot.frameNumber());
        }
        return new SequenceMetadata(sequence.get(0).videoId(), start, end, end - start, completeness);
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    // population standard deviation
    private static double stddev(double[] values, double mean) {
        double sq = 0.0;
        for (double v : values) {
            sq += (v - mean) * (v - mean);
        }
        return Math.sqrt(sq / values.length);
    }
}
