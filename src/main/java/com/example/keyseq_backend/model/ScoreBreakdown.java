package com.example.keyseq_backend.model;

/**
 * Sub-scores that make up a sequence score.
 *
 * @param baseSimilarity mean slot similarity.
 * @param temporal       continuity score derived from frame-number gaps.
 * @param completeness   completeness ratio, halved below the configured floor.
 * @param consistency    {@code max(0, 1 - stddev(similarities))}.
 * @param order          fraction of consecutive pairs in strictly increasing frame order.
 */
public record ScoreBreakdown(double baseSimilarity,
                             double temporal,
                             double completeness,
                             double consistency,
                             double order) {
}
