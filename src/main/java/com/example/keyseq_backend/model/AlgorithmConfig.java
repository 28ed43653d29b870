package com.example.keyseq_backend.model;

/**
 * Tunable parameters of one sequence search. Read at the start of a search and constant for its duration.
 *
 * @param similarityThreshold     minimum similarity to accept a pivot or a slot match.
 * @param scoreThreshold          minimum final score for a sequence to be returned.
 * @param topK                    number of candidates requested from the initial retrieval.
 * @param maxTemporalGap          frame-number gap that maps to the maximum temporal penalty.
 * @param searchWindow            frame-number radius searched around the pivot.
 * @param minSequenceCompleteness minimum fraction of events a sequence must cover.
 * @param temporalWeight          weight of the temporal sub-score.
 * @param completenessWeight      weight of the completeness sub-score.
 * @param callTimeoutSeconds      per-call timeout for the retrieval service, {@code 0} for the server default.
 */
public record AlgorithmConfig(double similarityThreshold,
                              double scoreThreshold,
                              int topK,
                              int maxTemporalGap,
                              int searchWindow,
                              double minSequenceCompleteness,
                              double temporalWeight,
                              double completenessWeight,
                              int callTimeoutSeconds) {

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.0;
    public static final double DEFAULT_SCORE_THRESHOLD = 0.0;
    public static final int DEFAULT_TOP_K = 10;
    public static final int DEFAULT_MAX_TEMPORAL_GAP = 150;
    public static final int DEFAULT_SEARCH_WINDOW = 3000;
    public static final double DEFAULT_MIN_SEQUENCE_COMPLETENESS = 0.1;
    public static final double DEFAULT_TEMPORAL_WEIGHT = 0.3;
    public static final double DEFAULT_COMPLETENESS_WEIGHT = 0.2;
    public static final int DEFAULT_CALL_TIMEOUT_SECONDS = 0;
    public static final int MAX_CALL_TIMEOUT_SECONDS = 600;

    public AlgorithmConfig {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be >= 1");
        }
        if (maxTemporalGap < 1) {
            throw new IllegalArgumentException("maxTemporalGap must be >= 1");
        }
        if (searchWindow < 0) {
            throw new IllegalArgumentException("searchWindow must be >= 0");
        }
        if (minSequenceCompleteness < 0.0 || minSequenceCompleteness > 1.0) {
            throw new IllegalArgumentException("minSequenceCompleteness must be within [0,1]");
        }
        if (temporalWeight < 0.0 || completenessWeight < 0.0) {
            throw new IllegalArgumentException("weights must be >= 0");
        }
        if (callTimeoutSeconds < 0 || callTimeoutSeconds > MAX_CALL_TIMEOUT_SECONDS) {
            throw new IllegalArgumentException("callTimeoutSeconds must be within [0," + MAX_CALL_TIMEOUT_SECONDS + "]");
        }
    }

    public AlgorithmConfig(double similarityThreshold, double scoreThreshold, int topK, int maxTemporalGap,
                           int searchWindow, double minSequenceCompleteness, double temporalWeight,
                           double completenessWeight) {
        this(similarityThreshold, scoreThreshold, topK, maxTemporalGap, searchWindow, minSequenceCompleteness,
                temporalWeight, completenessWeight, DEFAULT_CALL_TIMEOUT_SECONDS);
    }

    public static AlgorithmConfig defaults() {
        return new AlgorithmConfig(
                DEFAULT_SIMILARITY_THRESHOLD,
                DEFAULT_SCORE_THRESHOLD,
                DEFAULT_TOP_K,
                DEFAULT_MAX_TEMPORAL_GAP,
                DEFAULT_SEARCH_WINDOW,
                DEFAULT_MIN_SEQUENCE_COMPLETENESS,
                DEFAULT_TEMPORAL_WEIGHT,
                DEFAULT_COMPLETENESS_WEIGHT,
                DEFAULT_CALL_TIMEOUT_SECONDS);
    }

    public AlgorithmConfig withSimilarityThreshold(double threshold) {
        return new AlgorithmConfig(threshold, scoreThreshold, topK, maxTemporalGap, searchWindow,
                minSequenceCompleteness, temporalWeight, completenessWeight, callTimeoutSeconds);
    }

    public AlgorithmConfig withScoreThreshold(double threshold) {
        return new AlgorithmConfig(similarityThreshold, threshold, topK, maxTemporalGap, searchWindow,
                minSequenceCompleteness, temporalWeight, completenessWeight, callTimeoutSeconds);
    }

    public AlgorithmConfig withMinSequenceCompleteness(double completeness) {
        return new AlgorithmConfig(similarityThreshold, scoreThreshold, topK, maxTemporalGap, searchWindow,
                completeness, temporalWeight, completenessWeight, callTimeoutSeconds);
    }

    public AlgorithmConfig withCallTimeoutSeconds(int seconds) {
        return new AlgorithmConfig(similarityThreshold, scoreThreshold, topK, maxTemporalGap, searchWindow,
                minSequenceCompleteness, temporalWeight, completenessWeight, seconds);
    }
}
