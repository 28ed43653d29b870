package com.example.keyseq_backend.config;

import com.example.keyseq_backend.model.AlgorithmConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Server-side defaults for {@link AlgorithmConfig} and limits of analysis sessions.
 * Values supplied with a search request override these.
 */
@ConfigurationProperties(prefix = "sequence.search")
public class SequenceSearchProperties {

    private double similarityThreshold = AlgorithmConfig.DEFAULT_SIMILARITY_THRESHOLD;
    private double scoreThreshold = AlgorithmConfig.DEFAULT_SCORE_THRESHOLD;
    private int topK = AlgorithmConfig.DEFAULT_TOP_K;
    private int maxTemporalGap = AlgorithmConfig.DEFAULT_MAX_TEMPORAL_GAP;
    private int searchWindow = AlgorithmConfig.DEFAULT_SEARCH_WINDOW;
    private double minSequenceCompleteness = AlgorithmConfig.DEFAULT_MIN_SEQUENCE_COMPLETENESS;
    private double temporalWeight = AlgorithmConfig.DEFAULT_TEMPORAL_WEIGHT;
    private double completenessWeight = AlgorithmConfig.DEFAULT_COMPLETENESS_WEIGHT;
    private int callTimeoutSeconds = AlgorithmConfig.DEFAULT_CALL_TIMEOUT_SECONDS;

    private int analysisCandidateLimit = 10;
    private int analysisFrameLimit = 200;

    public AlgorithmConfig toAlgorithmConfig() {
        return new AlgorithmConfig(similarityThreshold, scoreThreshold, topK, maxTemporalGap, searchWindow,
                minSequenceCompleteness, temporalWeight, completenessWeight, callTimeoutSeconds);
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public void setSimilarityThreshold(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    public double getScoreThreshold() {
        return scoreThreshold;
    }

    public void setScoreThreshold(double scoreThreshold) {
        this.scoreThreshold = scoreThreshold;
    }

    public int getTopK() {
        return topK;
    }

    public void setTopK(int topK) {
        this.topK = topK;
    }

    public int getMaxTemporalGap() {
        return maxTemporalGap;
    }

    public void setMaxTemporalGap(int maxTemporalGap) {
        this.maxTemporalGap = maxTemporalGap;
    }

    public int getSearchWindow() {
        return searchWindow;
    }

    public void setSearchWindow(int searchWindow) {
        this.searchWindow = searchWindow;
    }

    public double getMinSequenceCompleteness() {
        return minSequenceCompleteness;
    }

    public void setMinSequenceCompleteness(double minSequenceCompleteness) {
        this.minSequenceCompleteness = minSequenceCompleteness;
    }

    public double getTemporalWeight() {
        return temporalWeight;
    }

    public void setTemporalWeight(double temporalWeight) {
        this.temporalWeight = temporalWeight;
    }

    public double getCompletenessWeight() {
        return completenessWeight;
    }

    public void setCompletenessWeight(double completenessWeight) {
        this.completenessWeight = completenessWeight;
    }

    public int getAnalysisCandidateLimit() {
        return analysisCandidateLimit;
    }

    public void setAnalysisCandidateLimit(int analysisCandidateLimit) {
        this.analysisCandidateLimit = analysisCandidateLimit;
    }

    public int getAnalysisFrameLimit() {
        return analysisFrameLimit;
    }

    public void setAnalysisFrameLimit(int analysisFrameLimit) {
        this.analysisFrameLimit = analysisFrameLimit;
    }

    public int getCallTimeoutSeconds() {
        return callTimeoutSeconds;
    }

    public void setCallTimeoutSeconds(int callTimeoutSeconds) {
        this.callTimeoutSeconds = callTimeoutSeconds;
    }
}
