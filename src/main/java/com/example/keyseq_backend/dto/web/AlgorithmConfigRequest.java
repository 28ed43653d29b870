package com.example.keyseq_backend.dto.web;

import com.example.keyseq_backend.model.AlgorithmConfig;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Per-request overrides of the server-side algorithm defaults. Absent fields keep the default.
 */
public record AlgorithmConfigRequest(
        @DecimalMin("0.0") @DecimalMax("1.0") Double similarityThreshold,
        @DecimalMin("0.0") Double scoreThreshold,
        @Min(1) @Max(1000) Integer topK,
        @Min(1) Integer maxTemporalGap,
        @Min(0) Integer searchWindow,
        @DecimalMin("0.0") @DecimalMax("1.0") Double minSequenceCompleteness,
        @DecimalMin("0.0") Double temporalWeight,
        @DecimalMin("0.0") Double completenessWeight,
        @Min(1) @Max(AlgorithmConfig.MAX_CALL_TIMEOUT_SECONDS) Integer callTimeoutSeconds
) {

    public AlgorithmConfig applyTo(AlgorithmConfig defaults) {
        return new AlgorithmConfig(
                similarityThreshold != null ? similarityThreshold : defaults.similarityThreshold(),
                scoreThreshold != null ? scoreThreshold : defaults.scoreThreshold(),
                topK != null ? topK : defaults.topK(),
                maxTemporalGap != null ? maxTemporalGap : defaults.maxTemporalGap(),
                searchWindow != null ? searchWindow : defaults.searchWindow(),
                minSequenceCompleteness != null ? minSequenceCompleteness : defaults.minSequenceCompleteness(),
                temporalWeight != null ? temporalWeight : defaults.temporalWeight(),
                completenessWeight != null ? completenessWeight : defaults.completenessWeight(),
                callTimeoutSeconds != null ? callTimeoutSeconds : defaults.callTimeoutSeconds());
    }
}
