package com.example.keyseq_backend.dto.retrieval;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Similarity matrix of the batch endpoint: one row per text query, one column per frame id,
 * both in request order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BatchMatrixResponse(
        @JsonProperty("similarity_matrix") List<List<Double>> similarityMatrix,
        @JsonProperty("shape") List<Integer> shape
) {
}
