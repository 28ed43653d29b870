package com.example.keyseq_backend.dto.retrieval;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FrameTextSimilarityResponse(
        @JsonProperty("frame_id") Long frameId,
        @JsonProperty("text_query") String textQuery,
        @JsonProperty("similarity") Double similarity
) {
}
