package com.example.keyseq_backend.dto.retrieval;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TextSearchResponse(
        @JsonProperty("query") String query,
        @JsonProperty("results") List<FrameRecord> results,
        @JsonProperty("total_found") Integer totalFound
) {
}
