package com.example.keyseq_backend.dto.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record BatchMatrixRequest(
        @JsonProperty("frame_ids") List<Long> frameIds,
        @JsonProperty("text_queries") List<String> textQueries
) {
}
