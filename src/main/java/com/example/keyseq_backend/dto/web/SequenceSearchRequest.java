package com.example.keyseq_backend.dto.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record SequenceSearchRequest(
        @NotEmpty @Size(max = 20) List<@Size(max = 1000) String> events,
        @Valid AlgorithmConfigRequest config,
        @Size(max = 256) String videoId
) {
}
