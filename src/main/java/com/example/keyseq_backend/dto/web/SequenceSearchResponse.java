package com.example.keyseq_backend.dto.web;

import com.example.keyseq_backend.model.ScoredSequence;

import java.util.List;

public record SequenceSearchResponse(List<String> events, int count, List<ScoredSequence> sequences) {
}
