package com.example.keyseq_backend.dto.analysis;

import com.example.keyseq_backend.model.AlgorithmConfig;
import com.example.keyseq_backend.model.ScoredSequence;

import java.util.List;

/**
 * Everything an analysis session observed, phase by phase.
 */
public record AnalysisReport(String sessionId,
                             String query,
                             List<String> events,
                             AlgorithmConfig config,
                             CandidateStats candidates,
                             List<CandidateTrace> discovery,
                             List<ScoringTrace> scoring,
                             List<ScoredSequence> results,
                             PhaseTimings timings) {
}
