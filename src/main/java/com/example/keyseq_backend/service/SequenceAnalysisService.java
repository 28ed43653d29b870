package com.example.keyseq_backend.service;

import com.example.keyseq_backend.dto.analysis.AnalysisReport;
import com.example.keyseq_backend.model.AlgorithmConfig;
import com.example.keyseq_backend.model.Event;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Diagnostic run of the search pipeline on a fresh cache with capped candidate and window sizes.
 */
public interface SequenceAnalysisService {

    AnalysisReport analyze(List<Event> events, AlgorithmConfig config, @Nullable String videoId);
}
