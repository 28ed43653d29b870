package com.example.keyseq_backend.controller;

import com.example.keyseq_backend.config.SequenceSearchProperties;
import com.example.keyseq_backend.dto.analysis.AnalysisReport;
import com.example.keyseq_backend.dto.web.SequenceSearchRequest;
import com.example.keyseq_backend.dto.web.SequenceSearchResponse;
import com.example.keyseq_backend.model.AlgorithmConfig;
import com.example.keyseq_backend.model.Event;
import com.example.keyseq_backend.model.ScoredSequence;
import com.example.keyseq_backend.service.SequenceAnalysisService;
import com.example.keyseq_backend.service.SequenceSearchException;
import com.example.keyseq_backend.service.SequenceSearchService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST entry points of the temporal sequence search.
 */
@RestController
@RequestMapping("/v1/sequences")
public class SequenceSearchController {

    private final SequenceSearchService searchService;
    private final SequenceAnalysisService analysisService;
    private final SequenceSearchProperties props;

    public SequenceSearchController(SequenceSearchService searchService,
                                    SequenceAnalysisService analysisService,
                                    SequenceSearchProperties props) {
        this.searchService = searchService;
        this.analysisService = analysisService;
        this.props = props;
    }

    /**
     * Runs a sequence search.
     *
     * @param request events in temporal order, optional config overrides and video restriction.
     * @return ranked sequences.
     */
    @PostMapping("/search")
    public SequenceSearchResponse search(@Valid @RequestBody SequenceSearchRequest request) {
        List<Event> events = Event.fromDescriptions(request.events());
        AlgorithmConfig config = resolveConfig(request);
        try {
            List<ScoredSequence> sequences = searchService.search(events, config, request.videoId());
            return new SequenceSearchResponse(events.stream().map(Event::description).toList(),
                    sequences.size(), sequences);
        } catch (SequenceSearchException ex) {
            throw toStatus(ex);
        }
    }

    /**
     * Runs the same pipeline as {@link #search} on a cleared cache and reports every phase.
     */
    @PostMapping("/analyze")
    public AnalysisReport analyze(@Valid @RequestBody SequenceSearchRequest request) {
        List<Event> events = Event.fromDescriptions(request.events());
        AlgorithmConfig config = resolveConfig(request);
        try {
            return analysisService.analyze(events, config, request.videoId());
        } catch (SequenceSearchException ex) {
            throw toStatus(ex);
        }
    }

    @DeleteMapping("/cache")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clearCache() {
        searchService.clearCache();
    }

    private AlgorithmConfig resolveConfig(SequenceSearchRequest request) {
        AlgorithmConfig defaults = props.toAlgorithmConfig();
        if (request.config() == null) {
            return defaults;
        }
        try {
            return request.config().applyTo(defaults);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_CONFIG", ex);
        }
    }

    private static ResponseStatusException toStatus(SequenceSearchException ex) {
        HttpStatus status = switch (ex.getReason()) {
            case TOO_FEW_EVENTS -> HttpStatus.BAD_REQUEST;
            case NO_CANDIDATES -> HttpStatus.NOT_FOUND;
            case CANDIDATE_RETRIEVAL_FAILED -> HttpStatus.BAD_GATEWAY;
        };
        return new ResponseStatusException(status, ex.getReason().name(), ex);
    }
}
