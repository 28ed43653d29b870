package com.example.keyseq_backend.sequence;

import com.example.keyseq_backend.model.ScoredSequence;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Component
public class SequenceRanker {

    /**
     * Keeps sequences scoring at least {@code scoreThreshold}, best first. Exact ties keep input order.
     */
    public List<ScoredSequence> rank(List<ScoredSequence> sequences, double scoreThreshold) {
        List<ScoredSequence> kept = new ArrayList<>();
        for (ScoredSequence s : sequences) {
            if (s.score() >= scoreThreshold) {
                kept.add(s);
            }
        }
        kept.sort(Comparator.comparingDouble(ScoredSequence::score).reversed());
        return List.copyOf(kept);
    }
}
