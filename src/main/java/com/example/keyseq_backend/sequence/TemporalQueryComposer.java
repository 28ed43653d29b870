package com.example.keyseq_backend.sequence;

import com.example.keyseq_backend.model.Event;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Merges ordered events into the single text query used for the initial candidate retrieval.
 */
@Component
public class TemporalQueryComposer {

    static final String PREFIX = "temporal sequence: ";
    private static final String[] TRANSITIONS = {"followed by", "then", "subsequently"};

    public String compose(List<Event> events) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("at least one event is required");
        }
        if (events.size() == 1) {
            return events.get(0).description();
        }
        StringBuilder query = new StringBuilder(PREFIX);
        int last = events.size() - 1;
        for (int i = 0; i < events.size(); i++) {
            String word;
            if (i == 0) {
                word = "first";
            } else if (i == last) {
                word = "finally";
            } else {
                word = TRANSITIONS[i % TRANSITIONS.length];
            }
            query.append(word).append(' ').append(events.get(i).description());
            if (i < last) {
                query.append(", ");
            }
        }
        return query.toString();
    }
}
