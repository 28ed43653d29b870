package com.example.keyseq_backend.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One ordered stage of a temporal query.
 *
 * @param index       zero-based position in the event list.
 * @param description free-text description of what should be visible in the frame.
 * @param weight      event weight, currently always {@code 1.0}.
 */
public record Event(int index, String description, double weight) {

    public static final double DEFAULT_WEIGHT = 1.0;

    public Event {
        Objects.requireNonNull(description, "description");
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
    }

    /**
     * Builds the ordered event list from raw descriptions, skipping blank entries.
     *
     * @param descriptions descriptions in temporal order.
     * @return immutable event list with consecutive indices.
     */
    public static List<Event> fromDescriptions(List<String> descriptions) {
        if (descriptions == null) {
            return List.of();
        }
        List<Event> events = new ArrayList<>();
        for (String raw : descriptions) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            events.add(new Event(events.size(), raw.trim(), DEFAULT_WEIGHT));
        }
        return List.copyOf(events);
    }
}
