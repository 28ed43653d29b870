package com.example.keyseq_backend.model;

/**
 * Result of pivot selection for a single candidate frame.
 *
 * @param candidate  the candidate frame acting as tentative pivot.
 * @param eventIndex index of the event the candidate matches best.
 * @param similarity similarity between the candidate and that event.
 */
public record PivotMatch(Frame candidate, int eventIndex, double similarity) {
}
