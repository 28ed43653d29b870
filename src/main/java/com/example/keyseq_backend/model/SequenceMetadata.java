package com.example.keyseq_backend.model;

/**
 * Derived facts about a scored sequence.
 *
 * @param videoId      video all slots belong to.
 * @param startFrame   smallest frame number in the sequence.
 * @param endFrame     largest frame number in the sequence.
 * @param duration     {@code endFrame - startFrame}, in frame numbers.
 * @param completeness assigned events divided by total events.
 */
public record SequenceMetadata(String videoId,
                               int startFrame,
                               int endFrame,
                               int duration,
                               double completeness) {
}
