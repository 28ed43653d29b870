package com.example.keyseq_backend.model;

/**
 * Assignment of one event to a frame. Unassigned slots only exist while a sequence is being built;
 * finalized sequences contain assigned slots exclusively.
 *
 * @param eventIndex  event this slot belongs to.
 * @param frame       chosen frame, {@code null} only when {@code assigned} is {@code false}.
 * @param similarity  similarity of the frame to the event.
 * @param frameNumber keyframe number of the chosen frame, {@code -1} when unassigned.
 * @param videoId     video of the chosen frame, {@code null} when unassigned.
 * @param pivot       whether this slot holds the pivot frame.
 * @param assigned    whether a frame was found for the event.
 */
public record SequenceSlot(int eventIndex,
                           Frame frame,
                           double similarity,
                           int frameNumber,
                           String videoId,
                           boolean pivot,
                           boolean assigned) {

    public static SequenceSlot unassigned(int eventIndex) {
        return new SequenceSlot(eventIndex, null, 0.0, -1, null, false, false);
    }

    public static SequenceSlot pivot(int eventIndex, Frame frame, double similarity) {
        return new SequenceSlot(eventIndex, frame, similarity, frame.frameNumber(), frame.videoId(), true, true);
    }

    public static SequenceSlot matched(int eventIndex, Frame frame, double similarity) {
        return new SequenceSlot(eventIndex, frame, similarity, frame.frameNumber(), frame.videoId(), false, true);
    }
}
