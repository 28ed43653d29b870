package com.example.keyseq_backend.model;

/**
 * Keyframe reference data as delivered by the retrieval service. Never mutated by the engine.
 *
 * @param id          opaque frame identifier used by the similarity endpoints.
 * @param videoId     owning video.
 * @param frameNumber keyframe number, unique within a video and increasing with playback time.
 * @param timestamp   presentation time in seconds.
 * @param similarity  similarity reported by the retrieval call that produced this frame
 *                    ({@code 0.0} for frames listed without a query).
 * @param imageRef    image path or reference, may be {@code null}.
 */
public record Frame(long id,
                    String videoId,
                    int frameNumber,
                    double timestamp,
                    double similarity,
                    String imageRef) {
}
