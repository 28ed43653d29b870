package com.example.keyseq_backend.dto.retrieval;

import com.example.keyseq_backend.model.Frame;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Keyframe row as returned by {@code search/text} and {@code video/{id}/frames}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FrameRecord(
        @JsonProperty("id") long id,
        @JsonProperty("video_id") String videoId,
        @JsonProperty("keyframe_n") int keyframeN,
        @JsonProperty("pts_time") Double ptsTime,
        @JsonProperty("similarity") Double similarity,
        @JsonProperty("image_path") String imagePath,
        @JsonProperty("image_filename") String imageFilename
) {

    public Frame toFrame() {
        return toFrame(null);
    }

    /**
     * Converts to the domain frame, using {@code fallbackVideoId} when the row carries no video id.
     */
    public Frame toFrame(String fallbackVideoId) {
        String video = videoId != null && !videoId.isBlank() ? videoId : fallbackVideoId;
        String imageRef = imagePath != null && !imagePath.isBlank() ? imagePath : imageFilename;
        return new Frame(id, video, keyframeN,
                ptsTime == null ? 0.0 : ptsTime,
                similarity == null ? 0.0 : similarity,
                imageRef);
    }
}
