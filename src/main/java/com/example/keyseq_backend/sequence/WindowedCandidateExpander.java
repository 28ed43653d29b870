package com.example.keyseq_backend.sequence;

import com.example.keyseq_backend.model.Frame;
import com.example.keyseq_backend.service.retrieval.RetrievalClient;
import com.example.keyseq_backend.service.retrieval.RetrievalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Collects the frames of the pivot's video within a frame-number radius around the pivot.
 */
@Component
public class WindowedCandidateExpander {
    private static final Logger LOGGER = LoggerFactory.getLogger(WindowedCandidateExpander.class);

    private final RetrievalClient retrievalClient;

    public WindowedCandidateExpander(RetrievalClient retrievalClient) {
        this.retrievalClient = retrievalClient;
    }

    /**
     * Returns the frames of the pivot's video whose frame number lies in
     * {@code [max(1, pivot - searchWindow), pivot + searchWindow]}, ordered by frame number.
     * A failed frame listing yields an empty window.
     */
    public List<Frame> expand(SearchSession session, Frame pivot, int searchWindow) {
        FrameRange range = FrameRange.around(pivot.frameNumber(), searchWindow);
        List<Frame> all;
        try {
            all = session.videoFrames(pivot.videoId(),
                    videoId -> retrievalClient.videoFrames(videoId, session.callTimeout()));
        } catch (RetrievalException ex) {
            LOGGER.warn("frame listing failed session={} video={}: {}", session.id(), pivot.videoId(), ex.getMessage());
            return List.of();
        }
        List<Frame> window = all.stream()
                .filter(f -> pivot.videoId().equals(f.videoId()))
                .filter(f -> range.contains(f.frameNumber()))
                .sorted(Comparator.comparingInt(Frame::frameNumber))
                .toList();
        LOGGER.debug("window session={} video={} range=[{},{}] frames={}",
                session.id(), pivot.videoId(), range.min(), range.max(), window.size());
        return window;
    }

    /**
     * Inclusive frame-number range.
     */
    public record FrameRange(int min, int max) {

        public static FrameRange around(int pivotFrameNumber, int searchWindow) {
            long low = Math.max(1L, (long) pivotFrameNumber - searchWindow);
            long high = Math.min(Integer.MAX_VALUE, (long) pivotFrameNumber + searchWindow);
            return new FrameRange((int) low, (int) high);
        }

        public boolean contains(int frameNumber) {
            return frameNumber >= min && frameNumber <= max;
        }
    }
}
