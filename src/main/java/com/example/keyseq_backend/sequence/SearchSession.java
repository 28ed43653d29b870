package com.example.keyseq_backend.sequence;

import com.example.keyseq_backend.model.AlgorithmConfig;
import com.example.keyseq_backend.model.Frame;
import com.example.keyseq_backend.service.similarity.SimilarityCache;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * State owned by one search call: an immutable config snapshot, the similarity cache handle and the
 * per-video frame lists fetched so far. Passed by reference through every engine component.
 */
public final class SearchSession {

    private final String id;
    private final AlgorithmConfig config;
    private final SimilarityCache cache;
    private final boolean analysis;
    private final int frameLimit;
    private final Map<String, List<Frame>> videoFrames = new ConcurrentHashMap<>();

    private SearchSession(AlgorithmConfig config, SimilarityCache cache, boolean analysis, int frameLimit) {
        this.id = UUID.randomUUID().toString().substring(0, 8);
        this.config = Objects.requireNonNull(config, "config");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.analysis = analysis;
        this.frameLimit = frameLimit;
    }

    /**
     * Regular search session sharing whatever the cache already holds.
     */
    public static SearchSession search(AlgorithmConfig config, SimilarityCache cache) {
        return new SearchSession(config, cache, false, 0);
    }

    /**
     * Analysis session: clears the cache before starting and caps the frames scored per window.
     *
     * @param frameLimit maximum window frames scored per candidate, {@code 0} for no cap.
     */
    public static SearchSession analysis(AlgorithmConfig config, SimilarityCache cache, int frameLimit) {
        cache.clear();
        return new SearchSession(config, cache, true, Math.max(0, frameLimit));
    }

    public String id() {
        return id;
    }

    public AlgorithmConfig config() {
        return config;
    }

    public SimilarityCache cache() {
        return cache;
    }

    public boolean isAnalysis() {
        return analysis;
    }

    public int frameLimit() {
        return frameLimit;
    }

    /**
     * Caller-requested timeout for each retrieval call, or {@code null} for the server default.
     */
    @Nullable
    public Duration callTimeout() {
        int seconds = config.callTimeoutSeconds();
        return seconds > 0 ? Duration.ofSeconds(seconds) : null;
    }

    List<Frame> videoFrames(String videoId, Function<String, List<Frame>> loader) {
        List<Frame> cached = videoFrames.get(videoId);
        if (cached != null) {
            return cached;
        }
        List<Frame> loaded = List.copyOf(loader.apply(videoId));
        videoFrames.put(videoId, loaded);
        return loaded;
    }
}
