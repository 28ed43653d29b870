package com.example.keyseq_backend.service.retrieval;

import com.example.keyseq_backend.config.RetrievalProperties;
import com.example.keyseq_backend.config.SimilarityProperties;
import com.example.keyseq_backend.dto.retrieval.BatchMatrixRequest;
import com.example.keyseq_backend.dto.retrieval.BatchMatrixResponse;
import com.example.keyseq_backend.dto.retrieval.FrameRecord;
import com.example.keyseq_backend.dto.retrieval.FrameTextSimilarityResponse;
import com.example.keyseq_backend.dto.retrieval.TextSearchResponse;
import com.example.keyseq_backend.model.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Blocking client for the keyframe retrieval service. Every call is bounded by
 * {@code retrieval.timeout-seconds}; callers may pass a shorter per-call timeout.
 * Failures surface as {@link RetrievalException}.
 */
@Component
public class RetrievalClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetrievalClient.class);

    static final String SEARCH_TEXT = "/search/text";
    static final String VIDEO_FRAMES = "/video/{videoId}/frames";
    static final String FRAME_TEXT_SIMILARITY = "/similarity/frame-text";
    static final String BATCH_MATRIX = "/similarity/batch-matrix";

    private static final ParameterizedTypeReference<List<FrameRecord>> FRAME_LIST = new ParameterizedTypeReference<>() {
    };

    private final WebClient client;
    private final Duration timeout;
    private final int batchRetryAttempts;
    private final Duration batchRetryBackoff;

    public RetrievalClient(@Qualifier("retrievalWebClient") WebClient client,
                           RetrievalProperties props,
                           SimilarityProperties similarityProps) {
        this.client = client;
        this.timeout = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
        this.batchRetryAttempts = Math.max(0, similarityProps.getBatchRetryAttempts());
        this.batchRetryBackoff = Duration.ofMillis(Math.max(0, similarityProps.getBatchRetryBackoffMillis()));
    }

    /**
     * Runs the text-to-frame retrieval.
     *
     * @param query   text query.
     * @param topK    number of results requested.
     * @param videoId optional video restriction.
     * @param timeout optional per-call timeout, capped at the configured one.
     * @return frames in the order returned by the service.
     */
    public List<Frame> searchText(String query, int topK, @Nullable String videoId, @Nullable Duration timeout) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("query", query);
        vars.put("topK", topK);
        if (videoId != null && !videoId.isBlank()) {
            vars.put("videoId", videoId);
        }
        long start = System.currentTimeMillis();
        TextSearchResponse response = execute(SEARCH_TEXT, client.post()
                .uri(b -> {
                    b.path(SEARCH_TEXT).queryParam("query", "{query}").queryParam("top_k", "{topK}");
                    if (vars.containsKey("videoId")) {
                        b.queryParam("video_id", "{videoId}");
                    }
                    return b.build(vars);
                })
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp -> toError(SEARCH_TEXT, resp))
                .bodyToMono(TextSearchResponse.class), effective(timeout));
        if (response == null || response.results() == null) {
            throw new RetrievalException(SEARCH_TEXT, "empty search response");
        }
        LOGGER.debug("retrieval search topK={} videoId={} results={} in {} ms",
                topK, videoId, response.results().size(), System.currentTimeMillis() - start);
        return response.results().stream().map(r -> r.toFrame()).toList();
    }

    /**
     * Lists every keyframe of a video.
     */
    public List<Frame> videoFrames(String videoId, @Nullable Duration timeout) {
        List<FrameRecord> records = execute(VIDEO_FRAMES, client.get()
                .uri(VIDEO_FRAMES, videoId)
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp -> toError(VIDEO_FRAMES, resp))
                .bodyToMono(FRAME_LIST), effective(timeout));
        if (records == null) {
            return List.of();
        }
        return records.stream().map(r -> r.toFrame(videoId)).toList();
    }

    /**
     * Single-pair similarity between a stored frame and a text query.
     */
    public double frameTextSimilarity(long frameId, String textQuery, @Nullable Duration timeout) {
        FrameTextSimilarityResponse response = execute(FRAME_TEXT_SIMILARITY, client.post()
                .uri(b -> b.path(FRAME_TEXT_SIMILARITY)
                        .queryParam("frame_id", "{frameId}")
                        .queryParam("text_query", "{text}")
                        .build(Map.of("frameId", frameId, "text", textQuery)))
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp -> toError(FRAME_TEXT_SIMILARITY, resp))
                .bodyToMono(FrameTextSimilarityResponse.class), effective(timeout));
        if (response == null || response.similarity() == null) {
            throw new RetrievalException(FRAME_TEXT_SIMILARITY, "similarity missing for frame " + frameId);
        }
        return response.similarity();
    }

    /**
     * Computes the query x frame similarity matrix in one call. Transport failures and 5xx responses
     * are retried {@code similarity.batch-retry-attempts} times.
     */
    public BatchMatrixResponse batchMatrix(List<Long> frameIds, List<String> textQueries, @Nullable Duration timeout) {
        Duration perAttempt = effective(timeout);
        long start = System.currentTimeMillis();
        BatchMatrixResponse response = execute(BATCH_MATRIX, client.post()
                .uri(BATCH_MATRIX)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new BatchMatrixRequest(frameIds, textQueries))
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp -> toError(BATCH_MATRIX, resp))
                .bodyToMono(BatchMatrixResponse.class)
                .timeout(perAttempt)
                .retryWhen(Retry.backoff(batchRetryAttempts, batchRetryBackoff)
                        .filter(this::isRetryable)
                        .doBeforeRetry(signal -> LOGGER.warn("batch matrix retry attempt={} frames={} queries={} type={}",
                                signal.totalRetriesInARow() + 1, frameIds.size(), textQueries.size(),
                                signal.failure() == null ? "unknown" : signal.failure().getClass().getSimpleName()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure())),
                batchBudget(perAttempt));
        if (response == null || response.similarityMatrix() == null) {
            throw new RetrievalException(BATCH_MATRIX, "empty similarity matrix");
        }
        LOGGER.debug("batch matrix {}x{} computed in {} ms", textQueries.size(), frameIds.size(),
                System.currentTimeMillis() - start);
        return response;
    }

    private <T> T execute(String endpoint, Mono<T> call, Duration budget) {
        try {
            return call.timeout(budget).block();
        } catch (RetrievalException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            Throwable cause = Exceptions.unwrap(ex);
            if (cause instanceof RetrievalException retrievalException) {
                throw retrievalException;
            }
            String message = cause instanceof TimeoutException
                    ? endpoint + " timed out after " + budget.toMillis() + " ms"
                    : endpoint + " failed: " + cause.getMessage();
            throw new RetrievalException(endpoint, null, message, cause);
        }
    }

    Duration effective(@Nullable Duration requested) {
        if (requested == null || requested.isNegative() || requested.isZero()) {
            return timeout;
        }
        return requested.compareTo(timeout) < 0 ? requested : timeout;
    }

    // each attempt has its own timeout, the outer budget covers all attempts plus backoff
    private Duration batchBudget(Duration perAttempt) {
        return perAttempt.multipliedBy(batchRetryAttempts + 1L)
                .plus(batchRetryBackoff.multipliedBy(2L * batchRetryAttempts + 1L));
    }

    private static Mono<RetrievalException> toError(String endpoint, ClientResponse resp) {
        return resp.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new RetrievalException(endpoint, resp.statusCode().value(),
                        "retrieval error %s on %s: %s".formatted(resp.statusCode(), endpoint, body), null));
    }

    private boolean isRetryable(Throwable failure) {
        Throwable root = Exceptions.unwrap(failure);
        if (root instanceof RetrievalException ex) {
            return ex.getStatus() != null && ex.getStatus() >= 500;
        }
        return root instanceof WebClientRequestException
                || root instanceof PrematureCloseException
                || root instanceof TimeoutException;
    }
}
