package com.example.keyseq_backend.service.retrieval;

import com.example.keyseq_backend.config.RetrievalProperties;
import com.example.keyseq_backend.config.SimilarityProperties;
import com.example.keyseq_backend.dto.retrieval.BatchMatrixResponse;
import com.example.keyseq_backend.model.Frame;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RetrievalClientTest {

    @Test
    void searchTextSendsQueryParametersAndMapsFrames() {
        List<URI> urls = new CopyOnWriteArrayList<>();
        RetrievalClient client = client(request -> {
            urls.add(request.url());
            return Mono.just(json(HttpStatus.OK, """
                    {"query":"q","total_found":2,"results":[
                      {"id":11,"video_id":"L01_V001","keyframe_n":500,"pts_time":20.0,"similarity":0.81,"image_path":"k/500.jpg"},
                      {"id":12,"video_id":"L01_V002","keyframe_n":90,"similarity":0.5,"image_filename":"90.jpg","extra":true}
                    ]}
                    """));
        }, new SimilarityProperties());

        List<Frame> frames = client.searchText("temporal sequence: first a, finally b", 5, "L01_V001", null);

        assertThat(frames).hasSize(2);
        assertThat(frames.get(0)).isEqualTo(new Frame(11, "L01_V001", 500, 20.0, 0.81, "k/500.jpg"));
        assertThat(frames.get(1).imageRef()).isEqualTo("90.jpg");
        assertThat(frames.get(1).timestamp()).isEqualTo(0.0);
        assertThat(urls.get(0).getPath()).isEqualTo("/search/text");
        assertThat(urls.get(0).getRawQuery()).contains("top_k=5").contains("video_id=L01_V001");
    }

    @Test
    void videoFramesFillsMissingVideoId() {
        RetrievalClient client = client(request -> Mono.just(json(HttpStatus.OK, """
                [{"id":1,"keyframe_n":10,"pts_time":0.4},{"id":2,"keyframe_n":20,"pts_time":0.8}]
                """)), new SimilarityProperties());

        List<Frame> frames = client.videoFrames("L02_V010", null);

        assertThat(frames).extracting(Frame::videoId).containsOnly("L02_V010");
        assertThat(frames).extracting(Frame::similarity).containsOnly(0.0);
    }

    @Test
    void batchMatrixRetriesConnectionAndServerErrors() {
        SimilarityProperties props = new SimilarityProperties();
        props.setBatchRetryAttempts(2);
        props.setBatchRetryBackoffMillis(1);
        AtomicInteger attempts = new AtomicInteger();
        RetrievalClient client = client(request -> {
            int attempt = attempts.incrementAndGet();
            if (attempt == 1) {
                return Mono.error(new WebClientRequestException(new IOException("connection reset"),
                        HttpMethod.POST, request.url(), new HttpHeaders()));
            }
            if (attempt == 2) {
                return Mono.just(json(HttpStatus.SERVICE_UNAVAILABLE, "{\"detail\":\"busy\"}"));
            }
            return Mono.just(json(HttpStatus.OK, "{\"similarity_matrix\":[[0.1,0.2]],\"shape\":[1,2]}"));
        }, props);

        BatchMatrixResponse response = client.batchMatrix(List.of(1L, 2L), List.of("a"), null);

        assertThat(attempts.get()).isEqualTo(3);
        assertThat(response.similarityMatrix()).containsExactly(List.of(0.1, 0.2));
    }

    @Test
    void batchMatrixDoesNotRetryClientErrors() {
        SimilarityProperties props = new SimilarityProperties();
        props.setBatchRetryAttempts(3);
        props.setBatchRetryBackoffMillis(1);
        AtomicInteger attempts = new AtomicInteger();
        RetrievalClient client = client(request -> {
            attempts.incrementAndGet();
            return Mono.just(json(HttpStatus.UNPROCESSABLE_ENTITY, "{\"detail\":\"too many frames\"}"));
        }, props);

        RetrievalException ex = assertThrows(RetrievalException.class,
                () -> client.batchMatrix(List.of(1L), List.of("a"), null));

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(ex.getStatus()).isEqualTo(422);
        assertThat(ex.getEndpoint()).isEqualTo(RetrievalClient.BATCH_MATRIX);
    }

    @Test
    void missingSimilarityIsAnError() {
        RetrievalClient client = client(request -> Mono.just(json(HttpStatus.OK,
                "{\"frame_id\":4,\"text_query\":\"a\"}")), new SimilarityProperties());

        assertThrows(RetrievalException.class, () -> client.frameTextSimilarity(4, "a", null));
    }

    @Test
    void perCallTimeoutBoundsTheCall() {
        RetrievalClient client = client(request -> Mono.never(), new SimilarityProperties());

        RetrievalException ex = assertThrows(RetrievalException.class,
                () -> client.frameTextSimilarity(4, "a", Duration.ofMillis(50)));

        assertThat(ex.getEndpoint()).isEqualTo(RetrievalClient.FRAME_TEXT_SIMILARITY);
        assertThat(ex.getMessage()).contains("timed out");
    }

    @Test
    void perCallTimeoutIsCappedAtConfiguredTimeout() {
        RetrievalClient client = client(request -> Mono.never(), new SimilarityProperties());

        assertThat(client.effective(null)).isEqualTo(Duration.ofSeconds(30));
        assertThat(client.effective(Duration.ofSeconds(5))).isEqualTo(Duration.ofSeconds(5));
        assertThat(client.effective(Duration.ofMinutes(10))).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void transportFailureBecomesRetrievalException() {
        RetrievalClient client = client(request -> Mono.error(new IllegalStateException("connection refused")),
                new SimilarityProperties());

        RetrievalException ex = assertThrows(RetrievalException.class, () -> client.searchText("q", 10, null, null));

        assertThat(ex.getStatus()).isNull();
        assertThat(ex.getMessage()).contains("connection refused");
    }

    private static RetrievalClient client(ExchangeFunction exchange, SimilarityProperties similarityProps) {
        WebClient webClient = WebClient.builder().exchangeFunction(exchange).build();
        return new RetrievalClient(webClient, new RetrievalProperties(), similarityProps);
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
