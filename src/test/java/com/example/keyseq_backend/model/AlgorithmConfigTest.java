package com.example.keyseq_backend.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AlgorithmConfigTest {

    @Test
    void defaultsMatchDocumentedValues() {
        AlgorithmConfig cfg = AlgorithmConfig.defaults();

        assertThat(cfg.similarityThreshold()).isEqualTo(0.0);
        assertThat(cfg.scoreThreshold()).isEqualTo(0.0);
        assertThat(cfg.topK()).isEqualTo(10);
        assertThat(cfg.maxTemporalGap()).isEqualTo(150);
        assertThat(cfg.searchWindow()).isEqualTo(3000);
        assertThat(cfg.minSequenceCompleteness()).isEqualTo(0.1);
        assertThat(cfg.temporalWeight()).isEqualTo(0.3);
        assertThat(cfg.completenessWeight()).isEqualTo(0.2);
        assertThat(cfg.callTimeoutSeconds()).isZero();
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> new AlgorithmConfig(0, 0, 0, 150, 3000, 0.1, 0.3, 0.2));
        assertThrows(IllegalArgumentException.class, () -> new AlgorithmConfig(0, 0, 10, 0, 3000, 0.1, 0.3, 0.2));
        assertThrows(IllegalArgumentException.class, () -> new AlgorithmConfig(0, 0, 10, 150, -1, 0.1, 0.3, 0.2));
        assertThrows(IllegalArgumentException.class, () -> AlgorithmConfig.defaults().withMinSequenceCompleteness(1.2));
        assertThrows(IllegalArgumentException.class, () -> new AlgorithmConfig(0, 0, 10, 150, 3000, 0.1, -0.3, 0.2));
        assertThrows(IllegalArgumentException.class, () -> AlgorithmConfig.defaults().withCallTimeoutSeconds(-1));
        assertThrows(IllegalArgumentException.class, () -> AlgorithmConfig.defaults().withCallTimeoutSeconds(601));
    }

    @Test
    void eventsSkipBlankDescriptionsAndKeepConsecutiveIndices() {
        List<Event> events = Event.fromDescriptions(Arrays.asList(" person enters ", "", null, "car arrives"));

        assertThat(events).extracting(Event::index).containsExactly(0, 1);
        assertThat(events).extracting(Event::description).containsExactly("person enters", "car arrives");
        assertThat(events).extracting(Event::weight).containsOnly(Event.DEFAULT_WEIGHT);
    }

    @Test
    void similarityMatrixRejectsRaggedRows() {
        assertThrows(IllegalArgumentException.class,
                () -> SimilarityMatrix.of(new double[][]{{0.1, 0.2}, {0.3}}));
        SimilarityMatrix matrix = SimilarityMatrix.of(new double[][]{{0.1, 0.2}, {0.3, 0.4}});
        assertThat(matrix.get(1, 0)).isEqualTo(0.3);
        assertThat(matrix.covers(1, 2)).isFalse();
    }
}
