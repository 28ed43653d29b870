package com.example.keyseq_backend.sequence;

import com.example.keyseq_backend.model.ScoreBreakdown;
import com.example.keyseq_backend.model.ScoredSequence;
import com.example.keyseq_backend.model.SequenceMetadata;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SequenceRankerTest {

    private final SequenceRanker ranker = new SequenceRanker();

    @Test
    void filtersByThresholdAndSortsDescending() {
        ScoredSequence low = scored(0.2, "a");
        ScoredSequence mid = scored(0.5, "b");
        ScoredSequence high = scored(0.9, "c");

        List<ScoredSequence> ranked = ranker.rank(List.of(low, high, mid), 0.5);

        assertThat(ranked).containsExactly(high, mid);
    }

    @Test
    void exactTiesKeepInputOrder() {
        ScoredSequence first = scored(0.7, "first");
        ScoredSequence second = scored(0.7, "second");
        ScoredSequence best = scored(0.8, "best");

        List<ScoredSequence> ranked = ranker.rank(List.of(first, second, best), 0.0);

        assertThat(ranked).extracting(s -> s.metadata().videoId()).containsExactly("best", "first", "second");
    }

    private static ScoredSequence scored(double score, String videoId) {
        return new ScoredSequence(List.of(), score, new ScoreBreakdown(0, 0, 0, 0, 0),
                new SequenceMetadata(videoId, 0, 0, 0, 0));
    }
}
