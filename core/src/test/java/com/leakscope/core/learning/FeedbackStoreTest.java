package com.leakscope.core.learning;

import com.leakscope.core.model.MatchContext;
import com.leakscope.core.model.RawMatch;
import com.leakscope.core.pattern.PatternDefinition;
import com.leakscope.core.scanner.ConfidenceScorer;
import com.leakscope.core.util.FrozenClock;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class FeedbackStoreTest {

    private final FrozenClock clock = new FrozenClock(1_700_000_000_000L);
    private final FeedbackStore store = new FeedbackStore(clock);

    private void vote(String value, boolean falsePositive, int times) {
        for (int i = 0; i < times; i++) store.recordFeedback("p", value, falsePositive, Map.of());
    }

    @Test
    void seededPlaceholders_arePenalizedWithoutVotes() {
        assertThat(store.adjustment("any", "your_api_key_here")).isCloseTo(-0.3, within(1e-9));
        assertThat(store.adjustment("any", "  LOCALHOST ")).isCloseTo(-0.3, within(1e-9));
        assertThat(store.adjustment("any", "k9Qz81LmT")).isZero();
        assertThat(store.isKnownFalsePositive("Example.com")).isTrue();
    }

    @Test
    void falsePositiveVotes_pullHarderUpToCap() {
        vote("v1", true, 1);
        vote("v2", true, 2);
        vote("v10", true, 10);

        assertThat(store.adjustment("p", "v1")).isCloseTo(-0.30, within(1e-9));
        assertThat(store.adjustment("p", "v2")).isCloseTo(-0.35, within(1e-9));
        assertThat(store.adjustment("p", "v10")).isCloseTo(-0.45, within(1e-9));
    }

    @Test
    void truePositiveVotes_pushUp_andMixedVotesNetOut() {
        vote("tp", false, 1);
        vote("tp3", false, 5);
        vote("mixed", true, 1);
        vote("mixed", false, 1);

        assertThat(store.adjustment("p", "tp")).isCloseTo(0.2, within(1e-9));
        assertThat(store.adjustment("p", "tp3")).isCloseTo(0.3, within(1e-9));
        assertThat(store.adjustment("p", "mixed")).isCloseTo(-0.1, within(1e-9));
    }

    @Test
    void votedValue_isKnownToOtherPatterns() {
        vote("shared-value", false, 1);

        assertThat(store.adjustment("other-pattern", "SHARED-VALUE")).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void recordsPerEntry_areBounded() {
        vote("busy", true, 60);

        LearningData.Entry e = store.exportLearningData().feedbackData.get(FeedbackStore.keyOf("p", "busy"));
        assertThat(e.falsePositiveCount).isEqualTo(60);
        assertThat(e.records).hasSize(FeedbackStore.MAX_RECORDS_PER_ENTRY);
    }

    @Test
    void exportThenImport_reproducesAdjustments() {
        vote("alpha", true, 2);
        vote("beta", false, 1);
        LearningData exported = store.exportLearningData();

        FeedbackStore fresh = new FeedbackStore(clock);
        fresh.importLearningData(exported);

        assertThat(fresh.adjustment("p", "alpha")).isCloseTo(-0.35, within(1e-9));
        assertThat(fresh.adjustment("p", "beta")).isCloseTo(0.2, within(1e-9));
        assertThat(exported.timestamp.toEpochMilli()).isEqualTo(clock.nowMillis());
    }

    @Test
    void import_mergesCountsIntoExistingEntries() {
        vote("alpha", true, 1);
        LearningData snapshot = store.exportLearningData();

        store.importLearningData(snapshot);

        assertThat(store.adjustment("p", "alpha")).isCloseTo(-0.35, within(1e-9));
    }

    @Test
    void clear_keepsOnlySeedList() {
        vote("alpha", true, 1);
        vote("beta", false, 1);

        store.clearLearningData();

        FeedbackStore.Statistics s = store.statistics();
        assertThat(s.feedbackEntries()).isZero();
        assertThat(s.truePositiveValues()).isZero();
        assertThat(s.falsePositiveValues()).isEqualTo(FeedbackStore.SEED_FALSE_POSITIVES.size());
        assertThat(store.adjustment("p", "alpha")).isZero();
        assertThat(store.adjustment("p", "localhost")).isCloseTo(-0.3, within(1e-9));
    }

    @Test
    void statistics_countVotes() {
        vote("alpha", true, 2);
        vote("beta", false, 3);

        FeedbackStore.Statistics s = store.statistics();
        assertThat(s.feedbackEntries()).isEqualTo(2);
        assertThat(s.falsePositiveVotes()).isEqualTo(2);
        assertThat(s.truePositiveVotes()).isEqualTo(3);
    }

    @Test
    void scorer_usesStoreAdjustment() {
        PatternDefinition p = PatternDefinition.builder().id("p").name("P").regex("x").confidence(0.95).build();
        RawMatch m = new RawMatch("abcdabcd", "abcdabcd", 0, 8, MatchContext.EMPTY, List.of());
        ConfidenceScorer scorer = new ConfidenceScorer(store, true);

        assertThat(scorer.score(m, p)).isCloseTo(0.95, within(1e-9));
        vote("abcdabcd", true, 1);
        assertThat(scorer.score(m, p)).isCloseTo(0.65, within(1e-9));
    }
}
