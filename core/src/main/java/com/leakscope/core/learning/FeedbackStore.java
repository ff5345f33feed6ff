package com.leakscope.core.learning;

import com.leakscope.core.model.Finding;
import com.leakscope.core.pattern.PatternDefinition;
import com.leakscope.core.scanner.FeedbackAdjuster;
import com.leakscope.core.scanner.dedupe.FingerprintGenerator;
import com.leakscope.core.util.MillisClock;
import com.leakscope.core.util.StructuredLog;
import com.leakscope.core.util.TextUtil;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 사용자 피드백 저장소. 지문(patternId, value) 단위로 오탐/정탐 표를 센다.
 * 표가 많을수록 보정 폭이 커지며(상한 있음), 표가 없으면 알려진 자리표시 값 목록을 본다.
 * 읽기-수정-쓰기는 모두 한 락 아래에서 일어난다.
 */
public final class FeedbackStore implements FeedbackAdjuster {
    private static final StructuredLog SLOG = StructuredLog.get(FeedbackStore.class);

    /** 처음부터 오탐으로 취급하는 자리표시/환경 이름 값 */
    static final List<String> SEED_FALSE_POSITIVES = List.of(
            "your_api_key_here", "your_secret_key", "replace_with_your_key",
            "insert_your_key_here", "add_your_api_key", "your_token_here",
            "test_key_123", "example_secret", "demo_token", "sample_api_key",
            "mock_secret_key", "fake_token_123",
            "localhost", "example.com", "test.com",
            "development", "production", "staging",
            "null", "undefined", "empty", "none", "default");

    static final double KNOWN_FP_ADJUSTMENT = -0.30;
    static final double KNOWN_TP_ADJUSTMENT = 0.20;
    static final int MAX_RECORDS_PER_ENTRY = 50;

    private final MillisClock clock;
    private final Set<String> falsePositiveValues = new LinkedHashSet<>();
    private final Set<String> truePositiveValues = new LinkedHashSet<>();
    private final Map<String, LearningData.Entry> entries = new LinkedHashMap<>();

    public FeedbackStore() {
        this(MillisClock.SYSTEM);
    }

    public FeedbackStore(MillisClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        falsePositiveValues.addAll(SEED_FALSE_POSITIVES);
    }

    public void recordFeedback(Finding finding, PatternDefinition pattern, boolean isFalsePositive,
                               Map<String, Object> metadata) {
        Objects.requireNonNull(finding, "finding");
        String patternId = (pattern != null ? pattern.getId() : finding.getPatternId());
        recordFeedback(patternId, finding.getValue(), isFalsePositive, metadata);
    }

    public synchronized void recordFeedback(String patternId, String value, boolean isFalsePositive,
                                            Map<String, Object> metadata) {
        String key = keyOf(patternId, value);
        String norm = TextUtil.normalizeValue(value);
        Instant now = Instant.ofEpochMilli(clock.nowMillis());

        LearningData.Entry e = entries.computeIfAbsent(key, k -> {
            LearningData.Entry n = new LearningData.Entry();
            n.patternId = patternId;
            n.value = norm;
            return n;
        });
        if (isFalsePositive) {
            e.falsePositiveCount++;
            falsePositiveValues.add(norm);
        } else {
            e.truePositiveCount++;
            truePositiveValues.add(norm);
        }
        e.records.add(new FeedbackRecord(isFalsePositive, now, metadata));
        if (e.records.size() > MAX_RECORDS_PER_ENTRY) e.records.remove(0);
        e.lastUpdated = now;

        SLOG.info("feedback-recorded", "pattern", patternId, "falsePositive", isFalsePositive,
                "fp", e.falsePositiveCount, "tp", e.truePositiveCount);
    }

    /**
     * 표가 있으면 tpPush - fpPull
     *   fpPull = min(0.45, 0.30 + 0.05*(fp-1)),  tpPush = min(0.30, 0.20 + 0.05*(tp-1))
     * 표가 없으면 알려진 오탐 값 -0.30, 알려진 정탐 값 +0.20, 그 외 0
     */
    @Override
    public synchronized double adjustment(String patternId, String value) {
        LearningData.Entry e = entries.get(keyOf(patternId, value));
        if (e != null && (e.falsePositiveCount > 0 || e.truePositiveCount > 0)) {
            double fpPull = e.falsePositiveCount > 0 ? Math.min(0.45, 0.30 + 0.05 * (e.falsePositiveCount - 1)) : 0.0;
            double tpPush = e.truePositiveCount > 0 ? Math.min(0.30, 0.20 + 0.05 * (e.truePositiveCount - 1)) : 0.0;
            return tpPush - fpPull;
        }
        String norm = TextUtil.normalizeValue(value);
        if (falsePositiveValues.contains(norm)) return KNOWN_FP_ADJUSTMENT;
        if (truePositiveValues.contains(norm)) return KNOWN_TP_ADJUSTMENT;
        return 0.0;
    }

    public synchronized boolean isKnownFalsePositive(String value) {
        return falsePositiveValues.contains(TextUtil.normalizeValue(value));
    }

    public synchronized LearningData exportLearningData() {
        LearningData d = new LearningData();
        d.falsePositivePatterns = new ArrayList<>(falsePositiveValues);
        d.truePositivePatterns = new ArrayList<>(truePositiveValues);
        d.feedbackData = new LinkedHashMap<>();
        for (Map.Entry<String, LearningData.Entry> me : entries.entrySet()) {
            d.feedbackData.put(me.getKey(), copyOf(me.getValue()));
        }
        d.timestamp = Instant.ofEpochMilli(clock.nowMillis());
        return d;
    }

    /** 기존 데이터에 합친다 (카운트는 더하고 기록은 이어 붙임). */
    public synchronized void importLearningData(LearningData data) {
        Objects.requireNonNull(data, "data");
        if (data.falsePositivePatterns != null) {
            for (String s : data.falsePositivePatterns) falsePositiveValues.add(TextUtil.normalizeValue(s));
        }
        if (data.truePositivePatterns != null) {
            for (String s : data.truePositivePatterns) truePositiveValues.add(TextUtil.normalizeValue(s));
        }
        int merged = 0;
        if (data.feedbackData != null) {
            for (Map.Entry<String, LearningData.Entry> me : data.feedbackData.entrySet()) {
                LearningData.Entry in = me.getValue();
                if (in == null || me.getKey() == null) continue;
                LearningData.Entry cur = entries.get(me.getKey());
                if (cur == null) {
                    entries.put(me.getKey(), copyOf(in));
                } else {
                    cur.falsePositiveCount += Math.max(0, in.falsePositiveCount);
                    cur.truePositiveCount += Math.max(0, in.truePositiveCount);
                    if (in.records != null) cur.records.addAll(in.records);
                    while (cur.records.size() > MAX_RECORDS_PER_ENTRY) cur.records.remove(0);
                    if (in.lastUpdated != null && (cur.lastUpdated == null || in.lastUpdated.isAfter(cur.lastUpdated))) {
                        cur.lastUpdated = in.lastUpdated;
                    }
                }
                merged++;
            }
        }
        SLOG.info("learning-imported", "entries", merged,
                "fpValues", falsePositiveValues.size(), "tpValues", truePositiveValues.size());
    }

    /** 학습 내용을 지우고 기본 자리표시 목록만 남긴다. */
    public synchronized void clearLearningData() {
        entries.clear();
        truePositiveValues.clear();
        falsePositiveValues.clear();
        falsePositiveValues.addAll(SEED_FALSE_POSITIVES);
        SLOG.info("learning-cleared");
    }

    public synchronized Statistics statistics() {
        long fp = 0, tp = 0;
        for (LearningData.Entry e : entries.values()) {
            fp += e.falsePositiveCount;
            tp += e.truePositiveCount;
        }
        return new Statistics(falsePositiveValues.size(), truePositiveValues.size(), entries.size(), fp, tp);
    }

    public record Statistics(int falsePositiveValues, int truePositiveValues, int feedbackEntries,
                             long falsePositiveVotes, long truePositiveVotes) {}

    static String keyOf(String patternId, String value) {
        return FingerprintGenerator.fingerprint(patternId, "", value);
    }

    private static LearningData.Entry copyOf(LearningData.Entry e) {
        LearningData.Entry c = new LearningData.Entry();
        c.patternId = e.patternId;
        c.value = e.value;
        c.falsePositiveCount = Math.max(0, e.falsePositiveCount);
        c.truePositiveCount = Math.max(0, e.truePositiveCount);
        c.records = (e.records == null ? new ArrayList<>() : new ArrayList<>(e.records));
        c.lastUpdated = e.lastUpdated;
        return c;
    }
}
