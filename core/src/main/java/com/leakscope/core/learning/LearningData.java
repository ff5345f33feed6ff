package com.leakscope.core.learning;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 학습 데이터 내보내기/가져오기 형식 (JSON). */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class LearningData {
    public String v = "1";
    /** 오탐으로 알려진 정규화 값 */
    public List<String> falsePositivePatterns = new ArrayList<>();
    /** 정탐으로 확인된 정규화 값 */
    public List<String> truePositivePatterns = new ArrayList<>();
    /** 지문(patternId, value) → 누적 판정 */
    public Map<String, Entry> feedbackData = new LinkedHashMap<>();
    public Instant timestamp;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Entry {
        public String patternId;
        public String value;
        public int falsePositiveCount;
        public int truePositiveCount;
        public List<FeedbackRecord> records = new ArrayList<>();
        public Instant lastUpdated;
    }
}
