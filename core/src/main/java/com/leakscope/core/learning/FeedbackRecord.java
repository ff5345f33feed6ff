package com.leakscope.core.learning;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** 사용자 판정 1건. metadata 는 호출자가 넘긴 그대로 (예: reviewer, note). */
public record FeedbackRecord(boolean falsePositive, Instant timestamp, Map<String, Object> metadata) {
    public FeedbackRecord {
        metadata = (metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata)));
    }
}
