package com.leakscope.core.scanner;

/** 사용자 피드백 기반 점수 보정 공급자. learning.FeedbackStore 가 구현한다. */
@FunctionalInterface
public interface FeedbackAdjuster {

    /** 가산 보정값 (음수면 오탐 쪽) */
    double adjustment(String patternId, String value);

    FeedbackAdjuster NONE = (patternId, value) -> 0.0;
}
