package com.leakscope.core.scanner;

/** 점수 항목별 기여도. confidence 는 합산 후 [0,1] 클램프 값. */
public record ConfidenceBreakdown(double base,
                                  double context,
                                  double length,
                                  double validator,
                                  double entropy,
                                  double feedback,
                                  double category,
                                  double severity,
                                  double confidence) {

    /** category/severity 보정 전 소계 */
    public double subtotal() {
        return base + context + length + validator + entropy + feedback;
    }
}
