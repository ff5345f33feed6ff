package com.leakscope.core.model;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * scanContent 호출 단위 옵션.
 * 설정 파일 값은 DetectionConfig#toScanOptions() 로 넘어온다.
 */
public final class ScanOptions {
    private Set<Category> categories = Category.all();
    private double confidenceThreshold = 0.5;
    private int maxMatches = 100;            // 최종 결과 상한
    private int maxMatchesPerPattern = 20;   // 패턴별 후보 상한
    private int contextWindow = 50;          // 문맥 반경(문자)
    private boolean enableDeduplication = true;

    public static ScanOptions defaults() { return new ScanOptions(); }

    public Set<Category> getCategories() { return categories; }
    public double getConfidenceThreshold() { return confidenceThreshold; }
    public int getMaxMatches() { return maxMatches; }
    public int getMaxMatchesPerPattern() { return maxMatchesPerPattern; }
    public int getContextWindow() { return contextWindow; }
    public boolean isEnableDeduplication() { return enableDeduplication; }

    public ScanOptions setCategories(Set<Category> v) {
        this.categories = (v == null || v.isEmpty()) ? Category.all() : EnumSet.copyOf(v);
        return this;
    }
    public ScanOptions setConfidenceThreshold(double v) {
        this.confidenceThreshold = Math.max(0.0, Math.min(1.0, v));
        return this;
    }
    public ScanOptions setMaxMatches(int v) { this.maxMatches = Math.max(1, v); return this; }
    public ScanOptions setMaxMatchesPerPattern(int v) { this.maxMatchesPerPattern = Math.max(1, v); return this; }
    public ScanOptions setContextWindow(int v) { this.contextWindow = Math.max(0, v); return this; }
    public ScanOptions setEnableDeduplication(boolean v) { this.enableDeduplication = v; return this; }

    public ScanOptions copy() {
        return new ScanOptions()
                .setCategories(categories)
                .setConfidenceThreshold(confidenceThreshold)
                .setMaxMatches(maxMatches)
                .setMaxMatchesPerPattern(maxMatchesPerPattern)
                .setContextWindow(contextWindow)
                .setEnableDeduplication(enableDeduplication);
    }

    public void validate() {
        Objects.requireNonNull(categories, "categories");
        if (Double.isNaN(confidenceThreshold)) throw new IllegalArgumentException("confidenceThreshold must be a number");
        if (maxMatches < 1) throw new IllegalArgumentException("maxMatches must be >= 1");
        if (maxMatchesPerPattern < 1) throw new IllegalArgumentException("maxMatchesPerPattern must be >= 1");
        if (contextWindow < 0) throw new IllegalArgumentException("contextWindow must be >= 0");
    }
}
