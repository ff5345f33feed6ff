package com.leakscope.core.config;

import com.leakscope.core.model.Category;
import com.leakscope.core.model.ScanOptions;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * 탐지 코어 설정 (leakscope.yml 매핑 대상).
 * 스캔 호출 단위 옵션은 {@link #toScanOptions()} 로 만든다.
 */
public final class DetectionConfig {

    /** 중복 제거 엔진 하위 설정: YAML의 `dedup:` 섹션과 매핑 */
    public static final class Dedup {
        private boolean enableFileLevel = true;
        private boolean enableScanLevel = true;
        /** 지문 → 병합 레코드 캐시 상한 */
        private int maxCacheSize = 1000;
        /** 1회 병합 소프트 타임아웃(ms) */
        private long maxDeduplicationTimeMs = 30_000;
        /** 배치 추정 메모리 상한(MB). 넘으면 병합 없이 fallback */
        private int memoryLimitMB = 512;
        private boolean enableCircuitBreaker = true;
        /** 연속 실패 몇 번에 OPEN 할지 */
        private int circuitBreakerThreshold = 3;
        /** OPEN 유지 시간(ms). 지나면 HALF_OPEN 시험 1회 */
        private long circuitBreakerResetTimeMs = 60_000;

        public static Dedup defaults() { return new Dedup(); }

        public boolean isEnableFileLevel() { return enableFileLevel; }
        public Dedup setEnableFileLevel(boolean v) { this.enableFileLevel = v; return this; }

        public boolean isEnableScanLevel() { return enableScanLevel; }
        public Dedup setEnableScanLevel(boolean v) { this.enableScanLevel = v; return this; }

        public int getMaxCacheSize() { return maxCacheSize; }
        public Dedup setMaxCacheSize(int v) { this.maxCacheSize = Math.max(1, v); return this; }

        public long getMaxDeduplicationTimeMs() { return maxDeduplicationTimeMs; }
        public Dedup setMaxDeduplicationTimeMs(long v) { this.maxDeduplicationTimeMs = Math.max(1, v); return this; }

        public int getMemoryLimitMB() { return memoryLimitMB; }
        public Dedup setMemoryLimitMB(int v) { this.memoryLimitMB = Math.max(1, v); return this; }

        public boolean isEnableCircuitBreaker() { return enableCircuitBreaker; }
        public Dedup setEnableCircuitBreaker(boolean v) { this.enableCircuitBreaker = v; return this; }

        public int getCircuitBreakerThreshold() { return circuitBreakerThreshold; }
        public Dedup setCircuitBreakerThreshold(int v) { this.circuitBreakerThreshold = Math.max(1, v); return this; }

        public long getCircuitBreakerResetTimeMs() { return circuitBreakerResetTimeMs; }
        public Dedup setCircuitBreakerResetTimeMs(long v) { this.circuitBreakerResetTimeMs = Math.max(0, v); return this; }

        public long memoryLimitBytes() { return memoryLimitMB * 1024L * 1024L; }

        void validate() {
            if (maxCacheSize < 1) throw new IllegalArgumentException("dedup.maxCacheSize must be >= 1");
            if (maxDeduplicationTimeMs < 1) throw new IllegalArgumentException("dedup.maxDeduplicationTimeMs must be > 0");
            if (memoryLimitMB < 1) throw new IllegalArgumentException("dedup.memoryLimitMB must be >= 1");
            if (circuitBreakerThreshold < 1) throw new IllegalArgumentException("dedup.circuitBreakerThreshold must be >= 1");
            if (circuitBreakerResetTimeMs < 0) throw new IllegalArgumentException("dedup.circuitBreakerResetTimeMs must be >= 0");
        }
    }

    // ---------- 스캔 기본값 ----------
    private double confidenceThreshold = 0.5;
    private int maxMatches = 100;
    private int maxMatchesPerPattern = 20;
    private int contextWindow = 50;
    private boolean enableDeduplication = true;
    private boolean contextAnalysisEnabled = true;
    private Set<Category> categories = Category.all();

    private Dedup dedup = new Dedup();

    public static DetectionConfig defaults() { return new DetectionConfig(); }

    // ---------- getters ----------
    public double getConfidenceThreshold() { return confidenceThreshold; }
    public int getMaxMatches() { return maxMatches; }
    public int getMaxMatchesPerPattern() { return maxMatchesPerPattern; }
    public int getContextWindow() { return contextWindow; }
    public boolean isEnableDeduplication() { return enableDeduplication; }
    public boolean isContextAnalysisEnabled() { return contextAnalysisEnabled; }
    public Set<Category> getCategories() { return EnumSet.copyOf(categories); }
    public Dedup getDedup() { return dedup; }

    // ---------- fluent setters ----------
    /** 범위 검사는 validate() 에서 (잘못된 YAML 값을 조용히 바꾸지 않음) */
    public DetectionConfig setConfidenceThreshold(double v) { this.confidenceThreshold = v; return this; }
    public DetectionConfig setMaxMatches(int v) { this.maxMatches = Math.max(1, v); return this; }
    public DetectionConfig setMaxMatchesPerPattern(int v) { this.maxMatchesPerPattern = Math.max(1, v); return this; }
    public DetectionConfig setContextWindow(int v) { this.contextWindow = Math.max(0, v); return this; }
    public DetectionConfig setEnableDeduplication(boolean v) { this.enableDeduplication = v; return this; }
    public DetectionConfig setContextAnalysisEnabled(boolean v) { this.contextAnalysisEnabled = v; return this; }
    public DetectionConfig setCategories(Set<Category> v) {
        if (v != null && !v.isEmpty()) this.categories = EnumSet.copyOf(v);
        return this;
    }
    public DetectionConfig setDedup(Dedup v) { this.dedup = (v != null ? v : new Dedup()); return this; }

    // ---------- validate ----------
    public void validate() {
        if (Double.isNaN(confidenceThreshold) || confidenceThreshold < 0.0 || confidenceThreshold > 1.0)
            throw new IllegalArgumentException("confidenceThreshold must be within [0,1]");
        if (maxMatches < 1) throw new IllegalArgumentException("maxMatches must be >= 1");
        if (maxMatchesPerPattern < 1) throw new IllegalArgumentException("maxMatchesPerPattern must be >= 1");
        if (contextWindow < 0) throw new IllegalArgumentException("contextWindow must be >= 0");
        Objects.requireNonNull(categories, "categories");
        if (categories.isEmpty()) throw new IllegalArgumentException("categories must not be empty");
        Objects.requireNonNull(dedup, "dedup");
        dedup.validate();
    }

    public ScanOptions toScanOptions() {
        return ScanOptions.defaults()
                .setCategories(categories)
                .setConfidenceThreshold(confidenceThreshold)
                .setMaxMatches(maxMatches)
                .setMaxMatchesPerPattern(maxMatchesPerPattern)
                .setContextWindow(contextWindow)
                .setEnableDeduplication(enableDeduplication);
    }
}
