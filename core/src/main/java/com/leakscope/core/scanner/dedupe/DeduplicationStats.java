package com.leakscope.core.scanner.dedupe;

import java.time.Instant;
import java.util.Locale;

/** 중복 제거 누적 통계 (스레드 세이프). */
public final class DeduplicationStats {
    private long totalFindings;
    private long uniqueFindings;
    private long operationCount;
    private long totalTimeMs;
    private long lastTimeMs;
    private long maxTimeMs;
    private long fallbackCount;
    private long errorCount;
    private LastError lastError;

    /** 한 번의 병합(또는 fallback) 결과를 누적. fallback 이면 in == out */
    public synchronized void recordOperation(int in, int out, long elapsedMs) {
        totalFindings += in;
        uniqueFindings += out;
        operationCount++;
        totalTimeMs += elapsedMs;
        lastTimeMs = elapsedMs;
        maxTimeMs = Math.max(maxTimeMs, elapsedMs);
    }

    public synchronized void recordFallback() { fallbackCount++; }

    public synchronized void recordError(String message, String operationType) {
        errorCount++;
        lastError = new LastError(message, Instant.now(), operationType);
    }

    public synchronized void reset() {
        totalFindings = uniqueFindings = operationCount = 0;
        totalTimeMs = lastTimeMs = maxTimeMs = 0;
        fallbackCount = errorCount = 0;
        lastError = null;
    }

    public synchronized Snapshot snapshot(int cacheSize, int maxCacheSize, long cacheEvictions,
                                         CircuitBreaker.Snapshot breaker) {
        long removed = Math.max(0, totalFindings - uniqueFindings);
        long avg = operationCount == 0 ? 0 : totalTimeMs / operationCount;
        return new Snapshot(totalFindings, uniqueFindings, removed, formatRate(removed, totalFindings),
                operationCount, lastTimeMs, avg, maxTimeMs, cacheSize, maxCacheSize, cacheEvictions,
                fallbackCount, errorCount, breaker, lastError);
    }

    /** "12.34%" (입력 0건이면 "0.00%") */
    static String formatRate(long removed, long total) {
        double rate = total == 0 ? 0.0 : (removed * 100.0) / total;
        return String.format(Locale.ROOT, "%.2f%%", rate);
    }

    /** 마지막 오류 */
    public record LastError(String message, Instant timestamp, String operationType) {}

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long totalFindings;
        public final long uniqueFindings;
        public final long duplicatesRemoved;
        public final String deduplicationRate;
        public final long operationCount;
        public final long lastTimeMs;
        public final long averageTimeMs;
        public final long maxTimeMs;
        public final int cacheSize;
        public final int maxCacheSize;
        public final long cacheEvictions;   // 마지막 reset 이후
        public final long fallbackCount;
        public final long errorCount;
        public final CircuitBreaker.Snapshot circuitBreaker;
        public final LastError lastError;   // nullable

        Snapshot(long totalFindings, long uniqueFindings, long duplicatesRemoved, String deduplicationRate,
                 long operationCount, long lastTimeMs, long averageTimeMs, long maxTimeMs,
                 int cacheSize, int maxCacheSize, long cacheEvictions, long fallbackCount, long errorCount,
                 CircuitBreaker.Snapshot circuitBreaker, LastError lastError) {
            this.totalFindings = totalFindings;
            this.uniqueFindings = uniqueFindings;
            this.duplicatesRemoved = duplicatesRemoved;
            this.deduplicationRate = deduplicationRate;
            this.operationCount = operationCount;
            this.lastTimeMs = lastTimeMs;
            this.averageTimeMs = averageTimeMs;
            this.maxTimeMs = maxTimeMs;
            this.cacheSize = cacheSize;
            this.maxCacheSize = maxCacheSize;
            this.cacheEvictions = cacheEvictions;
            this.fallbackCount = fallbackCount;
            this.errorCount = errorCount;
            this.circuitBreaker = circuitBreaker;
            this.lastError = lastError;
        }
    }
}
