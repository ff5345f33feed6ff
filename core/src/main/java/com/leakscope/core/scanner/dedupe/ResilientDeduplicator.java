package com.leakscope.core.scanner.dedupe;

import com.leakscope.core.error.DeduplicationException;
import com.leakscope.core.error.ResourceLimitException;
import com.leakscope.core.model.Finding;
import com.leakscope.core.model.Location;
import com.leakscope.core.util.MillisClock;
import com.leakscope.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 병합 루틴을 감싸는 데코레이터: 메모리 가드 → 서킷 → 소프트 타임아웃 → 예외 시 fallback.
 * fallback 은 순수 통과: 길이/순서 유지, null 이 아닌 항목마다 fallback 표시.
 * 병합 루틴이 던지는 것은 Error 까지 모두 실패로 기록하고 밖으로 던지지 않는다.
 */
public final class ResilientDeduplicator {
    private static final Logger LOG = LoggerFactory.getLogger(ResilientDeduplicator.class);
    private static final StructuredLog SLOG = StructuredLog.get(ResilientDeduplicator.class);

    public static final String REASON_PERFORMANCE_LIMIT = "performance_limit";

    // 항목당 대략적 점유 바이트 (객체 헤더/필드/리스트)
    static final long BASE_BYTES_PER_FINDING = 512;
    static final long BYTES_PER_LOCATION = 64;

    private final DeduplicationAlgorithm delegate;
    private final CircuitBreaker breaker;
    private final DeduplicationStats stats;
    private final long timeBudgetMs;
    private final long memoryLimitBytes;
    private final MillisClock clock;

    public ResilientDeduplicator(DeduplicationAlgorithm delegate, CircuitBreaker breaker, DeduplicationStats stats,
                                 long timeBudgetMs, long memoryLimitBytes, MillisClock clock) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.breaker = Objects.requireNonNull(breaker, "breaker");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.timeBudgetMs = timeBudgetMs;
        this.memoryLimitBytes = memoryLimitBytes;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** 실행 결과. fallback 이면 reason 이 채워진다. */
    public record Outcome(List<Finding> findings, boolean fallback, String reason, long elapsedMs) {}

    public Outcome run(List<Finding> input, String defaultFile, String operationType) {
        long t0 = clock.nowMillis();

        long estimated = estimateBytes(input);
        if (estimated > memoryLimitBytes) {
            LOG.warn("{} dedup skipped: estimated {} bytes > limit {} bytes", operationType, estimated, memoryLimitBytes);
            return fallback(input, defaultFile, REASON_PERFORMANCE_LIMIT, operationType, t0, "memory_guard");
        }
        if (!breaker.tryAcquire()) {
            return fallback(input, defaultFile, REASON_PERFORMANCE_LIMIT, operationType, t0, "circuit_open");
        }

        try {
            List<Finding> out = delegate.deduplicate(input, defaultFile, new Deadline(clock, timeBudgetMs));
            if (out == null) throw new DeduplicationException("deduplication returned null");
            breaker.recordSuccess();
            return new Outcome(out, false, null, clock.nowMillis() - t0);
        } catch (ResourceLimitException e) {
            onFailure(e, operationType);
            return fallback(input, defaultFile, REASON_PERFORMANCE_LIMIT, operationType, t0, e.getKind().name());
        } catch (OutOfMemoryError e) {
            onFailure(e, operationType);
            return fallback(input, defaultFile, REASON_PERFORMANCE_LIMIT, operationType, t0, "MEMORY");
        } catch (Throwable e) {
            // Error 포함: HALF_OPEN 시험 호출도 여기서 실패로 닫힌다
            onFailure(e, operationType);
            String reason = e.getClass().getSimpleName();
            return fallback(input, defaultFile, reason, operationType, t0, reason);
        }
    }

    private void onFailure(Throwable e, String operationType) {
        breaker.recordFailure();
        stats.recordError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), operationType);
        SLOG.error("dedup-error", e, "operation", operationType, "breaker", breaker.state().name());
    }

    private Outcome fallback(List<Finding> input, String defaultFile, String reason,
                             String operationType, long t0, String cause) {
        stats.recordFallback();
        List<Finding> out = passThrough(input, defaultFile, reason);
        SLOG.warn("dedup-fallback", "operation", operationType, "reason", reason, "cause", cause,
                "count", out.size());
        return new Outcome(out, true, reason, clock.nowMillis() - t0);
    }

    /** 입력 그대로(null 은 null 로, occurrenceCount 유지) + fallback 표시. 위치가 없으면 자기 위치 1개로 채운다. */
    static List<Finding> passThrough(List<Finding> input, String defaultFile, String reason) {
        if (input == null) return new ArrayList<>();
        List<Finding> out = new ArrayList<>(input.size());
        for (Finding f : input) {
            if (f == null) {
                out.add(null);
                continue;
            }
            List<Location> locs = f.getLocations().isEmpty() ? List.of(f.ownLocation(defaultFile)) : f.getLocations();
            out.add(f.toBuilder()
                    .locations(locs)
                    .deduplicationStatus(Finding.STATUS_FALLBACK)
                    .fallbackReason(reason)
                    .build());
        }
        return out;
    }

    /** 배치가 점유할 대략적 메모리(바이트) */
    static long estimateBytes(List<Finding> input) {
        if (input == null) return 0;
        long total = 0;
        for (Finding f : input) {
            if (f == null) continue;
            total += BASE_BYTES_PER_FINDING
                    + 2L * (len(f.getValue()) + len(f.getFullMatch()) + len(f.getFile())
                    + f.getContext().full().length())
                    + BYTES_PER_LOCATION * f.getLocations().size();
        }
        return total;
    }

    private static int len(String s) { return s == null ? 0 : s.length(); }
}
