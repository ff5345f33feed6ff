package com.leakscope.core.scanner.dedupe;

import com.leakscope.core.config.DetectionConfig;
import com.leakscope.core.model.Finding;
import com.leakscope.core.model.FindingInput;
import com.leakscope.core.util.MillisClock;
import com.leakscope.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 파일 단위/스캔 단위 중복 제거 엔진.
 *  - 병합은 {@link DeduplicationAlgorithm}(기본 FingerprintMerger)에 위임
 *  - 타임아웃/메모리/서킷/예외 처리는 {@link ResilientDeduplicator}
 *  - 파일 단위 결과는 스캔 누적 캐시(지문 → 레코드)에 합쳐 둔다
 *
 * 어떤 경우에도 예외를 던지지 않고, 실패하면 입력을 fallback 표시와 함께 돌려준다.
 */
public final class DeduplicationEngine {
    private static final Logger LOG = LoggerFactory.getLogger(DeduplicationEngine.class);
    private static final StructuredLog SLOG = StructuredLog.get(DeduplicationEngine.class);

    static final String OP_FILE = "file";
    static final String OP_SCAN = "scan";

    private final DetectionConfig.Dedup cfg;
    private final FindingCache cache;
    private final CircuitBreaker breaker;
    private final DeduplicationStats stats = new DeduplicationStats();
    private final ResilientDeduplicator guard;

    public DeduplicationEngine() {
        this(DetectionConfig.Dedup.defaults());
    }

    public DeduplicationEngine(DetectionConfig.Dedup cfg) {
        this(cfg, new FingerprintMerger(), MillisClock.SYSTEM);
    }

    /** DI/테스트용: 병합 루틴과 시계 주입 */
    public DeduplicationEngine(DetectionConfig.Dedup cfg, DeduplicationAlgorithm algorithm, MillisClock clock) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(clock, "clock");
        this.cache = new FindingCache(cfg.getMaxCacheSize());
        this.breaker = new CircuitBreaker(cfg.getCircuitBreakerThreshold(), cfg.getCircuitBreakerResetTimeMs(),
                cfg.isEnableCircuitBreaker(), clock);
        this.guard = new ResilientDeduplicator(algorithm, breaker, stats,
                cfg.getMaxDeduplicationTimeMs(), cfg.memoryLimitBytes(), clock);
    }

    /**
     * 한 파일에서 나온 항목 병합.
     * @param filePath 항목에 file 이 없을 때 쓰는 경로
     */
    public List<Finding> deduplicateFileFindings(List<Finding> findings, String filePath) {
        if (findings == null || findings.isEmpty()) return new ArrayList<>();
        if (!cfg.isEnableFileLevel()) return new ArrayList<>(findings);

        int in = countNonNull(findings);
        ResilientDeduplicator.Outcome o = guard.run(findings, filePath, OP_FILE);
        int out = o.fallback() ? in : o.findings().size();
        stats.recordOperation(in, out, o.elapsedMs());

        if (!o.fallback()) {
            for (Finding f : o.findings()) {
                cache.merge(FingerprintGenerator.of(f, filePath), f, FingerprintMerger::merge);
            }
        }
        LOG.debug("file dedup {}: {} -> {} ({}ms{})", filePath, in, out, o.elapsedMs(),
                o.fallback() ? ", fallback=" + o.reason() : "");
        SLOG.debug("dedup-complete", "operation", OP_FILE, "file", filePath, "in", in, "out", out,
                "ms", o.elapsedMs(), "fallback", o.fallback());
        return o.findings();
    }

    /** 스캔 전체 항목 병합. 성공 시 누적 캐시를 이번 결과로 다시 채운다. */
    public ScanDeduplicationResult deduplicateScanFindings(List<Finding> findings) {
        List<Finding> input = (findings == null ? List.of() : findings);
        int in = countNonNull(input);
        if (!cfg.isEnableScanLevel() || input.isEmpty()) {
            return new ScanDeduplicationResult(new ArrayList<>(input), in, in, 0,
                    DeduplicationStats.formatRate(0, in), 0, false, null);
        }

        ResilientDeduplicator.Outcome o = guard.run(input, null, OP_SCAN);
        int out = o.fallback() ? in : o.findings().size();
        stats.recordOperation(in, out, o.elapsedMs());

        if (!o.fallback()) {
            cache.replaceAll(o.findings(), f -> FingerprintGenerator.of(f, null), FingerprintMerger::merge);
        }
        int removed = in - out;
        String rate = DeduplicationStats.formatRate(removed, in);
        LOG.info("scan dedup: {} -> {} (removed {}, {}) in {}ms", in, out, removed, rate, o.elapsedMs());
        SLOG.info("dedup-complete", "operation", OP_SCAN, "in", in, "out", out, "removed", removed,
                "rate", rate, "ms", o.elapsedMs(), "fallback", o.fallback());
        return new ScanDeduplicationResult(o.findings(), in, out, removed, rate, o.elapsedMs(),
                o.fallback(), o.reason());
    }

    /** 느슨한 외부 입력을 정규화한 뒤 스캔 단위 병합. null/정규화 불가 항목은 건너뛴다. */
    public ScanDeduplicationResult deduplicateInputs(List<FindingInput> inputs) {
        List<Finding> normalized = new ArrayList<>();
        int skipped = 0;
        if (inputs != null) {
            for (FindingInput fi : inputs) {
                Optional<Finding> f = (fi == null ? Optional.empty() : fi.toFinding());
                if (f.isPresent()) normalized.add(f.get());
                else skipped++;
            }
        }
        if (skipped > 0) LOG.debug("skipped {} malformed finding inputs", skipped);
        return deduplicateScanFindings(normalized);
    }

    /** 지금까지 파일 단위로 누적된 병합 레코드 (캐시 상한 내) */
    public List<Finding> scanSnapshot() { return cache.values(); }

    public Finding cached(String fingerprint) { return cache.get(fingerprint); }

    public DeduplicationStats.Snapshot stats() {
        return stats.snapshot(cache.size(), cache.maxSize(), cache.evictions(), breaker.snapshot());
    }

    public CircuitBreaker.Snapshot circuitBreaker() { return breaker.snapshot(); }

    /** 새 논리 스캔 시작: 캐시/통계/서킷 초기화 */
    public void reset() {
        cache.clear();
        stats.reset();
        breaker.reset();
    }

    private static int countNonNull(List<Finding> list) {
        int n = 0;
        for (Finding f : list) if (f != null) n++;
        return n;
    }
}
