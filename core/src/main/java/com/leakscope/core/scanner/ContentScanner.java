package com.leakscope.core.scanner;

import com.leakscope.core.error.MatchingException;
import com.leakscope.core.model.Finding;
import com.leakscope.core.model.Location;
import com.leakscope.core.model.RawMatch;
import com.leakscope.core.model.ScanOptions;
import com.leakscope.core.pattern.PatternDefinition;
import com.leakscope.core.pattern.PatternRegistry;
import com.leakscope.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 텍스트 1건 스캔 파이프라인:
 *  - 등록 순서대로 패턴 매칭 (앞선 패턴이 점유한 구간은 뒤 패턴이 못 가져감)
 *  - 패턴 내부 근접 중복 제거 → 점수 → 임계값 필터
 *  - 호출 전체 (patternId, 값) 병합 → confidence 내림차순 → maxMatches 상한
 *
 * 패턴 하나의 정규식 오류는 로그만 남기고 건너뛴다.
 */
public final class ContentScanner {
    private static final Logger LOG = LoggerFactory.getLogger(ContentScanner.class);
    private static final StructuredLog SLOG = StructuredLog.get(ContentScanner.class);

    private final PatternRegistry registry;
    private final MatchFinder finder;
    private final ConfidenceScorer scorer;

    public ContentScanner(PatternRegistry registry) {
        this(registry, new MatchFinder(), new ConfidenceScorer());
    }

    public ContentScanner(PatternRegistry registry, ConfidenceScorer scorer) {
        this(registry, new MatchFinder(), scorer);
    }

    /** DI/테스트용 */
    public ContentScanner(PatternRegistry registry, MatchFinder finder, ConfidenceScorer scorer) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.finder = Objects.requireNonNull(finder, "finder");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    public List<Finding> scanContent(String content) {
        return scanContent(content, null, ScanOptions.defaults());
    }

    public List<Finding> scanContent(String content, ScanOptions options) {
        return scanContent(content, null, options);
    }

    /**
     * @param filePath 결과 Finding/Location 에 기록할 출처 (null 허용)
     * @return confidence 내림차순 목록. 내용이 없으면 빈 목록
     */
    public List<Finding> scanContent(String content, String filePath, ScanOptions options) {
        if (content == null || content.isEmpty()) return List.of();
        ScanOptions opts = (options == null ? ScanOptions.defaults() : options);
        opts.validate();

        long t0 = System.nanoTime();
        PositionLedger global = new PositionLedger();
        LineIndex lines = new LineIndex(content);
        MatchDeduplicator merger = new MatchDeduplicator();
        List<Finding> plain = new ArrayList<>();
        boolean dedup = opts.isEnableDeduplication();
        int skippedPatterns = 0;
        int candidates = 0;

        List<PatternDefinition> patterns = registry.patternsFor(opts.getCategories());
        outer:
        for (PatternDefinition p : patterns) {
            List<RawMatch> raw;
            try {
                raw = finder.find(content, p, global, opts.getContextWindow(), opts.getMaxMatchesPerPattern());
            } catch (MatchingException e) {
                skippedPatterns++;
                LOG.warn("pattern {} skipped: {}", p.getId(), e.getMessage());
                SLOG.warn("pattern-matching-failed", e.getCause(), "pattern", p.getId(), "file", filePath);
                continue;
            }
            candidates += raw.size();
            List<RawMatch> kept = dedup ? MatchDeduplicator.collapseNearby(raw) : raw;

            for (RawMatch m : kept) {
                double confidence = scorer.score(m, p);
                if (confidence < opts.getConfidenceThreshold()) continue;

                Finding f = toFinding(m, p, confidence, filePath, lines);
                global.claim(m.index(), m.end());
                if (dedup) {
                    merger.add(f);
                } else {
                    plain.add(f);
                    if (plain.size() >= opts.getMaxMatches()) break outer;
                }
            }
        }

        List<Finding> out = dedup ? merger.findings() : plain;
        out.sort(Comparator.comparingDouble(Finding::getConfidence).reversed());
        if (out.size() > opts.getMaxMatches()) out = new ArrayList<>(out.subList(0, opts.getMaxMatches()));

        long ms = (System.nanoTime() - t0) / 1_000_000L;
        LOG.debug("scanContent file={} patterns={} candidates={} findings={} in {}ms",
                filePath, patterns.size(), candidates, out.size(), ms);
        if (skippedPatterns > 0) {
            SLOG.info("scan-partial", "file", filePath, "skippedPatterns", skippedPatterns, "findings", out.size());
        }
        return out;
    }

    private static Finding toFinding(RawMatch m, PatternDefinition p, double confidence, String filePath, LineIndex lines) {
        int line = lines.line(m.index());
        int column = lines.column(m.index());
        Instant now = Instant.now();
        return Finding.builder()
                .patternId(p.getId())
                .patternName(p.getName())
                .category(p.getCategory())
                .severity(p.getSeverity())
                .fromMatch(m)
                .confidence(confidence)
                .file(filePath)
                .line(line)
                .column(column)
                .occurrenceCount(1)
                .addLocation(new Location(filePath, line, column, m.index()))
                .firstSeen(now)
                .lastSeen(now)
                .build();
    }

    public PatternRegistry registry() { return registry; }
}
