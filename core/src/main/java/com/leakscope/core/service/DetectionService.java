package com.leakscope.core.service;

import com.leakscope.core.config.DetectionConfig;
import com.leakscope.core.learning.FeedbackStore;
import com.leakscope.core.model.Finding;
import com.leakscope.core.model.ScanOptions;
import com.leakscope.core.pattern.PatternCatalog;
import com.leakscope.core.pattern.PatternDefinition;
import com.leakscope.core.pattern.PatternRegistry;
import com.leakscope.core.scanner.ConfidenceScorer;
import com.leakscope.core.scanner.ContentScanner;
import com.leakscope.core.scanner.dedupe.DeduplicationEngine;
import com.leakscope.core.scanner.dedupe.ScanDeduplicationResult;
import com.leakscope.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 탐지 코어 조립:
 *  - 파일(텍스트) 1건: scanContent → 파일 단위 중복 제거
 *  - 스캔 종료: 누적 결과 스캔 단위 중복 제거
 *  - 피드백은 FeedbackStore 에 기록되어 이후 점수에 반영
 * 오케스트레이터(가져오기/진행률/취소)는 이 클래스 바깥 책임.
 * 기본 생성자는 내장 카탈로그 사용, DI 생성자는 테스트/플러그인 주입용.
 */
public final class DetectionService {
    private static final Logger LOG = LoggerFactory.getLogger(DetectionService.class);
    private static final StructuredLog SLOG = StructuredLog.get(DetectionService.class);

    private final DetectionConfig config;
    private final PatternRegistry registry;
    private final FeedbackStore feedback;
    private final ContentScanner scanner;
    private final DeduplicationEngine dedup;

    /** 기본 구현: 내장 카탈로그(설정된 카테고리만) + 새 피드백 저장소 */
    public DetectionService(DetectionConfig config) {
        this(config, PatternCatalog.registry(Objects.requireNonNull(config, "config").getCategories()), new FeedbackStore());
    }

    /** DI/테스트/플러그인용 */
    public DetectionService(DetectionConfig config, PatternRegistry registry, FeedbackStore feedback) {
        this.config = Objects.requireNonNull(config, "config");
        config.validate();
        this.registry = Objects.requireNonNull(registry, "registry");
        this.feedback = Objects.requireNonNull(feedback, "feedback");
        this.scanner = new ContentScanner(registry, new ConfidenceScorer(feedback, config.isContextAnalysisEnabled()));
        this.dedup = new DeduplicationEngine(config.getDedup());
        LOG.info("detection core ready: {} patterns, threshold={}", registry.size(), config.getConfidenceThreshold());
    }

    /** 텍스트 1건 스캔 후 파일 단위 병합 */
    public List<Finding> scanFile(String filePath, String content) {
        ScanOptions opts = config.toScanOptions();
        List<Finding> found = scanner.scanContent(content, filePath, opts);
        if (found.isEmpty()) return found;
        return dedup.deduplicateFileFindings(found, filePath);
    }

    /** 여러 출처에서 모은 결과를 스캔 단위로 병합 */
    public ScanDeduplicationResult finishScan(List<Finding> collected) {
        List<Finding> all = (collected == null ? new ArrayList<>() : collected);
        ScanDeduplicationResult r = dedup.deduplicateScanFindings(all);
        SLOG.info("scan-finished", "in", r.totalFindings(), "out", r.uniqueFindings(),
                "rate", r.deduplicationRate(), "fallback", r.fallback());
        return r;
    }

    public void recordFeedback(Finding finding, boolean isFalsePositive, Map<String, Object> metadata) {
        Objects.requireNonNull(finding, "finding");
        PatternDefinition p = registry.get(finding.getPatternId());
        feedback.recordFeedback(finding, p, isFalsePositive, metadata);
    }

    /** 새 논리 스캔 시작 (중복 제거 캐시/통계/서킷 초기화, 학습 데이터는 유지) */
    public void beginScan() { dedup.reset(); }

    public DetectionConfig config() { return config; }
    public PatternRegistry registry() { return registry; }
    public FeedbackStore feedback() { return feedback; }
    public ContentScanner scanner() { return scanner; }
    public DeduplicationEngine deduplication() { return dedup; }
}
