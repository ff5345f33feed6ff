package com.leakscope.core.scanner;

import com.leakscope.core.error.ScoringException;
import com.leakscope.core.model.Category;
import com.leakscope.core.model.RawMatch;
import com.leakscope.core.model.Severity;
import com.leakscope.core.pattern.PatternDefinition;
import com.leakscope.core.pattern.ValueValidator;
import com.leakscope.core.util.StructuredLog;
import com.leakscope.core.util.TextUtil;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 결정적 가중 휴리스틱 점수.
 * confidence = clamp01(base + context + length + validator + entropy + feedback + category + severity)
 * category/severity 보정은 앞 6개 항목의 소계를 기준으로 정한다.
 */
public final class ConfidenceScorer {
    private static final StructuredLog SLOG = StructuredLog.get(ConfidenceScorer.class);

    // ---- 가중치 ----
    static final double ASSIGNMENT_BONUS = 0.15;
    static final double ENV_ACCESS_BONUS = 0.20;
    static final double CONFIG_ACCESS_BONUS = 0.10;
    static final double FP_VOCABULARY_PENALTY = -0.30;
    static final double COMMENT_PENALTY = -0.20;
    static final double MIN_LENGTH_BONUS = 0.10;
    static final double VALIDATOR_BONUS = 0.15;
    static final double HIGH_ENTROPY_BONUS = 0.10;
    static final double LOW_ENTROPY_PENALTY = -0.20;
    static final double HIGH_ENTROPY = 3.5;
    static final double LOW_ENTROPY = 2.0;

    // 매치 바로 앞: 대입 관용구
    private static final List<Pattern> ASSIGNMENT = List.of(
            Pattern.compile("(?:const|let|var)\\s+\\w+\\s*=\\s*$"),
            Pattern.compile("\\w+\\s*[:=]\\s*$"),
            Pattern.compile("['\"`]\\s*$"));

    private static final List<Pattern> ENV_ACCESS = List.of(
            Pattern.compile("process\\.env\\."),
            Pattern.compile("process\\.env\\["),
            Pattern.compile("ENV\\["),
            Pattern.compile("getenv\\("),
            Pattern.compile("os\\.environ"),
            Pattern.compile("System\\.getenv"));

    private static final List<Pattern> CONFIG_ACCESS = List.of(
            Pattern.compile("config\\."),
            Pattern.compile("settings\\."),
            Pattern.compile("options\\."),
            Pattern.compile("credentials\\."));

    private static final Pattern FP_VOCABULARY = Pattern.compile(
            "example|placeholder|test|demo|sample|mock|fake|dummy", Pattern.CASE_INSENSITIVE);

    // 열린 주석 뒤에 매치가 위치 (같은 줄의 // 또는 #, 닫히지 않은 /* 또는 <!--). \z: 윗줄 주석은 제외
    private static final List<Pattern> OPEN_COMMENT = List.of(
            Pattern.compile("/\\*(?:(?!\\*/)[\\s\\S])*\\z"),
            Pattern.compile("(?<!:)//[^\\n]*\\z"),
            Pattern.compile("<!--(?:(?!-->)[\\s\\S])*\\z"),
            Pattern.compile("#[^\\n]*\\z"));

    private final FeedbackAdjuster feedback;
    private final boolean contextAnalysisEnabled;

    public ConfidenceScorer() {
        this(FeedbackAdjuster.NONE, true);
    }

    public ConfidenceScorer(FeedbackAdjuster feedback, boolean contextAnalysisEnabled) {
        this.feedback = Objects.requireNonNull(feedback, "feedback");
        this.contextAnalysisEnabled = contextAnalysisEnabled;
    }

    public double score(RawMatch match, PatternDefinition pattern) {
        return explain(match, pattern).confidence();
    }

    public ConfidenceBreakdown explain(RawMatch match, PatternDefinition pattern) {
        Objects.requireNonNull(match, "match");
        Objects.requireNonNull(pattern, "pattern");
        String value = match.value();

        double base = pattern.getConfidence();
        double context = contextAnalysisEnabled ? contextAdjustment(match.context().before(), match.context().after()) : 0.0;
        double length = (pattern.getMinLength() != null && value.length() >= pattern.getMinLength()) ? MIN_LENGTH_BONUS : 0.0;
        double validator = runValidator(pattern, value) ? VALIDATOR_BONUS : 0.0;
        double entropy = entropyAdjustment(value);
        double fb = feedback.adjustment(pattern.getId(), value);

        double subtotal = base + context + length + validator + entropy + fb;
        double category = categoryAdjustment(pattern.getCategory(), subtotal);
        double severity = severityAdjustment(pattern.getSeverity(), subtotal);
        double confidence = clamp01(subtotal + category + severity);

        return new ConfidenceBreakdown(base, context, length, validator, entropy, fb, category, severity, confidence);
    }

    static double contextAdjustment(String before, String after) {
        double adj = 0.0;
        if (anyFind(ASSIGNMENT, before)) adj += ASSIGNMENT_BONUS;
        if (anyFind(ENV_ACCESS, before)) adj += ENV_ACCESS_BONUS;
        if (anyFind(CONFIG_ACCESS, before)) adj += CONFIG_ACCESS_BONUS;
        if (FP_VOCABULARY.matcher(before).find() || FP_VOCABULARY.matcher(after).find()) adj += FP_VOCABULARY_PENALTY;
        if (anyFind(OPEN_COMMENT, before)) adj += COMMENT_PENALTY;
        return adj;
    }

    static double entropyAdjustment(String value) {
        double h = TextUtil.shannonEntropy(value);
        if (h > HIGH_ENTROPY) return HIGH_ENTROPY_BONUS;
        if (h < LOW_ENTROPY) return LOW_ENTROPY_PENALTY;
        return 0.0;
    }

    /** 약한 근거의 secrets 는 더 엄격하게, configurations 는 약간 관대하게 */
    static double categoryAdjustment(Category c, double subtotal) {
        return switch (c) {
            case SECRETS -> subtotal < 0.6 ? -0.10 : 0.0;
            case VULNERABILITIES -> subtotal < 0.7 ? -0.05 : 0.0;
            case CONFIGURATIONS -> 0.05;
        };
    }

    /** critical 은 높은 근거를 요구, low 는 약간 가산 */
    static double severityAdjustment(Severity s, double subtotal) {
        return switch (s) {
            case CRITICAL -> subtotal < 0.8 ? -0.15 : 0.0;
            case LOW -> 0.05;
            default -> 0.0;
        };
    }

    private boolean runValidator(PatternDefinition p, String value) {
        if (p.getValidator() == null) return false;
        try {
            return invokeValidator(p, value);
        } catch (ScoringException e) {
            SLOG.debug("validator-failed", "pattern", p.getId(),
                    "cause", e.getCause().getClass().getSimpleName(), "message", e.getCause().getMessage());
            return false;
        }
    }

    /** 검증기 예외는 ScoringException 으로 감싼다 (호출부에서 "검증 실패"로 처리). */
    static boolean invokeValidator(PatternDefinition p, String value) {
        ValueValidator v = p.getValidator();
        try {
            return v.validate(value);
        } catch (RuntimeException e) {
            throw new ScoringException("validator failed for pattern '" + p.getId() + "'", e);
        }
    }

    private static boolean anyFind(List<Pattern> patterns, String text) {
        if (text == null || text.isEmpty()) return false;
        for (Pattern p : patterns) {
            if (p.matcher(text).find()) return true;
        }
        return false;
    }

    static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
