package com.leakscope.core.pattern;

import com.leakscope.core.error.PatternValidationException;
import com.leakscope.core.model.Category;
import com.leakscope.core.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 등록된(검증 완료) 탐지 패턴. 불변.
 * Builder 는 텍스트 입력(YAML 등)을 허용하고 build() 에서 검증/기본값 적용/정규식 컴파일을 한다.
 */
public final class PatternDefinition {
    public static final double DEFAULT_CONFIDENCE = 0.8;
    /** 정규식을 문자열로 받을 때의 기본 플래그 */
    public static final int DEFAULT_FLAGS = Pattern.CASE_INSENSITIVE;

    private final String id;
    private final String name;
    private final String description;
    private final Category category;
    private final Severity severity;
    private final Pattern regex;
    private final Integer extractGroup;   // nullable
    private final double confidence;
    private final Integer minLength;      // nullable
    private final Integer maxLength;      // nullable
    private final ValueValidator validator;  // nullable
    private final List<FalsePositiveFilter> falsePositiveFilters;

    private PatternDefinition(Builder b, Category category, Severity severity, Pattern regex, double confidence) {
        this.id = b.id;
        this.name = b.name;
        this.description = b.description;
        this.category = category;
        this.severity = severity;
        this.regex = regex;
        this.extractGroup = b.extractGroup;
        this.confidence = confidence;
        this.minLength = b.minLength;
        this.maxLength = b.maxLength;
        this.validator = b.validator;
        this.falsePositiveFilters = List.copyOf(b.filters);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public Category getCategory() { return category; }
    public Severity getSeverity() { return severity; }
    public Pattern getRegex() { return regex; }
    public Integer getExtractGroup() { return extractGroup; }
    public double getConfidence() { return confidence; }
    public Integer getMinLength() { return minLength; }
    public Integer getMaxLength() { return maxLength; }
    public ValueValidator getValidator() { return validator; }
    public List<FalsePositiveFilter> getFalsePositiveFilters() { return falsePositiveFilters; }

    @Override
    public String toString() {
        return "PatternDefinition{" + id + ", " + category.id() + "/" + severity.id() + ", /" + regex.pattern() + "/}";
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private Category category;
        private String categoryText;
        private Severity severity;
        private String severityText;
        private Pattern compiled;
        private String regexSource;
        private int flags = DEFAULT_FLAGS;
        private Integer extractGroup;
        private Double confidence;
        private Integer minLength;
        private Integer maxLength;
        private ValueValidator validator;
        private final List<FalsePositiveFilter> filters = new ArrayList<>();

        public Builder id(String v) { this.id = v; return this; }
        public Builder name(String v) { this.name = v; return this; }
        public Builder description(String v) { this.description = v; return this; }
        public Builder category(Category v) { this.category = v; this.categoryText = null; return this; }
        /** 텍스트 입력 (allow-list 검증 대상) */
        public Builder category(String v) { this.categoryText = v; this.category = null; return this; }
        public Builder severity(Severity v) { this.severity = v; this.severityText = null; return this; }
        public Builder severity(String v) { this.severityText = v; this.severity = null; return this; }
        /** 이미 컴파일된 정규식 (플래그는 그대로 사용) */
        public Builder regex(Pattern v) { this.compiled = v; this.regexSource = null; return this; }
        /** 정규식 원문. build() 에서 flags 로 컴파일 */
        public Builder regex(String v) { this.regexSource = v; this.compiled = null; return this; }
        public Builder flags(int v) { this.flags = v; return this; }
        public Builder extractGroup(Integer v) { this.extractGroup = v; return this; }
        public Builder confidence(Double v) { this.confidence = v; return this; }
        public Builder minLength(Integer v) { this.minLength = v; return this; }
        public Builder maxLength(Integer v) { this.maxLength = v; return this; }
        public Builder validator(ValueValidator v) { this.validator = v; return this; }
        public Builder addFilter(FalsePositiveFilter f) { if (f != null) this.filters.add(f); return this; }
        public Builder filters(List<FalsePositiveFilter> fs) {
            this.filters.clear();
            if (fs != null) for (FalsePositiveFilter f : fs) addFilter(f);
            return this;
        }

        public String getId() { return id; }

        /**
         * 검증 + 기본값 적용 + 컴파일.
         * @throws PatternValidationException 필수 필드 누락, 허용되지 않는 category/severity,
         *         잘못된 정규식, 범위를 벗어난 confidence/length/extractGroup
         */
        public PatternDefinition build() {
            if (id == null || id.isBlank()) {
                throw new PatternValidationException(null, "id is required");
            }
            if (name == null || name.isBlank()) {
                throw new PatternValidationException(id, "name is required");
            }

            Category cat = category;
            if (cat == null && categoryText != null) {
                cat = Category.fromId(categoryText);
                if (cat == null) throw new PatternValidationException(id, "invalid category: " + categoryText);
            }
            if (cat == null) cat = Category.SECRETS;

            Severity sev = severity;
            if (sev == null && severityText != null) {
                sev = Severity.fromId(severityText);
                if (sev == null) throw new PatternValidationException(id, "invalid severity: " + severityText);
            }
            if (sev == null) sev = Severity.MEDIUM;

            Pattern rx = compiled;
            if (rx == null) {
                if (regexSource == null || regexSource.isEmpty()) {
                    throw new PatternValidationException(id, "regex is required");
                }
                try {
                    rx = Pattern.compile(regexSource, flags);
                } catch (PatternSyntaxException e) {
                    throw new PatternValidationException(id, "invalid regex: " + e.getDescription(), e);
                } catch (IllegalArgumentException e) {
                    throw new PatternValidationException(id, "invalid regex flags: " + flags, e);
                }
            }

            double conf = (confidence == null ? DEFAULT_CONFIDENCE : confidence);
            if (Double.isNaN(conf) || conf < 0.0 || conf > 1.0) {
                throw new PatternValidationException(id, "confidence must be within [0,1]: " + conf);
            }
            if (minLength != null && minLength < 0) {
                throw new PatternValidationException(id, "minLength must be >= 0");
            }
            if (maxLength != null && maxLength < 1) {
                throw new PatternValidationException(id, "maxLength must be >= 1");
            }
            if (minLength != null && maxLength != null && minLength > maxLength) {
                throw new PatternValidationException(id, "minLength must be <= maxLength");
            }
            if (extractGroup != null) {
                int groups = rx.matcher("").groupCount();
                if (extractGroup < 0 || extractGroup > groups) {
                    throw new PatternValidationException(id,
                            "extractGroup " + extractGroup + " out of range (groups=" + groups + ")");
                }
            }
            return new PatternDefinition(this, cat, sev, rx, conf);
        }
    }
}
