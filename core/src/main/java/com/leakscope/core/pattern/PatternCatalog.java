package com.leakscope.core.pattern;

import com.leakscope.core.error.PatternValidationException;
import com.leakscope.core.model.Category;
import com.leakscope.core.model.ScanOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 내장 패턴 카탈로그(classpath patterns.yml) 로더.
 *
 * <pre>
 * patterns:
 *   - id: aws-access-key
 *     name: AWS Access Key ID
 *     category: secrets
 *     severity: critical
 *     regex: '(AKIA[0-9A-Z]{16})'
 *     extractGroup: 1
 *     confidence: 0.95
 *     validator: 'AKIA[0-9A-Z]{16}'
 *     falsePositiveFilters: ['example']
 *     keywords: ['sample']
 * </pre>
 */
public final class PatternCatalog {
    public static final String DEFAULT_RESOURCE = "/patterns.yml";

    /** 용도별 프리셋: 카테고리 + 기본 임계값 */
    public enum Preset {
        FULL(Category.all(), 0.5),
        SECRETS_ONLY(EnumSet.of(Category.SECRETS), 0.6),
        VULNERABILITIES(EnumSet.of(Category.VULNERABILITIES), 0.5),
        CONFIGURATIONS(EnumSet.of(Category.CONFIGURATIONS), 0.7);

        private final Set<Category> categories;
        private final double threshold;

        Preset(Set<Category> categories, double threshold) {
            this.categories = categories;
            this.threshold = threshold;
        }

        public Set<Category> categories() { return EnumSet.copyOf(categories); }
        public double threshold() { return threshold; }

        public ScanOptions options() {
            return ScanOptions.defaults().setCategories(categories).setConfidenceThreshold(threshold);
        }
    }

    private PatternCatalog() {}

    /** 내장 카탈로그 전체를 등록한 새 레지스트리 */
    public static PatternRegistry defaultRegistry() {
        return registry(Category.all());
    }

    /** 내장 카탈로그 중 지정 카테고리만 등록한 새 레지스트리 */
    public static PatternRegistry registry(Set<Category> categories) {
        PatternRegistry reg = new PatternRegistry();
        for (PatternDefinition p : buildAll(loadDefault())) {
            if (categories == null || categories.contains(p.getCategory())) reg.register(p);
        }
        return reg;
    }

    public static PatternRegistry registry(Preset preset) {
        return registry(Objects.requireNonNull(preset, "preset").categories());
    }

    public static List<PatternDefinition.Builder> loadDefault() {
        try (InputStream in = PatternCatalog.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("pattern catalog not found on classpath: " + DEFAULT_RESOURCE);
            }
            return load(in);
        } catch (IOException e) {
            throw new IllegalStateException("failed to read pattern catalog: " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * YAML 을 Builder 목록으로 읽는다. 검증은 build()/register() 시점.
     * @throws PatternValidationException YAML 구문 오류 또는 구조가 맞지 않을 때
     */
    public static List<PatternDefinition.Builder> load(InputStream in) {
        Objects.requireNonNull(in, "in");
        Object root;
        try {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
        } catch (YAMLException e) {
            throw new PatternValidationException(null, "malformed pattern catalog: " + e.getMessage(), e);
        }
        List<PatternDefinition.Builder> out = new ArrayList<>();
        if (!(root instanceof Map<?, ?> map)) return out;

        Object list = map.get("patterns");
        if (list == null) return out;
        if (!(list instanceof List<?> entries)) {
            throw new PatternValidationException(null, "'patterns' must be a list");
        }
        for (Object e : entries) {
            if (!(e instanceof Map<?, ?> m)) {
                throw new PatternValidationException(null, "pattern entry must be a mapping: " + e);
            }
            out.add(toBuilder(m));
        }
        return out;
    }

    static List<PatternDefinition> buildAll(List<PatternDefinition.Builder> builders) {
        List<PatternDefinition> out = new ArrayList<>(builders.size());
        for (PatternDefinition.Builder b : builders) out.add(b.build());
        return out;
    }

    private static PatternDefinition.Builder toBuilder(Map<?, ?> m) {
        String id = str(m, "id");
        PatternDefinition.Builder b = PatternDefinition.builder()
                .id(id)
                .name(str(m, "name"))
                .description(str(m, "description"))
                .regex(str(m, "regex"))
                .extractGroup(integer(id, m, "extractGroup"))
                .confidence(dbl(id, m, "confidence"))
                .minLength(integer(id, m, "minLength"))
                .maxLength(integer(id, m, "maxLength"));

        String cat = str(m, "category");
        if (cat != null) b.category(cat);
        String sev = str(m, "severity");
        if (sev != null) b.severity(sev);
        if (Boolean.TRUE.equals(m.get("caseSensitive"))) b.flags(0);

        String validator = str(m, "validator");
        if (validator != null) {
            try {
                b.validator(ValueValidator.matching(validator));
            } catch (IllegalArgumentException ex) {
                throw new PatternValidationException(id, "invalid validator regex: " + validator, ex);
            }
        }
        for (String f : strings(m, "falsePositiveFilters")) {
            try {
                b.addFilter(FalsePositiveFilter.regex(Pattern.compile(f, Pattern.CASE_INSENSITIVE)));
            } catch (IllegalArgumentException ex) {
                throw new PatternValidationException(id, "invalid false-positive filter: " + f, ex);
            }
        }
        for (String k : strings(m, "keywords")) {
            b.addFilter(FalsePositiveFilter.keyword(k));
        }
        return b;
    }

    // ------------ helpers ------------
    private static String str(Map<?, ?> m, String key) {
        Object v = m.get(key);
        return v == null ? null : String.valueOf(v);
    }

    private static Integer integer(String id, Map<?, ?> m, String key) {
        Object v = m.get(key);
        if (v == null) return null;
        if (v instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new PatternValidationException(id, key + " must be an integer: " + v, e);
        }
    }

    private static Double dbl(String id, Map<?, ?> m, String key) {
        Object v = m.get(key);
        if (v == null) return null;
        if (v instanceof Number n) return n.doubleValue();
        try {
            return Double.parseDouble(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new PatternValidationException(id, key + " must be a number: " + v, e);
        }
    }

    private static List<String> strings(Map<?, ?> m, String key) {
        Object v = m.get(key);
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else if (v != null) {
            out.add(String.valueOf(v));
        }
        return out;
    }
}
