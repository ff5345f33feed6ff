package com.leakscope.core.config;

import com.leakscope.core.model.Category;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * leakscope.yml 을 읽어 DetectionConfig 로 변환.
 *
 * 예상 YAML 키:
 * confidenceThreshold: 0.5
 * maxMatches: 100
 * maxMatchesPerPattern: 20
 * contextWindow: 50
 * enableDeduplication: true
 * contextAnalysisEnabled: true
 * categories: [secrets, vulnerabilities, configurations]   # 또는 "secrets,configurations"
 *
 * dedup:
 *   enableFileLevel: true
 *   enableScanLevel: true
 *   maxCacheSize: 1000
 *   maxDeduplicationTimeMs: 30000
 *   memoryLimitMB: 512
 *   enableCircuitBreaker: true
 *   circuitBreakerThreshold: 3
 *   circuitBreakerResetTimeMs: 60000
 */
public final class YamlConfigLoader {
    public static final String DEFAULT_RESOURCE = "/leakscope.yml";

    private YamlConfigLoader() {}

    /** classpath 의 기본 설정 */
    public static DetectionConfig loadDefault() throws IOException {
        try (InputStream in = YamlConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) throw new IOException("leakscope.yml not found on classpath");
            return load(in);
        }
    }

    public static DetectionConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("leakscope.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static DetectionConfig load(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        DetectionConfig cfg = DetectionConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setDouble(map, "confidenceThreshold", cfg::setConfidenceThreshold);
        setInt(map, "maxMatches", cfg::setMaxMatches);
        setInt(map, "maxMatchesPerPattern", cfg::setMaxMatchesPerPattern);
        setInt(map, "contextWindow", cfg::setContextWindow);
        setBoolean(map, "enableDeduplication", cfg::setEnableDeduplication);
        setBoolean(map, "contextAnalysisEnabled", cfg::setContextAnalysisEnabled);
        setCategories(map, "categories", cfg::setCategories);

        // 2) dedup.*
        Map<String, Object> dd = getMap(map, "dedup");
        if (dd != null) {
            var d = cfg.getDedup();
            setBoolean(dd, "enableFileLevel", d::setEnableFileLevel);
            setBoolean(dd, "enableScanLevel", d::setEnableScanLevel);
            setInt(dd, "maxCacheSize", d::setMaxCacheSize);
            setLong(dd, "maxDeduplicationTimeMs", d::setMaxDeduplicationTimeMs);
            setInt(dd, "memoryLimitMB", d::setMemoryLimitMB);
            setBoolean(dd, "enableCircuitBreaker", d::setEnableCircuitBreaker);
            setInt(dd, "circuitBreakerThreshold", d::setCircuitBreakerThreshold);
            setLong(dd, "circuitBreakerResetTimeMs", d::setCircuitBreakerResetTimeMs);
        }

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) setter.accept(Double.parseDouble(String.valueOf(v).trim()));
    }

    /** 리스트 또는 "a,b" 문자열. 알 수 없는 이름은 무시(전부 무시되면 기본값 유지) */
    private static void setCategories(Map<?, ?> map, String key, Consumer<Set<Category>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<?> items = (v instanceof List<?> list) ? list : List.of(String.valueOf(v).split("\\s*,\\s*"));
        Set<Category> out = EnumSet.noneOf(Category.class);
        for (Object o : items) {
            Category c = (o == null ? null : Category.fromId(String.valueOf(o)));
            if (c != null) out.add(c);
        }
        if (!out.isEmpty()) setter.accept(out);
    }
}
