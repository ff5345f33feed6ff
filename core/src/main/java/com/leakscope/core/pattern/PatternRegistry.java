package com.leakscope.core.pattern;

import com.leakscope.core.error.PatternValidationException;
import com.leakscope.core.model.Category;
import com.leakscope.core.model.Severity;
import com.leakscope.core.util.StructuredLog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 패턴 저장소. id 와 category 로 색인하며 등록 순서를 보존한다.
 * 등록은 보통 시작 시 1회, 조회는 여러 스레드에서 동시에 일어날 수 있다.
 */
public final class PatternRegistry {
    private static final StructuredLog SLOG = StructuredLog.get(PatternRegistry.class);

    private final Map<String, PatternDefinition> byId = new LinkedHashMap<>();
    private final Map<Category, List<PatternDefinition>> byCategory = new EnumMap<>(Category.class);

    public PatternRegistry() {
        for (Category c : Category.values()) byCategory.put(c, new ArrayList<>());
    }

    /** 검증 후 등록. 중복 id 는 거부한다. */
    public PatternDefinition register(PatternDefinition.Builder def) {
        Objects.requireNonNull(def, "def");
        return register(def.build());
    }

    public synchronized PatternDefinition register(PatternDefinition p) {
        Objects.requireNonNull(p, "pattern");
        if (byId.containsKey(p.getId())) {
            throw new PatternValidationException(p.getId(), "duplicate pattern id");
        }
        byId.put(p.getId(), p);
        byCategory.get(p.getCategory()).add(p);
        SLOG.debug("pattern-registered", "id", p.getId(), "category", p.getCategory().id(),
                "severity", p.getSeverity().id(), "confidence", p.getConfidence());
        return p;
    }

    /** 순서대로 등록. 첫 번째 잘못된 항목에서 예외(그 이전 항목은 등록된 상태로 남음). */
    public List<PatternDefinition> registerAll(List<PatternDefinition.Builder> defs) {
        Objects.requireNonNull(defs, "defs");
        List<PatternDefinition> out = new ArrayList<>(defs.size());
        for (PatternDefinition.Builder d : defs) out.add(register(d));
        return out;
    }

    public synchronized PatternDefinition get(String id) {
        return byId.get(id);
    }

    /** 지정 카테고리 패턴을 category 선언 순서 → 등록 순서로 반환. null/빈 집합이면 전체. */
    public synchronized List<PatternDefinition> patternsFor(Set<Category> categories) {
        Set<Category> cats = (categories == null || categories.isEmpty()) ? Category.all() : categories;
        List<PatternDefinition> out = new ArrayList<>();
        for (Category c : Category.values()) {
            if (cats.contains(c)) out.addAll(byCategory.get(c));
        }
        return out;
    }

    public synchronized List<PatternDefinition> all() {
        return List.copyOf(byId.values());
    }

    public synchronized int size() { return byId.size(); }

    public synchronized void clear() {
        byId.clear();
        byCategory.values().forEach(List::clear);
    }

    public synchronized Stats stats() {
        Map<Category, Integer> counts = new EnumMap<>(Category.class);
        List<Summary> summaries = new ArrayList<>(byId.size());
        for (Category c : Category.values()) counts.put(c, byCategory.get(c).size());
        for (PatternDefinition p : byId.values()) {
            summaries.add(new Summary(p.getId(), p.getName(), p.getCategory(), p.getSeverity(), p.getConfidence()));
        }
        return new Stats(byId.size(), Collections.unmodifiableMap(counts), List.copyOf(summaries));
    }

    public record Summary(String id, String name, Category category, Severity severity, double confidence) {}

    public record Stats(int total, Map<Category, Integer> byCategory, List<Summary> patterns) {}
}
