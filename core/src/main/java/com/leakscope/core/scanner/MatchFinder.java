package com.leakscope.core.scanner;

import com.leakscope.core.error.MatchingException;
import com.leakscope.core.model.MatchContext;
import com.leakscope.core.model.RawMatch;
import com.leakscope.core.pattern.FalsePositiveFilter;
import com.leakscope.core.pattern.PatternDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;

/**
 * 단일 패턴의 후보 매치를 찾는다.
 * - 전역 ledger(앞선 패턴이 점유) 또는 이 패턴 자체 ledger 와 겹치면 제외
 * - 오탐 필터 적중 시 제외
 * - 길이 0 매치는 커서를 1 전진
 */
public final class MatchFinder {
    public static final int DEFAULT_CONTEXT_WINDOW = 50;
    public static final int DEFAULT_MAX_MATCHES_PER_PATTERN = 20;

    /** 필터가 하나라도 있는 패턴에 한해 문맥(full)에서 추가로 걸러내는 자리표시 어휘 */
    static final List<String> PLACEHOLDER_KEYWORDS = List.of(
            "example", "placeholder", "test", "demo", "sample",
            "mock", "fake", "dummy", "your_key_here", "replace_with");

    public List<RawMatch> find(String content, PatternDefinition pattern, PositionLedger global) {
        return find(content, pattern, global, DEFAULT_CONTEXT_WINDOW, DEFAULT_MAX_MATCHES_PER_PATTERN);
    }

    /**
     * @return 위치 순서의 후보 목록 (최대 maxMatches 개)
     * @throws MatchingException 정규식 평가 중 런타임 오류/스택 오버플로
     */
    public List<RawMatch> find(String content, PatternDefinition pattern, PositionLedger global,
                               int contextWindow, int maxMatches) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(global, "global");
        List<RawMatch> out = new ArrayList<>();
        if (content == null || content.isEmpty() || maxMatches <= 0) return out;

        PositionLedger own = new PositionLedger();
        Matcher m = pattern.getRegex().matcher(content);
        int len = content.length();
        int from = 0;
        try {
            while (out.size() < maxMatches && from <= len && m.find(from)) {
                int s = m.start();
                int e = m.end();
                from = (e == s) ? e + 1 : e;

                if (global.overlaps(s, e) || own.overlaps(s, e)) continue;

                RawMatch candidate = toRawMatch(content, m, pattern, contextWindow);
                Integer maxLen = pattern.getMaxLength();
                if (maxLen != null && candidate.value().length() > maxLen) continue;
                if (isFalsePositive(candidate, pattern)) continue;

                out.add(candidate);
                own.claim(s, e);
            }
        } catch (RuntimeException | StackOverflowError ex) {
            throw new MatchingException(pattern.getId(),
                    "regex evaluation failed for pattern '" + pattern.getId() + "' at offset " + from, ex);
        }
        return out;
    }

    private static RawMatch toRawMatch(String content, Matcher m, PatternDefinition p, int window) {
        int s = m.start();
        int e = m.end();
        String full = m.group();
        String value = full;
        Integer g = p.getExtractGroup();
        if (g != null && g > 0) {
            String gv = m.group(g);
            if (gv != null) value = gv;   // 그룹이 참여하지 않았으면 전체 매치 사용
        }
        List<String> groups = new ArrayList<>(m.groupCount());
        for (int i = 1; i <= m.groupCount(); i++) {
            String gi = m.group(i);
            groups.add(gi == null ? "" : gi);
        }
        return new RawMatch(value, full, s, e - s, contextOf(content, s, e, window), groups);
    }

    static MatchContext contextOf(String content, int s, int e, int window) {
        int w = Math.max(0, window);
        int cs = Math.max(0, s - w);
        int ce = Math.min(content.length(), e + w);
        return new MatchContext(content.substring(cs, s), content.substring(e, ce), content.substring(cs, ce));
    }

    static boolean isFalsePositive(RawMatch m, PatternDefinition p) {
        List<FalsePositiveFilter> filters = p.getFalsePositiveFilters();
        if (filters.isEmpty()) return false;
        for (FalsePositiveFilter f : filters) {
            if (f.rejects(m)) return true;
        }
        String ctx = m.context().full().toLowerCase(Locale.ROOT);
        for (String k : PLACEHOLDER_KEYWORDS) {
            if (ctx.contains(k)) return true;
        }
        return false;
    }
}
