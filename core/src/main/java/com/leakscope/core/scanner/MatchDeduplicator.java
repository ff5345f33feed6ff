package com.leakscope.core.scanner;

import com.leakscope.core.model.Finding;
import com.leakscope.core.model.Location;
import com.leakscope.core.model.RawMatch;
import com.leakscope.core.model.Severity;
import com.leakscope.core.util.TextUtil;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * scanContent 1회 범위의 중복 정리.
 * 1) 패턴 내부: 같은 값(trim, 대소문자 무시)이 10자 이내에 다시 잡히면 하나만 남긴다.
 * 2) 호출 전체: (patternId, 정규화 값) 기준으로 Finding 을 합치고 위치를 누적한다.
 */
public final class MatchDeduplicator {
    /** 같은 값으로 볼 최대 위치 차이(문자) */
    public static final int NEARBY_DISTANCE = 10;

    private final Map<String, Finding> byKey = new LinkedHashMap<>();

    /** 위치 순서 유지. 더 나은 쪽이 앞선 항목 자리를 대체한다. */
    public static List<RawMatch> collapseNearby(List<RawMatch> matches) {
        List<RawMatch> kept = new ArrayList<>(matches.size());
        for (RawMatch m : matches) {
            String norm = TextUtil.normalizeValue(m.value());
            int hit = -1;
            for (int i = 0; i < kept.size(); i++) {
                RawMatch k = kept.get(i);
                if (TextUtil.normalizeValue(k.value()).equals(norm)
                        && Math.abs(k.index() - m.index()) <= NEARBY_DISTANCE) {
                    hit = i;
                    break;
                }
            }
            if (hit < 0) {
                kept.add(m);
            } else if (isBetter(m, kept.get(hit))) {
                kept.set(hit, m);
            }
        }
        return kept;
    }

    /** 문맥이 더 풍부한 쪽 → 값이 긴 쪽 → 앞선 위치 */
    static boolean isBetter(RawMatch a, RawMatch b) {
        int ca = a.context().surroundingLength();
        int cb = b.context().surroundingLength();
        if (ca != cb) return ca > cb;
        if (a.value().length() != b.value().length()) return a.value().length() > b.value().length();
        return a.index() < b.index();
    }

    /** 호출 전체 병합에 하나 추가 */
    public void add(Finding f) {
        String key = f.getPatternId() + ":" + TextUtil.normalizeValue(f.getValue());
        Finding prev = byKey.get(key);
        if (prev == null) {
            byKey.put(key, f);
            return;
        }
        Finding.Builder b = prev.toBuilder()
                .confidence(Math.max(prev.getConfidence(), f.getConfidence()))
                .severity(Severity.max(prev.getSeverity(), f.getSeverity()))
                .lastSeen(f.getLastSeen() != null ? f.getLastSeen() : Instant.now());
        for (Location l : f.getLocations()) b.addLocation(l);
        b.occurrenceCount(prev.getLocations().size() + f.getLocations().size());
        byKey.put(key, b.build());
    }

    public List<Finding> findings() {
        return new ArrayList<>(byKey.values());
    }

    public int size() { return byKey.size(); }
}
