package com.leakscope.core.scanner.dedupe;

import com.leakscope.core.model.Finding;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BinaryOperator;
import java.util.function.Function;

/**
 * 지문 → 병합 레코드 캐시 (삽입 순서 기준 축출).
 * 축출은 누적 뷰에서 덜 합쳐지는 결과만 낳고 잘못된 병합은 만들지 않는다.
 */
final class FindingCache {
    private final int maxSize;
    private final LinkedHashMap<String, Finding> map;
    private long evictions;

    FindingCache(int maxSize) {
        this.maxSize = Math.max(1, maxSize);
        this.map = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Finding> eldest) {
                boolean evict = size() > FindingCache.this.maxSize;
                if (evict) evictions++;
                return evict;
            }
        };
    }

    synchronized void merge(String fingerprint, Finding f, BinaryOperator<Finding> mergeFn) {
        mergeLocked(fingerprint, f, mergeFn);
    }

    /** 비우고 다시 채우기를 한 잠금 안에서 수행 (동시 파일 단위 병합이 사이에 끼지 않음) */
    synchronized void replaceAll(List<Finding> findings, Function<Finding, String> fingerprintFn,
                                 BinaryOperator<Finding> mergeFn) {
        map.clear();
        for (Finding f : findings) {
            if (f != null) mergeLocked(fingerprintFn.apply(f), f, mergeFn);
        }
    }

    private void mergeLocked(String fingerprint, Finding f, BinaryOperator<Finding> mergeFn) {
        Finding prev = map.get(fingerprint);
        if (prev == null) map.put(fingerprint, f);
        else map.put(fingerprint, mergeFn.apply(prev, f));   // 기존 키 갱신은 삽입 순서를 바꾸지 않음
    }

    synchronized Finding get(String fingerprint) { return map.get(fingerprint); }

    synchronized List<Finding> values() { return new ArrayList<>(map.values()); }

    synchronized int size() { return map.size(); }

    synchronized long evictions() { return evictions; }

    int maxSize() { return maxSize; }

    synchronized void clear() {
        map.clear();
        evictions = 0;
    }
}
