package com.leakscope.core.scanner.dedupe;

import com.leakscope.core.model.Finding;
import com.leakscope.core.model.Location;
import com.leakscope.core.model.Severity;
import com.leakscope.core.util.TextUtil;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 지문 기반 병합 (기본 알고리즘).
 * - 처음 본 지문: 레코드 생성 (이미 병합된 항목이면 위치 목록과 occurrenceCount 유지)
 * - 다시 본 지문: confidence/severity 최대, occurrenceCount 합산, 위치 추가
 * - line/column 을 아는 위치가 이미 있으면 재보고로 보고 위치도 횟수도 늘리지 않는다.
 *   line/column 을 모르는 위치(0)는 구분할 수 없으므로 항상 별개 발생으로 센다.
 * 지문마다 레코드가 하나뿐인 출력을 다시 넣으면 결과가 같다(멱등).
 */
public final class FingerprintMerger implements DeduplicationAlgorithm {

    @Override
    public List<Finding> deduplicate(List<Finding> findings, String defaultFile, Deadline deadline) {
        Map<String, Acc> seen = new LinkedHashMap<>();
        if (findings == null) return new ArrayList<>();
        for (Finding f : findings) {
            deadline.check();
            if (f == null) continue;
            String fp = FingerprintGenerator.of(f, defaultFile);
            Acc acc = seen.get(fp);
            if (acc == null) seen.put(fp, new Acc(f, defaultFile));
            else acc.absorb(f, defaultFile);
        }
        List<Finding> out = new ArrayList<>(seen.size());
        for (Acc acc : seen.values()) out.add(acc.toFinding());
        return out;
    }

    /** 이미 병합된 두 레코드를 합친다 (스캔 누적 캐시용). */
    public static Finding merge(Finding a, Finding b) {
        Acc acc = new Acc(a, null);
        acc.absorb(b, null);
        return acc.toFinding();
    }

    /** 항목이 가진 위치 목록. 비어 있으면 자기 자신의 위치 1개. */
    static List<Location> locationsOf(Finding f, String defaultFile) {
        if (!f.getLocations().isEmpty()) return f.getLocations();
        return List.of(f.ownLocation(defaultFile));
    }

    /** 병합 누적기 (호출 지역) */
    private static final class Acc {
        private final Finding first;
        private final String file;
        private final List<Location> locations = new ArrayList<>();
        private int occurrences;
        private double confidence;
        private Severity severity;
        private Instant firstSeen;
        private Instant lastSeen;

        Acc(Finding f, String defaultFile) {
            this.first = f;
            this.file = TextUtil.isBlank(f.getFile()) ? defaultFile : f.getFile();
            this.confidence = f.getConfidence();
            this.severity = f.getSeverity();
            this.firstSeen = f.getFirstSeen();
            this.lastSeen = f.getLastSeen();
            add(f, defaultFile);
        }

        void absorb(Finding f, String defaultFile) {
            confidence = Math.max(confidence, f.getConfidence());
            severity = Severity.max(severity, f.getSeverity());
            firstSeen = earliest(firstSeen, f.getFirstSeen());
            lastSeen = latest(lastSeen, f.getLastSeen());
            add(f, defaultFile);
        }

        /** 항목의 발생 횟수를 더하고, 이미 있는 위치로 판명된 만큼은 빼서 재보고를 세지 않는다. */
        private void add(Finding f, String defaultFile) {
            List<Location> ls = locationsOf(f, defaultFile);
            int offered = 0;
            int repeated = 0;
            for (Location l : ls) {
                if (l == null) continue;
                offered++;
                if (l.isKnown() && containsPlace(l)) repeated++;
                else locations.add(l);
            }
            int reported = Math.max(f.getOccurrenceCount(), offered);
            occurrences += Math.max(0, reported - repeated);
        }

        private boolean containsPlace(Location l) {
            for (Location k : locations) {
                if (k.samePlace(l)) return true;
            }
            return false;
        }

        Finding toFinding() {
            Instant now = Instant.now();
            return first.toBuilder()
                    .file(file)
                    .confidence(confidence)
                    .severity(severity)
                    .locations(locations)
                    .occurrenceCount(Math.max(occurrences, locations.size()))
                    .firstSeen(firstSeen != null ? firstSeen : now)
                    .lastSeen(lastSeen != null ? lastSeen : now)
                    .deduplicationStatus(null)
                    .fallbackReason(null)
                    .build();
        }

        private static Instant earliest(Instant a, Instant b) {
            if (a == null) return b;
            if (b == null) return a;
            return a.isBefore(b) ? a : b;
        }

        private static Instant latest(Instant a, Instant b) {
            if (a == null) return b;
            if (b == null) return a;
            return a.isAfter(b) ? a : b;
        }
    }
}
