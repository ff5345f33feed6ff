package com.leakscope.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 점수가 매겨진 발견 항목.
 * 병합 후 occurrenceCount 는 위치 수 이상이며, 입력마다 횟수와 위치 수가 같으면 둘이 같다.
 * 외부(오케스트레이터)에서 온 항목은 일부 필드가 비어 있을 수 있다.
 */
public final class Finding {
    public static final String STATUS_FALLBACK = "fallback";

    // 패턴 요약
    private final String patternId;
    private final String patternName;
    private final Category category;
    private final Severity severity;

    // 매치
    private final String value;
    private final String fullMatch;
    private final int index;
    private final int length;
    private final MatchContext context;
    private final List<String> groups;
    private final double confidence;    // 0.0~1.0

    // 출처
    private final String file;
    private final int line;
    private final int column;

    // 병합 결과
    private final int occurrenceCount;
    private final List<Location> locations;
    private final Instant firstSeen;
    private final Instant lastSeen;

    // fallback 표시 (정상 경로에선 null)
    private final String deduplicationStatus;
    private final String fallbackReason;

    private Finding(Builder b) {
        this.patternId = b.patternId;
        this.patternName = b.patternName;
        this.category = b.category;
        this.severity = b.severity;
        this.value = b.value;
        this.fullMatch = b.fullMatch;
        this.index = b.index;
        this.length = b.length;
        this.context = (b.context == null ? MatchContext.EMPTY : b.context);
        this.groups = List.copyOf(b.groups);
        this.confidence = b.confidence;
        this.file = b.file;
        this.line = b.line;
        this.column = b.column;
        this.occurrenceCount = b.occurrenceCount;
        this.locations = List.copyOf(b.locations);
        this.firstSeen = b.firstSeen;
        this.lastSeen = b.lastSeen;
        this.deduplicationStatus = b.deduplicationStatus;
        this.fallbackReason = b.fallbackReason;
    }

    public String getPatternId() { return patternId; }
    public String getPatternName() { return patternName; }
    public Category getCategory() { return category; }
    public Severity getSeverity() { return severity; }
    public String getValue() { return value; }
    public String getFullMatch() { return fullMatch; }
    public int getIndex() { return index; }
    public int getLength() { return length; }
    public MatchContext getContext() { return context; }
    public List<String> getGroups() { return groups; }
    public double getConfidence() { return confidence; }
    public String getFile() { return file; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public int getOccurrenceCount() { return occurrenceCount; }
    public List<Location> getLocations() { return locations; }
    public Instant getFirstSeen() { return firstSeen; }
    public Instant getLastSeen() { return lastSeen; }
    public String getDeduplicationStatus() { return deduplicationStatus; }
    public String getFallbackReason() { return fallbackReason; }

    public boolean isFallback() { return STATUS_FALLBACK.equals(deduplicationStatus); }

    /** 이 항목 자체가 가리키는 위치 (file 이 비어 있으면 defaultFile 사용) */
    public Location ownLocation(String defaultFile) {
        String f = (file == null || file.isBlank()) ? defaultFile : file;
        return new Location(f, line, column, index);
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.patternId = patternId;
        b.patternName = patternName;
        b.category = category;
        b.severity = severity;
        b.value = value;
        b.fullMatch = fullMatch;
        b.index = index;
        b.length = length;
        b.context = context;
        b.groups = new ArrayList<>(groups);
        b.confidence = confidence;
        b.file = file;
        b.line = line;
        b.column = column;
        b.occurrenceCount = occurrenceCount;
        b.locations = new ArrayList<>(locations);
        b.firstSeen = firstSeen;
        b.lastSeen = lastSeen;
        b.deduplicationStatus = deduplicationStatus;
        b.fallbackReason = fallbackReason;
        return b;
    }

    @Override
    public String toString() {
        return "Finding{" + patternId + ", sev=" + severity + ", conf=" + confidence
                + ", file=" + file + ", occ=" + occurrenceCount + "}";
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String patternId;
        private String patternName;
        private Category category;
        private Severity severity;
        private String value;
        private String fullMatch;
        private int index;
        private int length;
        private MatchContext context;
        private List<String> groups = new ArrayList<>();
        private double confidence;
        private String file;
        private int line;
        private int column;
        private int occurrenceCount = 1;
        private List<Location> locations = new ArrayList<>();
        private Instant firstSeen;
        private Instant lastSeen;
        private String deduplicationStatus;
        private String fallbackReason;

        public Builder patternId(String v) { this.patternId = v; return this; }
        public Builder patternName(String v) { this.patternName = v; return this; }
        public Builder category(Category v) { this.category = v; return this; }
        public Builder severity(Severity v) { this.severity = v; return this; }
        public Builder value(String v) { this.value = v; return this; }
        public Builder fullMatch(String v) { this.fullMatch = v; return this; }
        public Builder index(int v) { this.index = v; return this; }
        public Builder length(int v) { this.length = v; return this; }
        public Builder context(MatchContext v) { this.context = v; return this; }
        public Builder groups(List<String> v) { this.groups = (v == null ? new ArrayList<>() : new ArrayList<>(v)); return this; }
        public Builder confidence(double v) { this.confidence = v; return this; }
        public Builder file(String v) { this.file = v; return this; }
        public Builder line(int v) { this.line = v; return this; }
        public Builder column(int v) { this.column = v; return this; }
        public Builder occurrenceCount(int v) { this.occurrenceCount = v; return this; }
        public Builder locations(List<Location> v) { this.locations = (v == null ? new ArrayList<>() : new ArrayList<>(v)); return this; }
        public Builder addLocation(Location v) { if (v != null) this.locations.add(v); return this; }
        public Builder firstSeen(Instant v) { this.firstSeen = v; return this; }
        public Builder lastSeen(Instant v) { this.lastSeen = v; return this; }
        public Builder deduplicationStatus(String v) { this.deduplicationStatus = v; return this; }
        public Builder fallbackReason(String v) { this.fallbackReason = v; return this; }

        /** RawMatch 의 매치 필드를 한 번에 복사 */
        public Builder fromMatch(RawMatch m) {
            this.value = m.value();
            this.fullMatch = m.fullMatch();
            this.index = m.index();
            this.length = m.length();
            this.context = m.context();
            this.groups = new ArrayList<>(m.groups());
            return this;
        }

        public Finding build() {
            if (occurrenceCount < 1) occurrenceCount = 1;
            return new Finding(this);
        }
    }
}
