package com.leakscope.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Optional;

/**
 * 외부(오케스트레이터/JSON)에서 넘어오는 느슨한 발견 항목.
 * 모든 필드는 선택이며 {@link #toFinding()} 에서 정규화한다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FindingInput {
    public String patternId;
    public String patternName;
    public String category;
    public String severity;
    public String value;
    public String fullMatch;
    public String file;
    public Integer line;
    public Integer column;
    public Integer index;
    public Double confidence;
    public Integer occurrenceCount;
    public List<Location> locations;

    /** patternId 와 value 가 모두 없으면 정규화 불가(빈 Optional). */
    public Optional<Finding> toFinding() {
        boolean noId = patternId == null || patternId.isBlank();
        boolean noValue = value == null || value.isBlank();
        if (noId && noValue) return Optional.empty();

        Severity sev = Severity.fromId(severity);
        double conf = (confidence == null || confidence.isNaN()) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        Finding.Builder b = Finding.builder()
                .patternId(patternId)
                .patternName(patternName)
                .category(Category.fromId(category))
                .severity(sev == null ? Severity.MEDIUM : sev)
                .value(value)
                .fullMatch(fullMatch != null ? fullMatch : value)
                .file(file)
                .line(line == null ? 0 : line)
                .column(column == null ? 0 : column)
                .index(index == null ? 0 : index)
                .confidence(conf)
                .occurrenceCount(occurrenceCount == null ? 1 : occurrenceCount);
        if (locations != null) {
            for (Location l : locations) b.addLocation(l);
        }
        return Optional.of(b.build());
    }
}
