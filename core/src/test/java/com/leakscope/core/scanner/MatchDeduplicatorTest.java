package com.leakscope.core.scanner;

import com.leakscope.core.model.Finding;
import com.leakscope.core.model.Location;
import com.leakscope.core.model.MatchContext;
import com.leakscope.core.model.RawMatch;
import com.leakscope.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MatchDeduplicatorTest {

    private static RawMatch raw(String value, int index, String before) {
        return new RawMatch(value, value, index, value.length(), new MatchContext(before, "", before + value), List.of());
    }

    @Test
    void collapseNearby_keepsOneOfSameValueWithinDistance() {
        List<RawMatch> out = MatchDeduplicator.collapseNearby(List.of(
                raw("Abc", 0, ""),
                raw(" abc ", 8, "x"),
                raw("abc", 40, "")));

        assertThat(out).hasSize(2);
        assertThat(out.get(0).index()).isEqualTo(8);
        assertThat(out.get(1).index()).isEqualTo(40);
    }

    @Test
    void isBetter_prefersContextThenLengthThenEarlierIndex() {
        assertThat(MatchDeduplicator.isBetter(raw("abc", 5, "xx"), raw("abc", 0, "x"))).isTrue();
        assertThat(MatchDeduplicator.isBetter(raw("abcd", 5, "x"), raw("abc", 0, "x"))).isTrue();
        assertThat(MatchDeduplicator.isBetter(raw("abc", 5, "x"), raw("abc", 0, "x"))).isFalse();
        assertThat(MatchDeduplicator.isBetter(raw("abc", 0, "x"), raw("abc", 5, "x"))).isTrue();
    }

    private static Finding finding(String value, double confidence, Severity severity, int line) {
        return Finding.builder().patternId("p").value(value).confidence(confidence).severity(severity)
                .line(line).column(1)
                .addLocation(new Location("a.txt", line, 1, 0))
                .build();
    }

    @Test
    void add_mergesByPatternAndNormalizedValue() {
        MatchDeduplicator d = new MatchDeduplicator();
        d.add(finding("Secret", 0.6, Severity.LOW, 1));
        d.add(finding("secret", 0.9, Severity.HIGH, 4));
        d.add(finding("other", 0.5, Severity.LOW, 5));

        assertThat(d.size()).isEqualTo(2);
        Finding merged = d.findings().get(0);
        assertThat(merged.getValue()).isEqualTo("Secret");
        assertThat(merged.getConfidence()).isEqualTo(0.9);
        assertThat(merged.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(merged.getOccurrenceCount()).isEqualTo(2);
        assertThat(merged.getLocations()).extracting(Location::line).containsExactly(1, 4);
    }
}
