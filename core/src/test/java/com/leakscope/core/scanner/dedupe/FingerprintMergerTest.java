package com.leakscope.core.scanner.dedupe;

import com.leakscope.core.error.ResourceLimitException;
import com.leakscope.core.model.Finding;
import com.leakscope.core.model.Location;
import com.leakscope.core.model.Severity;
import com.leakscope.core.util.FrozenClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FingerprintMergerTest {

    private final FingerprintMerger merger = new FingerprintMerger();

    private static Finding at(int line, Instant seen) {
        return Finding.builder().patternId("p").value("v").file("a.txt").line(line).column(3)
                .severity(Severity.LOW).confidence(0.5).firstSeen(seen).lastSeen(seen).build();
    }

    @Test
    void keepsEarliestFirstSeenAndLatestLastSeen() {
        Instant t1 = Instant.parse("2024-01-01T00:00:00Z");
        Instant t2 = Instant.parse("2024-01-02T00:00:00Z");

        List<Finding> out = merger.deduplicate(List.of(at(2, t2), at(1, t1)), null, Deadline.none());

        assertThat(out).hasSize(1);
        assertThat(out.get(0).getFirstSeen()).isEqualTo(t1);
        assertThat(out.get(0).getLastSeen()).isEqualTo(t2);
        assertThat(out.get(0).getLocations()).extracting(Location::line).containsExactly(2, 1);
    }

    @Test
    void sameLocationTwice_countsOnce() {
        Instant t = Instant.now();
        List<Finding> out = merger.deduplicate(List.of(at(1, t), at(1, t)), null, Deadline.none());

        assertThat(out.get(0).getOccurrenceCount()).isEqualTo(1);
        assertThat(out.get(0).getLocations()).hasSize(1);
    }

    @Test
    void unplacedRecords_sumTheirCounts() {
        Finding unplaced = Finding.builder().patternId("p").value("v").severity(Severity.LOW).confidence(0.5).build();
        Finding a = merger.deduplicate(List.of(unplaced, unplaced), "a.txt", Deadline.none()).get(0);

        Finding m = FingerprintMerger.merge(a, unplaced.toBuilder().file("a.txt").build());

        assertThat(a.getOccurrenceCount()).isEqualTo(2);
        assertThat(m.getOccurrenceCount()).isEqualTo(3);
        assertThat(m.getLocations()).hasSize(3);
    }

    @Test
    void nullEntries_areSkipped() {
        List<Finding> in = new ArrayList<>(Arrays.asList(null, at(1, Instant.now()), null));

        assertThat(merger.deduplicate(in, null, Deadline.none())).hasSize(1);
    }

    @Test
    void expiredDeadline_abortsWithTimeout() {
        FrozenClock clock = new FrozenClock(0);
        Deadline deadline = new Deadline(clock, 10);
        clock.plusMillis(11);

        assertThatThrownBy(() -> merger.deduplicate(List.of(at(1, Instant.now())), null, deadline))
                .isInstanceOf(ResourceLimitException.class)
                .satisfies(e -> assertThat(((ResourceLimitException) e).getKind())
                        .isEqualTo(ResourceLimitException.Kind.TIMEOUT));
    }

    @Test
    void merge_combinesTwoMergedRecords() {
        Instant t = Instant.now();
        Finding a = merger.deduplicate(List.of(at(1, t), at(2, t)), null, Deadline.none()).get(0);
        Finding b = at(3, t).toBuilder().severity(Severity.HIGH).confidence(0.9).build();

        Finding m = FingerprintMerger.merge(a, b);

        assertThat(m.getOccurrenceCount()).isEqualTo(3);
        assertThat(m.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(m.getConfidence()).isEqualTo(0.9);
    }
}
