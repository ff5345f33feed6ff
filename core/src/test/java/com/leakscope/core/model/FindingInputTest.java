package com.leakscope.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class FindingInputTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void json_isNormalizedWithDefaults() throws Exception {
        FindingInput in = om.readValue("""
                {"patternId":"aws-access-key","value":"AKIA1","severity":"CRITICAL",
                 "category":"secrets","confidence":1.7,"line":4,"extra":"ignored"}
                """, FindingInput.class);

        Finding f = in.toFinding().orElseThrow();

        assertThat(f.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(f.getCategory()).isEqualTo(Category.SECRETS);
        assertThat(f.getConfidence()).isEqualTo(1.0);
        assertThat(f.getFullMatch()).isEqualTo("AKIA1");
        assertThat(f.getLine()).isEqualTo(4);
        assertThat(f.getOccurrenceCount()).isEqualTo(1);
    }

    @Test
    void missingIdAndValue_cannotBeNormalized() {
        FindingInput in = new FindingInput();
        in.file = "a.txt";
        in.value = "  ";

        assertThat(in.toFinding()).isEmpty();
    }

    @Test
    void unknownSeverity_defaultsToMedium() {
        FindingInput in = new FindingInput();
        in.value = "v";
        in.severity = "extreme";

        assertThat(in.toFinding().orElseThrow().getSeverity()).isEqualTo(Severity.MEDIUM);
    }
}
