package com.leakscope.core.learning;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class LearningDataIOTest {

    @TempDir
    Path tmp;

    private final LearningDataIO io = new LearningDataIO();

    @Test
    void exportImport_roundTripsThroughJsonFile() throws Exception {
        FeedbackStore store = new FeedbackStore();
        store.recordFeedback("stripe-secret-key", "sk_live_abc", true, Map.of("reviewer", "alice"));
        store.recordFeedback("stripe-secret-key", "sk_live_abc", true, Map.of());
        Path file = tmp.resolve("nested/learning.json");

        io.exportStore(store, file);
        String json = Files.readString(file, StandardCharsets.UTF_8);
        assertThat(json).contains("\"v\" : \"1\"").contains("sk_live_abc").doesNotContain("\"timestamp\" : 1");

        FeedbackStore restored = new FeedbackStore();
        io.importInto(restored, file);

        assertThat(restored.adjustment("stripe-secret-key", "SK_LIVE_ABC")).isCloseTo(-0.35, within(1e-9));
        LearningData.Entry e = restored.exportLearningData().feedbackData.values().iterator().next();
        assertThat(e.records).hasSize(2);
        assertThat(e.records.get(0).metadata()).containsEntry("reviewer", "alice");
    }

    @Test
    void import_rejectsUnknownVersion() throws Exception {
        Path file = tmp.resolve("future.json");
        Files.writeString(file, "{\"v\":\"2\",\"feedbackData\":{}}", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> io.importFromFile(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("version");
    }

    @Test
    void import_ignoresUnknownProperties() throws Exception {
        Path file = tmp.resolve("extra.json");
        Files.writeString(file, "{\"v\":\"1\",\"producer\":\"other-tool\",\"falsePositivePatterns\":[\"Dummy\"]}",
                StandardCharsets.UTF_8);

        LearningData d = io.importFromFile(file);

        assertThat(d.falsePositivePatterns).containsExactly("Dummy");
    }

    @Test
    void import_missingFile_throwsIOException() {
        assertThatThrownBy(() -> io.importFromFile(tmp.resolve("absent.json")))
                .isInstanceOf(IOException.class);
    }

    @Test
    void export_rejectsNullData() {
        assertThatThrownBy(() -> io.exportToFile(null, tmp.resolve("x.json")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
