package com.leakscope.core.learning;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** 학습 데이터 파일 Import/Export (.json, ISO-8601 시각) */
public final class LearningDataIO {
    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public void exportToFile(LearningData data, Path file) throws IOException {
        if (data == null) throw new IllegalArgumentException("data is null");
        Objects.requireNonNull(file, "file");
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        om.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), data);
    }

    public LearningData importFromFile(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        LearningData d = om.readValue(file.toFile(), LearningData.class);
        if (d == null || !"1".equals(d.v)) {
            throw new IllegalArgumentException("Unsupported learning data version: " + (d == null ? null : d.v));
        }
        return d;
    }

    /** 스토어 전체를 파일로 */
    public void exportStore(FeedbackStore store, Path file) throws IOException {
        exportToFile(store.exportLearningData(), file);
    }

    /** 파일 내용을 스토어에 합친다 */
    public void importInto(FeedbackStore store, Path file) throws IOException {
        store.importLearningData(importFromFile(file));
    }
}
