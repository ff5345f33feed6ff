package com.leakscope.core.config;

import com.leakscope.core.model.Category;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class YamlConfigLoaderTest {

    @TempDir
    Path tmp;

    private Path write(String yaml) throws IOException {
        Path p = tmp.resolve("leakscope.yml");
        Files.writeString(p, yaml, StandardCharsets.UTF_8);
        return p;
    }

    @Test
    void loadDefault_readsBundledDefaults() throws Exception {
        DetectionConfig cfg = YamlConfigLoader.loadDefault();

        assertThat(cfg.getConfidenceThreshold()).isEqualTo(0.5);
        assertThat(cfg.getMaxMatches()).isEqualTo(100);
        assertThat(cfg.getMaxMatchesPerPattern()).isEqualTo(20);
        assertThat(cfg.getContextWindow()).isEqualTo(50);
        assertThat(cfg.getCategories()).containsExactlyInAnyOrder(Category.values());
        assertThat(cfg.getDedup().getMaxCacheSize()).isEqualTo(1000);
        assertThat(cfg.getDedup().getMaxDeduplicationTimeMs()).isEqualTo(30_000L);
        assertThat(cfg.getDedup().getCircuitBreakerThreshold()).isEqualTo(3);
        assertThat(cfg.getDedup().getCircuitBreakerResetTimeMs()).isEqualTo(60_000L);
    }

    @Test
    void load_overridesOnlyGivenKeys() throws Exception {
        DetectionConfig cfg = YamlConfigLoader.load(write("""
                confidenceThreshold: 0.7
                maxMatches: "25"
                contextAnalysisEnabled: false
                categories: "secrets, configurations"
                dedup:
                  maxCacheSize: 10
                  enableCircuitBreaker: false
                  memoryLimitMB: 64
                """));

        assertThat(cfg.getConfidenceThreshold()).isEqualTo(0.7);
        assertThat(cfg.getMaxMatches()).isEqualTo(25);
        assertThat(cfg.getMaxMatchesPerPattern()).isEqualTo(20);
        assertThat(cfg.isContextAnalysisEnabled()).isFalse();
        assertThat(cfg.getCategories()).containsExactlyInAnyOrder(Category.SECRETS, Category.CONFIGURATIONS);
        assertThat(cfg.getDedup().getMaxCacheSize()).isEqualTo(10);
        assertThat(cfg.getDedup().isEnableCircuitBreaker()).isFalse();
        assertThat(cfg.getDedup().memoryLimitBytes()).isEqualTo(64L * 1024 * 1024);
        assertThat(cfg.getDedup().isEnableFileLevel()).isTrue();
    }

    @Test
    void load_unknownCategoryNames_keepDefaults() throws Exception {
        DetectionConfig cfg = YamlConfigLoader.load(write("categories: [bogus, nope]\n"));

        assertThat(cfg.getCategories()).hasSize(3);
    }

    @Test
    void load_rejectsThresholdOutsideUnitInterval() {
        assertThatThrownBy(() -> YamlConfigLoader.load(write("confidenceThreshold: 1.5\n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("confidenceThreshold");
    }

    @Test
    void load_missingFile_throwsIOException() {
        assertThatThrownBy(() -> YamlConfigLoader.load(tmp.resolve("absent.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void load_emptyFile_givesDefaults() throws Exception {
        DetectionConfig cfg = YamlConfigLoader.load(write(""));

        assertThat(cfg.getConfidenceThreshold()).isEqualTo(0.5);
        assertThat(cfg.getDedup().isEnableScanLevel()).isTrue();
    }
}
