package com.leakscope.core.config;

import com.leakscope.core.model.Category;
import com.leakscope.core.model.ScanOptions;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class DetectionConfigTest {

    @Test
    void setters_clampOutOfRangeCounts() {
        DetectionConfig cfg = DetectionConfig.defaults()
                .setMaxMatches(0)
                .setMaxMatchesPerPattern(-3)
                .setContextWindow(-1);
        cfg.getDedup().setMaxCacheSize(0).setCircuitBreakerThreshold(0).setMemoryLimitMB(0);

        assertThat(cfg.getMaxMatches()).isEqualTo(1);
        assertThat(cfg.getMaxMatchesPerPattern()).isEqualTo(1);
        assertThat(cfg.getContextWindow()).isZero();
        assertThat(cfg.getDedup().getMaxCacheSize()).isEqualTo(1);
        assertThat(cfg.getDedup().getCircuitBreakerThreshold()).isEqualTo(1);
        assertThat(cfg.getDedup().getMemoryLimitMB()).isEqualTo(1);
        assertThatCode(cfg::validate).doesNotThrowAnyException();
    }

    @Test
    void validate_rejectsNaNThreshold() {
        DetectionConfig cfg = DetectionConfig.defaults().setConfidenceThreshold(Double.NaN);

        assertThatThrownBy(cfg::validate).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyCategorySet_isIgnored() {
        DetectionConfig cfg = DetectionConfig.defaults().setCategories(Set.of());

        assertThat(cfg.getCategories()).hasSize(3);
    }

    @Test
    void toScanOptions_copiesScanFields() {
        DetectionConfig cfg = DetectionConfig.defaults()
                .setConfidenceThreshold(0.65)
                .setMaxMatches(7)
                .setMaxMatchesPerPattern(3)
                .setContextWindow(12)
                .setEnableDeduplication(false)
                .setCategories(EnumSet.of(Category.VULNERABILITIES));

        ScanOptions o = cfg.toScanOptions();

        assertThat(o.getConfidenceThreshold()).isEqualTo(0.65);
        assertThat(o.getMaxMatches()).isEqualTo(7);
        assertThat(o.getMaxMatchesPerPattern()).isEqualTo(3);
        assertThat(o.getContextWindow()).isEqualTo(12);
        assertThat(o.isEnableDeduplication()).isFalse();
        assertThat(o.getCategories()).containsExactly(Category.VULNERABILITIES);
    }
}
