package com.leakscope.core.model;

import com.leakscope.core.pattern.PatternCatalog;
import com.leakscope.core.scanner.ContentScanner;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class ScanOptionsTest {

    @Test
    void setters_clampOutOfRangeValues() {
        ScanOptions o = ScanOptions.defaults()
                .setConfidenceThreshold(1.7)
                .setMaxMatches(0)
                .setContextWindow(-5)
                .setCategories(Set.of());

        assertThat(o.getConfidenceThreshold()).isEqualTo(1.0);
        assertThat(o.getMaxMatches()).isEqualTo(1);
        assertThat(o.getContextWindow()).isZero();
        assertThat(o.getCategories()).isEqualTo(Category.all());
        o.validate();
    }

    @Test
    void nanThreshold_isRejected() {
        ScanOptions o = ScanOptions.defaults().setConfidenceThreshold(Double.NaN);

        assertThatThrownBy(o::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("confidenceThreshold");
    }

    @Test
    void scanner_rejectsNanThreshold() {
        ContentScanner scanner = new ContentScanner(PatternCatalog.defaultRegistry());
        ScanOptions o = ScanOptions.defaults().setConfidenceThreshold(Double.NaN);

        assertThatThrownBy(() -> scanner.scanContent("password = \"hunter2hunter2\"", o))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
