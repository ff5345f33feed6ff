package com.leakscope.core.util;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest {

    @Test
    void toJson_escapesAndAppendsBoundContext() {
        StructuredLog log = StructuredLog.get(StructuredLogTest.class).withContext("engine", "e1");

        String line = log.toJson(Level.INFO, "dedup-complete", null, "file", "a\"b\\c\n", "in", 3, "ok", true);

        assertThat(line).startsWith("{").endsWith("}");
        assertThat(line).contains("\"comp\":\"StructuredLogTest\"");
        assertThat(line).contains("\"event\":\"dedup-complete\"");
        assertThat(line).contains("\"engine\":\"e1\"");
        assertThat(line).contains("\"file\":\"a\\\"b\\\\c\\n\"");
        assertThat(line).contains("\"in\":3").contains("\"ok\":true");
    }

    @Test
    void toJson_marksOddKeyValueCount_andAddsThrowable() {
        StructuredLog log = StructuredLog.get(StructuredLogTest.class);

        String line = log.toJson(Level.WARNING, "x", new IllegalStateException("boom"), "dangling");

        assertThat(line).contains("\"_kv_mismatch\":true");
        assertThat(line).contains("\"error\":\"IllegalStateException\"").contains("\"message\":\"boom\"");
    }
}
