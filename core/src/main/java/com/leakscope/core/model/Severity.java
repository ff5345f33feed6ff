package com.leakscope.core.model;

import java.util.Locale;

/** 심각도. 선언 순서 = 순위(LOW 1 .. CRITICAL 4). */
public enum Severity {
    LOW, MEDIUM, HIGH, CRITICAL;

    /** 1..4 */
    public int rank() { return ordinal() + 1; }

    /** 소문자 식별자 (YAML/JSON 표기) */
    public String id() { return name().toLowerCase(Locale.ROOT); }

    /** 더 심각한 쪽. null은 무시한다. */
    public static Severity max(Severity a, Severity b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.rank() >= b.rank() ? a : b;
    }

    /** 대소문자 무시 파싱. 알 수 없는 값이면 null. */
    public static Severity fromId(String s) {
        if (s == null) return null;
        String k = s.trim();
        for (Severity v : values()) {
            if (v.name().equalsIgnoreCase(k)) return v;
        }
        return null;
    }
}
