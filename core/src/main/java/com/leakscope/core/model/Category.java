package com.leakscope.core.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/** 패턴 분류 */
public enum Category {
    SECRETS, VULNERABILITIES, CONFIGURATIONS;

    public String id() { return name().toLowerCase(Locale.ROOT); }

    public static Set<Category> all() { return EnumSet.allOf(Category.class); }

    /** 대소문자 무시 파싱. 알 수 없는 값이면 null. */
    public static Category fromId(String s) {
        if (s == null) return null;
        String k = s.trim();
        for (Category c : values()) {
            if (c.name().equalsIgnoreCase(k)) return c;
        }
        return null;
    }
}
