package com.leakscope.core.util;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/** 문자열 통계/정규화 유틸 */
public final class TextUtil {
    private TextUtil() {}

    /** Shannon 엔트로피(bit/문자). 빈 문자열은 0. */
    public static double shannonEntropy(String s) {
        if (s == null || s.isEmpty()) return 0.0;
        Map<Integer, Integer> freq = new HashMap<>();
        int n = 0;
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            freq.merge(cp, 1, Integer::sum);
            i += Character.charCount(cp);
            n++;
        }
        double h = 0.0;
        for (int c : freq.values()) {
            double p = (double) c / n;
            h -= p * (Math.log(p) / Math.log(2));
        }
        return h;
    }

    /** trim + 소문자. null → "" */
    public static String normalizeValue(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isBlank(String s) { return s == null || s.isBlank(); }
}
