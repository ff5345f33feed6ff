package com.leakscope.core.scanner.dedupe;

import com.leakscope.core.model.Finding;
import com.leakscope.core.util.TextUtil;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * 발견 항목 지문: sha256hex(patternId | 정규화 경로 | 정규화 값).
 * 경로 표기(./, \, 중복 슬래시, 대소문자)가 달라도 같은 지문이 나온다.
 */
public final class FingerprintGenerator {
    static final String UNKNOWN_PATTERN = "unknown";

    private FingerprintGenerator() {}

    public static String fingerprint(String patternId, String filePath, String value) {
        String pid = TextUtil.isBlank(patternId) ? UNKNOWN_PATTERN : patternId.trim();
        String key = pid + "|" + normalizePath(filePath) + "|" + TextUtil.normalizeValue(value);
        return sha256Hex(key);
    }

    /** 항목의 file 이 비어 있으면 defaultFile 기준 */
    public static String of(Finding f, String defaultFile) {
        String file = TextUtil.isBlank(f.getFile()) ? defaultFile : f.getFile();
        return fingerprint(f.getPatternId(), file, f.getValue());
    }

    /** 역슬래시 → '/', 중복 '/' 축약, 앞쪽 "./" 와 앞뒤 '/' 제거, 소문자 */
    public static String normalizePath(String path) {
        if (path == null) return "";
        String p = path.trim().replace('\\', '/').replaceAll("/{2,}", "/");
        while (p.startsWith("./")) p = p.substring(2);
        while (p.startsWith("/")) p = p.substring(1);
        while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
        return p.toLowerCase(Locale.ROOT);
    }

    private static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // 모든 JRE 필수 알고리즘
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
