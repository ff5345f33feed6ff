package com.leakscope.core.pattern;

import java.util.Objects;
import java.util.regex.Pattern;

/** 추출된 값이 형식상 유효한지 판단하는 술어. 예외를 던지면 "검증 실패"로 취급된다. */
@FunctionalInterface
public interface ValueValidator {

    boolean validate(String value);

    /** 값 전체가 정규식과 일치하면 true (YAML 카탈로그용) */
    static ValueValidator matching(String regex) {
        Pattern p = Pattern.compile(Objects.requireNonNull(regex, "regex"));
        return v -> v != null && p.matcher(v).matches();
    }
}
