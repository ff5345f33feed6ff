package com.leakscope.core.pattern;

import com.leakscope.core.model.RawMatch;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/** 후보 매치를 버릴지 판단. 하나라도 true 면 후보 폐기. */
@FunctionalInterface
public interface FalsePositiveFilter {

    boolean rejects(RawMatch match);

    /** 값 또는 전체 매치에서 정규식이 발견되면 폐기 */
    static FalsePositiveFilter regex(Pattern p) {
        Objects.requireNonNull(p, "pattern");
        return m -> p.matcher(m.value()).find() || p.matcher(m.fullMatch()).find();
    }

    /** 대소문자 무시 정규식 */
    static FalsePositiveFilter regex(String source) {
        return regex(Pattern.compile(Objects.requireNonNull(source, "source"), Pattern.CASE_INSENSITIVE));
    }

    /** 문맥(full)에 키워드가 있으면 폐기 (대소문자 무시) */
    static FalsePositiveFilter keyword(String keyword) {
        String k = Objects.requireNonNull(keyword, "keyword").toLowerCase(Locale.ROOT);
        return m -> m.context().full().toLowerCase(Locale.ROOT).contains(k);
    }
}
