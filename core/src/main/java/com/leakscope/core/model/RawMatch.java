package com.leakscope.core.model;

import java.util.List;

/**
 * 점수 계산 전의 단일 정규식 매치.
 * index/length 는 전체 매치 기준이며 value 는 extractGroup 적용 결과.
 */
public record RawMatch(String value,
                       String fullMatch,
                       int index,
                       int length,
                       MatchContext context,
                       List<String> groups) {

    public RawMatch {
        value = (value == null ? "" : value);
        fullMatch = (fullMatch == null ? "" : fullMatch);
        context = (context == null ? MatchContext.EMPTY : context);
        groups = (groups == null ? List.of() : List.copyOf(groups));
    }

    public int end() { return index + length; }
}
