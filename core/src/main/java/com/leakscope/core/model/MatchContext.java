package com.leakscope.core.model;

/** 매치 주변 문맥. full = before + 매치 + after (윈도우 범위). */
public record MatchContext(String before, String after, String full) {
    public static final MatchContext EMPTY = new MatchContext("", "", "");

    public MatchContext {
        before = (before == null ? "" : before);
        after = (after == null ? "" : after);
        full = (full == null ? "" : full);
    }

    /** before + after 길이 (문맥 풍부도) */
    public int surroundingLength() { return before.length() + after.length(); }
}
