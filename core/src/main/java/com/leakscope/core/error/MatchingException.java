package com.leakscope.core.error;

/** 정규식 평가 중 이상. ContentScanner 가 패턴 단위로 잡고 스캔은 계속한다. */
public class MatchingException extends DetectionException {
    private final String patternId;

    public MatchingException(String patternId, String message, Throwable cause) {
        super(message, cause);
        this.patternId = patternId;
    }

    public String getPatternId() { return patternId; }
}
