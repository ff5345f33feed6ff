package com.leakscope.core.error;

/** 패턴 등록 시 정의가 잘못됨. 시작 시점 치명 오류로 호출자에게 전파된다. */
public class PatternValidationException extends DetectionException {
    private final String patternId;

    public PatternValidationException(String patternId, String message) {
        super(patternId == null ? message : "pattern '" + patternId + "': " + message);
        this.patternId = patternId;
    }

    public PatternValidationException(String patternId, String message, Throwable cause) {
        super(patternId == null ? message : "pattern '" + patternId + "': " + message, cause);
        this.patternId = patternId;
    }

    /** 식별 가능한 경우의 패턴 id (없으면 null) */
    public String getPatternId() { return patternId; }
}
