package com.leakscope.core.error;

/** 값 검증기(validator)가 예외를 던짐. 검증 실패로 취급되며 밖으로 나가지 않는다. */
public class ScoringException extends DetectionException {
    public ScoringException(String message, Throwable cause) { super(message, cause); }
}
