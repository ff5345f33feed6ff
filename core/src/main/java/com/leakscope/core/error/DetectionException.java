package com.leakscope.core.error;

/** 탐지 코어 예외의 공통 상위 타입 (unchecked). */
public class DetectionException extends RuntimeException {
    public DetectionException(String message) { super(message); }
    public DetectionException(String message, Throwable cause) { super(message, cause); }
}
