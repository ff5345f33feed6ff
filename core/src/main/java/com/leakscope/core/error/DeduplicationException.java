package com.leakscope.core.error;

/** 병합 루틴 내부 오류. fallback + 서킷 실패 1회로 처리된다. */
public class DeduplicationException extends DetectionException {
    public DeduplicationException(String message) { super(message); }
    public DeduplicationException(String message, Throwable cause) { super(message, cause); }
}
