package com.leakscope.core.error;

/** 시간/메모리 예산 초과. 하드 실패가 아니라 fallback(performance_limit) 사유. */
public class ResourceLimitException extends DetectionException {

    public enum Kind { TIMEOUT, MEMORY }

    private final Kind kind;

    public ResourceLimitException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
