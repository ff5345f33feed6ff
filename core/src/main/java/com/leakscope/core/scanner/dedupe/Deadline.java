package com.leakscope.core.scanner.dedupe;

import com.leakscope.core.error.ResourceLimitException;
import com.leakscope.core.util.MillisClock;

import java.util.Objects;

/** 병합 루프가 항목 사이사이에 확인하는 소프트 타임아웃. */
public final class Deadline {
    private final MillisClock clock;
    private final long startedAt;
    private final long budgetMs;

    public Deadline(MillisClock clock, long budgetMs) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startedAt = clock.nowMillis();
        this.budgetMs = budgetMs;
    }

    /** 예산 없음 (테스트/직접 호출용) */
    public static Deadline none() {
        return new Deadline(MillisClock.SYSTEM, Long.MAX_VALUE);
    }

    public long elapsedMs() { return clock.nowMillis() - startedAt; }

    /** @throws ResourceLimitException 예산 초과 시 */
    public void check() {
        long elapsed = elapsedMs();
        if (elapsed > budgetMs) {
            throw new ResourceLimitException(ResourceLimitException.Kind.TIMEOUT,
                    "deduplication timeout after " + elapsed + "ms (budget " + budgetMs + "ms)");
        }
    }
}
