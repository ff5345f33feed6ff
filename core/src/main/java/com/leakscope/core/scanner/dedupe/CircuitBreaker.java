package com.leakscope.core.scanner.dedupe;

import com.leakscope.core.util.MillisClock;
import com.leakscope.core.util.StructuredLog;

import java.util.Objects;

/**
 * 병합 루틴용 서킷 브레이커.
 *
 * CLOSED --(연속 실패 threshold 회)--> OPEN --(resetTimeout 경과 후 다음 호출)--> HALF_OPEN
 * HALF_OPEN: 시험 호출 1건만 통과. 성공 → CLOSED(failureCount=0), 실패 → OPEN 재진입.
 * OPEN 상태에서 거절된 호출은 실패로 세지 않는다.
 */
public final class CircuitBreaker {
    private static final StructuredLog SLOG = StructuredLog.get(CircuitBreaker.class);

    public enum State { CLOSED, OPEN, HALF_OPEN }

    private final int threshold;
    private final long resetTimeoutMs;
    private final boolean enabled;
    private final MillisClock clock;

    private State state = State.CLOSED;
    private int failureCount;
    private long lastFailureTime;
    private long nextAttemptTime;
    private boolean trialInFlight;

    public CircuitBreaker(int threshold, long resetTimeoutMs, boolean enabled, MillisClock clock) {
        this.threshold = Math.max(1, threshold);
        this.resetTimeoutMs = Math.max(0, resetTimeoutMs);
        this.enabled = enabled;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** 호출 허용 여부. OPEN 이 만료됐으면 여기서 HALF_OPEN 으로 바뀐다. */
    public synchronized boolean tryAcquire() {
        if (!enabled) return true;
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (clock.nowMillis() < nextAttemptTime) return false;
                state = State.HALF_OPEN;
                trialInFlight = true;
                SLOG.info("circuit-half-open", "failureCount", failureCount);
                return true;
            case HALF_OPEN:
            default:
                if (trialInFlight) return false;
                trialInFlight = true;
                return true;
        }
    }

    public synchronized void recordSuccess() {
        if (!enabled) return;
        State prev = state;
        state = State.CLOSED;
        failureCount = 0;
        trialInFlight = false;
        if (prev != State.CLOSED) SLOG.info("circuit-closed", "from", prev.name());
    }

    public synchronized void recordFailure() {
        if (!enabled) return;
        long now = clock.nowMillis();
        failureCount++;
        lastFailureTime = now;
        if (state == State.HALF_OPEN || (state == State.CLOSED && failureCount >= threshold)) {
            open(now);
        }
    }

    private void open(long now) {
        State prev = state;
        state = State.OPEN;
        trialInFlight = false;
        nextAttemptTime = now + resetTimeoutMs;
        SLOG.warn("circuit-opened", "from", prev.name(), "failureCount", failureCount,
                "threshold", threshold, "nextAttemptTime", nextAttemptTime);
    }

    public synchronized State state() { return state; }

    public synchronized void reset() {
        state = State.CLOSED;
        failureCount = 0;
        lastFailureTime = 0;
        nextAttemptTime = 0;
        trialInFlight = false;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(state, failureCount, lastFailureTime, nextAttemptTime, threshold, enabled);
    }

    /** 불변 스냅샷 */
    public record Snapshot(State state, int failureCount, long lastFailureTime,
                           long nextAttemptTime, int threshold, boolean enabled) {}
}
