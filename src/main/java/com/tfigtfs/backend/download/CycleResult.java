package com.tfigtfs.backend.download;

import lombok.Value;

import java.time.Duration;

/**
 * Outcome of one fetch cycle and how long the agent should wait before the next.
 */
@Value
public class CycleResult {

    public enum Outcome {
        SUCCESS,
        FAILED,
        /** The ETag was unchanged, nothing was downloaded. */
        SKIPPED
    }

    Outcome outcome;
    Duration nextWait;

    public static CycleResult success(Duration nextWait) {
        return new CycleResult(Outcome.SUCCESS, nextWait);
    }

    public static CycleResult failed(Duration nextWait) {
        return new CycleResult(Outcome.FAILED, nextWait);
    }

    public static CycleResult skipped(Duration nextWait) {
        return new CycleResult(Outcome.SKIPPED, nextWait);
    }

    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }
}
