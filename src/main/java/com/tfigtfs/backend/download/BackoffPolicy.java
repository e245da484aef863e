package com.tfigtfs.backend.download;

/**
 * Exponential backoff between failed fetches: 1, 2, 4 ... seconds, capped at the
 * ceiling. A rate-limited response jumps straight to the ceiling.
 */
public class BackoffPolicy {

    private final long maxWaitSeconds;

    private long errorWait;

    public BackoffPolicy(long maxWaitSeconds) {
        if (maxWaitSeconds < 1) {
            throw new IllegalArgumentException("Backoff ceiling must be at least 1 second: " + maxWaitSeconds);
        }
        this.maxWaitSeconds = maxWaitSeconds;
    }

    /**
     * Returns the wait for the failure that just happened and advances the state
     * for the next one.
     */
    public synchronized long nextWait(boolean rateLimited) {
        long wait = rateLimited ? maxWaitSeconds : Math.max(errorWait, 1);
        errorWait = Math.min(wait * 2, maxWaitSeconds);
        return wait;
    }

    public synchronized void reset() {
        errorWait = 0;
    }

    public synchronized long getErrorWait() {
        return errorWait;
    }

    public long getMaxWaitSeconds() {
        return maxWaitSeconds;
    }
}
