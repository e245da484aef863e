package com.tfigtfs.backend.service;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot barrier: closed until {@link #open()} is first called, then open
 * forever. Opening is idempotent and wakes every waiter.
 */
@Slf4j
public class ReadinessGate {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void open() {
        if (latch.getCount() > 0) {
            latch.countDown();
            log.info("🟢 Readiness gate opened");
        }
    }

    public boolean isReady() {
        return latch.getCount() == 0;
    }

    /**
     * Blocks until the gate opens or the timeout elapses; a zero timeout only
     * checks. Returns whether the gate is open.
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(Math.max(timeout.toMillis(), 0), TimeUnit.MILLISECONDS);
    }

    /**
     * Blocks until the gate opens.
     */
    public void await() throws InterruptedException {
        latch.await();
    }
}
