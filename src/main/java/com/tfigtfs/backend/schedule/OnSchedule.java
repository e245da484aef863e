package com.tfigtfs.backend.schedule;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs a task every {@code period}, forever, on its own daemon thread, starting
 * as soon as it is constructed.
 * <p>
 * Invocations never overlap. A failing invocation is logged and the loop carries
 * on, even when the task throws an {@link Error}. {@link #stop()} is observed at the next sleep boundary; an invocation that
 * is already running always completes. Without an explicit {@link Sleeper} the
 * loop sleeps on a stop signal, so a stopped schedule wakes up and exits at once.
 */
@Slf4j
public class OnSchedule {

    @Getter
    private final String name;
    @Getter
    private final Duration period;

    private final Runnable target;
    private final Sleeper sleeper;
    private final Thread thread;
    private final AtomicLong runCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    private volatile boolean stopped;

    public OnSchedule(String name, Runnable target, Duration period, boolean runAtStart) {
        this(name, target, period, runAtStart, null);
    }

    public OnSchedule(String name, Runnable target, Duration period, boolean runAtStart, Sleeper sleeper) {
        if (period == null || period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("Period must be positive: " + period);
        }
        this.name = name;
        this.target = target;
        this.period = period;
        this.sleeper = sleeper != null ? sleeper : this::awaitStop;

        this.thread = new Thread(() -> loop(runAtStart), name + "-schedule");
        this.thread.setDaemon(true);
        this.thread.start();
    }

    private void loop(boolean runAtStart) {
        boolean first = true;
        while (!stopped) {
            if (!(first && runAtStart)) {
                try {
                    sleeper.sleep(period);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.debug("{} schedule interrupted while sleeping", name);
                    break;
                }
                if (stopped) {
                    break;
                }
            }
            first = false;
            invoke();
        }
        log.debug("{} schedule stopped after {} runs", name, runCount.get());
    }

    private void invoke() {
        long startMillis = System.currentTimeMillis();
        try {
            target.run();
            log.debug("{} schedule ran in {}ms", name, System.currentTimeMillis() - startMillis);
        } catch (RuntimeException | Error e) {
            failureCount.incrementAndGet();
            log.error("❌ {} schedule: task failed after {}ms", name, System.currentTimeMillis() - startMillis, e);
        } finally {
            runCount.incrementAndGet();
        }
    }

    private void awaitStop(Duration duration) throws InterruptedException {
        stopSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Advisory: the loop exits at its next sleep boundary.
     */
    public void stop() {
        stopped = true;
        stopSignal.countDown();
    }

    public boolean isStopped() {
        return stopped;
    }

    public boolean isAlive() {
        return thread.isAlive();
    }

    public long runCount() {
        return runCount.get();
    }

    public long failureCount() {
        return failureCount.get();
    }

    /**
     * Waits for the loop thread to exit. Test and shutdown helper.
     */
    public boolean join(Duration timeout) throws InterruptedException {
        thread.join(Math.max(timeout.toMillis(), 1));
        return !thread.isAlive();
    }
}
