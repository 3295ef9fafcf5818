package com.gridcalc.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of warning logs so a formula that fails on every pass (or a
 * broken range feeding many cells) does not flood the log. Messages dropped
 * inside the interval are counted and reported with the next one.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime;
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
        this.lastLogTime = new AtomicLong(System.nanoTime() - minIntervalNanos - 1);
    }

    /** Logs at warn unless another message was logged within the interval. */
    public void log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (now - last > minIntervalNanos && lastLogTime.compareAndSet(last, now)) {
            long dropped = suppressed.getAndSet(0);
            if (dropped > 0)
                logger.warn("{} ({} similar messages suppressed)", message, dropped);
            else
                logger.warn(message);
            logger.debug("Cause", t);
        } else {
            suppressed.incrementAndGet();
        }
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
