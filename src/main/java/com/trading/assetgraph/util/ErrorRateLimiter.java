package com.trading.assetgraph.util;

import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Throttles error logging per failure key, typically an HTTP route. Each key
 * is written at most once per interval; failures in between are counted and
 * reported with the next line written for that key.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long intervalNanos;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    public ErrorRateLimiter(Logger logger, long intervalMillis) {
        this.logger = logger;
        this.intervalNanos = intervalMillis * 1_000_000;
    }

    /**
     * Records a failure for {@code key} and logs it unless the key already
     * logged within the interval.
     *
     * @return true if a log line was written.
     */
    public boolean record(String key, String message, Throwable t) {
        Window w = windows.computeIfAbsent(key, k -> new Window());
        long suppressed;
        synchronized (w) {
            long now = System.nanoTime();
            if (w.written && now - w.lastWrite <= intervalNanos) {
                w.suppressed++;
                return false;
            }
            suppressed = w.suppressed;
            w.suppressed = 0;
            w.lastWrite = now;
            w.written = true;
        }
        if (suppressed > 0)
            logger.error("{} ({} similar failures suppressed)", message, suppressed, t);
        else
            logger.error(message, t);
        return true;
    }

    /** Failures for {@code key} held back since its last written line. */
    public long suppressedCount(String key) {
        Window w = windows.get(key);
        if (w == null)
            return 0;
        synchronized (w) {
            return w.suppressed;
        }
    }

    private static final class Window {
        boolean written;
        long lastWrite;
        long suppressed;
    }
}
