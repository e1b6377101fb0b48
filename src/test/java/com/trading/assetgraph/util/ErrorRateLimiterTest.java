package com.trading.assetgraph.util;

import org.apache.logging.log4j.LogManager;
import org.junit.Test;
import static org.junit.Assert.*;

public class ErrorRateLimiterTest {

    private static ErrorRateLimiter limiter(long intervalMillis) {
        return new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), intervalMillis);
    }

    @Test
    public void testFirstFailureLogsThenThrottles() {
        ErrorRateLimiter limiter = limiter(60_000);
        assertTrue(limiter.record("GET /api/metrics", "boom", new RuntimeException("first")));
        assertFalse(limiter.record("GET /api/metrics", "boom", new RuntimeException("second")));
        assertFalse(limiter.record("GET /api/metrics", "boom", null));
        assertEquals(2, limiter.suppressedCount("GET /api/metrics"));
    }

    @Test
    public void testKeysThrottleIndependently() {
        ErrorRateLimiter limiter = limiter(60_000);
        assertTrue(limiter.record("GET /api/metrics", "boom", null));
        assertTrue(limiter.record("GET /api/visualization", "boom", null));
        assertFalse(limiter.record("GET /api/metrics", "boom", null));
        assertEquals(1, limiter.suppressedCount("GET /api/metrics"));
        assertEquals(0, limiter.suppressedCount("GET /api/visualization"));
        assertEquals(0, limiter.suppressedCount("GET /unknown"));
    }

    @Test
    public void testSuppressedCountResetsWhenWritten() throws InterruptedException {
        ErrorRateLimiter limiter = limiter(200);
        assertTrue(limiter.record("k", "boom", null));
        assertFalse(limiter.record("k", "boom", null));
        Thread.sleep(300);
        assertTrue(limiter.record("k", "boom", null));
        assertEquals(0, limiter.suppressedCount("k"));
    }
}
