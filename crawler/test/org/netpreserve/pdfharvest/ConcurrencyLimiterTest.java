package org.netpreserve.pdfharvest;

import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencyLimiterTest {
    @Test
    void permitsAreCountedAndReleased() throws Exception {
        var limiter = new ConcurrencyLimiter(2);
        try (var a = limiter.acquire(); var b = limiter.acquire()) {
            assertEquals(2, limiter.inFlight());
            assertEquals(0, limiter.available());
        }
        assertEquals(2, limiter.available());
    }

    @Test
    void closingAPermitTwiceReleasesOnce() throws Exception {
        var limiter = new ConcurrencyLimiter(1);
        var permit = limiter.acquire();
        permit.close();
        permit.close();
        assertEquals(1, limiter.available());
    }

    @Test
    void acquireBlocksAtCapacity() throws Exception {
        var limiter = new ConcurrencyLimiter(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            var held = limiter.acquire();
            Future<?> waiter = executor.submit(() -> {
                try (var permit = limiter.acquire()) {
                    return permit;
                }
            });
            assertThrows(TimeoutException.class, () -> waiter.get(200, TimeUnit.MILLISECONDS));
            held.close();
            waiter.get(5, TimeUnit.SECONDS);
            assertEquals(1, limiter.available());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void permitIsReleasedWhenWorkThrows() throws Exception {
        var limiter = new ConcurrencyLimiter(1);
        assertThrows(IllegalStateException.class, () -> {
            try (var permit = limiter.acquire()) {
                throw new IllegalStateException("boom");
            }
        });
        assertEquals(1, limiter.available());
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new ConcurrencyLimiter(0));
    }
}
