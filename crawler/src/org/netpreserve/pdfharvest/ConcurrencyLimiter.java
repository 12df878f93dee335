package org.netpreserve.pdfharvest;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounds how many pages are rendered at once.
 */
public class ConcurrencyLimiter {
    private final Semaphore semaphore;
    private final int capacity;

    public ConcurrencyLimiter(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be at least 1");
        this.capacity = capacity;
        this.semaphore = new Semaphore(capacity, true);
    }

    /**
     * Blocks until a slot is free. Close the returned permit to give the slot back.
     */
    public Permit acquire() throws InterruptedException {
        semaphore.acquire();
        return new Permit();
    }

    public void release() {
        semaphore.release();
    }

    public int available() {
        return semaphore.availablePermits();
    }

    public int inFlight() {
        return capacity - semaphore.availablePermits();
    }

    public int capacity() {
        return capacity;
    }

    public class Permit implements AutoCloseable {
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                release();
            }
        }
    }
}
