package com.phillippitts.uptimemonitor.service.scheduler;

import java.util.concurrent.Semaphore;

/**
 * Global cap on probes running at the same time across all monitors.
 *
 * <p>A limit of 0 disables the cap. Otherwise a cycle blocks in {@link #acquire()} until a permit is
 * free, which delays that monitor's check instead of skipping it.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * guard.acquire();
 * try {
 *     // ... run probe ...
 * } finally {
 *     guard.release();
 * }
 * }</pre>
 */
public final class CheckConcurrencyGuard {

    private final Semaphore semaphore;
    private final int limit;

    /**
     * @param limit maximum concurrent probes, 0 for unlimited
     */
    public CheckConcurrencyGuard(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Concurrency limit must not be negative: " + limit);
        }
        this.limit = limit;
        this.semaphore = limit == 0 ? null : new Semaphore(limit, true);
    }

    public static CheckConcurrencyGuard unlimited() {
        return new CheckConcurrencyGuard(0);
    }

    /**
     * Waits for a permit.
     *
     * @throws InterruptedException if interrupted while waiting; no permit is held then
     */
    public void acquire() throws InterruptedException {
        if (semaphore != null) {
            semaphore.acquire();
        }
    }

    /** Releases a permit taken by {@link #acquire()}. Call from a finally block. */
    public void release() {
        if (semaphore != null) {
            semaphore.release();
        }
    }

    public boolean isLimited() {
        return semaphore != null;
    }

    public int getLimit() {
        return limit;
    }

    /**
     * @return permits currently available, {@link Integer#MAX_VALUE} when unlimited
     */
    public int availablePermits() {
        return semaphore == null ? Integer.MAX_VALUE : semaphore.availablePermits();
    }
}
