package io.terraform.tfe.internal;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Token bucket shared by every request of one client. It starts unlimited; {@link #configure(String)} applies a
 * server-advertised limit, split into a sustained rate of two thirds and a burst of one third so a client can spend
 * part of its allowance at once and then settles below the server's limit.
 */
public final class RateLimiter {

    private static final double RATE_SHARE = 0.66;
    private static final double BURST_SHARE = 0.33;

    private final ReentrantLock lock = new ReentrantLock();
    private final LongSupplier nanoClock;

    private double ratePerSecond = Double.POSITIVE_INFINITY;
    private int burst;
    private double tokens;
    private long lastRefill;

    public RateLimiter() {
        this(System::nanoTime);
    }

    RateLimiter(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
        this.lastRefill = nanoClock.getAsLong();
    }

    /**
     * Reconfigures the limiter from a raw {@code X-RateLimit-Limit} value. Blank, non-numeric and non-positive values
     * disable limiting.
     */
    public void configure(String rawLimit) {
        double limit = 0;
        if (rawLimit != null && !rawLimit.isBlank()) {
            try {
                limit = Double.parseDouble(rawLimit.trim());
            } catch (NumberFormatException ex) {
                limit = 0;
            }
        }
        if (limit > 0) {
            configure(limit * RATE_SHARE, Math.max(1, (int) (limit * BURST_SHARE)));
        } else {
            configure(Double.POSITIVE_INFINITY, 0);
        }
    }

    public void configure(double ratePerSecond, int burst) {
        lock.lock();
        try {
            this.ratePerSecond = ratePerSecond;
            this.burst = burst;
            this.tokens = burst;
            this.lastRefill = nanoClock.getAsLong();
        } finally {
            lock.unlock();
        }
    }

    public boolean isUnlimited() {
        lock.lock();
        try {
            return Double.isInfinite(ratePerSecond);
        } finally {
            lock.unlock();
        }
    }

    public double ratePerSecond() {
        lock.lock();
        try {
            return ratePerSecond;
        } finally {
            lock.unlock();
        }
    }

    public int burst() {
        lock.lock();
        try {
            return burst;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes a permit if one is available right now.
     */
    public boolean tryAcquire() {
        return reserve() == 0L;
    }

    /**
     * Blocks until a permit is available.
     *
     * @throws InterruptedException when the calling thread is interrupted while waiting.
     */
    public void acquire() throws InterruptedException {
        while (true) {
            if (Thread.interrupted()) {
                throw new InterruptedException("rate limiter wait interrupted");
            }
            long waitNanos = reserve();
            if (waitNanos == 0L) {
                return;
            }
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
    }

    /**
     * Consumes a token and returns 0, or returns the nanoseconds until the next token without consuming one.
     */
    private long reserve() {
        lock.lock();
        try {
            if (Double.isInfinite(ratePerSecond)) {
                return 0L;
            }
            long now = nanoClock.getAsLong();
            double elapsedSeconds = (now - lastRefill) / 1e9;
            tokens = Math.min(burst, tokens + elapsedSeconds * ratePerSecond);
            lastRefill = now;
            if (tokens >= 1) {
                tokens -= 1;
                return 0L;
            }
            return Math.max(1L, (long) (((1 - tokens) / ratePerSecond) * 1e9));
        } finally {
            lock.unlock();
        }
    }
}
