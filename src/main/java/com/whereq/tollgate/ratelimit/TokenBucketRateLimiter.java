package com.whereq.tollgate.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-window token bucket.
 *
 * <p>Tokens are reset to {@code requestsPerMinute} once per 60-second window by
 * {@link #refillIfDue()}, which a background tick calls far more often than once a minute.
 * Bursts right after a window boundary are allowed. A token is taken when a job is dispatched;
 * a job that finds the bucket empty stays queued until a later drain tick after the refill.
 */
@Slf4j
public class TokenBucketRateLimiter {

    public static final Duration WINDOW = Duration.ofMinutes(1);

    private final int requestsPerMinute;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private int tokens;
    private long lastRefillMillis;

    public TokenBucketRateLimiter(int requestsPerMinute, Clock clock) {
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be positive: " + requestsPerMinute);
        }
        this.requestsPerMinute = requestsPerMinute;
        this.clock = clock;
        this.tokens = requestsPerMinute;
        this.lastRefillMillis = clock.millis();
    }

    /**
     * Take a token if one is available, without waiting
     */
    public boolean tryAcquire() {
        lock.lock();
        try {
            if (tokens > 0) {
                tokens--;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Give back a token taken for a dispatch that did not happen. Never exceeds the maximum.
     */
    public void refund() {
        lock.lock();
        try {
            if (tokens < requestsPerMinute) {
                tokens++;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reset tokens to the configured maximum if a full window has elapsed since the last refill
     *
     * @return true if the bucket was refilled
     */
    public boolean refillIfDue() {
        lock.lock();
        try {
            long now = clock.millis();
            if (now - lastRefillMillis < WINDOW.toMillis()) {
                return false;
            }
            tokens = requestsPerMinute;
            lastRefillMillis = now;
            log.debug("Rate limiter refilled to {} tokens", requestsPerMinute);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean hasToken() {
        return availableTokens() > 0;
    }

    public int availableTokens() {
        lock.lock();
        try {
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    public int getRequestsPerMinute() {
        return requestsPerMinute;
    }
}
