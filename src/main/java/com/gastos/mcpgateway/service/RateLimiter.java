package com.gastos.mcpgateway.service;

import com.gastos.mcpgateway.config.GwProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Per-client fixed-window rate limiter.
 *
 * Each client identifier (the caller's IP) owns a bucket counting points consumed in the
 * current window. The first request after a window has elapsed starts a fresh window.
 * Requests beyond maxPoints are rejected, never queued. Buckets are replaced atomically
 * through ConcurrentHashMap.compute, so concurrent requests from one client cannot overspend.
 */
@Service
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final Map<String, RateBucket> buckets = new ConcurrentHashMap<>();
    private final Duration window;
    private final int maxPoints;
    private final Clock clock;

    @Autowired
    public RateLimiter(GwProperties properties, Clock clock) {
        this(properties.getRateLimit().window(), properties.getRateLimit().getMaxRequests(), clock);
    }

    public RateLimiter(Duration window, int maxPoints, Clock clock) {
        if (window.isZero() || window.isNegative() || maxPoints < 1) {
            throw new IllegalArgumentException("Invalid rate limit: window=" + window + ", maxPoints=" + maxPoints);
        }
        this.window = window;
        this.maxPoints = maxPoints;
        this.clock = clock;
        log.info("RateLimiter initialized with window={}, maxPoints={}", window, maxPoints);
    }

    /**
     * Consume one point for the client.
     *
     * @param clientId client identifier, normally the remote IP
     * @return the decision; rejected decisions carry the time until the window resets
     */
    public RateLimitDecision consume(String clientId) {
        String key = clientId != null ? clientId : "unknown";
        Instant now = clock.instant();

        RateBucket bucket = buckets.compute(key, (id, existing) -> {
            if (existing == null || existing.windowEnded(now, window)) {
                return new RateBucket(now, 1, true);
            }
            if (existing.consumed() >= maxPoints) {
                return new RateBucket(existing.windowStart(), existing.consumed(), false);
            }
            return new RateBucket(existing.windowStart(), existing.consumed() + 1, true);
        });

        if (bucket.lastAllowed()) {
            return RateLimitDecision.allowed(maxPoints - bucket.consumed());
        }
        Duration retryAfter = Duration.between(now, bucket.windowStart().plus(window));
        log.debug("Rate limit exceeded for client {} (max={}, retryAfter={})", key, maxPoints, retryAfter);
        return RateLimitDecision.rejected(retryAfter);
    }

    /**
     * Drop buckets whose window has ended; their next request starts a new window anyway.
     *
     * @return number of buckets removed
     */
    public int evictIdle() {
        Instant now = clock.instant();
        int before = buckets.size();
        buckets.entrySet().removeIf(entry -> entry.getValue().windowEnded(now, window));
        int removed = Math.max(0, before - buckets.size());
        if (removed > 0) {
            log.debug("Evicted {} idle rate limit buckets", removed);
        }
        return removed;
    }

    public int bucketCount() {
        return buckets.size();
    }

    public Duration getWindow() {
        return window;
    }

    public int getMaxPoints() {
        return maxPoints;
    }

    /**
     * The result of a rate-limit check.
     *
     * @param allowed    true if the request may proceed
     * @param remaining  points left in the current window after this request
     * @param retryAfter time until the window resets; zero for allowed requests
     */
    public record RateLimitDecision(boolean allowed, int remaining, Duration retryAfter) {

        static RateLimitDecision allowed(int remaining) {
            return new RateLimitDecision(true, remaining, Duration.ZERO);
        }

        static RateLimitDecision rejected(Duration retryAfter) {
            return new RateLimitDecision(false, 0, retryAfter);
        }

        /**
         * Retry-After in whole seconds, rounded up and at least 1.
         */
        public long retryAfterSeconds() {
            long millis = retryAfter.toMillis();
            return Math.max(1, (millis + 999) / 1000);
        }
    }

    /**
     * Immutable bucket state; a new instance is installed on every consume.
     */
    private record RateBucket(Instant windowStart, int consumed, boolean lastAllowed) {

        boolean windowEnded(Instant now, Duration window) {
            return !now.isBefore(windowStart.plus(window));
        }
    }
}
