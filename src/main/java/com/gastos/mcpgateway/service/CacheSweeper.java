package com.gastos.mcpgateway.service;

import com.gastos.mcpgateway.config.GwProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

/**
 * Periodically drops expired credentials and idle rate-limit buckets.
 * Only bounds memory; reads already ignore expired entries.
 */
@Service
public class CacheSweeper {
    private static final Logger log = LoggerFactory.getLogger(CacheSweeper.class);

    private final CredentialCache cache;
    private final RateLimiter rateLimiter;
    private final Duration interval;

    private Disposable subscription;

    public CacheSweeper(CredentialCache cache, RateLimiter rateLimiter, GwProperties properties) {
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.interval = properties.getCache().sweepInterval();
    }

    @PostConstruct
    public void start() {
        subscription = Flux.interval(interval, interval, Schedulers.boundedElastic())
                .subscribe(tick -> sweepOnce(),
                        error -> log.error("Cache sweeper stopped: {}", error.getMessage(), error));
        log.info("CacheSweeper started with interval={}", interval);
    }

    @PreDestroy
    public void stop() {
        if (subscription != null && !subscription.isDisposed()) {
            subscription.dispose();
            log.info("CacheSweeper stopped");
        }
    }

    /**
     * One sweep pass; safe to call at any time.
     */
    public void sweepOnce() {
        try {
            int expired = cache.sweep();
            int buckets = rateLimiter.evictIdle();
            if (expired > 0 || buckets > 0) {
                log.info("Sweep removed {} expired credentials and {} idle rate-limit buckets", expired, buckets);
            }
        } catch (RuntimeException e) {
            // keep the interval alive for the next tick
            log.error("Sweep failed: {}", e.getMessage(), e);
        }
    }

    Duration getInterval() {
        return interval;
    }

    boolean isRunning() {
        return subscription != null && !subscription.isDisposed();
    }
}
