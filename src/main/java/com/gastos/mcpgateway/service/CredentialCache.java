package com.gastos.mcpgateway.service;

import com.gastos.mcpgateway.config.GwProperties;
import com.gastos.mcpgateway.model.AuthRecord;
import com.gastos.mcpgateway.model.Credential;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * In-process cache of validated credentials with TTL expiry.
 *
 * Expiry is evaluated on every read against the injected clock; sweep() only bounds memory
 * and is never required for correctness. Entries are replaced atomically per credential.
 */
@Service
public class CredentialCache {
    private static final Logger log = LoggerFactory.getLogger(CredentialCache.class);

    private final Map<Credential, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    @Autowired
    public CredentialCache(GwProperties properties, Clock clock) {
        this(properties.getCache().ttl(), clock);
    }

    public CredentialCache(Duration ttl, Clock clock) {
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must be positive: " + ttl);
        }
        this.ttl = ttl;
        this.clock = clock;
        log.info("CredentialCache initialized with ttl={}", ttl);
    }

    /**
     * Get a still-valid record for the credential.
     *
     * @return the record, or empty when absent or expired
     */
    public Optional<AuthRecord> get(Credential credential) {
        CacheEntry entry = entries.get(credential);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry, clock.instant())) {
            // Only drop the entry we looked at; a concurrent put may already have replaced it
            entries.remove(credential, entry);
            log.debug("Cache entry expired for credential {}", credential);
            return Optional.empty();
        }
        log.debug("Cache hit for credential {}", credential);
        return Optional.of(entry.record());
    }

    /**
     * Store or overwrite the record with insertedAt = now.
     */
    public void put(Credential credential, AuthRecord record) {
        entries.put(credential, new CacheEntry(copyOf(record), clock.instant()));
        log.debug("Cached credential {} for user {}", credential, record.userId());
    }

    /**
     * Remove the credential explicitly, e.g. after the backend reported it revoked.
     */
    public void invalidate(Credential credential) {
        CacheEntry removed = entries.remove(credential);
        if (removed != null) {
            log.info("Invalidated cached credential {} (user={})", credential, removed.record().userId());
        }
    }

    /**
     * Remove every entry whose age reached the TTL.
     *
     * @return number of entries removed
     */
    public int sweep() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<Map.Entry<Credential, CacheEntry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Credential, CacheEntry> current = it.next();
            if (isExpired(current.getValue(), now)
                    && entries.remove(current.getKey(), current.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired cache entries ({} remaining)", removed, entries.size());
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    public Duration getTtl() {
        return ttl;
    }

    private boolean isExpired(CacheEntry entry, Instant now) {
        return Duration.between(entry.insertedAt(), now).compareTo(ttl) >= 0;
    }

    private static AuthRecord copyOf(AuthRecord record) {
        return new AuthRecord(
                record.userId(),
                record.userAttributes(),
                record.keyId(),
                record.scopes(),
                record.rateLimitTier(),
                record.validatedAt()
        );
    }

    /**
     * Cached record with its insertion time.
     */
    record CacheEntry(AuthRecord record, Instant insertedAt) {}
}
