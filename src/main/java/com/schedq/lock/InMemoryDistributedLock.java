package com.schedq.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Lock backed by a map in this JVM. Instances built on the same map behave like
 * separate nodes sharing one backend.
 */
public class InMemoryDistributedLock implements DistributedLock {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDistributedLock.class);

    private final ConcurrentMap<String, Grant> grants;
    private final Clock clock;
    private final String holder = UUID.randomUUID().toString();

    public InMemoryDistributedLock() {
        this(new ConcurrentHashMap<>(), Clock.systemUTC());
    }

    public InMemoryDistributedLock(ConcurrentMap<String, Grant> grants, Clock clock) {
        this.grants = grants;
        this.clock = clock;
    }

    @Override
    public boolean acquire(String key, Duration timeout) {
        Instant now = clock.instant();
        Grant requested = new Grant(holder, now.plus(timeout));
        Grant current = grants.compute(key, (k, existing) ->
                existing == null || existing.isExpired(now) ? requested : existing);
        boolean acquired = current == requested;
        log.debug(acquired ? "Acquired lock: {}" : "Failed to acquire lock: {} (already held)", key);
        return acquired;
    }

    @Override
    public boolean release(String key) {
        Instant now = clock.instant();
        boolean[] released = new boolean[1];
        grants.computeIfPresent(key, (k, existing) -> {
            if (!existing.holder().equals(holder)) {
                return existing;
            }
            released[0] = !existing.isExpired(now);
            return null;
        });
        if (!released[0]) {
            log.warn("Attempted to release unheld lock: {}", key);
        }
        return released[0];
    }

    @Override
    public boolean extend(String key, Duration timeout) {
        Instant now = clock.instant();
        boolean[] extended = new boolean[1];
        grants.computeIfPresent(key, (k, existing) -> {
            if (!existing.holder().equals(holder) || existing.isExpired(now)) {
                return existing;
            }
            extended[0] = true;
            return new Grant(holder, now.plus(timeout));
        });
        return extended[0];
    }

    @Override
    public String getStrategyName() {
        return "memory";
    }

    public record Grant(String holder, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
