package com.swarmcore.core.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link MemoryStore}. Expired entries are dropped on read and by
 * {@link #purgeExpired()}.
 */
public class InMemoryMemoryStore implements MemoryStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMemoryStore.class);

    private record Entry(String value, Instant expiresAt) {
        boolean expired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryMemoryStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void put(String key, String value) {
        entries.put(key, new Entry(value, null));
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            put(key, value);
            return;
        }
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public boolean delete(String key) {
        return entries.remove(key) != null;
    }

    /**
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> e.getValue().expired(now));
        int purged = before - entries.size();
        if (purged > 0) {
            log.debug("Purged {} expired entries", purged);
        }
        return purged;
    }

    public int size() {
        return entries.size();
    }
}
