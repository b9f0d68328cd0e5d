package com.swarmcore.core.conflict;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * Table of versioned entity snapshots with compare-and-swap updates.
 * <p>
 * Each entity is swapped independently, so updates to unrelated entities never contend.
 * An update succeeds only if the caller's expected version is still current; otherwise
 * it fails with {@link VersionConflictException} and nothing changes.
 *
 * @param <T> immutable snapshot type
 */
public class OptimisticLockManager<T> {

    private static final Logger log = LoggerFactory.getLogger(OptimisticLockManager.class);

    private final String name;
    private final Clock clock;
    private final ConcurrentHashMap<String, Versioned<T>> entries = new ConcurrentHashMap<>();
    private final AtomicLong updates = new AtomicLong();
    private final AtomicLong conflicts = new AtomicLong();

    public OptimisticLockManager(String name, Clock clock) {
        this.name = name;
        this.clock = clock;
    }

    /**
     * Stores the initial snapshot at version 0.
     *
     * @throws IllegalArgumentException if the id is already registered
     */
    public Versioned<T> register(String id, T value) {
        var initial = new Versioned<>(id, value, 0L, clock.instant());
        if (entries.putIfAbsent(id, initial) != null) {
            throw new IllegalArgumentException(name + " already contains " + id);
        }
        return initial;
    }

    /**
     * Restores a snapshot at a known version, replacing any existing entry.
     */
    public void restore(Versioned<T> snapshot) {
        entries.put(snapshot.id(), snapshot);
    }

    public Optional<Versioned<T>> read(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    public Versioned<T> require(String id) {
        Versioned<T> current = entries.get(id);
        if (current == null) {
            throw new NoSuchElementException(name + " has no entry " + id);
        }
        return current;
    }

    /**
     * Applies {@code mutation} if {@code expectedVersion} is current.
     *
     * @return the new snapshot, one version higher
     * @throws VersionConflictException if another writer got there first
     */
    public Versioned<T> tryUpdate(String id, long expectedVersion, UnaryOperator<T> mutation) {
        Versioned<T> current = require(id);
        if (current.version() != expectedVersion) {
            throw conflict(id, expectedVersion, current.version());
        }
        var next = new Versioned<>(id, mutation.apply(current.value()), expectedVersion + 1, clock.instant());
        if (!entries.replace(id, current, next)) {
            throw conflict(id, expectedVersion, require(id).version());
        }
        updates.incrementAndGet();
        return next;
    }

    /**
     * Read-modify-write loop that re-reads after each conflict.
     *
     * @throws VersionConflictException if every attempt lost the race
     */
    public Versioned<T> update(String id, UnaryOperator<T> mutation, int maxAttempts) {
        VersionConflictException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Versioned<T> current = require(id);
            try {
                return tryUpdate(id, current.version(), mutation);
            } catch (VersionConflictException e) {
                last = e;
                log.debug("{}: attempt {}/{} on {} lost the race", name, attempt, maxAttempts, id);
            }
        }
        throw last;
    }

    public boolean remove(String id) {
        return entries.remove(id) != null;
    }

    public Collection<Versioned<T>> snapshots() {
        return List.copyOf(entries.values());
    }

    public List<T> values() {
        return entries.values().stream().map(Versioned::value).toList();
    }

    public int size() {
        return entries.size();
    }

    public long updateCount() {
        return updates.get();
    }

    public long conflictCount() {
        return conflicts.get();
    }

    private VersionConflictException conflict(String id, long expected, long actual) {
        conflicts.incrementAndGet();
        return new VersionConflictException(id, expected, actual);
    }
}
