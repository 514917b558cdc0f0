package io.mnemo.core.record;

import io.mnemo.core.error.ConcurrencyConflictException;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-owner read/write locks with bounded acquisition. An owner's lock is dropped when that owner is
 * purged, so the registry only holds locks for owners that still have data or in-flight work.
 */
public final class OwnerLockRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(OwnerLockRegistry.class);

    private final Map<String, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();
    private final Duration attemptTimeout;
    private final int maxAttempts;

    public OwnerLockRegistry() {
        this(Duration.ofSeconds(2), 3);
    }

    public OwnerLockRegistry(Duration attemptTimeout, int maxAttempts) {
        this.attemptTimeout = attemptTimeout == null ? Duration.ofSeconds(2) : attemptTimeout;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public <T> T read(String ownerId, LockedAction<T> action) throws IOException {
        return withLock(ownerId, false, false, action);
    }

    public <T> T write(String ownerId, LockedAction<T> action) throws IOException {
        return withLock(ownerId, true, false, action);
    }

    public <T> T writeAndRelease(String ownerId, LockedAction<T> action) throws IOException {
        return withLock(ownerId, true, true, action);
    }

    public int trackedOwners() {
        return locks.size();
    }

    private ReentrantReadWriteLock lockFor(String ownerId) {
        return locks.computeIfAbsent(ownerId, ignored -> new ReentrantReadWriteLock(true));
    }

    private <T> T withLock(String ownerId, boolean exclusive, boolean release, LockedAction<T> action)
        throws IOException {
        String mode = exclusive ? "write" : "read";
        int attempt = 0;
        while (attempt < maxAttempts) {
            ReentrantReadWriteLock current = lockFor(ownerId);
            Lock lock = exclusive ? current.writeLock() : current.readLock();
            boolean acquired;
            try {
                acquired = lock.tryLock(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConcurrencyConflictException("Interrupted while waiting for " + mode + " lock", e);
            }
            if (!acquired) {
                attempt++;
                LOG.debug("Contended {} lock for owner, attempt {}/{}", mode, attempt, maxAttempts);
                continue;
            }
            try {
                if (locks.get(ownerId) != current) {
                    // dropped by a purge while we waited
                    continue;
                }
                T result = action.run();
                if (release) {
                    locks.remove(ownerId, current);
                }
                return result;
            } finally {
                lock.unlock();
            }
        }
        throw new ConcurrencyConflictException(
            "Could not acquire " + mode + " lock after " + maxAttempts + " attempts"
        );
    }

    @FunctionalInterface
    public interface LockedAction<T> {
        T run() throws IOException;
    }
}
