package com.airline.reservation.service;

import com.airline.reservation.constants.ReservationConstants;
import com.airline.reservation.service.lock.LockOperations;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-process lock service.
 * Per-flight operations share the store lock and hold an exclusive lock for their flight;
 * snapshots take the store lock exclusively. Every wait is bounded.
 */
@Service
@Slf4j
public class FlightLockService implements LockOperations {

    private final ReadWriteLock storeLock = new ReentrantReadWriteLock(true);
    private final ConcurrentMap<String, ReentrantLock> flightLocks = new ConcurrentHashMap<>();
    private final long waitTimeoutMs;

    public FlightLockService(
            @Value("${reservation.lock.wait-timeout-ms:" + ReservationConstants.DEFAULT_LOCK_WAIT_TIMEOUT_MS + "}")
            long waitTimeoutMs) {
        this.waitTimeoutMs = waitTimeoutMs;
    }

    @Override
    public <T> T executeWithLock(String flightId, Supplier<T> action) {
        Lock shared = storeLock.readLock();
        acquire(shared, "store (shared) for flight " + flightId);
        try {
            ReentrantLock flightLock = flightLocks.computeIfAbsent(flightId, id -> new ReentrantLock(true));
            acquire(flightLock, "flight " + flightId);
            log.debug("Acquired lock: flightId={}", flightId);
            try {
                return action.get();
            } finally {
                flightLock.unlock();
                log.debug("Released lock: flightId={}", flightId);
            }
        } finally {
            shared.unlock();
        }
    }

    @Override
    public <T> T executeExclusive(Supplier<T> action) {
        Lock exclusive = storeLock.writeLock();
        acquire(exclusive, "store (exclusive)");
        try {
            return action.get();
        } finally {
            exclusive.unlock();
        }
    }

    private void acquire(Lock lock, String resource) {
        try {
            if (!lock.tryLock(waitTimeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Failed to acquire lock within timeout: resource={}, waitTimeout={}ms",
                        resource, waitTimeoutMs);
                throw new LockAcquisitionException("Failed to acquire lock for " + resource);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Lock acquisition interrupted: resource={}", resource);
            throw new LockAcquisitionException("Lock acquisition interrupted for " + resource);
        }
    }
}
