package com.park.lot.service;

import com.park.lot.exception.LotBusyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-wide mutex around every mutation of the space pool: entry, exit and the
 * reservation toggle. The guarded work must include the transaction commit, so that
 * the next holder always sees the previous holder's writes.
 */
@Slf4j
@Component
public class LotLock {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final long timeoutMs;

    public LotLock(@Value("${parking.lock.timeout-ms:5000}") long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public <T> T withLock(String plate, Supplier<T> work) {
        boolean acquired;
        try {
            acquired = lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LotBusyException(plate);
        }
        if (!acquired) {
            log.warn("Lot lock not acquired within {}ms for {}", timeoutMs, plate);
            throw new LotBusyException(plate);
        }
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }
}
