package com.park.lot.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Half-day tariff: every started 12 hour block is billed at the unit rate,
 * package vehicles are never billed.
 */
@Service
public class TariffService {

    static final long HALF_DAY_MS = Duration.ofHours(12).toMillis();

    private final double unitRate;

    public TariffService(@Value("${parking.tariff.unit-rate:20}") double unitRate) {
        if (unitRate < 0) {
            throw new IllegalArgumentException("parking.tariff.unit-rate must not be negative");
        }
        this.unitRate = unitRate;
    }

    /**
     * Number of started half-day blocks between entry and exit. A clock that moved
     * backwards yields a negative span, which is billed as zero.
     */
    public long halfDays(Instant entryTime, Instant exitTime) {
        long durationMs = Duration.between(entryTime, exitTime).toMillis();
        if (durationMs <= 0) {
            return 0;
        }
        return (durationMs + HALF_DAY_MS - 1) / HALF_DAY_MS;
    }

    public double fee(long halfDays, boolean hasPackage) {
        if (hasPackage) {
            return 0.0;
        }
        return halfDays * unitRate;
    }
}
