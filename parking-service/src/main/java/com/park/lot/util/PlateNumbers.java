package com.park.lot.util;

import java.util.Locale;

public final class PlateNumbers {

    private PlateNumbers() {
    }

    /**
     * Canonical form used as the lookup key everywhere: trimmed, Latin letters upper-cased.
     * Province characters of Chinese plates are left as they are.
     */
    public static String normalize(String plate) {
        if (plate == null || plate.isBlank()) {
            throw new IllegalArgumentException("plateNumber must not be blank");
        }
        return plate.trim().toUpperCase(Locale.ROOT);
    }
}
