package com.affinity.x.dto.enums;

import java.util.Arrays;
import java.util.Optional;

public enum ZodiacSign {
    ARIES,
    TAURUS,
    GEMINI,
    CANCER,
    LEO,
    VIRGO,
    LIBRA,
    SCORPIO,
    SAGITTARIUS,
    CAPRICORN,
    AQUARIUS,
    PISCES;

    private static final double DEGREES_PER_SIGN = 30.0;

    /**
     * Ecliptic longitude of the first degree of this sign.
     */
    public double startDegree() {
        return ordinal() * DEGREES_PER_SIGN;
    }

    public static Optional<ZodiacSign> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim();
        return Arrays.stream(values())
                .filter(sign -> sign.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
