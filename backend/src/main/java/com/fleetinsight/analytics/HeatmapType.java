package com.fleetinsight.analytics;

import java.util.Locale;
import java.util.Optional;

/**
 * density: every point with its speed; speed: moving points only; altitude: points above sea level with
 * their altitude.
 */
public enum HeatmapType {
    DENSITY,
    SPEED,
    ALTITUDE;

    public static Optional<HeatmapType> fromParam(String param) {
        if (param == null || param.isBlank()) {
            return Optional.of(DENSITY);
        }
        try {
            return Optional.of(valueOf(param.strip().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
