package com.venue.scout.recommender.enums;

import java.time.LocalTime;
import java.util.Locale;

public enum TimeOfDay {
    MORNING,
    AFTERNOON,
    EVENING,
    NIGHT;

    /** 5-12 morning, 12-17 afternoon, 17-21 evening, otherwise night. */
    public static TimeOfDay of(LocalTime time) {
        int h = time.getHour();
        if (h >= 5 && h < 12) return MORNING;
        if (h >= 12 && h < 17) return AFTERNOON;
        if (h >= 17 && h < 21) return EVENING;
        return NIGHT;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
