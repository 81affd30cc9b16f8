package com.venue.scout.recommender.model.profile;

import com.venue.scout.recommender.enums.TimeOfDay;

import java.time.DayOfWeek;

/**
 * A recurring habit inferred from history, e.g. "coffee on weekday mornings".
 * A null day matches every day.
 */
public record SchedulePattern(DayOfWeek day, TimeOfDay timeOfDay, String category) {

    public boolean matches(DayOfWeek d, TimeOfDay t, String cat) {
        return (day == null || day == d)
                && timeOfDay == t
                && category != null && category.equalsIgnoreCase(cat);
    }
}
