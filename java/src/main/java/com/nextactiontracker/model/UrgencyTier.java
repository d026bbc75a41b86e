package com.nextactiontracker.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Presentation-only classification of how overdue a next action is.
 *
 * <p>Both dates are calendar days; callers truncate timestamps in the dashboard's zone
 * before classifying.
 */
public enum UrgencyTier {

    /** More than three days overdue. */
    RED,

    /** One to three days overdue. */
    YELLOW,

    /** Due today, or not yet due. */
    BLUE;

    private static final long RED_THRESHOLD_DAYS = 3;

    public static UrgencyTier classify(LocalDate nextActionDate, LocalDate today) {
        long daysOverdue = daysOverdue(nextActionDate, today);
        if (daysOverdue > RED_THRESHOLD_DAYS) {
            return RED;
        }
        if (daysOverdue >= 1) {
            return YELLOW;
        }
        return BLUE;
    }

    public static long daysOverdue(LocalDate nextActionDate, LocalDate today) {
        return ChronoUnit.DAYS.between(nextActionDate, today);
    }
}
