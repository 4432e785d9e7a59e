package com.vet.intake.rules;

import java.time.LocalDate;

/**
 * Search window in whole days relative to today (day 0), bounds inclusive.
 * A skipping window carries no bounds.
 */
public record UrgencyWindow(boolean skipSearch, int startDaysFromToday, int endDaysFromToday) {

    public UrgencyWindow {
        if (!skipSearch && (startDaysFromToday < 0 || endDaysFromToday < startDaysFromToday)) {
            throw new IllegalArgumentException("invalid window [" + startDaysFromToday + ", " + endDaysFromToday + "]");
        }
    }

    public static UrgencyWindow skip() {
        return new UrgencyWindow(true, 0, 0);
    }

    public static UrgencyWindow days(int start, int end) {
        return new UrgencyWindow(false, start, end);
    }

    public int numDays() {
        requireSearchable();
        return endDaysFromToday - startDaysFromToday + 1;
    }

    public LocalDate startDate(LocalDate today) {
        requireSearchable();
        return today.plusDays(startDaysFromToday);
    }

    public LocalDate endDate(LocalDate today) {
        requireSearchable();
        return today.plusDays(endDaysFromToday);
    }

    private void requireSearchable() {
        if (skipSearch) throw new IllegalStateException("no search window: urgency skips the slot search");
    }
}
