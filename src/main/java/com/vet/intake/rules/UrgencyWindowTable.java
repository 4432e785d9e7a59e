package com.vet.intake.rules;

import com.vet.intake.domain.UrgencyLevel;

/**
 * Fixed mapping from urgency to slot-search window. Emergencies and 24-48h requests are
 * never searched; staff call those households back.
 */
public final class UrgencyWindowTable {

    private UrgencyWindowTable() {
    }

    public static UrgencyWindow windowFor(UrgencyLevel urgency) {
        if (urgency == null) {
            throw new IllegalArgumentException("urgency is required");
        }
        switch (urgency) {
            case SAME_DAY:
            case WITHIN_48_HOURS: return UrgencyWindow.skip();
            case THIS_WEEK: return UrgencyWindow.days(1, 7);
            case THREE_TO_FOUR_WEEKS: return UrgencyWindow.days(21, 35);
            case WITHIN_MONTH: return UrgencyWindow.days(4, 42);
            case ABOUT_3_MONTHS: return UrgencyWindow.days(75, 105);
            case ABOUT_6_MONTHS: return UrgencyWindow.days(135, 165);
            case ABOUT_12_MONTHS: return UrgencyWindow.days(345, 365);
            default: throw new IllegalArgumentException("unknown urgency " + urgency);
        }
    }
}
