package com.vet.intake.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How soon the household wants to be seen, in the order the form offers it.
 * The label is the {@code howSoon} value sent on the wire.
 */
public enum UrgencyLevel {
    SAME_DAY("Emergency – today"),
    WITHIN_48_HOURS("Urgent – within 24–48 hours"),
    THIS_WEEK("Soon – sometime this week"),
    THREE_TO_FOUR_WEEKS("In 3–4 weeks"),
    WITHIN_MONTH("Flexible – within the next month"),
    ABOUT_3_MONTHS("In about 3 months"),
    ABOUT_6_MONTHS("In about 6 months"),
    ABOUT_12_MONTHS("In about 12 months");

    private final String label;

    UrgencyLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static UrgencyLevel fromLabel(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Please tell us how soon your pet needs to be seen");
        }
        for (UrgencyLevel level : values()) {
            if (level.label.equals(value) || level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown urgency: " + value);
    }
}
