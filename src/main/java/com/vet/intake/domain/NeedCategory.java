package com.vet.intake.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why an animal needs to be seen this time. Labels are the answers shown on the form.
 */
public enum NeedCategory {
    WELLNESS("Wellness exam / check-up", false),
    NEW_ILLNESS("My pet isn't feeling well", true),
    FOLLOW_UP("Follow-up on a previous visit", true),
    TECHNICIAN("Technician visit (nail trim, vaccines, bloodwork)", true),
    END_OF_LIFE("End-of-life care / euthanasia", false);

    private final String label;
    private final boolean detailsRequired;

    NeedCategory(String label, boolean detailsRequired) {
        this.label = label;
        this.detailsRequired = detailsRequired;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean detailsRequired() {
        return detailsRequired;
    }

    @JsonCreator
    public static NeedCategory fromLabel(String value) {
        for (NeedCategory category : values()) {
            if (category.label.equals(value) || category.name().equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown need category: " + value);
    }
}
