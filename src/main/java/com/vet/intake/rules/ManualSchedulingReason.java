package com.vet.intake.rules;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ManualSchedulingReason {
    END_OF_LIFE("end_of_life"),
    URGENT("urgent");

    private final String wire;

    ManualSchedulingReason(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
