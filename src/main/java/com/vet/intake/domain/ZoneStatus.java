package com.vet.intake.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ZoneStatus {
    SERVICED("serviced"),
    NOT_SERVICED("not-serviced"),
    INCONCLUSIVE("inconclusive");

    private final String wire;

    ZoneStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /** Only a definite "outside every zone" stops provider and slot lookups. */
    public boolean blocksSearch() {
        return this == NOT_SERVICED;
    }

    /** Inconclusive results are never cached; the next edit or search asks again. */
    public boolean isDefinitive() {
        return this != INCONCLUSIVE;
    }
}
