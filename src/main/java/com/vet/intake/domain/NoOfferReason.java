package com.vet.intake.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NoOfferReason {
    NONE_FOUND("none_found"),
    SEARCH_SKIPPED("search_skipped"),
    ZONE_NOT_SERVICED("zone_not_serviced"),
    SEARCH_FAILED("search_failed"),
    PROVIDER_UNAVAILABLE("provider_unavailable");

    private final String wire;

    NoOfferReason(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
