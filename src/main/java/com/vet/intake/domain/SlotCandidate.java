package com.vet.intake.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * One proposed start time. {@code iso} is the full timestamp and doubles as the slot's
 * identity when the requester ranks the offer.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SlotCandidate(
        LocalDate date,
        LocalTime time,
        String iso,
        String display,
        String providerId,
        String providerName
) {

    public SlotCandidate {
        if (date == null) throw new IllegalArgumentException("slot date is required");
    }
}
