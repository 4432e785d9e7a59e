package com.vet.intake.integration;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of the slot search request. {@code doctorId} is left out when any provider will do.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AvailabilitySearch(
        long practiceId,
        String startDate,
        int numDays,
        int serviceMinutes,
        String address,
        boolean allowOtherDoctors,
        String doctorId
) {
}
