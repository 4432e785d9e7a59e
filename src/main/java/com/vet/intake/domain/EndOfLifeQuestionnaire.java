package com.vet.intake.domain;

import org.apache.commons.lang3.StringUtils;

/** The fixed follow-up questions asked when a need is end-of-life care. */
public record EndOfLifeQuestionnaire(
        String reason,
        String beenToVetLastThreeMonths,
        String interestedInOtherOptions,
        String aftercarePreference
) {

    public EndOfLifeQuestionnaire {
        if (StringUtils.isBlank(reason)) {
            throw new IllegalArgumentException("Please let us know what is going on with your pet");
        }
    }
}
