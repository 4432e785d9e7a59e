package com.vet.intake.dto;

import com.vet.intake.domain.Household;
import com.vet.intake.domain.Requester;
import com.vet.intake.domain.UrgencyLevel;

/**
 * The answers collected so far, as posted by the form when it asks for slots.
 */
public record IntakeDraft(Requester requester, Household household, UrgencyLevel urgency, String preferredDoctor) {

    public IntakeDraft {
        if (urgency == null) {
            throw new IllegalArgumentException("Please tell us how soon your pet needs to be seen");
        }
        Household.forRequester(requester, household);
    }
}
