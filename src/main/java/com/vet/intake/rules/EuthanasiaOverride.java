package com.vet.intake.rules;

import com.vet.intake.domain.Household;
import com.vet.intake.domain.Need;

import java.util.Collection;

/**
 * End-of-life visits are always scheduled by a person, whatever the urgency.
 */
public final class EuthanasiaOverride {

    private EuthanasiaOverride() {
    }

    public static boolean forceNoSearch(Collection<Need> needs) {
        return needs != null && needs.stream().anyMatch(Need::concernsEndOfLife);
    }

    public static boolean forceNoSearch(Household household) {
        return household != null && forceNoSearch(household.needs());
    }
}
