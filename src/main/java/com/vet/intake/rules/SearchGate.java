package com.vet.intake.rules;

import com.vet.intake.domain.Household;
import com.vet.intake.domain.UrgencyLevel;

public final class SearchGate {

    private SearchGate() {
    }

    /** End-of-life needs are checked before the urgency table so they win over any window. */
    public static SearchDecision decide(Household household, UrgencyLevel urgency) {
        if (EuthanasiaOverride.forceNoSearch(household)) {
            return SearchDecision.manual(ManualSchedulingReason.END_OF_LIFE);
        }
        UrgencyWindow window = UrgencyWindowTable.windowFor(urgency);
        if (window.skipSearch()) {
            return SearchDecision.manual(ManualSchedulingReason.URGENT);
        }
        return SearchDecision.searchIn(window);
    }
}
