package com.vet.intake.rules;

/**
 * Whether to search for slots, and in which window. A vetoed search carries the reason
 * staff must schedule the visit by hand and no window.
 */
public record SearchDecision(boolean search, UrgencyWindow window, ManualSchedulingReason manualReason) {

    public static SearchDecision searchIn(UrgencyWindow window) {
        return new SearchDecision(true, window, null);
    }

    public static SearchDecision manual(ManualSchedulingReason reason) {
        return new SearchDecision(false, null, reason);
    }
}
