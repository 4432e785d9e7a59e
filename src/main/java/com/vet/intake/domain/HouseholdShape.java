package com.vet.intake.domain;

/**
 * The four mutually exclusive ways a household's animals reach the engine.
 */
public enum HouseholdShape {
    KNOWN,
    KNOWN_PLUS_NEW,
    FREE_TEXT,
    NEW_ONLY;

    /** Whether a requester with this account/authentication status may use this shape. */
    public boolean accepts(Requester requester) {
        switch (this) {
            case KNOWN:
            case KNOWN_PLUS_NEW:
                return requester.isExisting() && requester.authenticated();
            case FREE_TEXT:
                return requester.isExisting() && !requester.authenticated();
            case NEW_ONLY:
                return requester.accountStatus() == AccountStatus.NEW;
            default:
                return false;
        }
    }
}
