package com.vet.intake.utils;

/**
 * Where an intake session stands. {@code ZONE_NOT_SERVICED} is terminal for the address
 * it was recorded against; a new address reopens the session.
 */
public enum IntakeState {
    COLLECTING,
    ZONE_NOT_SERVICED,
    SLOTS_OFFERED,
    MANUAL_FOLLOW_UP,
    SUBMITTED
}
