package com.vet.intake.exception;

public class IntakeSessionNotFoundException extends RuntimeException {

    public IntakeSessionNotFoundException(String sessionId) {
        super("No intake session " + sessionId);
    }
}
