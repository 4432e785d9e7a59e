package com.vet.intake.exception;

/** The session was already submitted, or a submission for it is in flight. */
public class SubmissionConflictException extends RuntimeException {

    public SubmissionConflictException(String message) {
        super(message);
    }
}
