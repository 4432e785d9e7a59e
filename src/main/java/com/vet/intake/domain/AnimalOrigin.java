package com.vet.intake.domain;

public enum AnimalOrigin {
    /** Already on file in the practice records. */
    KNOWN,
    /** Declared during this request; its id only exists for this submission. */
    NEW
}
