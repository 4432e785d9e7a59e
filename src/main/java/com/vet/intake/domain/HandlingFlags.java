package com.vet.intake.domain;

public record HandlingFlags(Boolean needsCalmingMedications, Boolean hasCalmingMedications, Boolean needsMuzzleOrSpecialHandling) {

    public static HandlingFlags none() {
        return new HandlingFlags(null, null, null);
    }
}
