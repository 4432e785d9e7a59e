package com.vet.intake.domain;

/** How the requester entered the form, kept for the practice's intake reporting. */
public record FormFlow(boolean startedAsLoggedIn, boolean startedAsExistingClient) {
}
