package com.vet.intake.domain;

import lombok.Builder;

import java.time.Instant;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Everything the practice needs to schedule one visit, assembled once at submission.
 *
 * <p>{@code offer} is the offer the requester saw, or a no-offer with the reason the
 * search did not produce one. {@code serviceMinutesUsed} is the visit length the offer
 * was searched with, null when no search ran. Ranked preferences always name slots of
 * {@code offer}.
 */
@Builder
public record AppointmentRequest(
        Requester requester,
        Household household,
        UrgencyLevel urgency,
        String preferredDoctor,
        ZoneCheckResult zone,
        SlotOffer offer,
        SlotSelection selection,
        SupplementalAnswers supplemental,
        Instant submittedAt,
        FormFlow formFlow,
        Integer serviceMinutesUsed
) {

    public AppointmentRequest {
        if (urgency == null) throw new IllegalArgumentException("urgency is required");
        if (submittedAt == null) throw new IllegalArgumentException("submittedAt is required");
        Household.forRequester(requester, household);
        if (offer == null) offer = SlotOffer.none(NoOfferReason.SEARCH_SKIPPED);
        if (selection == null) selection = SlotSelection.none();
        if (supplemental == null) supplemental = SupplementalAnswers.empty();
        if (formFlow == null) formFlow = new FormFlow(requester.authenticated(), requester.isExisting());
        if (selection.hasPreferences()) {
            if (!offer.hasOffer()) {
                throw new IllegalArgumentException("time preferences without an offer");
            }
            Set<String> offered = offer.candidates().stream().map(SlotCandidate::iso).collect(Collectors.toSet());
            if (!offered.containsAll(selection.preferencesByIso().keySet())) {
                throw new IllegalArgumentException("time preferences must name offered slots");
            }
        }
    }

    public boolean involvesEndOfLife() {
        return household.needs().stream().anyMatch(Need::concernsEndOfLife);
    }
}
