package com.vet.intake.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vet.intake.domain.NoOfferReason;
import com.vet.intake.domain.SlotOffer;
import com.vet.intake.rules.ManualSchedulingReason;

/**
 * Result of asking for availability: what the form shows next and what gets stored
 * on the session.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SearchOutcome {

    public enum Type {
        SLOTS_OFFERED,
        NO_SLOTS,
        MANUAL_FOLLOW_UP,
        ZONE_NOT_SERVICED
    }

    private final Type type;
    private final SlotOffer offer;
    private final Integer serviceMinutes;
    private final ManualSchedulingReason manualReason;

    private SearchOutcome(Type type, SlotOffer offer, Integer serviceMinutes, ManualSchedulingReason manualReason) {
        this.type = type;
        this.offer = offer;
        this.serviceMinutes = serviceMinutes;
        this.manualReason = manualReason;
    }

    public Type getType() {
        return type;
    }

    public SlotOffer getOffer() {
        return offer;
    }

    public Integer getServiceMinutes() {
        return serviceMinutes;
    }

    public ManualSchedulingReason getManualReason() {
        return manualReason;
    }

    public static SearchOutcome slotsOffered(SlotOffer offer, int serviceMinutes) {
        return new SearchOutcome(Type.SLOTS_OFFERED, offer, serviceMinutes, null);
    }

    public static SearchOutcome noSlots(NoOfferReason reason) {
        return new SearchOutcome(Type.NO_SLOTS, SlotOffer.none(reason), null, null);
    }

    public static SearchOutcome manualFollowUp(ManualSchedulingReason reason) {
        return new SearchOutcome(Type.MANUAL_FOLLOW_UP, SlotOffer.none(NoOfferReason.SEARCH_SKIPPED), null, reason);
    }

    public static SearchOutcome zoneNotServiced() {
        return new SearchOutcome(Type.ZONE_NOT_SERVICED, SlotOffer.none(NoOfferReason.ZONE_NOT_SERVICED), null, null);
    }
}
