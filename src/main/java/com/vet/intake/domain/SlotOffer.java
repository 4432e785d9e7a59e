package com.vet.intake.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Either one winning slot with up to two alternates, or no offer at all together with
 * the reason there is none. Never both.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SlotOffer(SlotCandidate winner, List<SlotCandidate> alternates, NoOfferReason noOfferReason) {

    public static final int MAX_ALTERNATES = 2;

    public SlotOffer {
        alternates = alternates == null ? List.of() : List.copyOf(alternates);
        if (winner == null) {
            if (noOfferReason == null) throw new IllegalArgumentException("an empty offer needs a reason");
            if (!alternates.isEmpty()) throw new IllegalArgumentException("alternates without a winner");
        } else {
            if (noOfferReason != null) throw new IllegalArgumentException("an offer with a winner has no reason");
            if (alternates.size() > MAX_ALTERNATES) {
                throw new IllegalArgumentException("at most " + MAX_ALTERNATES + " alternates, got " + alternates.size());
            }
        }
    }

    public static SlotOffer of(SlotCandidate winner, List<SlotCandidate> alternates) {
        return new SlotOffer(winner, alternates, null);
    }

    public static SlotOffer none(NoOfferReason reason) {
        return new SlotOffer(null, List.of(), reason);
    }

    public boolean hasOffer() {
        return winner != null;
    }

    /** Winner first, then alternates. */
    public List<SlotCandidate> candidates() {
        List<SlotCandidate> all = new ArrayList<>();
        if (winner != null) all.add(winner);
        all.addAll(alternates);
        return all;
    }
}
