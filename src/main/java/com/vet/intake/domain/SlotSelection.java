package com.vet.intake.domain;

import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The requester's answer to an offer: slots ranked 1..3 by timestamp, or "none of these
 * work for me". A free-text preferred date/time can accompany either.
 */
public record SlotSelection(Map<String, Integer> preferencesByIso, boolean noneOfTheseWork, String preferredDateTime) {

    public SlotSelection {
        Map<String, Integer> copy = new LinkedHashMap<>();
        if (preferencesByIso != null) {
            preferencesByIso.forEach((iso, rank) -> {
                if (StringUtils.isBlank(iso)) throw new IllegalArgumentException("preference without a slot");
                if (rank == null || rank < 1 || rank > 3) {
                    throw new IllegalArgumentException("preference for " + iso + " must be 1, 2 or 3");
                }
                copy.put(iso, rank);
            });
        }
        if (new HashSet<>(copy.values()).size() != copy.size()) {
            throw new IllegalArgumentException("each preference rank can only be used once");
        }
        if (noneOfTheseWork && !copy.isEmpty()) {
            throw new IllegalArgumentException("cannot rank slots and say none of them work");
        }
        preferencesByIso = Collections.unmodifiableMap(copy);
        preferredDateTime = StringUtils.trimToNull(preferredDateTime);
    }

    public static SlotSelection none() {
        return new SlotSelection(Map.of(), false, null);
    }

    public boolean hasPreferences() {
        return !preferencesByIso.isEmpty();
    }
}
