package com.vet.intake.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import org.apache.commons.lang3.RandomStringUtils;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * One patient. Known animals come from the practice records; new ones are declared on
 * the form and get a local id ({@code new-<millis>-<suffix>}) when they are created.
 */
@Builder(toBuilder = true)
public record Animal(
        String id,
        AnimalOrigin origin,
        String name,
        CatalogRef species,
        CatalogRef breed,
        String age,
        String dob,
        String sex,
        Boolean spayedNeutered,
        String color,
        BigDecimal weight,
        String behaviorNotes,
        HandlingFlags handling,
        boolean selected,
        String dbId,
        String clientId,
        String primaryProviderName,
        String alerts
) {

    public Animal {
        if (origin == null) origin = AnimalOrigin.KNOWN;
        if (StringUtils.isBlank(id)) {
            if (origin == AnimalOrigin.KNOWN) {
                throw new IllegalArgumentException("known animal '" + name + "' has no record id");
            }
            id = newLocalId();
        }
        if (handling == null) handling = HandlingFlags.none();
    }

    public static String newLocalId() {
        return "new-" + System.currentTimeMillis() + "-"
                + RandomStringUtils.randomAlphanumeric(6).toLowerCase(Locale.ROOT);
    }

    @JsonIgnore
    public boolean isNew() {
        return origin == AnimalOrigin.NEW;
    }

    Animal asSelected() {
        return selected ? this : toBuilder().selected(true).build();
    }
}
