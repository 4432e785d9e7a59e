package com.vet.intake.domain;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.vet.intake.IntakeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class HouseholdTests {

    @Test
    void unselectedAnimalStaysInRosterButHasNoNeed() {
        Map<String, Need> needs = new LinkedHashMap<>();
        needs.put("p1", wellness());
        needs.put("p2", sick("coughing"));
        Household household = new Household.KnownAnimals(
                List.of(knownAnimal("p1", "Biscuit", true), knownAnimal("p2", "Pepper", false)), needs);

        assertEquals(2, household.animals().size());
        assertEquals(List.of("p1"), household.selectedAnimals().stream().map(Animal::id).toList());
        assertTrue(household.needFor("p1").isPresent());
        assertTrue(household.needFor("p2").isEmpty());
        assertEquals(1, household.needs().size());
    }

    @Test
    void needForAnimalOutsideTheRosterIsRejected() {
        Map<String, Need> needs = Map.of("ghost", wellness());
        assertThrows(IllegalArgumentException.class,
                () -> new Household.KnownAnimals(List.of(knownAnimal("p1", "Biscuit", true)), needs));
    }

    @Test
    void newlyDeclaredAnimalsAreAlwaysSelected() {
        Animal kitten = newAnimal("Miso");
        assertFalse(kitten.selected());
        assertTrue(kitten.id().startsWith("new-"));

        Household household = new Household.NewAnimalsOnly(List.of(kitten), wellness());
        assertTrue(household.animals().get(0).selected());
        assertEquals(wellness(), household.needFor(kitten.id()).orElseThrow());
    }

    @Test
    void knownPlusNewCombinesRosterAndNewAnimals() {
        Animal kitten = newAnimal("Miso");
        Map<String, Need> needs = new LinkedHashMap<>();
        needs.put("p1", wellness());
        needs.put(kitten.id(), sick("sneezing"));
        Household household = new Household.KnownPlusNewAnimals(
                List.of(knownAnimal("p1", "Biscuit", true)), List.of(kitten), needs);

        assertEquals(HouseholdShape.KNOWN_PLUS_NEW, household.shape());
        assertEquals(2, household.selectedAnimals().size());
        assertEquals(NeedCategory.NEW_ILLNESS, household.needFor(kitten.id()).orElseThrow().category());
    }

    @Test
    void knownPlusNewWithoutNewAnimalsIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new Household.KnownPlusNewAnimals(List.of(knownAnimal("p1", "Biscuit", true)), List.of(), Map.of()));
    }

    @Test
    void shapeMustFitTheRequester() {
        Household known = new Household.KnownAnimals(List.of(knownAnimal("p1", "Biscuit", true)), Map.of("p1", wellness()));
        Household freeText = new Household.FreeTextAnimals("Two dogs, Biscuit and Pepper", wellness());
        Household newOnly = new Household.NewAnimalsOnly(List.of(newAnimal("Miso")), wellness());

        assertSame(known, Household.forRequester(existingLoggedIn(), known));
        assertSame(freeText, Household.forRequester(existingLoggedOut(), freeText));
        assertSame(newOnly, Household.forRequester(newClient(orchardLane()), newOnly));

        assertThrows(IllegalArgumentException.class, () -> Household.forRequester(existingLoggedOut(), known));
        assertThrows(IllegalArgumentException.class, () -> Household.forRequester(newClient(orchardLane()), freeText));
        assertThrows(IllegalArgumentException.class, () -> Household.forRequester(existingLoggedIn(), newOnly));
    }

    @Test
    void needValidation() {
        assertThrows(IllegalArgumentException.class, () -> Need.of(NeedCategory.NEW_ILLNESS, "  "));
        assertThrows(IllegalArgumentException.class, () -> Need.of(NeedCategory.END_OF_LIFE, null));
        assertThrows(IllegalArgumentException.class,
                () -> new Need(NeedCategory.WELLNESS, null, endOfLife().endOfLife()));
        assertEquals("Wellness exam / check-up", wellness().category().label());
    }

    @Test
    void requesterDropsMailingAddressEqualToPhysical() {
        Requester requester = new Requester(AccountStatus.NEW, false, "sam@example.com", FullName.of("Sam", "Okafor"),
                null, null, orchardLane(), PostalAddress.of(" 24 Orchard Ln ", "Durham", "ME", "04111"), true);

        assertNull(requester.mailingAddress());
        assertFalse(requester.suppliedNewAddress());
        assertThrows(IllegalArgumentException.class, () -> new Requester(AccountStatus.NEW, true, null, null,
                null, null, orchardLane(), null, false));
    }
}
