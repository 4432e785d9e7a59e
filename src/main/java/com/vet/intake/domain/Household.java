package com.vet.intake.domain;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The requester's animals and what each of them needs, in one of four shapes.
 *
 * <p>Every shape answers the same questions: which animals are in the household,
 * which of them are part of this visit, and what each selected animal needs. An animal
 * that is not selected for this visit contributes no need but stays in the roster.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "shape")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Household.KnownAnimals.class, name = "known"),
        @JsonSubTypes.Type(value = Household.KnownPlusNewAnimals.class, name = "known-plus-new"),
        @JsonSubTypes.Type(value = Household.FreeTextAnimals.class, name = "free-text"),
        @JsonSubTypes.Type(value = Household.NewAnimalsOnly.class, name = "new-only")
})
public interface Household {

    HouseholdShape shape();

    /** Full roster in display order, selected or not. */
    List<Animal> animals();

    Optional<Need> needFor(String animalId);

    /** Every need contributing to this visit. */
    List<Need> needs();

    default List<Animal> selectedAnimals() {
        return animals().stream().filter(Animal::selected).toList();
    }

    /**
     * Returns {@code household} if its shape is the one the requester's account and login
     * status allow, otherwise rejects it.
     */
    static Household forRequester(Requester requester, Household household) {
        if (requester == null || household == null) {
            throw new IllegalArgumentException("requester and household are both required");
        }
        if (!household.shape().accepts(requester)) {
            throw new IllegalArgumentException("household shape " + household.shape() + " does not fit a "
                    + requester.accountStatus().wire()
                    + (requester.authenticated() ? " authenticated" : " unauthenticated") + " requester");
        }
        return household;
    }

    /** Authenticated existing holder picking from the animals on file. */
    record KnownAnimals(List<Animal> roster, Map<String, Need> needsByAnimal) implements Household {

        public KnownAnimals {
            roster = List.copyOf(roster == null ? List.of() : roster);
            requireOrigin(roster, AnimalOrigin.KNOWN);
            needsByAnimal = selectedNeeds(roster, needsByAnimal);
        }

        @Override
        public HouseholdShape shape() {
            return HouseholdShape.KNOWN;
        }

        @Override
        public List<Animal> animals() {
            return roster;
        }

        @Override
        public Optional<Need> needFor(String animalId) {
            return Optional.ofNullable(needsByAnimal.get(animalId));
        }

        @Override
        public List<Need> needs() {
            return List.copyOf(needsByAnimal.values());
        }
    }

    /** Authenticated existing holder who also declared animals that are not on file yet. */
    record KnownPlusNewAnimals(List<Animal> roster, List<Animal> newAnimals, Map<String, Need> needsByAnimal)
            implements Household {

        public KnownPlusNewAnimals {
            roster = List.copyOf(roster == null ? List.of() : roster);
            requireOrigin(roster, AnimalOrigin.KNOWN);
            newAnimals = declared(newAnimals);
            if (newAnimals.isEmpty()) {
                throw new IllegalArgumentException("known-plus-new household declares no new animals");
            }
            List<Animal> everyone = new ArrayList<>(roster);
            everyone.addAll(newAnimals);
            needsByAnimal = selectedNeeds(everyone, needsByAnimal);
        }

        @Override
        public HouseholdShape shape() {
            return HouseholdShape.KNOWN_PLUS_NEW;
        }

        @Override
        public List<Animal> animals() {
            List<Animal> all = new ArrayList<>(roster);
            all.addAll(newAnimals);
            return Collections.unmodifiableList(all);
        }

        @Override
        public Optional<Need> needFor(String animalId) {
            return Optional.ofNullable(needsByAnimal.get(animalId));
        }

        @Override
        public List<Need> needs() {
            return List.copyOf(needsByAnimal.values());
        }
    }

    /** Returning but unauthenticated requester: a single unstructured description. */
    record FreeTextAnimals(String description, Need visitNeed) implements Household {

        public FreeTextAnimals {
            if (StringUtils.isBlank(description)) {
                throw new IllegalArgumentException("please tell us which pets need to be seen");
            }
            description = description.trim();
        }

        @Override
        public HouseholdShape shape() {
            return HouseholdShape.FREE_TEXT;
        }

        @Override
        public List<Animal> animals() {
            return List.of();
        }

        @Override
        public Optional<Need> needFor(String animalId) {
            return Optional.empty();
        }

        @Override
        public List<Need> needs() {
            return visitNeed == null ? List.of() : List.of(visitNeed);
        }
    }

    /** Brand-new requester: only newly declared animals, one need for the household. */
    record NewAnimalsOnly(List<Animal> animals, Need visitNeed) implements Household {

        public NewAnimalsOnly {
            animals = declared(animals);
        }

        @Override
        public HouseholdShape shape() {
            return HouseholdShape.NEW_ONLY;
        }

        @Override
        public Optional<Need> needFor(String animalId) {
            boolean member = animals.stream().anyMatch(a -> a.id().equals(animalId));
            return member ? Optional.ofNullable(visitNeed) : Optional.empty();
        }

        @Override
        public List<Need> needs() {
            return visitNeed == null ? List.of() : List.of(visitNeed);
        }
    }

    private static void requireOrigin(List<Animal> animals, AnimalOrigin origin) {
        for (Animal animal : animals) {
            if (animal.origin() != origin) {
                throw new IllegalArgumentException("animal " + animal.id() + " is not " + origin);
            }
        }
    }

    private static List<Animal> declared(List<Animal> animals) {
        if (animals == null) return List.of();
        requireOrigin(animals, AnimalOrigin.NEW);
        return animals.stream().map(Animal::asSelected).toList();
    }

    /** Keeps needs for selected animals only, in roster order. */
    private static Map<String, Need> selectedNeeds(List<Animal> animals, Map<String, Need> needs) {
        Map<String, Need> source = needs == null ? Map.of() : needs;
        Set<String> known = animals.stream().map(Animal::id).collect(Collectors.toSet());
        for (String id : source.keySet()) {
            if (!known.contains(id)) {
                throw new IllegalArgumentException("need given for unknown animal " + id);
            }
        }
        Map<String, Need> kept = new LinkedHashMap<>();
        for (Animal animal : animals) {
            Need need = source.get(animal.id());
            if (animal.selected() && need != null) {
                kept.put(animal.id(), need);
            }
        }
        return Collections.unmodifiableMap(kept);
    }
}
