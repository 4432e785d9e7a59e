package com.vet.intake.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vet.intake.domain.Animal;
import com.vet.intake.domain.AppointmentRequest;
import com.vet.intake.domain.CatalogRef;
import com.vet.intake.domain.EndOfLifeQuestionnaire;
import com.vet.intake.domain.FullName;
import com.vet.intake.domain.Household;
import com.vet.intake.domain.HouseholdShape;
import com.vet.intake.domain.Need;
import com.vet.intake.domain.NoOfferReason;
import com.vet.intake.domain.PostalAddress;
import com.vet.intake.domain.Requester;
import com.vet.intake.domain.SlotCandidate;
import com.vet.intake.domain.SlotOffer;
import com.vet.intake.domain.SlotSelection;
import com.vet.intake.domain.SupplementalAnswers;
import com.vet.intake.rules.SearchDecision;
import com.vet.intake.rules.SearchGate;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the record sent to {@code /public/appointments/form}.
 *
 * <p>Each household shape has its own writer and a field is only added when it applies
 * to that shape and has a value, so nothing has to be stripped afterwards. The one key
 * that is written as an explicit {@code null} is {@code selectedDateTimePreferences}: the
 * practice's intake reads a null there as "no slot was picked, call the client".
 */
@Component
public class PayloadNormalizer {

    public static final String EUTHANASIA = "euthanasia";
    public static final String REGULAR_VISIT = "regular_visit";

    private static final Set<String> COMMON_KEYS = Set.of(
            "clientType", "isLoggedIn", "email", "fullName", "phoneNumber", "canWeText",
            "physicalAddress", "mailingAddress",
            "appointmentType", "preferredDoctor", "serviceArea", "howSoon", "preferredDateTime",
            "selectedDateTimePreferences", "noneOfWorkForMe", "serviceMinutes",
            "requiresManualScheduling", "manualSchedulingReason", "slotSearchOutcome",
            "previousVeterinaryPractices", "okayToContactPreviousVets", "otherPersonsOnAccount",
            "condoApartmentInfo", "howDidYouHearAboutUs", "anythingElse",
            "submittedAt", "formFlow");

    private static final Set<String> HOUSEHOLD_NEED_KEYS = Set.of(
            "visitReason", "visitDetails",
            "euthanasiaReason", "beenToVetLastThreeMonths", "interestedInOtherOptions", "aftercarePreference");

    private static final Map<HouseholdShape, Set<String>> ALLOWED_KEYS = Map.of(
            HouseholdShape.KNOWN, keys(Set.of("pets", "allPets", "petSpecificData")),
            HouseholdShape.KNOWN_PLUS_NEW, keys(Set.of("pets", "allPets", "petSpecificData", "existingClientNewPets")),
            HouseholdShape.FREE_TEXT, keys(Set.of("petInfoText"), HOUSEHOLD_NEED_KEYS),
            HouseholdShape.NEW_ONLY, keys(Set.of("newClientPets"), HOUSEHOLD_NEED_KEYS));

    private final ObjectMapper mapper;

    public PayloadNormalizer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Every top-level key a record for {@code shape} may contain. */
    public static Set<String> allowedKeys(HouseholdShape shape) {
        return ALLOWED_KEYS.get(shape);
    }

    public ObjectNode normalize(AppointmentRequest request) {
        ObjectNode root = mapper.createObjectNode();
        writeRequester(root, request.requester());
        writeVisit(root, request);
        writeScheduling(root, request);

        Household household = request.household();
        switch (household.shape()) {
            case KNOWN:
                writeKnown(root, (Household.KnownAnimals) household);
                break;
            case KNOWN_PLUS_NEW:
                writeKnownPlusNew(root, (Household.KnownPlusNewAnimals) household);
                break;
            case FREE_TEXT:
                writeFreeText(root, (Household.FreeTextAnimals) household);
                break;
            case NEW_ONLY:
                writeNewOnly(root, (Household.NewAnimalsOnly) household);
                break;
            default:
                throw new IllegalArgumentException("unknown household shape " + household.shape());
        }

        writeSupplemental(root, request.supplemental());
        root.put("submittedAt", request.submittedAt().toString());
        ObjectNode flow = root.putObject("formFlow");
        flow.put("startedAsLoggedIn", request.formFlow().startedAsLoggedIn());
        flow.put("startedAsExistingClient", request.formFlow().startedAsExistingClient());
        return root;
    }

    private void writeRequester(ObjectNode root, Requester requester) {
        root.put("clientType", requester.accountStatus().wire());
        root.put("isLoggedIn", requester.authenticated());
        putText(root, "email", requester.email());

        FullName name = requester.fullName();
        ObjectNode fullName = root.putObject("fullName");
        fullName.put("first", name.first());
        fullName.put("last", name.last());
        putText(fullName, "middle", name.middle());
        putText(fullName, "prefix", name.prefix());
        putText(fullName, "suffix", name.suffix());

        putText(root, "phoneNumber", requester.phone());
        putYesNo(root, "canWeText", requester.canWeText());
        putAddress(root, "physicalAddress", requester.physicalAddress());
        putAddress(root, "mailingAddress", requester.mailingAddress());
    }

    private void writeVisit(ObjectNode root, AppointmentRequest request) {
        root.put("appointmentType", request.involvesEndOfLife() ? EUTHANASIA : REGULAR_VISIT);
        putText(root, "preferredDoctor", request.preferredDoctor());
        if (request.zone() != null) {
            putText(root, "serviceArea", request.zone().zoneName());
        }
        root.put("howSoon", request.urgency().label());
        putText(root, "preferredDateTime", request.selection().preferredDateTime());
    }

    private void writeScheduling(ObjectNode root, AppointmentRequest request) {
        SearchDecision decision = SearchGate.decide(request.household(), request.urgency());
        if (!decision.search()) {
            root.putNull("selectedDateTimePreferences");
            root.put("requiresManualScheduling", true);
            root.put("manualSchedulingReason", decision.manualReason().wire());
            return;
        }

        SlotOffer offer = request.offer();
        SlotSelection selection = request.selection();
        if (selection.hasPreferences()) {
            root.set("selectedDateTimePreferences", preferences(selection, offer));
            if (request.serviceMinutesUsed() != null) {
                root.put("serviceMinutes", request.serviceMinutesUsed());
            }
        } else {
            root.putNull("selectedDateTimePreferences");
        }
        if (searchRan(offer)) {
            root.put("noneOfWorkForMe", selection.noneOfTheseWork());
        }
        root.put("slotSearchOutcome", offer.hasOffer() ? "offered" : offer.noOfferReason().wire());
    }

    private ArrayNode preferences(SlotSelection selection, SlotOffer offer) {
        Map<String, String> displayByIso = new HashMap<>();
        for (SlotCandidate candidate : offer.candidates()) {
            displayByIso.put(candidate.iso(), candidate.display());
        }
        ArrayNode array = mapper.createArrayNode();
        selection.preferencesByIso().entrySet().stream()
                .sorted(Map.Entry.comparingByValue(Comparator.naturalOrder()))
                .forEach(entry -> {
                    ObjectNode preference = array.addObject();
                    preference.put("preference", entry.getValue());
                    preference.put("dateTime", entry.getKey());
                    preference.put("display", displayByIso.get(entry.getKey()));
                });
        return array;
    }

    /** Zone, provider and skip outcomes mean nothing was searched, so nothing could be declined. */
    private static boolean searchRan(SlotOffer offer) {
        if (offer.hasOffer()) return true;
        NoOfferReason reason = offer.noOfferReason();
        return reason == NoOfferReason.NONE_FOUND || reason == NoOfferReason.SEARCH_FAILED;
    }

    private void writeKnown(ObjectNode root, Household.KnownAnimals household) {
        writeRoster(root, household.roster(), household);
    }

    private void writeKnownPlusNew(ObjectNode root, Household.KnownPlusNewAnimals household) {
        writeRoster(root, household.roster(), household);
        ArrayNode newPets = root.putArray("existingClientNewPets");
        household.newAnimals().forEach(animal -> writeNewAnimal(newPets.addObject(), animal));
    }

    private void writeRoster(ObjectNode root, List<Animal> roster, Household household) {
        ArrayNode pets = mapper.createArrayNode();
        ArrayNode allPets = mapper.createArrayNode();
        for (Animal animal : roster) {
            if (animal.selected()) {
                writeKnownAnimal(pets.addObject(), animal);
            }
            writeKnownAnimal(allPets.addObject(), animal).put("isSelected", animal.selected());
        }
        if (!pets.isEmpty()) root.set("pets", pets);
        if (!allPets.isEmpty()) root.set("allPets", allPets);

        ObjectNode petSpecificData = mapper.createObjectNode();
        for (Animal animal : household.selectedAnimals()) {
            household.needFor(animal.id())
                    .ifPresent(need -> writeNeed(petSpecificData.putObject(animal.id()), need, "needsToday", "needsTodayDetails"));
        }
        if (!petSpecificData.isEmpty()) root.set("petSpecificData", petSpecificData);
    }

    private void writeFreeText(ObjectNode root, Household.FreeTextAnimals household) {
        root.put("petInfoText", household.description());
        if (household.visitNeed() != null) {
            writeNeed(root, household.visitNeed(), "visitReason", "visitDetails");
        }
    }

    private void writeNewOnly(ObjectNode root, Household.NewAnimalsOnly household) {
        ArrayNode pets = root.putArray("newClientPets");
        household.animals().forEach(animal -> writeNewAnimal(pets.addObject(), animal));
        if (household.visitNeed() != null) {
            writeNeed(root, household.visitNeed(), "visitReason", "visitDetails");
        }
    }

    private ObjectNode writeKnownAnimal(ObjectNode node, Animal animal) {
        node.put("id", animal.id());
        putText(node, "dbId", animal.dbId());
        putText(node, "clientId", animal.clientId());
        putText(node, "name", animal.name());
        putText(node, "species", name(animal.species()));
        putText(node, "breed", name(animal.breed()));
        putText(node, "dob", animal.dob());
        putText(node, "primaryProviderName", animal.primaryProviderName());
        putText(node, "alerts", animal.alerts());
        return node;
    }

    private void writeNewAnimal(ObjectNode node, Animal animal) {
        node.put("id", animal.id());
        putText(node, "name", animal.name());
        if (animal.species() != null) {
            putText(node, "species", animal.species().name());
            putText(node, "speciesId", animal.species().id());
        }
        if (animal.breed() != null) {
            putText(node, "breed", animal.breed().name());
            putText(node, "breedId", animal.breed().id());
        }
        putText(node, "age", animal.age());
        putText(node, "dob", animal.dob());
        putText(node, "sex", animal.sex());
        putYesNo(node, "spayedNeutered", animal.spayedNeutered());
        putText(node, "color", animal.color());
        BigDecimal weight = animal.weight();
        if (weight != null) node.put("weight", weight);
        putText(node, "behaviorAtPreviousVisits", animal.behaviorNotes());
        putYesNo(node, "needsCalmingMedications", animal.handling().needsCalmingMedications());
        putYesNo(node, "hasCalmingMedications", animal.handling().hasCalmingMedications());
        putYesNo(node, "needsMuzzleOrSpecialHandling", animal.handling().needsMuzzleOrSpecialHandling());
    }

    private void writeNeed(ObjectNode node, Need need, String categoryKey, String detailsKey) {
        node.put(categoryKey, need.category().label());
        putText(node, detailsKey, need.details());
        if (need.concernsEndOfLife()) {
            EndOfLifeQuestionnaire eol = need.endOfLife();
            putText(node, "euthanasiaReason", eol.reason());
            putText(node, "beenToVetLastThreeMonths", eol.beenToVetLastThreeMonths());
            putText(node, "interestedInOtherOptions", eol.interestedInOtherOptions());
            putText(node, "aftercarePreference", eol.aftercarePreference());
        }
    }

    private void writeSupplemental(ObjectNode root, SupplementalAnswers answers) {
        putText(root, "previousVeterinaryPractices", answers.previousVeterinaryPractices());
        putText(root, "okayToContactPreviousVets", answers.okayToContactPreviousVets());
        putText(root, "otherPersonsOnAccount", answers.otherPersonsOnAccount());
        putText(root, "condoApartmentInfo", answers.condoApartmentInfo());
        putText(root, "howDidYouHearAboutUs", answers.howDidYouHearAboutUs());
        putText(root, "anythingElse", answers.anythingElse());
    }

    private void putAddress(ObjectNode root, String key, PostalAddress address) {
        if (address == null) return;
        ObjectNode node = root.putObject(key);
        node.put("line1", address.line1());
        putText(node, "line2", address.line2());
        node.put("city", address.city());
        node.put("state", address.state());
        node.put("zip", address.zip());
        node.put("country", address.country());
    }

    private static void putText(ObjectNode node, String key, String value) {
        if (StringUtils.isNotBlank(value)) {
            node.put(key, value);
        }
    }

    private static void putYesNo(ObjectNode node, String key, Boolean value) {
        if (value != null) {
            node.put(key, value ? "Yes" : "No");
        }
    }

    private static String name(CatalogRef ref) {
        return ref == null ? null : ref.name();
    }

    @SafeVarargs
    private static Set<String> keys(Set<String>... groups) {
        Set<String> all = new LinkedHashSet<>(COMMON_KEYS);
        for (Set<String> group : groups) {
            all.addAll(group);
        }
        return Set.copyOf(all);
    }
}
