package com.vet.intake.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vet.intake.component.DebouncedLookup;
import com.vet.intake.config.IntakeProperties;
import com.vet.intake.domain.AppointmentRequest;
import com.vet.intake.domain.FormFlow;
import com.vet.intake.domain.NoOfferReason;
import com.vet.intake.domain.PostalAddress;
import com.vet.intake.domain.Provider;
import com.vet.intake.domain.Requester;
import com.vet.intake.domain.SearchInputs;
import com.vet.intake.domain.SlotCandidate;
import com.vet.intake.domain.SlotOffer;
import com.vet.intake.domain.SlotSelection;
import com.vet.intake.domain.ZoneCheckResult;
import com.vet.intake.dto.IntakeDraft;
import com.vet.intake.dto.SearchOutcome;
import com.vet.intake.dto.SubmissionDraft;
import com.vet.intake.entity.IntakeSessionEntity;
import com.vet.intake.exception.BackendUnavailableException;
import com.vet.intake.exception.SubmissionConflictException;
import com.vet.intake.integration.AvailabilitySearch;
import com.vet.intake.integration.SchedulingBackendClient;
import com.vet.intake.rules.SearchDecision;
import com.vet.intake.rules.SearchGate;
import com.vet.intake.rules.UrgencyWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs an intake session from answers to the one record sent to the practice.
 *
 * <p>Availability: the search gate runs first, then the zone gate, and only then are
 * providers listed and slots searched. Submission is one send plus one write-once save.
 */
@Service
public class AppointmentIntakeService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentIntakeService.class);

    private final IntakeSessionService sessions;
    private final ZoneCheckCoordinator zoneChecks;
    private final ProviderDirectory providers;
    private final VisitDurationEstimator durationEstimator;
    private final AvailabilityMatcher matcher;
    private final PayloadNormalizer normalizer;
    private final SchedulingBackendClient backend;
    private final DebouncedLookup lookup;
    private final IntakeProperties properties;
    private final Clock clock;

    private final Set<String> submitting = ConcurrentHashMap.newKeySet();

    public AppointmentIntakeService(IntakeSessionService sessions,
                                    ZoneCheckCoordinator zoneChecks,
                                    ProviderDirectory providers,
                                    VisitDurationEstimator durationEstimator,
                                    AvailabilityMatcher matcher,
                                    PayloadNormalizer normalizer,
                                    SchedulingBackendClient backend,
                                    DebouncedLookup lookup,
                                    IntakeProperties properties,
                                    Clock clock) {
        this.sessions = sessions;
        this.zoneChecks = zoneChecks;
        this.providers = providers;
        this.durationEstimator = durationEstimator;
        this.matcher = matcher;
        this.normalizer = normalizer;
        this.backend = backend;
        this.lookup = lookup;
        this.properties = properties;
        this.clock = clock;
    }

    /** Gate, zone, providers, search. Only the zone result is written to the session. */
    public SearchOutcome computeAvailability(String sessionId, IntakeDraft draft) {
        sessions.get(sessionId);
        SearchDecision decision = SearchGate.decide(draft.household(), draft.urgency());
        if (!decision.search()) {
            log.info("[{}] Slot search skipped: {}", sessionId, decision.manualReason().wire());
            return SearchOutcome.manualFollowUp(decision.manualReason());
        }

        Requester requester = draft.requester();
        ZoneCheckResult zone = zoneChecks.resolveNow(sessionId, requester);
        if (zone.blocksSearch()) {
            log.info("[{}] Address outside service zones, no provider or slot lookup", sessionId);
            return SearchOutcome.zoneNotServiced();
        }

        int serviceMinutes = durationEstimator.estimateMinutes(draft.household());

        List<Provider> available;
        try {
            available = providers.listFor(requester, zone);
        } catch (RestClientException e) {
            log.warn("[{}] Provider listing failed: {}", sessionId, e.getMessage());
            return SearchOutcome.noSlots(NoOfferReason.SEARCH_FAILED);
        }
        if (available.isEmpty()) {
            return SearchOutcome.noSlots(NoOfferReason.PROVIDER_UNAVAILABLE);
        }
        boolean anyDoctor = ProviderDirectory.isNoPreference(draft.preferredDoctor());
        Optional<Provider> preferred = ProviderDirectory.resolvePreferred(draft.preferredDoctor(), available);
        if (!anyDoctor && preferred.isEmpty()) {
            log.info("[{}] Preferred doctor '{}' not available for this address", sessionId, draft.preferredDoctor());
            return SearchOutcome.noSlots(NoOfferReason.PROVIDER_UNAVAILABLE);
        }

        UrgencyWindow window = decision.window();
        LocalDate today = LocalDate.now(clock);
        PostalAddress address = requester.physicalAddress();
        AvailabilitySearch search = new AvailabilitySearch(
                properties.getPracticeId(),
                window.startDate(today).toString(),
                window.numDays(),
                serviceMinutes,
                address == null ? null : address.toSingleLine(),
                anyDoctor,
                preferred.map(Provider::id).orElse(null));

        JsonNode raw;
        try {
            raw = backend.searchAvailability(search);
        } catch (RestClientException e) {
            log.warn("[{}] Availability search failed: {}", sessionId, e.getMessage());
            return SearchOutcome.noSlots(NoOfferReason.SEARCH_FAILED);
        }
        SlotOffer offer = matcher.match(raw);
        if (!offer.hasOffer()) {
            return SearchOutcome.noSlots(offer.noOfferReason());
        }
        log.info("[{}] Offering {} slot(s) for {} min", sessionId, offer.candidates().size(), serviceMinutes);
        return SearchOutcome.slotsOffered(offer, serviceMinutes);
    }

    public SearchOutcome requestAvailability(String sessionId, IntakeDraft draft) {
        lookup.cancel(searchKey(sessionId));
        SearchOutcome outcome = computeAvailability(sessionId, draft);
        apply(sessionId, outcome, draft);
        return outcome;
    }

    /** Debounced variant for answers that are still changing; the latest draft wins. */
    public void scheduleAvailability(String sessionId, IntakeDraft draft) {
        sessions.get(sessionId);
        lookup.submit(searchKey(sessionId), properties.getSearch().getQuietPeriod(),
                () -> computeAvailability(sessionId, draft),
                outcome -> apply(sessionId, outcome, draft));
    }

    public ObjectNode submit(String sessionId, SubmissionDraft draft) {
        if (!submitting.add(sessionId)) {
            throw new SubmissionConflictException("This appointment request is already being submitted");
        }
        try {
            return doSubmit(sessionId, draft);
        } finally {
            submitting.remove(sessionId);
        }
    }

    private ObjectNode doSubmit(String sessionId, SubmissionDraft draft) {
        IntakeSessionEntity session = sessions.get(sessionId);
        if (sessions.isSubmitted(sessionId)) {
            throw new SubmissionConflictException("This appointment request has already been submitted");
        }
        IntakeDraft intake = draft.intake();
        SlotSelection selection = draft.selection();
        SearchDecision decision = SearchGate.decide(intake.household(), intake.urgency());
        if (!decision.search() && selection.hasPreferences()) {
            throw new IllegalArgumentException("Time preferences can't be chosen for a visit our team schedules with you");
        }

        Requester requester = intake.requester();
        SlotOffer offer = SlotOffer.none(NoOfferReason.SEARCH_SKIPPED);
        Integer serviceMinutes = null;
        if (decision.search()) {
            SearchInputs current = searchInputs(intake, decision.window());
            Optional<SearchInputs> searched = sessions.findSearchInputs(sessionId);
            if (searched.isPresent() && searched.get().equals(current)) {
                offer = sessions.findOffer(sessionId).orElse(offer);
                serviceMinutes = offer.hasOffer() ? current.serviceMinutes() : null;
            } else if (searched.isPresent()) {
                log.info("[{}] Answers changed since the last search, stored offer not used", sessionId);
            }
        }
        requireOffered(selection, offer);
        ZoneCheckResult zone = requester.keepsAddressOnFile()
                ? ZoneCheckResult.onFile()
                : sessions.findZoneResult(sessionId, requester.physicalAddress()).orElse(null);

        Instant submittedAt = Instant.now(clock);
        AppointmentRequest request = AppointmentRequest.builder()
                .requester(requester)
                .household(intake.household())
                .urgency(intake.urgency())
                .preferredDoctor(intake.preferredDoctor())
                .zone(zone)
                .offer(offer)
                .selection(selection)
                .supplemental(draft.supplemental())
                .submittedAt(submittedAt)
                .formFlow(new FormFlow(session.isStartedAsLoggedIn(), session.isStartedAsExistingClient()))
                .serviceMinutesUsed(serviceMinutes)
                .build();
        ObjectNode payload = normalizer.normalize(request);

        try {
            backend.submitForm(payload);
        } catch (RestClientException e) {
            throw new BackendUnavailableException("Form submission failed for session " + sessionId, e);
        }
        sessions.recordSubmission(sessionId, payload, submittedAt);
        log.info("[{}] Appointment request submitted ({})", sessionId, payload.path("appointmentType").asText());
        return payload;
    }

    private void apply(String sessionId, SearchOutcome outcome, IntakeDraft draft) {
        if (outcome.getType() == SearchOutcome.Type.MANUAL_FOLLOW_UP) {
            sessions.recordManualFollowUp(sessionId, outcome.getManualReason());
        } else {
            UrgencyWindow window = SearchGate.decide(draft.household(), draft.urgency()).window();
            sessions.recordOffer(sessionId, outcome.getOffer(), searchInputs(draft, window));
        }
    }

    private SearchInputs searchInputs(IntakeDraft draft, UrgencyWindow window) {
        PostalAddress address = draft.requester().physicalAddress();
        String doctor = ProviderDirectory.isNoPreference(draft.preferredDoctor()) ? null : draft.preferredDoctor().trim();
        return new SearchInputs(window.startDaysFromToday(), window.endDaysFromToday(),
                durationEstimator.estimateMinutes(draft.household()),
                address == null ? null : address.key(), doctor);
    }

    /** Ranked times must come from the offer the requester was shown for these answers. */
    private static void requireOffered(SlotSelection selection, SlotOffer offer) {
        if (!selection.hasPreferences()) {
            return;
        }
        if (!offer.hasOffer()) {
            throw new IllegalArgumentException("No appointment times were offered for these answers, so none can be ranked");
        }
        Set<String> offered = new HashSet<>();
        for (SlotCandidate candidate : offer.candidates()) {
            offered.add(candidate.iso());
        }
        for (String iso : selection.preferencesByIso().keySet()) {
            if (!offered.contains(iso)) {
                throw new IllegalArgumentException(iso + " was not one of the offered appointment times");
            }
        }
    }

    static String searchKey(String sessionId) {
        return "search:" + sessionId;
    }
}
