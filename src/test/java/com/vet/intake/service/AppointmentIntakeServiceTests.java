package com.vet.intake.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vet.intake.component.DebouncedLookup;
import com.vet.intake.config.IntakeProperties;
import com.vet.intake.domain.Household;
import com.vet.intake.domain.Need;
import com.vet.intake.domain.NoOfferReason;
import com.vet.intake.domain.Provider;
import com.vet.intake.domain.Requester;
import com.vet.intake.domain.SearchInputs;
import com.vet.intake.domain.SlotCandidate;
import com.vet.intake.domain.SlotOffer;
import com.vet.intake.domain.SlotSelection;
import com.vet.intake.domain.UrgencyLevel;
import com.vet.intake.domain.ZoneCheckResult;
import com.vet.intake.dto.IntakeDraft;
import com.vet.intake.dto.SearchOutcome;
import com.vet.intake.dto.SubmissionDraft;
import com.vet.intake.entity.IntakeSessionEntity;
import com.vet.intake.exception.BackendUnavailableException;
import com.vet.intake.exception.SubmissionConflictException;
import com.vet.intake.integration.AvailabilitySearch;
import com.vet.intake.integration.SchedulingBackendClient;
import com.vet.intake.rules.ManualSchedulingReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.client.ResourceAccessException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.vet.intake.IntakeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AppointmentIntakeServiceTests {

    private static final String SESSION = "s-42";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-15T15:30:00Z"), ZoneOffset.UTC);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private IntakeSessionService sessions;
    private ZoneCheckCoordinator zoneChecks;
    private ProviderDirectory providers;
    private SchedulingBackendClient backend;
    private DebouncedLookup lookup;
    private AppointmentIntakeService service;

    @BeforeEach
    void setUp() {
        sessions = mock(IntakeSessionService.class);
        zoneChecks = mock(ZoneCheckCoordinator.class);
        providers = mock(ProviderDirectory.class);
        backend = mock(SchedulingBackendClient.class);
        lookup = mock(DebouncedLookup.class);
        IntakeProperties properties = new IntakeProperties();
        service = new AppointmentIntakeService(sessions, zoneChecks, providers,
                new VisitDurationEstimator(properties), new AvailabilityMatcher(), new PayloadNormalizer(MAPPER),
                backend, lookup, properties, CLOCK);

        when(sessions.get(SESSION)).thenReturn(IntakeSessionEntity.builder()
                .sessionId(SESSION)
                .startedAsLoggedIn(false)
                .startedAsExistingClient(false)
                .serviceMinutes(60)
                .build());
    }

    @Test
    void addressOutsideServiceZonesSkipsProvidersAndSearch() {
        when(zoneChecks.resolveNow(eq(SESSION), any(Requester.class))).thenReturn(ZoneCheckResult.notServiced());

        SearchOutcome outcome = service.computeAvailability(SESSION, newClientDraft(UrgencyLevel.THIS_WEEK, wellness()));

        assertEquals(SearchOutcome.Type.ZONE_NOT_SERVICED, outcome.getType());
        verifyNoInteractions(providers);
        verifyNoInteractions(backend);
    }

    @Test
    void endOfLifeVisitIsNeverSearchedWhateverTheUrgency() {
        SearchOutcome outcome = service.computeAvailability(SESSION,
                newClientDraft(UrgencyLevel.ABOUT_6_MONTHS, endOfLife()));

        assertEquals(SearchOutcome.Type.MANUAL_FOLLOW_UP, outcome.getType());
        assertEquals(ManualSchedulingReason.END_OF_LIFE, outcome.getManualReason());
        verifyNoInteractions(zoneChecks);
        verifyNoInteractions(backend);
    }

    @Test
    void urgentVisitGoesToManualFollowUp() {
        SearchOutcome outcome = service.requestAvailability(SESSION,
                newClientDraft(UrgencyLevel.WITHIN_48_HOURS, sick("Limping since last night")));

        assertEquals(ManualSchedulingReason.URGENT, outcome.getManualReason());
        verify(sessions).recordManualFollowUp(SESSION, ManualSchedulingReason.URGENT);
        verifyNoInteractions(zoneChecks);
    }

    @Test
    void servicedAddressSearchesTheUrgencyWindow() throws Exception {
        when(zoneChecks.resolveNow(eq(SESSION), any(Requester.class)))
                .thenReturn(ZoneCheckResult.serviced("z-3", "North"));
        when(providers.listFor(any(Requester.class), any(ZoneCheckResult.class)))
                .thenReturn(List.of(new Provider("d-1", "Dr. Ana Patel", null)));
        when(backend.searchAvailability(any(AvailabilitySearch.class))).thenReturn(MAPPER.readTree(
                "{\"candidates\":[{\"suggestedStartIso\":\"2024-01-16T10:02:00-05:00\",\"doctorId\":\"d-1\"},"
                        + "{\"suggestedStartIso\":\"2024-01-17T13:30:00-05:00\",\"doctorId\":\"d-1\"}]}"));

        SearchOutcome outcome = service.requestAvailability(SESSION, newClientDraft(UrgencyLevel.THIS_WEEK, wellness()));

        ArgumentCaptor<AvailabilitySearch> search = ArgumentCaptor.forClass(AvailabilitySearch.class);
        verify(backend).searchAvailability(search.capture());
        assertEquals("2024-01-16", search.getValue().startDate());
        assertEquals(7, search.getValue().numDays());
        assertEquals(40, search.getValue().serviceMinutes());
        assertTrue(search.getValue().allowOtherDoctors());
        assertNull(search.getValue().doctorId());

        assertEquals(SearchOutcome.Type.SLOTS_OFFERED, outcome.getType());
        assertEquals("2024-01-16T10:02:00-05:00", outcome.getOffer().winner().iso());
        assertEquals(LocalTime.of(10, 0), outcome.getOffer().winner().time());
        assertEquals(1, outcome.getOffer().alternates().size());
        verify(sessions).recordOffer(SESSION, outcome.getOffer(), thisWeekInputs());
    }

    @Test
    void namedDoctorIsPassedToTheSearch() {
        when(zoneChecks.resolveNow(eq(SESSION), any(Requester.class)))
                .thenReturn(ZoneCheckResult.serviced("z-3", "North"));
        when(providers.listFor(any(Requester.class), any(ZoneCheckResult.class)))
                .thenReturn(List.of(new Provider("d-1", "Dr. Ana Patel", null), new Provider("d-2", "Dr. Lee Brooks", null)));
        when(backend.searchAvailability(any(AvailabilitySearch.class))).thenReturn(MAPPER.createArrayNode());

        IntakeDraft draft = new IntakeDraft(newClient(orchardLane()),
                singleNewAnimal(wellness()), UrgencyLevel.WITHIN_MONTH, "Dr. Lee Brooks");
        SearchOutcome outcome = service.computeAvailability(SESSION, draft);

        ArgumentCaptor<AvailabilitySearch> search = ArgumentCaptor.forClass(AvailabilitySearch.class);
        verify(backend).searchAvailability(search.capture());
        assertEquals("d-2", search.getValue().doctorId());
        assertFalse(search.getValue().allowOtherDoctors());
        assertEquals(NoOfferReason.NONE_FOUND, outcome.getOffer().noOfferReason());
    }

    @Test
    void unavailablePreferredDoctorEndsWithoutSearching() {
        when(zoneChecks.resolveNow(eq(SESSION), any(Requester.class)))
                .thenReturn(ZoneCheckResult.serviced("z-3", "North"));
        when(providers.listFor(any(Requester.class), any(ZoneCheckResult.class)))
                .thenReturn(List.of(new Provider("d-1", "Dr. Ana Patel", null)));

        IntakeDraft draft = new IntakeDraft(newClient(orchardLane()),
                singleNewAnimal(wellness()), UrgencyLevel.WITHIN_MONTH, "Dr. Someone Else");
        SearchOutcome outcome = service.computeAvailability(SESSION, draft);

        assertEquals(NoOfferReason.PROVIDER_UNAVAILABLE, outcome.getOffer().noOfferReason());
        verify(backend, never()).searchAvailability(any());
    }

    @Test
    void failedSearchIsReportedAsNoOffer() {
        when(zoneChecks.resolveNow(eq(SESSION), any(Requester.class)))
                .thenReturn(ZoneCheckResult.serviced("z-3", "North"));
        when(providers.listFor(any(Requester.class), any(ZoneCheckResult.class)))
                .thenReturn(List.of(new Provider("d-1", "Dr. Ana Patel", null)));
        when(backend.searchAvailability(any(AvailabilitySearch.class)))
                .thenThrow(new ResourceAccessException("read timed out"));

        SearchOutcome outcome = service.computeAvailability(SESSION, newClientDraft(UrgencyLevel.THIS_WEEK, wellness()));

        assertEquals(SearchOutcome.Type.NO_SLOTS, outcome.getType());
        assertEquals(NoOfferReason.SEARCH_FAILED, outcome.getOffer().noOfferReason());
    }

    @Test
    void scheduledAvailabilityGoesThroughTheDebouncer() {
        service.scheduleAvailability(SESSION, newClientDraft(UrgencyLevel.THIS_WEEK, wellness()));

        verify(lookup).submit(eq("search:" + SESSION), any(), any(), any());
        verifyNoInteractions(backend);
    }

    @Test
    void submitSendsOnceAndStores() {
        when(sessions.findZoneResult(eq(SESSION), any())).thenReturn(Optional.of(ZoneCheckResult.serviced("z-3", "North")));
        when(sessions.findSearchInputs(SESSION)).thenReturn(Optional.of(thisWeekInputs()));
        when(sessions.findOffer(SESSION)).thenReturn(Optional.of(SlotOffer.none(NoOfferReason.NONE_FOUND)));

        ObjectNode payload = service.submit(SESSION,
                new SubmissionDraft(newClientDraft(UrgencyLevel.THIS_WEEK, wellness()), SlotSelection.none(), null));

        verify(backend, times(1)).submitForm(payload);
        verify(sessions).recordSubmission(SESSION, payload, Instant.parse("2024-01-15T15:30:00Z"));
        assertEquals("new", payload.get("clientType").asText());
        assertEquals("2024-01-15T15:30:00Z", payload.get("submittedAt").asText());
        assertEquals("none_found", payload.get("slotSearchOutcome").asText());
    }

    @Test
    void rankedOfferedTimesAreSubmittedWithTheVisitLength() {
        when(sessions.findSearchInputs(SESSION)).thenReturn(Optional.of(thisWeekInputs()));
        when(sessions.findOffer(SESSION)).thenReturn(Optional.of(storedOffer()));

        ObjectNode payload = service.submit(SESSION, new SubmissionDraft(
                newClientDraft(UrgencyLevel.THIS_WEEK, wellness()), ranking("2024-01-17T13:30:00-05:00"), null));

        assertEquals(40, payload.get("serviceMinutes").asInt());
        JsonNode first = payload.get("selectedDateTimePreferences").get(0);
        assertEquals("2024-01-17T13:30:00-05:00", first.get("dateTime").asText());
        assertEquals("Wed, Jan 17 at 1:30 PM", first.get("display").asText());
        verify(backend).submitForm(payload);
    }

    @Test
    void preferencesAreRejectedWhenTheZoneWasNotServiced() {
        when(sessions.findSearchInputs(SESSION)).thenReturn(Optional.of(thisWeekInputs()));
        when(sessions.findOffer(SESSION)).thenReturn(Optional.of(SlotOffer.none(NoOfferReason.ZONE_NOT_SERVICED)));

        assertThrows(IllegalArgumentException.class, () -> service.submit(SESSION, new SubmissionDraft(
                newClientDraft(UrgencyLevel.THIS_WEEK, wellness()), ranking("2024-01-16T10:00:00-05:00"), null)));
        verifyNoInteractions(backend);
        verify(sessions, never()).recordSubmission(anyString(), any(), any());
    }

    @Test
    void preferencesAreRejectedWhenNothingWasSearched() {
        assertThrows(IllegalArgumentException.class, () -> service.submit(SESSION, new SubmissionDraft(
                newClientDraft(UrgencyLevel.THIS_WEEK, wellness()), ranking("2024-01-16T10:00:00-05:00"), null)));
        verifyNoInteractions(backend);
    }

    @Test
    void preferenceForATimeThatWasNotOfferedIsRejected() {
        when(sessions.findSearchInputs(SESSION)).thenReturn(Optional.of(thisWeekInputs()));
        when(sessions.findOffer(SESSION)).thenReturn(Optional.of(storedOffer()));

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> service.submit(SESSION,
                new SubmissionDraft(newClientDraft(UrgencyLevel.THIS_WEEK, wellness()),
                        ranking("2024-01-18T09:00:00-05:00"), null)));
        assertTrue(error.getMessage().contains("2024-01-18T09:00:00-05:00"));
        verifyNoInteractions(backend);
    }

    @Test
    void offerFromEarlierAnswersIsNotSubmitted() {
        when(sessions.findSearchInputs(SESSION)).thenReturn(Optional.of(thisWeekInputs()));
        when(sessions.findOffer(SESSION)).thenReturn(Optional.of(storedOffer()));

        ObjectNode payload = service.submit(SESSION, new SubmissionDraft(
                newClientDraft(UrgencyLevel.ABOUT_12_MONTHS, wellness()), SlotSelection.none(), null));

        assertEquals("search_skipped", payload.get("slotSearchOutcome").asText());
        assertFalse(payload.has("serviceMinutes"));
        assertTrue(payload.get("selectedDateTimePreferences").isNull());
        verify(sessions, never()).findOffer(anyString());
    }

    @Test
    void offerFromAnotherAddressCannotBeRanked() {
        when(sessions.findSearchInputs(SESSION)).thenReturn(Optional.of(thisWeekInputs()));
        when(sessions.findOffer(SESSION)).thenReturn(Optional.of(storedOffer()));

        IntakeDraft moved = new IntakeDraft(newClient(harborStreet()), singleNewAnimal(wellness()),
                UrgencyLevel.THIS_WEEK, null);

        assertThrows(IllegalArgumentException.class, () -> service.submit(SESSION,
                new SubmissionDraft(moved, ranking("2024-01-16T10:00:00-05:00"), null)));
        verifyNoInteractions(backend);
    }

    @Test
    void secondSubmissionIsRejected() {
        when(sessions.isSubmitted(SESSION)).thenReturn(true);

        assertThrows(SubmissionConflictException.class, () -> service.submit(SESSION,
                new SubmissionDraft(newClientDraft(UrgencyLevel.THIS_WEEK, wellness()), SlotSelection.none(), null)));
        verifyNoInteractions(backend);
    }

    @Test
    void timePreferencesAreRejectedForAManualFollowUpVisit() {
        Map<String, Integer> picks = new LinkedHashMap<>();
        picks.put("2024-01-16T10:00:00-05:00", 1);

        assertThrows(IllegalArgumentException.class, () -> service.submit(SESSION, new SubmissionDraft(
                newClientDraft(UrgencyLevel.SAME_DAY, sick("Vomiting")), new SlotSelection(picks, false, null), null)));
        verifyNoInteractions(backend);
    }

    @Test
    void backendFailureLeavesTheSessionOpen() {
        when(backend.submitForm(any(ObjectNode.class))).thenThrow(new ResourceAccessException("connection refused"));

        assertThrows(BackendUnavailableException.class, () -> service.submit(SESSION,
                new SubmissionDraft(newClientDraft(UrgencyLevel.SAME_DAY, sick("Vomiting")), SlotSelection.none(), null)));
        verify(sessions, never()).recordSubmission(anyString(), any(), any());
    }

    @Test
    void endOfLifeSubmissionAsksForManualScheduling() {
        ObjectNode payload = service.submit(SESSION,
                new SubmissionDraft(newClientDraft(UrgencyLevel.ABOUT_3_MONTHS, endOfLife()), SlotSelection.none(), null));

        JsonNode sent = payload;
        assertTrue(sent.get("selectedDateTimePreferences").isNull());
        assertTrue(sent.get("requiresManualScheduling").asBoolean());
        assertEquals("end_of_life", sent.get("manualSchedulingReason").asText());
        verify(sessions, never()).findOffer(anyString());
    }

    private static SearchInputs thisWeekInputs() {
        return new SearchInputs(1, 7, 40, orchardLane().key(), null);
    }

    private static SlotOffer storedOffer() {
        SlotCandidate winner = new SlotCandidate(LocalDate.of(2024, 1, 16), LocalTime.of(10, 0),
                "2024-01-16T10:00:00-05:00", "Tue, Jan 16 at 10:00 AM", "d-1", "Dr. Ana Patel");
        SlotCandidate alternate = new SlotCandidate(LocalDate.of(2024, 1, 17), LocalTime.of(13, 30),
                "2024-01-17T13:30:00-05:00", "Wed, Jan 17 at 1:30 PM", "d-1", "Dr. Ana Patel");
        return SlotOffer.of(winner, List.of(alternate));
    }

    private static SlotSelection ranking(String iso) {
        Map<String, Integer> picks = new LinkedHashMap<>();
        picks.put(iso, 1);
        return new SlotSelection(picks, false, null);
    }

    private static IntakeDraft newClientDraft(UrgencyLevel urgency, Need need) {
        return new IntakeDraft(newClient(orchardLane()), singleNewAnimal(need), urgency, null);
    }

    private static Household singleNewAnimal(Need need) {
        return new Household.NewAnimalsOnly(List.of(newAnimal("Mochi")), need);
    }
}
