package com.vet.intake.service;

import com.vet.intake.component.DebouncedLookup;
import com.vet.intake.config.IntakeProperties;
import com.vet.intake.domain.PostalAddress;
import com.vet.intake.domain.ZoneCheckResult;
import com.vet.intake.domain.ZoneStatus;
import com.vet.intake.integration.SchedulingBackendClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

import static com.vet.intake.IntakeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ZoneCheckCoordinatorTests {

    private static final String SESSION = "s-1";

    private SchedulingBackendClient backend;
    private IntakeSessionService sessions;
    private TaskScheduler scheduler;
    private ZoneCheckCoordinator coordinator;

    @BeforeEach
    void setUp() {
        backend = mock(SchedulingBackendClient.class);
        sessions = mock(IntakeSessionService.class);
        scheduler = mock(TaskScheduler.class);
        doReturn(mock(ScheduledFuture.class)).when(scheduler).schedule(any(Runnable.class), any(Instant.class));
        when(backend.findZone(anyString())).thenReturn(ResponseEntity.ok().build());
        coordinator = new ZoneCheckCoordinator(new ZoneGate(backend), sessions,
                new DebouncedLookup(scheduler, Clock.systemUTC()), new IntakeProperties());
    }

    @Test
    void incompleteAddressNeverTriggersALookup() {
        PostalAddress typing = PostalAddress.of("24 Orch", "", "", "");

        assertEquals(ZoneCheckCoordinator.Trigger.INCOMPLETE, coordinator.onAddressEdited(SESSION, newClient(typing)));
        assertEquals(ZoneCheckCoordinator.Trigger.INCOMPLETE,
                coordinator.onAddressEdited(SESSION, newClient(PostalAddress.of("24 Orchard Ln", "Durham", "ME", ""))));

        verifyNoInteractions(scheduler);
        verifyNoInteractions(backend);
    }

    @Test
    void stableCompleteAddressIsLookedUpExactlyOnce() {
        for (int i = 0; i < 3; i++) {
            assertEquals(ZoneCheckCoordinator.Trigger.SCHEDULED,
                    coordinator.onAddressEdited(SESSION, newClient(orchardLane())));
        }
        runScheduled();

        verify(backend, times(1)).findZone("24 Orchard Ln, Durham, ME, 04111");
        verify(sessions, times(1)).recordZoneResult(eq(SESSION), eq(orchardLane()), any(ZoneCheckResult.class));
    }

    @Test
    void onlyTheLatestAddressIsRecorded() {
        coordinator.onAddressEdited(SESSION, newClient(orchardLane()));
        coordinator.onAddressEdited(SESSION, newClient(harborStreet()));
        runScheduled();

        verify(backend, never()).findZone("24 Orchard Ln, Durham, ME, 04111");
        verify(backend).findZone("9 Harbor St, Portland, ME, 04101");
        verify(sessions).recordZoneResult(eq(SESSION), eq(harborStreet()), any(ZoneCheckResult.class));
    }

    @Test
    void addressOnFileIsNeverChecked() {
        assertEquals(ZoneCheckCoordinator.Trigger.NOT_REQUIRED, coordinator.onAddressEdited(SESSION, existingLoggedIn()));
        assertEquals(ZoneCheckCoordinator.Trigger.NOT_REQUIRED, coordinator.onAddressEdited(SESSION, existingLoggedOut()));

        assertEquals(ZoneStatus.SERVICED, coordinator.resolveNow(SESSION, existingLoggedIn()).status());
        verifyNoInteractions(scheduler);
        verifyNoInteractions(backend);
    }

    @Test
    void existingHolderWithANewAddressIsCheckedLikeANewClient() {
        assertEquals(ZoneCheckCoordinator.Trigger.SCHEDULED,
                coordinator.onAddressEdited(SESSION, existingMoved(harborStreet())));
        runScheduled();

        verify(backend).findZone("9 Harbor St, Portland, ME, 04101");
    }

    @Test
    void cachedResultForTheSameAddressIsReused() {
        when(sessions.findZoneResult(SESSION, orchardLane())).thenReturn(Optional.of(ZoneCheckResult.notServiced()));

        assertEquals(ZoneCheckCoordinator.Trigger.CACHED, coordinator.onAddressEdited(SESSION, newClient(orchardLane())));
        assertEquals(ZoneStatus.NOT_SERVICED, coordinator.resolveNow(SESSION, newClient(orchardLane())).status());

        verifyNoInteractions(scheduler);
        verifyNoInteractions(backend);
    }

    @Test
    void resolveNowLooksUpSynchronouslyWhenNothingIsCached() {
        ZoneCheckResult result = coordinator.resolveNow(SESSION, newClient(orchardLane()));

        assertEquals(ZoneStatus.SERVICED, result.status());
        verify(backend).findZone("24 Orchard Ln, Durham, ME, 04111");
        verify(sessions).recordZoneResult(SESSION, orchardLane(), result);
    }

    private void runScheduled() {
        ArgumentCaptor<Runnable> tasks = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler, atLeastOnce()).schedule(tasks.capture(), any(Instant.class));
        List<Runnable> all = tasks.getAllValues();
        all.forEach(Runnable::run);
    }
}
