package com.vet.intake.controller;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vet.intake.domain.FormFlow;
import com.vet.intake.domain.Requester;
import com.vet.intake.dto.IntakeDraft;
import com.vet.intake.dto.SearchOutcome;
import com.vet.intake.dto.SessionView;
import com.vet.intake.dto.SubmissionDraft;
import com.vet.intake.entity.IntakeSessionEntity;
import com.vet.intake.service.AppointmentIntakeService;
import com.vet.intake.service.IntakeSessionService;
import com.vet.intake.service.ZoneCheckCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/intake/sessions")
public class IntakeController {

    private static final Logger log = LoggerFactory.getLogger(IntakeController.class);

    private final IntakeSessionService sessions;
    private final ZoneCheckCoordinator zoneChecks;
    private final AppointmentIntakeService intake;

    public IntakeController(IntakeSessionService sessions, ZoneCheckCoordinator zoneChecks,
                            AppointmentIntakeService intake) {
        this.sessions = sessions;
        this.zoneChecks = zoneChecks;
        this.intake = intake;
    }

    @PostMapping
    public ResponseEntity<SessionView> create(@RequestBody(required = false) FormFlow formFlow) {
        IntakeSessionEntity session = sessions.create(formFlow);
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionView.of(session, null));
    }

    @GetMapping("/{sessionId}")
    public SessionView get(@PathVariable String sessionId) {
        IntakeSessionEntity session = sessions.get(sessionId);
        return SessionView.of(session, sessions.findOffer(sessionId).orElse(null));
    }

    /** Called on every address edit; the zone lookup itself happens once the address settles. */
    @PutMapping("/{sessionId}/address")
    public ResponseEntity<Map<String, String>> addressEdited(@PathVariable String sessionId,
                                                             @RequestBody Requester requester) {
        ZoneCheckCoordinator.Trigger trigger = zoneChecks.onAddressEdited(sessionId, requester);
        log.debug("[{}] Address edit -> {}", sessionId, trigger);
        return ResponseEntity.accepted().body(Map.of("zoneCheck", trigger.name()));
    }

    @PostMapping("/{sessionId}/availability")
    public ResponseEntity<SearchOutcome> availability(@PathVariable String sessionId,
                                                      @RequestBody IntakeDraft draft,
                                                      @RequestParam(name = "async", defaultValue = "false") boolean async) {
        if (async) {
            intake.scheduleAvailability(sessionId, draft);
            return ResponseEntity.accepted().build();
        }
        return ResponseEntity.ok(intake.requestAvailability(sessionId, draft));
    }

    @PostMapping("/{sessionId}/submit")
    public ObjectNode submit(@PathVariable String sessionId, @RequestBody SubmissionDraft draft) {
        return intake.submit(sessionId, draft);
    }
}
