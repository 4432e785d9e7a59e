package com.vet.intake.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vet.intake.domain.FormFlow;
import com.vet.intake.domain.NoOfferReason;
import com.vet.intake.domain.PostalAddress;
import com.vet.intake.domain.SearchInputs;
import com.vet.intake.domain.SlotOffer;
import com.vet.intake.domain.ZoneCheckResult;
import com.vet.intake.domain.ZoneStatus;
import com.vet.intake.entity.AppointmentRequestEntity;
import com.vet.intake.entity.IntakeSessionEntity;
import com.vet.intake.exception.IntakeSessionNotFoundException;
import com.vet.intake.exception.SubmissionConflictException;
import com.vet.intake.repository.AppointmentRequestRepository;
import com.vet.intake.repository.IntakeSessionRepository;
import com.vet.intake.rules.ManualSchedulingReason;
import com.vet.intake.utils.IntakeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-session state: the zone result for the current address, the last slot offer and
 * where the session stands. Cached results are kept for the rest of the session.
 */
@Service
public class IntakeSessionService {

    private static final Logger log = LoggerFactory.getLogger(IntakeSessionService.class);

    private final IntakeSessionRepository repository;
    private final AppointmentRequestRepository requestRepository;
    private final ObjectMapper mapper;

    public IntakeSessionService(IntakeSessionRepository repository,
                                AppointmentRequestRepository requestRepository,
                                ObjectMapper mapper) {
        this.repository = repository;
        this.requestRepository = requestRepository;
        this.mapper = mapper;
    }

    @Transactional
    public IntakeSessionEntity create(FormFlow formFlow) {
        IntakeSessionEntity session = IntakeSessionEntity.builder()
                .sessionId(UUID.randomUUID().toString())
                .state(IntakeState.COLLECTING)
                .startedAsLoggedIn(formFlow != null && formFlow.startedAsLoggedIn())
                .startedAsExistingClient(formFlow != null && formFlow.startedAsExistingClient())
                .build();
        session = repository.save(session);
        log.info("Created intake session {}", session.getSessionId());
        return session;
    }

    @Transactional(readOnly = true)
    public IntakeSessionEntity get(String sessionId) {
        return repository.findBySessionId(sessionId)
                .orElseThrow(() -> new IntakeSessionNotFoundException(sessionId));
    }

    /** The cached result for {@code address}, if one was recorded for that same address. */
    @Transactional(readOnly = true)
    public Optional<ZoneCheckResult> findZoneResult(String sessionId, PostalAddress address) {
        IntakeSessionEntity session = get(sessionId);
        if (address == null || session.getZoneStatus() == null || !address.key().equals(session.getZoneAddressKey())) {
            return Optional.empty();
        }
        return Optional.of(new ZoneCheckResult(session.getZoneStatus(), session.getZoneId(), session.getZoneName()));
    }

    @Transactional
    public IntakeSessionEntity recordZoneResult(String sessionId, PostalAddress address, ZoneCheckResult result) {
        IntakeSessionEntity session = get(sessionId);
        if (!result.status().isDefinitive()) {
            log.debug("[{}] Inconclusive zone result not cached", sessionId);
            return session;
        }
        if (session.getState() == IntakeState.SUBMITTED) {
            log.debug("[{}] Zone result arrived after submission, ignored", sessionId);
            return session;
        }
        session.setZoneAddressKey(address.key());
        session.setZoneStatus(result.status());
        session.setZoneId(result.zoneId());
        session.setZoneName(result.zoneName());
        if (result.status() == ZoneStatus.NOT_SERVICED) {
            session.setState(IntakeState.ZONE_NOT_SERVICED);
            session.setOfferJson(null);
            session.setServiceMinutes(null);
            storeSearchInputs(session, null);
        } else if (session.getState() == IntakeState.ZONE_NOT_SERVICED) {
            session.setState(IntakeState.COLLECTING);
        }
        log.info("[{}] Zone {} recorded", sessionId, result.status().wire());
        return repository.save(session);
    }

    @Transactional
    public IntakeSessionEntity recordOffer(String sessionId, SlotOffer offer, SearchInputs inputs) {
        IntakeSessionEntity session = get(sessionId);
        requireOpen(session);
        session.setOfferJson(write(offer));
        session.setServiceMinutes(offer.hasOffer() ? inputs.serviceMinutes() : null);
        storeSearchInputs(session, inputs);
        session.setManualReason(null);
        if (offer.hasOffer()) {
            session.setState(IntakeState.SLOTS_OFFERED);
        } else if (offer.noOfferReason() == NoOfferReason.ZONE_NOT_SERVICED) {
            session.setState(IntakeState.ZONE_NOT_SERVICED);
        } else {
            session.setState(IntakeState.COLLECTING);
        }
        return repository.save(session);
    }

    @Transactional
    public IntakeSessionEntity recordManualFollowUp(String sessionId, ManualSchedulingReason reason) {
        IntakeSessionEntity session = get(sessionId);
        requireOpen(session);
        session.setOfferJson(write(SlotOffer.none(NoOfferReason.SEARCH_SKIPPED)));
        session.setServiceMinutes(null);
        storeSearchInputs(session, null);
        session.setManualReason(reason.wire());
        session.setState(IntakeState.MANUAL_FOLLOW_UP);
        return repository.save(session);
    }

    @Transactional(readOnly = true)
    public Optional<SlotOffer> findOffer(String sessionId) {
        IntakeSessionEntity session = get(sessionId);
        if (session.getOfferJson() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(session.getOfferJson(), SlotOffer.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored slot offer for session " + sessionId + " is unreadable", e);
        }
    }

    /** Inputs of the search behind the stored offer. */
    @Transactional(readOnly = true)
    public Optional<SearchInputs> findSearchInputs(String sessionId) {
        IntakeSessionEntity session = get(sessionId);
        if (session.getSearchWindowStart() == null || session.getSearchServiceMinutes() == null) {
            return Optional.empty();
        }
        return Optional.of(new SearchInputs(session.getSearchWindowStart(), session.getSearchWindowEnd(),
                session.getSearchServiceMinutes(), session.getSearchAddressKey(), session.getSearchDoctor()));
    }

    @Transactional(readOnly = true)
    public boolean isSubmitted(String sessionId) {
        return requestRepository.existsBySessionId(sessionId);
    }

    @Transactional
    public AppointmentRequestEntity recordSubmission(String sessionId, ObjectNode payload, Instant submittedAt) {
        IntakeSessionEntity session = get(sessionId);
        requireOpen(session);
        AppointmentRequestEntity record = AppointmentRequestEntity.builder()
                .sessionId(sessionId)
                .appointmentType(payload.path("appointmentType").asText())
                .requiresManualScheduling(payload.path("requiresManualScheduling").asBoolean(false))
                .payload(payload.toString())
                .submittedAt(submittedAt)
                .build();
        record = requestRepository.save(record);
        session.setState(IntakeState.SUBMITTED);
        repository.save(session);
        log.info("[{}] Appointment request stored ({})", sessionId, record.getAppointmentType());
        return record;
    }

    private void requireOpen(IntakeSessionEntity session) {
        if (session.getState() == IntakeState.SUBMITTED || requestRepository.existsBySessionId(session.getSessionId())) {
            throw new SubmissionConflictException("This appointment request has already been submitted");
        }
    }

    private static void storeSearchInputs(IntakeSessionEntity session, SearchInputs inputs) {
        session.setSearchWindowStart(inputs == null ? null : inputs.windowStartDays());
        session.setSearchWindowEnd(inputs == null ? null : inputs.windowEndDays());
        session.setSearchServiceMinutes(inputs == null ? null : inputs.serviceMinutes());
        session.setSearchAddressKey(inputs == null ? null : inputs.addressKey());
        session.setSearchDoctor(inputs == null ? null : inputs.preferredDoctor());
    }

    private String write(SlotOffer offer) {
        try {
            return mapper.writeValueAsString(offer);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not store slot offer", e);
        }
    }
}
