package com.vet.intake.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vet.intake.domain.SlotOffer;
import com.vet.intake.domain.ZoneCheckResult;
import com.vet.intake.entity.IntakeSessionEntity;
import com.vet.intake.utils.IntakeState;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionView(
        String sessionId,
        IntakeState state,
        ZoneCheckResult zone,
        SlotOffer offer,
        Integer serviceMinutes,
        String manualSchedulingReason
) {

    public static SessionView of(IntakeSessionEntity session, SlotOffer offer) {
        ZoneCheckResult zone = session.getZoneStatus() == null ? null
                : new ZoneCheckResult(session.getZoneStatus(), session.getZoneId(), session.getZoneName());
        return new SessionView(session.getSessionId(), session.getState(), zone, offer,
                session.getServiceMinutes(), session.getManualReason());
    }
}
