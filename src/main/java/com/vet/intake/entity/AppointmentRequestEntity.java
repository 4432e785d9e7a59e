package com.vet.intake.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * The record exactly as it was sent to the practice. Written once per session.
 */
@Entity
@Table(name = "appointment_request", indexes = {
    @Index(name = "idx_appointment_request_session_id", columnList = "session_id", unique = true)
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AppointmentRequestEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, unique = true, updatable = false)
    private String sessionId;

    @Column(nullable = false, updatable = false)
    private String appointmentType;

    private boolean requiresManualScheduling;

    @Lob
    @Column(nullable = false, updatable = false)
    private String payload;

    @Column(nullable = false, updatable = false)
    private Instant submittedAt;
}
