package com.vet.intake.entity;

import com.vet.intake.domain.ZoneStatus;
import com.vet.intake.utils.IntakeState;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "intake_session", indexes = {
    @Index(name = "idx_intake_session_session_id", columnList = "session_id", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IntakeSessionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, unique = true)
    private String sessionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private IntakeState state = IntakeState.COLLECTING;

    /** {@link com.vet.intake.domain.PostalAddress#key()} of the address the zone result belongs to. */
    @Column(length = 1024)
    private String zoneAddressKey;

    @Enumerated(EnumType.STRING)
    private ZoneStatus zoneStatus;

    private String zoneId;

    private String zoneName;

    @Lob
    private String offerJson;

    private Integer serviceMinutes;

    /** Inputs of the search {@link #offerJson} came from; all null when no search was stored. */
    private Integer searchWindowStart;

    private Integer searchWindowEnd;

    private Integer searchServiceMinutes;

    @Column(length = 1024)
    private String searchAddressKey;

    private String searchDoctor;

    private String manualReason;

    private boolean startedAsLoggedIn;

    private boolean startedAsExistingClient;

    private Instant createdAt;

    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
