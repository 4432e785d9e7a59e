package com.vet.intake.repository;

import com.vet.intake.entity.AppointmentRequestEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AppointmentRequestRepository extends JpaRepository<AppointmentRequestEntity, Long> {

    boolean existsBySessionId(String sessionId);

    Optional<AppointmentRequestEntity> findBySessionId(String sessionId);
}
