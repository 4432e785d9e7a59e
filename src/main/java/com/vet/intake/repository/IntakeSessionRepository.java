package com.vet.intake.repository;

import com.vet.intake.entity.IntakeSessionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface IntakeSessionRepository extends JpaRepository<IntakeSessionEntity, Long> {

    Optional<IntakeSessionEntity> findBySessionId(String sessionId);
}
