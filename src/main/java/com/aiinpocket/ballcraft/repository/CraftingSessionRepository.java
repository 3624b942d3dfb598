package com.aiinpocket.ballcraft.repository;

import com.aiinpocket.ballcraft.model.entity.CraftingSession;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface CraftingSessionRepository extends JpaRepository<CraftingSession, Long> {

    Optional<CraftingSession> findByPlayerId(Long playerId);

    List<CraftingSession> findByExpiresAtBefore(Instant cutoff);
}
