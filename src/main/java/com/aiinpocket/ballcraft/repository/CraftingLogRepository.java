package com.aiinpocket.ballcraft.repository;

import com.aiinpocket.ballcraft.model.entity.CraftingLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CraftingLogRepository extends JpaRepository<CraftingLog, Long> {

    List<CraftingLog> findTop20ByPlayerIdOrderByCreatedAtDescIdDesc(Long playerId);
}
