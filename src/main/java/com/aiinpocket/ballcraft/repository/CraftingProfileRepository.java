package com.aiinpocket.ballcraft.repository;

import com.aiinpocket.ballcraft.model.entity.CraftingProfile;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface CraftingProfileRepository extends JpaRepository<CraftingProfile, Long> {

    Optional<CraftingProfile> findByPlayerId(Long playerId);

    /** 以悲觀寫鎖讀取（SELECT ... FOR UPDATE），同一玩家的合成交易在此排隊 */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM CraftingProfile p WHERE p.playerId = :playerId")
    Optional<CraftingProfile> findByPlayerIdForUpdate(@Param("playerId") Long playerId);
}
