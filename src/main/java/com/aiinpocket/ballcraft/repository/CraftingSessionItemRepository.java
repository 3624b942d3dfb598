package com.aiinpocket.ballcraft.repository;

import com.aiinpocket.ballcraft.model.entity.CraftingSessionItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface CraftingSessionItemRepository extends JpaRepository<CraftingSessionItem, Long> {

    /** 依加入順序列出暫存項目（fetch 球、球種與特殊效果） */
    @Query("""
        SELECT si FROM CraftingSessionItem si
        JOIN FETCH si.ballInstance bi
        JOIN FETCH bi.ball
        LEFT JOIN FETCH bi.special
        WHERE si.session.id = :sessionId
        ORDER BY si.id ASC
    """)
    List<CraftingSessionItem> findStagedItems(@Param("sessionId") Long sessionId);

    boolean existsBySessionIdAndBallInstanceId(Long sessionId, Long ballInstanceId);

    Optional<CraftingSessionItem> findBySessionIdAndBallInstanceId(Long sessionId, Long ballInstanceId);

    long countBySessionId(Long sessionId);
}
