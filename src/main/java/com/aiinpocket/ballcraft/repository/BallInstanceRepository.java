package com.aiinpocket.ballcraft.repository;

import com.aiinpocket.ballcraft.model.entity.BallInstance;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface BallInstanceRepository extends JpaRepository<BallInstance, Long> {

    long countByPlayerIdAndBallIdAndDeletedFalse(Long playerId, Long ballId);

    /** 玩家某球種尚未消耗的球，最早取得的在前（FIFO） */
    @Query("""
        SELECT bi FROM BallInstance bi
        WHERE bi.playerId = :playerId AND bi.ball.id = :ballId AND bi.deleted = false
        ORDER BY bi.catchDate ASC, bi.id ASC
    """)
    List<BallInstance> findAvailableOldestFirst(@Param("playerId") Long playerId,
                                                @Param("ballId") Long ballId);

    /** 查詢玩家持有中的特定一顆球（eager fetch ball + special） */
    @EntityGraph(attributePaths = {"ball", "special"})
    Optional<BallInstance> findByIdAndPlayerIdAndDeletedFalse(Long id, Long playerId);

    /**
     * 條件式消耗：只標記屬於該玩家且尚未消耗的球。
     * 回傳實際更新筆數，呼叫端據此判斷是否全部成功。
     */
    @Modifying(flushAutomatically = true)
    @Query("""
        UPDATE BallInstance bi SET bi.deleted = true
        WHERE bi.id IN :ids AND bi.playerId = :playerId AND bi.deleted = false
    """)
    int markConsumed(@Param("playerId") Long playerId, @Param("ids") Collection<Long> ids);

    @EntityGraph(attributePaths = {"ball"})
    List<BallInstance> findByPlayerIdAndDeletedFalseOrderByCatchDateAsc(Long playerId);
}
