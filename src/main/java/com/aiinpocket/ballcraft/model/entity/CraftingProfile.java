package com.aiinpocket.ballcraft.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 玩家的合成資料（全域冷卻）。
 * 每位玩家一列；合成交易以此列的悲觀鎖作為玩家層級的序列化點。
 */
@Entity
@Table(name = "crafting_profile", uniqueConstraints = {
        @UniqueConstraint(name = "uk_crafting_profile_player", columnNames = "player_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CraftingProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false)
    private Long playerId;

    /** 上次成功合成的時間（null = 從未合成） */
    @Column(name = "last_crafted_at")
    private Instant lastCraftedAt;
}
