package com.aiinpocket.ballcraft.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 玩家對單一配方的狀態：配方冷卻與自動合成旗標。
 */
@Entity
@Table(name = "crafting_recipe_state", uniqueConstraints = {
        @UniqueConstraint(name = "uk_recipe_state_player_recipe", columnNames = {"player_id", "recipe_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CraftingRecipeState {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false)
    private Long playerId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "recipe_id", nullable = false)
    private CraftingRecipe recipe;

    @Column(name = "last_crafted_at")
    private Instant lastCraftedAt;

    /** 自動合成進行中（迴圈結束一律清為 false） */
    @Column(name = "auto_enabled", nullable = false)
    @Builder.Default
    private boolean autoEnabled = false;
}
