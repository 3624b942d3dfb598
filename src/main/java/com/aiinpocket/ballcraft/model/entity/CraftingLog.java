package com.aiinpocket.ballcraft.model.entity;

import com.aiinpocket.ballcraft.model.enums.CraftMode;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 合成稽核紀錄（只新增，不修改也不刪除）。
 */
@Entity
@Table(name = "crafting_log", indexes = {
        @Index(name = "idx_crafting_log_player", columnList = "player_id, created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CraftingLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false)
    private Long playerId;

    /** 對應配方（工作階段找不到可合成配方時為 null） */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "recipe_id")
    private CraftingRecipe recipe;

    /** 請求時的配方名稱（配方不存在時仍保留） */
    @Column(name = "recipe_name", length = 128)
    private String recipeName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private CraftMode mode;

    @Column(nullable = false)
    private boolean success;

    @Column(length = 1000)
    private String message;

    /** 消耗與產出的編號（JSON） */
    @Column(length = 2000)
    private String detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
