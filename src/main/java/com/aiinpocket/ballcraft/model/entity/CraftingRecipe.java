package com.aiinpocket.ballcraft.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 合成配方：消耗一組球，產出新的球。
 * 由管理介面維護；合成交易期間視為不可變。
 */
@Entity
@Table(name = "crafting_recipe", indexes = {
        @Index(name = "idx_recipe_enabled", columnList = "enabled")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CraftingRecipe {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 128)
    private String name;

    @Column(length = 1000)
    private String description;

    /** 停用時玩家無法查看或合成 */
    @Column(nullable = false)
    @Builder.Default
    private boolean enabled = true;

    /** 是否允許玩家對此配方開啟自動合成 */
    @Column(name = "allow_auto", nullable = false)
    @Builder.Default
    private boolean allowAuto = true;

    /** 合成後額外套用的配方冷卻秒數 */
    @Column(name = "cooldown_seconds", nullable = false)
    @Builder.Default
    private Integer cooldownSeconds = 0;

    /** 產出的球種 */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "result_ball_id", nullable = false)
    private Ball resultBall;

    @Column(name = "result_quantity", nullable = false)
    @Builder.Default
    private Integer resultQuantity = 1;

    /** 產物附帶的特殊效果（可選） */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "result_special_id")
    private Special resultSpecial;

    /** 材料清單（同一球種可出現多次，檢查時會加總） */
    @OneToMany(mappedBy = "recipe", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @Builder.Default
    private List<CraftingIngredient> ingredients = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public void addIngredient(Ball ball, int quantity) {
        ingredients.add(CraftingIngredient.builder()
                .recipe(this)
                .ball(ball)
                .quantity(quantity)
                .build());
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        this.updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
