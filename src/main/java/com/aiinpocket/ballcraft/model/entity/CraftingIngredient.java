package com.aiinpocket.ballcraft.model.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "crafting_ingredient")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CraftingIngredient {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "recipe_id", nullable = false)
    private CraftingRecipe recipe;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "ball_id", nullable = false)
    private Ball ball;

    /** 需要的數量（至少 1） */
    @Column(nullable = false)
    @Builder.Default
    private Integer quantity = 1;
}
