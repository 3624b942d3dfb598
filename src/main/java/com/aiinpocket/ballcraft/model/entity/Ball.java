package com.aiinpocket.ballcraft.model.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * 球種定義（可收集物品的種類）。
 * 由外部球種資料維護，合成系統只讀取。
 */
@Entity
@Table(name = "ball")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Ball {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** 球種名稱，例如 "Eagle" */
    @Column(nullable = false, unique = true, length = 64)
    private String name;

    /** 基礎攻擊 */
    @Column(nullable = false)
    @Builder.Default
    private Integer attack = 0;

    /** 基礎生命 */
    @Column(nullable = false)
    @Builder.Default
    private Integer health = 0;

    @Column(nullable = false)
    @Builder.Default
    private boolean enabled = true;
}
