package com.aiinpocket.ballcraft.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 玩家擁有的一顆球（數量固定為 1 的獨立物品）。
 * 被合成消耗時只標記 deleted，不實際刪除資料列。
 */
@Entity
@Table(name = "ball_instance", indexes = {
        @Index(name = "idx_ball_instance_owner_kind", columnList = "player_id, ball_id, deleted")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BallInstance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** 擁有者 */
    @Column(name = "player_id", nullable = false)
    private Long playerId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "ball_id", nullable = false)
    private Ball ball;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "special_id")
    private Special special;

    /** 已被提領或消耗 */
    @Column(nullable = false)
    @Builder.Default
    private boolean deleted = false;

    /** 取得時間，FIFO 消耗順序依此排序 */
    @Column(name = "catch_date", nullable = false)
    private Instant catchDate;

    /** 攻擊加成（百分比） */
    @Column(name = "attack_bonus", nullable = false)
    @Builder.Default
    private Integer attackBonus = 0;

    /** 生命加成（百分比） */
    @Column(name = "health_bonus", nullable = false)
    @Builder.Default
    private Integer healthBonus = 0;

    /** 加成後攻擊 */
    public int getEffectiveAttack() {
        int base = ball.getAttack();
        return base + (int) (base * attackBonus * 0.01);
    }

    /** 加成後生命 */
    public int getEffectiveHealth() {
        int base = ball.getHealth();
        return base + (int) (base * healthBonus * 0.01);
    }

    /** 對外顯示的十六進位編號，例如 #1A */
    public String getDisplayId() {
        return String.format("#%X", id);
    }

    @PrePersist
    protected void onCreate() {
        if (this.catchDate == null) {
            this.catchDate = Instant.now();
        }
    }
}
