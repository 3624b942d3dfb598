package com.aiinpocket.ballcraft.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 合成工作階段：玩家暫存候選材料的緩衝區。
 * 每位玩家最多一個；暫存只是參照，不會鎖住物品。
 */
@Entity
@Table(name = "crafting_session", uniqueConstraints = {
        @UniqueConstraint(name = "uk_crafting_session_player", columnNames = "player_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CraftingSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false)
    private Long playerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @OneToMany(mappedBy = "session", cascade = CascadeType.ALL, orphanRemoval = true)
    @Builder.Default
    private List<CraftingSessionItem> items = new ArrayList<>();

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
