package com.aiinpocket.ballcraft.model.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "crafting_session_item", uniqueConstraints = {
        @UniqueConstraint(name = "uk_session_item", columnNames = {"session_id", "ball_instance_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CraftingSessionItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "session_id", nullable = false)
    private CraftingSession session;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "ball_instance_id", nullable = false)
    private BallInstance ballInstance;
}
