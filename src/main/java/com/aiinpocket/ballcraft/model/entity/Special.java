package com.aiinpocket.ballcraft.model.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * 特殊效果（合成產物可附帶的修飾，例如 Shiny）。
 */
@Entity
@Table(name = "special")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Special {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String name;

    @Column(length = 32)
    private String emoji;
}
