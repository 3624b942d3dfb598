package com.aiinpocket.ballcraft.model.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 合成工作階段的即時檢視（每次請求重新計算）。
 */
public record SessionView(
        boolean active,
        List<StagedItem> items,
        Map<String, Integer> countsByKind,
        int totalAttack,
        int totalHealth,
        List<String> craftableRecipes,
        Instant expiresAt,
        long minutesLeft
) {
    public record StagedItem(
            Long id, String displayId, String kind, String special,
            int attackBonus, int healthBonus, boolean available
    ) {}

    public static SessionView inactive() {
        return new SessionView(false, List.of(), Map.of(), 0, 0, List.of(), null, 0);
    }
}
