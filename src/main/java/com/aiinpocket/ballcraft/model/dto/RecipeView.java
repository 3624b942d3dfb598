package com.aiinpocket.ballcraft.model.dto;

import java.util.List;

/**
 * 配方列表的顯示資料。
 */
public record RecipeView(
        String name,
        String description,
        List<String> ingredients,
        String result,
        int cooldownSeconds,
        boolean allowAuto
) {}
