package com.aiinpocket.ballcraft.model.dto;

import com.aiinpocket.ballcraft.model.enums.CraftMode;

import java.util.List;

/**
 * 成功提交的合成交易收據（交易引擎 → 門面）。
 */
public record CraftReceipt(
        Long recipeId,
        String recipeName,
        CraftMode mode,
        List<Long> consumedIds,
        CraftResultSummary result
) {}
