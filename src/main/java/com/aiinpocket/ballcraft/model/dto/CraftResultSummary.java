package com.aiinpocket.ballcraft.model.dto;

import java.util.List;

/**
 * 合成產物摘要。
 *
 * @param resultKind   產出的球種名稱
 * @param quantity     產出數量
 * @param mintedIds    新球的編號
 * @param modifierName 特殊效果名稱（無則為 null）
 */
public record CraftResultSummary(
        String resultKind,
        int quantity,
        List<Long> mintedIds,
        String modifierName
) {}
