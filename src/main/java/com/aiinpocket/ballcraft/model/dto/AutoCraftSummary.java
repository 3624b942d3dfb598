package com.aiinpocket.ballcraft.model.dto;

import com.aiinpocket.ballcraft.model.enums.AutoCraftStopReason;

import java.util.List;

/**
 * 自動合成迴圈結束時的摘要。
 *
 * @param recipeName  配方名稱
 * @param crafted     成功合成次數
 * @param attempts    呼叫交易引擎的總次數（含冷卻重試）
 * @param mintedIds   迴圈期間產出的所有新球編號
 * @param stopReason  結束原因
 * @param lastOutcome 最後一次合成的結果（尚未執行任何合成時為 null）
 */
public record AutoCraftSummary(
        String recipeName,
        int crafted,
        int attempts,
        List<Long> mintedIds,
        AutoCraftStopReason stopReason,
        CraftOutcome lastOutcome
) {}
