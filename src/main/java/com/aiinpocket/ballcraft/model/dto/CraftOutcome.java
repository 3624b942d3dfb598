package com.aiinpocket.ballcraft.model.dto;

import com.aiinpocket.ballcraft.model.enums.CraftFailureReason;

/**
 * 合成相關操作回傳給呼叫端的結果。
 * 失敗時 reason 必有值；冷卻中會附上剩餘秒數，材料不足會附上缺少的明細。
 */
public record CraftOutcome(
        boolean success,
        String message,
        String recipeName,
        CraftFailureReason reason,
        Double remainingCooldownSeconds,
        IngredientShortage shortage,
        CraftResultSummary result
) {
    public static CraftOutcome success(String msg) {
        return new CraftOutcome(true, msg, null, null, null, null, null);
    }

    public static CraftOutcome crafted(String recipeName, String msg, CraftResultSummary result) {
        return new CraftOutcome(true, msg, recipeName, null, null, null, result);
    }

    public static CraftOutcome fail(CraftFailureReason reason, String msg) {
        return new CraftOutcome(false, msg, null, reason, null, null, null);
    }

    public static CraftOutcome fail(CraftFailureReason reason, String msg, String recipeName,
                                    Double remainingCooldownSeconds, IngredientShortage shortage) {
        return new CraftOutcome(false, msg, recipeName, reason, remainingCooldownSeconds, shortage, null);
    }
}
