package com.aiinpocket.ballcraft.service;

import com.aiinpocket.ballcraft.model.dto.IngredientShortage;
import com.aiinpocket.ballcraft.model.enums.CraftFailureReason;
import lombok.Getter;

/**
 * 預期內的合成失敗。
 * 屬於 RuntimeException，從 @Transactional 方法丟出時會自動回滾；
 * 由 {@link CraftingService} 轉成失敗的 CraftOutcome，不會傳到呼叫端之外。
 */
@Getter
public class CraftingException extends RuntimeException {

    private final CraftFailureReason reason;
    private final Long recipeId;
    private final String recipeName;
    private final Double remainingSeconds;
    private final IngredientShortage shortage;

    public CraftingException(CraftFailureReason reason, String message) {
        this(reason, message, null, null, null, null);
    }

    public CraftingException(CraftFailureReason reason, String message, Long recipeId, String recipeName) {
        this(reason, message, recipeId, recipeName, null, null);
    }

    public CraftingException(CraftFailureReason reason, String message, Long recipeId, String recipeName,
                             Double remainingSeconds, IngredientShortage shortage) {
        super(message);
        this.reason = reason;
        this.recipeId = recipeId;
        this.recipeName = recipeName;
        this.remainingSeconds = remainingSeconds;
        this.shortage = shortage;
    }

    public static CraftingException onCooldown(Long recipeId, String recipeName, double remainingSeconds) {
        return new CraftingException(CraftFailureReason.ON_COOLDOWN,
                String.format("合成冷卻中，請在 %.1f 秒後再試", remainingSeconds),
                recipeId, recipeName, remainingSeconds, null);
    }

    public static CraftingException insufficient(Long recipeId, String recipeName,
                                                 String kind, int required, long owned) {
        return new CraftingException(CraftFailureReason.INSUFFICIENT_INGREDIENTS,
                String.format("材料不足：需要 %d 個 %s，目前只有 %d 個", required, kind, owned),
                recipeId, recipeName, null, new IngredientShortage(kind, required, owned));
    }
}
