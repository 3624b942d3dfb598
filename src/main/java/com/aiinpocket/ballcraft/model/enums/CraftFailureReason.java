package com.aiinpocket.ballcraft.model.enums;

/**
 * 合成失敗原因。
 * 除了 COMMIT_FAILURE 以外都是預期內的結果，在任何狀態變更前就會被判定。
 */
public enum CraftFailureReason {
    /** 合成全域關閉、配方停用，或自動合成不被允許 */
    FEATURE_DISABLED,
    RECIPE_NOT_FOUND,
    ON_COOLDOWN,
    INSUFFICIENT_INGREDIENTS,
    /** 該球已在工作階段中 */
    ALREADY_STAGED,
    /** 移除的球不在工作階段中 */
    NOT_STAGED,
    /** 球不存在、非本人所有或已被消耗 */
    ITEM_NOT_FOUND,
    NO_SESSION_ACTIVE,
    /** 工作階段中的材料無法合成任何配方 */
    NO_CRAFTABLE_RECIPE,
    /** 原子交易中止（並行衝突），沒有任何部分生效 */
    COMMIT_FAILURE
}
