package com.aiinpocket.ballcraft.model.dto;

/**
 * 冷卻檢查結果。
 *
 * @param ready                   全域與配方冷卻都已結束
 * @param remainingSeconds        兩者剩餘秒數的較大值
 * @param globalRemainingSeconds  全域冷卻剩餘秒數
 * @param recipeRemainingSeconds  配方冷卻剩餘秒數
 */
public record CooldownStatus(
        boolean ready,
        double remainingSeconds,
        double globalRemainingSeconds,
        double recipeRemainingSeconds
) {
    public static CooldownStatus of(double globalRemaining, double recipeRemaining) {
        double remaining = Math.max(globalRemaining, recipeRemaining);
        return new CooldownStatus(remaining <= 0, remaining, globalRemaining, recipeRemaining);
    }
}
