package com.aiinpocket.ballcraft.config;

/**
 * 單次請求使用的合成設定快照（不可變）。
 * 每次合成呼叫都以參數傳入，避免全域單例造成的隱性耦合。
 *
 * @param enabled               是否全域啟用合成
 * @param globalCooldownSeconds 任何合成後的全域冷卻秒數
 * @param allowAutoCrafting     是否允許自動合成
 * @param sessionTimeoutMinutes 合成工作階段的存活分鐘數
 */
public record CraftingSettings(
        boolean enabled,
        int globalCooldownSeconds,
        boolean allowAutoCrafting,
        int sessionTimeoutMinutes
) {
    public CraftingSettings {
        if (globalCooldownSeconds < 0) {
            throw new IllegalArgumentException("globalCooldownSeconds 不可為負數");
        }
        if (sessionTimeoutMinutes < 1) {
            throw new IllegalArgumentException("sessionTimeoutMinutes 至少為 1");
        }
    }
}
