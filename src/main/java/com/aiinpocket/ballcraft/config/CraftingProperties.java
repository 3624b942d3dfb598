package com.aiinpocket.ballcraft.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 合成系統設定（application.yml 的 crafting.*）。
 * 僅作為 {@link PropertiesCraftingSettingsProvider} 的來源，核心邏輯只讀取 {@link CraftingSettings} 快照。
 */
@ConfigurationProperties(prefix = "crafting")
public record CraftingProperties(
        boolean enabled,
        int globalCooldownSeconds,
        boolean allowAutoCrafting,
        int sessionTimeoutMinutes,
        String sessionSweepCron,
        AutoParams auto
) {
    public record AutoParams(
            Duration iterationDelay,
            Integer defaultLoopBound
    ) {}
}
