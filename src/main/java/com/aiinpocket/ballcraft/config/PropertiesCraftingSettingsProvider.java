package com.aiinpocket.ballcraft.config;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 以 application.yml 為來源的預設設定提供者。
 */
@Component
@RequiredArgsConstructor
public class PropertiesCraftingSettingsProvider implements CraftingSettingsProvider {

    private final CraftingProperties properties;

    @Override
    public CraftingSettings current() {
        return new CraftingSettings(
                properties.enabled(),
                properties.globalCooldownSeconds(),
                properties.allowAutoCrafting(),
                properties.sessionTimeoutMinutes()
        );
    }
}
