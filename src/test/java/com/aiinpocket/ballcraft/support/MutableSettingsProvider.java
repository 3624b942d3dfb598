package com.aiinpocket.ballcraft.support;

import com.aiinpocket.ballcraft.config.CraftingSettings;
import com.aiinpocket.ballcraft.config.CraftingSettingsProvider;

/**
 * 測試用設定提供者，每個測試可替換設定快照。
 */
public class MutableSettingsProvider implements CraftingSettingsProvider {

    public static final CraftingSettings DEFAULTS = new CraftingSettings(true, 0, true, 10);

    private volatile CraftingSettings settings = DEFAULTS;

    public void set(CraftingSettings settings) {
        this.settings = settings;
    }

    public void reset() {
        this.settings = DEFAULTS;
    }

    @Override
    public CraftingSettings current() {
        return settings;
    }
}
