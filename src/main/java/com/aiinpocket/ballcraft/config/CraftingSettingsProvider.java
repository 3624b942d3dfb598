package com.aiinpocket.ballcraft.config;

/**
 * 合成設定來源。
 * 設定由外部管理介面維護，本系統只讀取；每次請求取得一份快照。
 */
public interface CraftingSettingsProvider {

    /** 取得目前的設定快照 */
    CraftingSettings current();
}
