package com.aiinpocket.ballcraft.model.enums;

/**
 * 合成方式。
 */
public enum CraftMode {
    /** 直接指定配方，材料依 FIFO 從背包取用 */
    DIRECT,
    /** 從合成工作階段暫存的材料合成 */
    STAGED,
    /** 自動合成迴圈中的單次合成 */
    AUTO
}
