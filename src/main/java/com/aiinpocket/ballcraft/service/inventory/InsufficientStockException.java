package com.aiinpocket.ballcraft.service.inventory;

import lombok.Getter;

/**
 * 可用的球少於要求數量，或要消耗的球已不屬於玩家可用庫存。
 */
@Getter
public class InsufficientStockException extends RuntimeException {

    private final String kind;
    private final int required;
    private final long available;

    public InsufficientStockException(String kind, int required, long available) {
        super(String.format("%s 庫存不足：需要 %d，可用 %d", kind, required, available));
        this.kind = kind;
        this.required = required;
        this.available = available;
    }
}
