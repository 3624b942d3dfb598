package com.aiinpocket.ballcraft.service;

import com.aiinpocket.ballcraft.model.entity.Ball;
import com.aiinpocket.ballcraft.model.entity.BallInstance;
import com.aiinpocket.ballcraft.service.inventory.InventoryPort;

import java.util.List;

/**
 * 直接合成：材料來自玩家背包，依取得時間 FIFO。
 */
class InventoryIngredientSource implements IngredientSource {

    private final InventoryPort inventory;
    private final Long playerId;

    InventoryIngredientSource(InventoryPort inventory, Long playerId) {
        this.inventory = inventory;
        this.playerId = playerId;
    }

    @Override
    public long available(Ball kind) {
        return inventory.countAvailable(playerId, kind);
    }

    @Override
    public List<BallInstance> select(Ball kind, int quantity) {
        return inventory.selectForConsumption(playerId, kind, quantity);
    }
}
