package com.aiinpocket.ballcraft.service.inventory;

import com.aiinpocket.ballcraft.model.entity.Ball;
import com.aiinpocket.ballcraft.model.entity.BallInstance;
import com.aiinpocket.ballcraft.model.entity.Special;

import java.util.List;

/**
 * 背包存取介面（外部球庫存）。
 * 所有操作都針對單一擁有者，且必須能在同一個交易內組合使用：
 * 合成時的消耗、產出與冷卻更新只會一起提交或一起回滾。
 */
public interface InventoryPort {

    /**
     * 擁有者某球種尚未消耗的數量。
     */
    long countAvailable(Long ownerId, Ball kind);

    /**
     * 依 FIFO（最早取得者優先）選出要消耗的球。
     *
     * @throws InsufficientStockException 可用數量少於 quantity
     */
    List<BallInstance> selectForConsumption(Long ownerId, Ball kind, int quantity);

    /**
     * 將指定的球標記為已消耗。全部成功或全部不生效。
     *
     * @throws InsufficientStockException 任何一顆已被消耗或不屬於擁有者
     */
    void consume(Long ownerId, List<BallInstance> items);

    /**
     * 產出新的球給擁有者。
     *
     * @param modifier 特殊效果，可為 null
     * @return 新球的編號（依建立順序）
     */
    List<Long> mint(Long ownerId, Ball kind, int quantity, Special modifier);
}
