package com.aiinpocket.ballcraft.service;

import com.aiinpocket.ballcraft.model.entity.Ball;
import com.aiinpocket.ballcraft.model.entity.BallInstance;

import java.util.List;

/**
 * 合成交易的材料來源：直接合成從背包 FIFO 取用，工作階段合成只取暫存的球。
 */
interface IngredientSource {

    /** 此來源中該球種可用的數量 */
    long available(Ball kind);

    /** 選出要消耗的球；數量不足時丟出 InsufficientStockException */
    List<BallInstance> select(Ball kind, int quantity);

    /** 消耗成功後、同一交易內的收尾（例如移除暫存列） */
    default void afterConsume(List<BallInstance> consumed) {
    }
}
