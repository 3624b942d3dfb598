package com.aiinpocket.ballcraft.service;

import com.aiinpocket.ballcraft.model.entity.Ball;
import com.aiinpocket.ballcraft.model.entity.BallInstance;
import com.aiinpocket.ballcraft.model.entity.CraftingSessionItem;
import com.aiinpocket.ballcraft.repository.CraftingSessionItemRepository;
import com.aiinpocket.ballcraft.service.inventory.InsufficientStockException;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 工作階段合成：材料只取自工作階段暫存的球，依加入順序。
 * 暫存後在別處被消耗或轉手的球不計入可用數量。
 */
class StagedIngredientSource implements IngredientSource {

    private final Long playerId;
    private final List<CraftingSessionItem> stagedItems;
    private final CraftingSessionItemRepository itemRepo;

    StagedIngredientSource(Long playerId, List<CraftingSessionItem> stagedItems,
                           CraftingSessionItemRepository itemRepo) {
        this.playerId = playerId;
        this.stagedItems = stagedItems;
        this.itemRepo = itemRepo;
    }

    /** 仍可用的暫存球：未消耗且仍屬於玩家 */
    static boolean isAvailable(BallInstance instance, Long playerId) {
        return !instance.isDeleted() && playerId.equals(instance.getPlayerId());
    }

    /** 依球種 ID 統計可用的暫存數量 */
    Map<Long, Long> availableCounts() {
        return stagedItems.stream()
                .map(CraftingSessionItem::getBallInstance)
                .filter(bi -> isAvailable(bi, playerId))
                .collect(Collectors.groupingBy(bi -> bi.getBall().getId(), Collectors.counting()));
    }

    /** 依球種 ID 統計全部暫存參照，包含已在別處消耗的球 */
    Map<Long, Long> stagedCounts() {
        return stagedItems.stream()
                .map(CraftingSessionItem::getBallInstance)
                .collect(Collectors.groupingBy(bi -> bi.getBall().getId(), Collectors.counting()));
    }

    private List<BallInstance> availableOf(Ball kind) {
        return stagedItems.stream()
                .map(CraftingSessionItem::getBallInstance)
                .filter(bi -> isAvailable(bi, playerId))
                .filter(bi -> bi.getBall().getId().equals(kind.getId()))
                .toList();
    }

    @Override
    public long available(Ball kind) {
        return availableOf(kind).size();
    }

    @Override
    public List<BallInstance> select(Ball kind, int quantity) {
        List<BallInstance> candidates = availableOf(kind);
        if (candidates.size() < quantity) {
            throw new InsufficientStockException(kind.getName(), quantity, candidates.size());
        }
        return List.copyOf(candidates.subList(0, quantity));
    }

    @Override
    public void afterConsume(List<BallInstance> consumed) {
        Set<Long> consumedIds = consumed.stream().map(BallInstance::getId).collect(Collectors.toSet());
        List<CraftingSessionItem> rows = stagedItems.stream()
                .filter(si -> consumedIds.contains(si.getBallInstance().getId()))
                .toList();
        itemRepo.deleteAll(rows);
        itemRepo.flush();
        stagedItems.removeAll(rows);
    }

    boolean isEmpty() {
        return stagedItems.isEmpty();
    }
}
