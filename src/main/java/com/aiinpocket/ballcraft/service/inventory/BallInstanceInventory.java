package com.aiinpocket.ballcraft.service.inventory;

import com.aiinpocket.ballcraft.model.entity.Ball;
import com.aiinpocket.ballcraft.model.entity.BallInstance;
import com.aiinpocket.ballcraft.model.entity.Special;
import com.aiinpocket.ballcraft.repository.BallInstanceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 以 ball_instance 資料表實作的背包存取。
 * 消耗與產出要求呼叫端已開啟交易（MANDATORY），確保它們與冷卻更新在同一個原子單位內。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BallInstanceInventory implements InventoryPort {

    private final BallInstanceRepository instanceRepo;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public long countAvailable(Long ownerId, Ball kind) {
        return instanceRepo.countByPlayerIdAndBallIdAndDeletedFalse(ownerId, kind.getId());
    }

    @Override
    @Transactional(readOnly = true)
    public List<BallInstance> selectForConsumption(Long ownerId, Ball kind, int quantity) {
        List<BallInstance> available = instanceRepo.findAvailableOldestFirst(ownerId, kind.getId());
        if (available.size() < quantity) {
            throw new InsufficientStockException(kind.getName(), quantity, available.size());
        }
        return List.copyOf(available.subList(0, quantity));
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void consume(Long ownerId, List<BallInstance> items) {
        if (items.isEmpty()) {
            return;
        }
        List<Long> ids = items.stream().map(BallInstance::getId).distinct().toList();
        int updated = instanceRepo.markConsumed(ownerId, ids);
        if (updated != ids.size()) {
            // 有球已在別處被消耗：丟出例外讓整個交易回滾（已更新的部分一併撤銷）
            log.warn("[背包] 玩家 {} 消耗失敗，預期 {} 顆，實際 {} 顆", ownerId, ids.size(), updated);
            String kind = items.get(0).getBall().getName();
            throw new InsufficientStockException(kind, ids.size(), updated);
        }
        items.forEach(item -> item.setDeleted(true));
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public List<Long> mint(Long ownerId, Ball kind, int quantity, Special modifier) {
        Instant now = clock.instant();
        List<BallInstance> created = new ArrayList<>(quantity);
        for (int i = 0; i < quantity; i++) {
            created.add(BallInstance.builder()
                    .playerId(ownerId)
                    .ball(kind)
                    .special(modifier)
                    .catchDate(now)
                    .build());
        }
        return instanceRepo.saveAll(created).stream()
                .map(BallInstance::getId)
                .toList();
    }
}
