package com.aiinpocket.ballcraft.service;

import com.aiinpocket.ballcraft.model.dto.CraftReceipt;
import com.aiinpocket.ballcraft.model.entity.CraftingLog;
import com.aiinpocket.ballcraft.model.enums.CraftMode;
import com.aiinpocket.ballcraft.repository.CraftingLogRepository;
import com.aiinpocket.ballcraft.repository.CraftingRecipeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * 合成稽核紀錄。
 * 每次合成嘗試（成功或失敗）寫入一筆，使用獨立交易：
 * 紀錄寫入失敗不會回滾已提交的合成，反之亦然。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CraftingAuditService {

    private final CraftingLogRepository logRepo;
    private final CraftingRecipeRepository recipeRepo;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * 寫入一筆稽核紀錄。
     *
     * @param recipeId 配方 ID（配方不存在或尚未決定時為 null）
     * @param receipt  成功時的交易收據，失敗時為 null
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public CraftingLog record(Long playerId, Long recipeId, String recipeName, CraftMode mode,
                              boolean success, String message, CraftReceipt receipt) {
        CraftingLog entry = CraftingLog.builder()
                .playerId(playerId)
                .recipe(recipeId != null ? recipeRepo.getReferenceById(recipeId) : null)
                .recipeName(recipeName)
                .mode(mode)
                .success(success)
                .message(message)
                .detail(receipt != null ? toDetailJson(receipt) : null)
                .createdAt(clock.instant())
                .build();
        return logRepo.save(entry);
    }

    @Transactional(readOnly = true)
    public List<CraftingLog> recentLogs(Long playerId) {
        return logRepo.findTop20ByPlayerIdOrderByCreatedAtDescIdDesc(playerId);
    }

    private String toDetailJson(CraftReceipt receipt) {
        try {
            return objectMapper.writeValueAsString(Map.of(
                    "consumed", receipt.consumedIds(),
                    "minted", receipt.result().mintedIds()
            ));
        } catch (Exception e) {
            log.warn("[合成紀錄] 明細序列化失敗: {}", e.getMessage());
            return null;
        }
    }
}
