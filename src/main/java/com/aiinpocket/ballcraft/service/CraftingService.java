package com.aiinpocket.ballcraft.service;

import com.aiinpocket.ballcraft.config.CraftingSettings;
import com.aiinpocket.ballcraft.config.CraftingSettingsProvider;
import com.aiinpocket.ballcraft.model.dto.CooldownStatus;
import com.aiinpocket.ballcraft.model.dto.CraftOutcome;
import com.aiinpocket.ballcraft.model.dto.CraftReceipt;
import com.aiinpocket.ballcraft.model.dto.CraftResultSummary;
import com.aiinpocket.ballcraft.model.dto.RecipeView;
import com.aiinpocket.ballcraft.model.dto.SessionView;
import com.aiinpocket.ballcraft.model.entity.BallInstance;
import com.aiinpocket.ballcraft.model.entity.CraftingLog;
import com.aiinpocket.ballcraft.model.entity.CraftingRecipe;
import com.aiinpocket.ballcraft.model.enums.CraftFailureReason;
import com.aiinpocket.ballcraft.model.enums.CraftMode;
import com.aiinpocket.ballcraft.service.catalog.RecipeCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 合成服務（呼叫端入口）。
 *
 * <p>每個請求取得一次設定快照後交給交易引擎或工作階段服務，
 * 把預期內的失敗轉成 {@link CraftOutcome}，並在交易結束後寫入稽核紀錄。
 * 只有非預期的儲存層錯誤會以例外往外傳（此時交易已完整回滾）。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CraftingService {

    private static final String COMMIT_FAILURE_MESSAGE = "合成交易中止，請稍後重試";

    private final CraftingTransactionEngine engine;
    private final CraftingSessionService sessionService;
    private final CooldownTracker cooldownTracker;
    private final RecipeCatalog catalog;
    private final RecipeMatcher matcher;
    private final CraftingAuditService auditService;
    private final CraftingSettingsProvider settingsProvider;

    // ===== 合成 =====

    /**
     * 指定配方直接合成。
     */
    public CraftOutcome craftDirect(Long playerId, String recipeName) {
        CraftingSettings settings = settingsProvider.current();
        return runCraft(playerId, recipeName, CraftMode.DIRECT,
                () -> engine.craftDirect(playerId, recipeName, CraftMode.DIRECT, settings));
    }

    /**
     * 自動合成迴圈中的單次合成（額外檢查自動合成開關）。
     */
    public CraftOutcome craftAuto(Long playerId, String recipeName) {
        CraftingSettings settings = settingsProvider.current();
        return runCraft(playerId, recipeName, CraftMode.AUTO,
                () -> engine.craftDirect(playerId, recipeName, CraftMode.AUTO, settings));
    }

    /**
     * 以工作階段暫存的材料合成第一個可合成的配方。
     */
    public CraftOutcome stageCraft(Long playerId) {
        CraftingSettings settings = settingsProvider.current();
        return runCraft(playerId, null, CraftMode.STAGED, () -> {
            // 過期的工作階段先在獨立交易中刪除，合成交易回滾時不受影響
            sessionService.findActive(playerId);
            return engine.craftStaged(playerId, settings);
        });
    }

    private CraftOutcome runCraft(Long playerId, String requestedName, CraftMode mode,
                                  Supplier<CraftReceipt> transaction) {
        try {
            CraftReceipt receipt = transaction.get();
            String message = formatResult(receipt.result());
            audit(playerId, receipt.recipeId(), receipt.recipeName(), mode, true, message, receipt);
            return CraftOutcome.crafted(receipt.recipeName(), message, receipt.result());
        } catch (CraftingException e) {
            String name = e.getRecipeName() != null ? e.getRecipeName() : requestedName;
            log.debug("[合成] 玩家 {} 合成「{}」失敗（{}）: {}", playerId, name, e.getReason(), e.getMessage());
            audit(playerId, e.getRecipeId(), name, mode, false, e.getMessage(), null);
            return CraftOutcome.fail(e.getReason(), e.getMessage(), name, e.getRemainingSeconds(), e.getShortage());
        } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
            log.warn("[合成] 玩家 {} 的合成交易中止: {}", playerId, e.getMessage());
            audit(playerId, null, requestedName, mode, false, COMMIT_FAILURE_MESSAGE, null);
            return CraftOutcome.fail(CraftFailureReason.COMMIT_FAILURE, COMMIT_FAILURE_MESSAGE,
                    requestedName, null, null);
        } catch (RuntimeException e) {
            log.error("[合成] 玩家 {} 合成時發生儲存層錯誤，交易已回滾", playerId, e);
            audit(playerId, null, requestedName, mode, false, "合成時發生系統錯誤", null);
            throw e;
        }
    }

    /** 寫入稽核紀錄；失敗只記錄日誌，不影響合成結果 */
    private void audit(Long playerId, Long recipeId, String recipeName, CraftMode mode,
                       boolean success, String message, CraftReceipt receipt) {
        try {
            auditService.record(playerId, recipeId, recipeName, mode, success, message, receipt);
        } catch (Exception e) {
            log.warn("[合成紀錄] 玩家 {} 的稽核紀錄寫入失敗: {}", playerId, e.getMessage());
        }
    }

    static String formatResult(CraftResultSummary result) {
        String special = result.modifierName() != null ? "，附帶 " + result.modifierName() : "";
        String ids = result.mintedIds().stream()
                .map(id -> String.format("#%X", id))
                .collect(Collectors.joining(", "));
        return String.format("合成 %d × %s%s\n編號：%s", result.quantity(), result.resultKind(), special, ids);
    }

    // ===== 工作階段 =====

    public CraftOutcome stageAdd(Long playerId, Long instanceId) {
        try {
            BallInstance instance = sessionService.addItem(playerId, instanceId, settingsProvider.current());
            return CraftOutcome.success("已將 " + instance.getDisplayId() + "（" + instance.getBall().getName()
                    + "）加入合成工作階段");
        } catch (CraftingException e) {
            return CraftOutcome.fail(e.getReason(), e.getMessage());
        } catch (DataIntegrityViolationException e) {
            // 同一玩家並行建立工作階段或重複暫存
            log.warn("[合成工作階段] 玩家 {} 暫存 {} 時發生衝突: {}", playerId, instanceId, e.getMessage());
            return CraftOutcome.fail(CraftFailureReason.COMMIT_FAILURE, COMMIT_FAILURE_MESSAGE);
        }
    }

    public CraftOutcome stageRemove(Long playerId, Long instanceId) {
        try {
            sessionService.removeItem(playerId, instanceId, settingsProvider.current());
            return CraftOutcome.success("已從合成工作階段移除 " + String.format("#%X", instanceId));
        } catch (CraftingException e) {
            return CraftOutcome.fail(e.getReason(), e.getMessage());
        }
    }

    public CraftOutcome stageClear(Long playerId) {
        try {
            int removed = sessionService.clear(playerId, settingsProvider.current());
            return CraftOutcome.success("已清空合成工作階段（移除 " + removed + " 顆）");
        } catch (CraftingException e) {
            return CraftOutcome.fail(e.getReason(), e.getMessage());
        }
    }

    public SessionView viewSession(Long playerId) {
        return sessionService.view(playerId);
    }

    // ===== 查詢 =====

    /**
     * 啟用中的配方列表（名稱排序）。
     */
    public List<RecipeView> listRecipes() {
        return catalog.listEnabledRecipes().stream()
                .map(this::toView)
                .toList();
    }

    /**
     * 查詢玩家對配方的冷卻狀態。
     *
     * @throws IllegalArgumentException 配方不存在
     */
    public CooldownStatus checkCooldown(Long playerId, String recipeName) {
        CraftingRecipe recipe = catalog.getRecipeByName(recipeName)
                .orElseThrow(() -> new IllegalArgumentException("找不到配方「" + recipeName + "」"));
        return cooldownTracker.checkReady(playerId, recipe, settingsProvider.current());
    }

    public List<CraftingLog> recentLogs(Long playerId) {
        return auditService.recentLogs(playerId);
    }

    private RecipeView toView(CraftingRecipe recipe) {
        List<String> ingredients = matcher.demandsOf(recipe).stream()
                .map(d -> d.quantity() + " × " + d.ball().getName())
                .toList();
        String special = recipe.getResultSpecial() != null ? "，附帶 " + recipe.getResultSpecial().getName() : "";
        String result = recipe.getResultQuantity() + " × " + recipe.getResultBall().getName() + special;
        return new RecipeView(recipe.getName(), recipe.getDescription(), ingredients, result,
                recipe.getCooldownSeconds(), recipe.isAllowAuto());
    }
}
