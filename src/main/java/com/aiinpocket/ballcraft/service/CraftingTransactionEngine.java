package com.aiinpocket.ballcraft.service;

import com.aiinpocket.ballcraft.config.CraftingSettings;
import com.aiinpocket.ballcraft.model.dto.CooldownStatus;
import com.aiinpocket.ballcraft.model.dto.CraftReceipt;
import com.aiinpocket.ballcraft.model.dto.CraftResultSummary;
import com.aiinpocket.ballcraft.model.dto.IngredientDemand;
import com.aiinpocket.ballcraft.model.entity.BallInstance;
import com.aiinpocket.ballcraft.model.entity.CraftingProfile;
import com.aiinpocket.ballcraft.model.entity.CraftingRecipe;
import com.aiinpocket.ballcraft.model.entity.CraftingRecipeState;
import com.aiinpocket.ballcraft.model.entity.CraftingSession;
import com.aiinpocket.ballcraft.model.entity.CraftingSessionItem;
import com.aiinpocket.ballcraft.model.enums.CraftFailureReason;
import com.aiinpocket.ballcraft.model.enums.CraftMode;
import com.aiinpocket.ballcraft.repository.CraftingSessionItemRepository;
import com.aiinpocket.ballcraft.repository.CraftingSessionRepository;
import com.aiinpocket.ballcraft.service.catalog.RecipeCatalog;
import com.aiinpocket.ballcraft.service.inventory.InsufficientStockException;
import com.aiinpocket.ballcraft.service.inventory.InventoryPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 合成交易引擎。
 *
 * <p>每次合成嘗試依序經過：驗證 → 冷卻檢查 → 材料檢查 → 提交。
 * 整個流程在單一資料庫交易內執行，並先以悲觀鎖鎖住玩家的冷卻列，
 * 同一玩家的並行合成因此會排隊，後到者重新讀取最新的庫存與冷卻狀態。
 *
 * <p>提交階段在同一交易內完成：
 * <ol>
 *   <li>消耗每項材料所選出的球</li>
 *   <li>產出配方結果</li>
 *   <li>推進全域與配方冷卻</li>
 *   <li>（工作階段合成）移除已消耗的暫存列</li>
 * </ol>
 * 任何一步失敗都會丟出例外使整個交易回滾，不會有部分生效。
 * 預期內的失敗以 {@link CraftingException} 表示；稽核紀錄由呼叫端在交易結束後另行寫入。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CraftingTransactionEngine {

    private final RecipeCatalog catalog;
    private final InventoryPort inventory;
    private final CooldownTracker cooldownTracker;
    private final RecipeMatcher matcher;
    private final CraftingSessionService sessionService;
    private final CraftingSessionRepository sessionRepo;
    private final CraftingSessionItemRepository itemRepo;
    private final Clock clock;

    /**
     * 指定配方合成，材料依 FIFO 從背包取用。
     *
     * @param mode DIRECT 或 AUTO；AUTO 另外要求自動合成開關與配方的 allowAuto
     * @throws CraftingException 預期內的失敗（交易已回滾）
     */
    @Transactional
    public CraftReceipt craftDirect(Long playerId, String recipeName, CraftMode mode, CraftingSettings settings) {
        requireEnabled(settings);
        CraftingRecipe recipe = catalog.getRecipeByName(recipeName)
                .orElseThrow(() -> new CraftingException(CraftFailureReason.RECIPE_NOT_FOUND,
                        "找不到配方「" + recipeName + "」", null, recipeName));
        validateRecipe(recipe, mode, settings);

        CraftingProfile profile = cooldownTracker.lockPlayer(playerId);
        return execute(playerId, recipe, mode, settings, profile, new InventoryIngredientSource(inventory, playerId));
    }

    /**
     * 以工作階段暫存的球合成。
     * 配方為目錄順序中第一個可由暫存材料滿足的配方；材料只從暫存的球選取。
     * 成功後只移除被消耗的暫存列，其餘暫存保留；工作階段清空時一併刪除。
     *
     * @throws CraftingException 預期內的失敗（交易已回滾）
     */
    @Transactional
    public CraftReceipt craftStaged(Long playerId, CraftingSettings settings) {
        requireEnabled(settings);
        CraftingProfile profile = cooldownTracker.lockPlayer(playerId);

        CraftingSession session = sessionService.findActive(playerId)
                .orElseThrow(() -> new CraftingException(CraftFailureReason.NO_SESSION_ACTIVE,
                        "目前沒有進行中的合成工作階段"));

        List<CraftingSessionItem> staged = new ArrayList<>(itemRepo.findStagedItems(session.getId()));
        StagedIngredientSource source = new StagedIngredientSource(playerId, staged, itemRepo);

        // 可用的暫存球湊不出配方時，改以全部暫存參照比對，由材料檢查回報被別處消耗的缺額
        List<CraftingRecipe> recipes = catalog.listEnabledRecipes();
        CraftingRecipe recipe = matcher.firstCraftable(source.availableCounts(), recipes)
                .or(() -> matcher.firstCraftable(source.stagedCounts(), recipes))
                .orElseThrow(() -> new CraftingException(CraftFailureReason.NO_CRAFTABLE_RECIPE,
                        "目前的材料無法合成任何配方"));
        validateRecipe(recipe, CraftMode.STAGED, settings);

        CraftReceipt receipt = execute(playerId, recipe, CraftMode.STAGED, settings, profile, source);
        if (source.isEmpty()) {
            sessionRepo.delete(session);
            log.debug("[合成工作階段] 玩家 {} 的暫存已全部消耗，關閉工作階段", playerId);
        }
        return receipt;
    }

    private void requireEnabled(CraftingSettings settings) {
        if (!settings.enabled()) {
            throw new CraftingException(CraftFailureReason.FEATURE_DISABLED, "合成功能目前已關閉");
        }
    }

    private void validateRecipe(CraftingRecipe recipe, CraftMode mode, CraftingSettings settings) {
        if (!recipe.isEnabled()) {
            throw new CraftingException(CraftFailureReason.FEATURE_DISABLED,
                    "配方「" + recipe.getName() + "」目前已停用", recipe.getId(), recipe.getName());
        }
        if (mode == CraftMode.AUTO) {
            if (!settings.allowAutoCrafting()) {
                throw new CraftingException(CraftFailureReason.FEATURE_DISABLED,
                        "自動合成功能目前已關閉", recipe.getId(), recipe.getName());
            }
            if (!recipe.isAllowAuto()) {
                throw new CraftingException(CraftFailureReason.FEATURE_DISABLED,
                        "配方「" + recipe.getName() + "」不允許自動合成", recipe.getId(), recipe.getName());
            }
        }
    }

    private CraftReceipt execute(Long playerId, CraftingRecipe recipe, CraftMode mode, CraftingSettings settings,
                                 CraftingProfile profile, IngredientSource source) {
        Instant now = clock.instant();

        // 冷卻檢查
        CraftingRecipeState state = cooldownTracker.recipeState(playerId, recipe);
        CooldownStatus cooldown = cooldownTracker.checkReady(profile, state, recipe, settings, now);
        if (!cooldown.ready()) {
            throw CraftingException.onCooldown(recipe.getId(), recipe.getName(), cooldown.remainingSeconds());
        }

        // 材料檢查：第一個不足的球種即中止
        List<IngredientDemand> demands = matcher.demandsOf(recipe);
        for (IngredientDemand demand : demands) {
            long owned = source.available(demand.ball());
            if (owned < demand.quantity()) {
                throw CraftingException.insufficient(recipe.getId(), recipe.getName(),
                        demand.ball().getName(), demand.quantity(), owned);
            }
        }

        // 提交
        List<Long> consumedIds = new ArrayList<>();
        for (IngredientDemand demand : demands) {
            try {
                List<BallInstance> selected = source.select(demand.ball(), demand.quantity());
                inventory.consume(playerId, selected);
                source.afterConsume(selected);
                selected.forEach(bi -> consumedIds.add(bi.getId()));
            } catch (InsufficientStockException e) {
                // 檢查後才被別處消耗（例如暫存的球已被轉手）
                throw CraftingException.insufficient(recipe.getId(), recipe.getName(),
                        demand.ball().getName(), demand.quantity(), e.getAvailable());
            }
        }

        List<Long> mintedIds = inventory.mint(playerId, recipe.getResultBall(),
                recipe.getResultQuantity(), recipe.getResultSpecial());
        cooldownTracker.commit(profile, state, now);

        CraftResultSummary result = new CraftResultSummary(
                recipe.getResultBall().getName(),
                recipe.getResultQuantity(),
                mintedIds,
                recipe.getResultSpecial() != null ? recipe.getResultSpecial().getName() : null
        );

        log.info("[合成] 玩家 {} 以 {} 方式合成「{}」：消耗 {} 顆，產出 {} × {}",
                playerId, mode, recipe.getName(), consumedIds.size(), result.quantity(), result.resultKind());
        return new CraftReceipt(recipe.getId(), recipe.getName(), mode, consumedIds, result);
    }
}
