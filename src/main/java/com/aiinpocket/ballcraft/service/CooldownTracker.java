package com.aiinpocket.ballcraft.service;

import com.aiinpocket.ballcraft.config.CraftingSettings;
import com.aiinpocket.ballcraft.model.dto.CooldownStatus;
import com.aiinpocket.ballcraft.model.entity.CraftingProfile;
import com.aiinpocket.ballcraft.model.entity.CraftingRecipe;
import com.aiinpocket.ballcraft.model.entity.CraftingRecipeState;
import com.aiinpocket.ballcraft.repository.CraftingProfileRepository;
import com.aiinpocket.ballcraft.repository.CraftingRecipeStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 合成冷卻追蹤。
 *
 * <p>兩種範圍：
 * <ul>
 *   <li>全域冷卻：每位玩家一列（{@link CraftingProfile}），長度取自設定</li>
 *   <li>配方冷卻：每位玩家 × 配方一列（{@link CraftingRecipeState}），長度取自配方</li>
 * </ul>
 * 兩者都歸零才可合成；回報的剩餘時間取較大者。
 * 冷卻時間戳只在合成交易內推進（{@link #commit}），與消耗和產出一起提交。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CooldownTracker {

    private final CraftingProfileRepository profileRepo;
    private final CraftingRecipeStateRepository stateRepo;
    private final CraftingStateRegistry stateRegistry;
    private final Clock clock;

    /**
     * 計算剩餘冷卻（純函式）。
     */
    public static double remainingSeconds(Instant lastCraftedAt, int cooldownSeconds, Instant now) {
        if (lastCraftedAt == null || cooldownSeconds <= 0) {
            return 0d;
        }
        double elapsed = Duration.between(lastCraftedAt, now).toMillis() / 1000d;
        return Math.max(0d, cooldownSeconds - elapsed);
    }

    /**
     * 唯讀查詢玩家對配方的冷卻狀態（不建立任何資料列）。
     */
    @Transactional(readOnly = true)
    public CooldownStatus checkReady(Long playerId, CraftingRecipe recipe, CraftingSettings settings) {
        Instant globalLast = profileRepo.findByPlayerId(playerId)
                .map(CraftingProfile::getLastCraftedAt).orElse(null);
        Instant recipeLast = stateRepo.findByPlayerIdAndRecipeId(playerId, recipe.getId())
                .map(CraftingRecipeState::getLastCraftedAt).orElse(null);
        return evaluate(globalLast, recipeLast, recipe, settings, clock.instant());
    }

    /**
     * 交易內的冷卻檢查，使用已鎖定的資料列。
     */
    public CooldownStatus checkReady(CraftingProfile profile, CraftingRecipeState state,
                                     CraftingRecipe recipe, CraftingSettings settings, Instant now) {
        return evaluate(profile.getLastCraftedAt(), state.getLastCraftedAt(), recipe, settings, now);
    }

    private CooldownStatus evaluate(Instant globalLast, Instant recipeLast, CraftingRecipe recipe,
                                    CraftingSettings settings, Instant now) {
        double globalRemaining = remainingSeconds(globalLast, settings.globalCooldownSeconds(), now);
        double recipeRemaining = remainingSeconds(recipeLast, recipe.getCooldownSeconds(), now);
        return CooldownStatus.of(globalRemaining, recipeRemaining);
    }

    /**
     * 鎖定玩家的全域冷卻列（不存在時先建立）。
     * 必須在合成交易內呼叫；同一玩家的其他合成交易會在此等待直到本交易結束。
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public CraftingProfile lockPlayer(Long playerId) {
        return profileRepo.findByPlayerIdForUpdate(playerId).orElseGet(() -> {
            try {
                stateRegistry.createProfileIfAbsent(playerId);
            } catch (DataAccessException e) {
                // 另一個請求剛好同時建立，重新讀取即可
                log.debug("[冷卻] 玩家 {} 的冷卻列已由其他請求建立: {}", playerId, e.getMessage());
            }
            return profileRepo.findByPlayerIdForUpdate(playerId).orElseThrow();
        });
    }

    /**
     * 取得玩家對配方的狀態列（不存在時先建立）。呼叫前應已持有 {@link #lockPlayer} 的鎖。
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public CraftingRecipeState recipeState(Long playerId, CraftingRecipe recipe) {
        return stateRepo.findByPlayerIdAndRecipeId(playerId, recipe.getId()).orElseGet(() -> {
            try {
                stateRegistry.createRecipeStateIfAbsent(playerId, recipe.getId());
            } catch (DataAccessException e) {
                log.debug("[冷卻] 玩家 {} 配方 {} 的狀態列已存在: {}", playerId, recipe.getName(), e.getMessage());
            }
            return stateRepo.findByPlayerIdAndRecipeId(playerId, recipe.getId()).orElseThrow();
        });
    }

    /**
     * 推進兩種冷卻的時間戳。只能在合成交易內呼叫。
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void commit(CraftingProfile profile, CraftingRecipeState state, Instant now) {
        profile.setLastCraftedAt(now);
        state.setLastCraftedAt(now);
        profileRepo.save(profile);
        stateRepo.save(state);
    }

    /**
     * 設定自動合成旗標。
     */
    @Transactional
    public void setAutoEnabled(Long playerId, CraftingRecipe recipe, boolean enabled) {
        CraftingRecipeState state = recipeState(playerId, recipe);
        state.setAutoEnabled(enabled);
        stateRepo.save(state);
    }

    /**
     * 清除玩家所有配方的自動合成旗標。
     */
    @Transactional
    public int clearAutoFlags(Long playerId) {
        List<CraftingRecipeState> active = stateRepo.findByPlayerIdAndAutoEnabledTrue(playerId);
        active.forEach(s -> s.setAutoEnabled(false));
        stateRepo.saveAll(active);
        return active.size();
    }

    @Transactional(readOnly = true)
    public boolean isAutoEnabled(Long playerId, Long recipeId) {
        return stateRepo.findByPlayerIdAndRecipeId(playerId, recipeId)
                .map(CraftingRecipeState::isAutoEnabled)
                .orElse(false);
    }
}
