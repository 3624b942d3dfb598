package com.aiinpocket.ballcraft.service;

import com.aiinpocket.ballcraft.config.CraftingSettings;
import com.aiinpocket.ballcraft.model.dto.SessionView;
import com.aiinpocket.ballcraft.model.entity.BallInstance;
import com.aiinpocket.ballcraft.model.entity.CraftingRecipe;
import com.aiinpocket.ballcraft.model.entity.CraftingSession;
import com.aiinpocket.ballcraft.model.entity.CraftingSessionItem;
import com.aiinpocket.ballcraft.model.enums.CraftFailureReason;
import com.aiinpocket.ballcraft.repository.BallInstanceRepository;
import com.aiinpocket.ballcraft.repository.CraftingSessionItemRepository;
import com.aiinpocket.ballcraft.repository.CraftingSessionRepository;
import com.aiinpocket.ballcraft.service.catalog.RecipeCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 合成工作階段（暫存區）管理。
 *
 * <p>每位玩家最多一個工作階段；到期判斷在存取時進行，過期的工作階段會被刪除，
 * 暫存的球不會帶到新的工作階段。暫存只是參照，不會鎖住球，
 * 球在別處被消耗後會在檢視中標示為不可用，也不計入可合成的配方。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CraftingSessionService {

    private final CraftingSessionRepository sessionRepo;
    private final CraftingSessionItemRepository itemRepo;
    private final BallInstanceRepository instanceRepo;
    private final RecipeCatalog catalog;
    private final RecipeMatcher matcher;
    private final Clock clock;

    /**
     * 取得玩家未過期的工作階段；沒有或已過期時建立新的。
     */
    @Transactional
    public CraftingSession getOrCreate(Long playerId, CraftingSettings settings) {
        return findActive(playerId).orElseGet(() -> {
            Instant now = clock.instant();
            CraftingSession session = CraftingSession.builder()
                    .playerId(playerId)
                    .createdAt(now)
                    .expiresAt(now.plus(Duration.ofMinutes(settings.sessionTimeoutMinutes())))
                    .build();
            log.debug("[合成工作階段] 玩家 {} 建立新的工作階段，到期 {}", playerId, session.getExpiresAt());
            return sessionRepo.save(session);
        });
    }

    /**
     * 取得玩家未過期的工作階段。已過期者在此刪除。
     */
    @Transactional
    public Optional<CraftingSession> findActive(Long playerId) {
        Optional<CraftingSession> existing = sessionRepo.findByPlayerId(playerId);
        if (existing.isPresent() && existing.get().isExpired(clock.instant())) {
            sessionRepo.delete(existing.get());
            // 先送出刪除，同一交易內才能再建立同玩家的工作階段
            sessionRepo.flush();
            log.debug("[合成工作階段] 玩家 {} 的工作階段已過期並刪除", playerId);
            return Optional.empty();
        }
        return existing;
    }

    /**
     * 暫存一顆球。球必須屬於玩家且尚未被消耗。
     *
     * @return 被暫存的球
     * @throws CraftingException ITEM_NOT_FOUND / ALREADY_STAGED / FEATURE_DISABLED
     */
    @Transactional
    public BallInstance addItem(Long playerId, Long instanceId, CraftingSettings settings) {
        requireEnabled(settings);
        BallInstance instance = instanceRepo.findByIdAndPlayerIdAndDeletedFalse(instanceId, playerId)
                .orElseThrow(() -> new CraftingException(CraftFailureReason.ITEM_NOT_FOUND,
                        "找不到該球，或你並未擁有它"));

        CraftingSession session = getOrCreate(playerId, settings);
        if (itemRepo.existsBySessionIdAndBallInstanceId(session.getId(), instanceId)) {
            throw new CraftingException(CraftFailureReason.ALREADY_STAGED,
                    instance.getDisplayId() + " 已在合成工作階段中");
        }

        itemRepo.save(CraftingSessionItem.builder()
                .session(session)
                .ballInstance(instance)
                .build());
        log.debug("[合成工作階段] 玩家 {} 暫存 {}（{}）", playerId, instance.getDisplayId(), instance.getBall().getName());
        return instance;
    }

    /**
     * 從工作階段移除一顆球。
     *
     * @throws CraftingException NO_SESSION_ACTIVE / NOT_STAGED / FEATURE_DISABLED
     */
    @Transactional
    public void removeItem(Long playerId, Long instanceId, CraftingSettings settings) {
        requireEnabled(settings);
        CraftingSession session = findActive(playerId)
                .orElseThrow(() -> new CraftingException(CraftFailureReason.NO_SESSION_ACTIVE,
                        "目前沒有進行中的合成工作階段"));
        CraftingSessionItem row = itemRepo.findBySessionIdAndBallInstanceId(session.getId(), instanceId)
                .orElseThrow(() -> new CraftingException(CraftFailureReason.NOT_STAGED,
                        "該球不在你的合成工作階段中"));
        itemRepo.delete(row);
    }

    /**
     * 清空並關閉工作階段。
     *
     * @return 被移除的暫存數量
     */
    @Transactional
    public int clear(Long playerId, CraftingSettings settings) {
        requireEnabled(settings);
        CraftingSession session = findActive(playerId)
                .orElseThrow(() -> new CraftingException(CraftFailureReason.NO_SESSION_ACTIVE,
                        "目前沒有進行中的合成工作階段"));
        int count = (int) itemRepo.countBySessionId(session.getId());
        sessionRepo.delete(session);
        log.debug("[合成工作階段] 玩家 {} 清空工作階段（{} 顆）", playerId, count);
        return count;
    }

    /**
     * 依目前的暫存內容計算可合成的配方（目錄順序）。每次呼叫都重新計算。
     */
    @Transactional(readOnly = true)
    public List<CraftingRecipe> computeCraftable(CraftingSession session) {
        List<CraftingSessionItem> staged = new ArrayList<>(itemRepo.findStagedItems(session.getId()));
        StagedIngredientSource source = new StagedIngredientSource(session.getPlayerId(), staged, itemRepo);
        return matcher.findCraftable(source.availableCounts(), catalog.listEnabledRecipes());
    }

    /**
     * 工作階段檢視：暫存項目、各球種數量、總數值、可合成配方與剩餘時間。
     */
    @Transactional
    public SessionView view(Long playerId) {
        Optional<CraftingSession> active = findActive(playerId);
        if (active.isEmpty()) {
            return SessionView.inactive();
        }
        CraftingSession session = active.get();
        List<CraftingSessionItem> staged = itemRepo.findStagedItems(session.getId());

        List<SessionView.StagedItem> items = new ArrayList<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        int totalAtk = 0;
        int totalHp = 0;
        for (CraftingSessionItem si : staged) {
            BallInstance bi = si.getBallInstance();
            boolean available = StagedIngredientSource.isAvailable(bi, playerId);
            items.add(new SessionView.StagedItem(
                    bi.getId(), bi.getDisplayId(), bi.getBall().getName(),
                    bi.getSpecial() != null ? bi.getSpecial().getName() : null,
                    bi.getAttackBonus(), bi.getHealthBonus(), available));
            if (available) {
                counts.merge(bi.getBall().getName(), 1, Integer::sum);
                totalAtk += bi.getEffectiveAttack();
                totalHp += bi.getEffectiveHealth();
            }
        }

        List<String> craftable = computeCraftable(session).stream()
                .map(CraftingRecipe::getName)
                .toList();
        long minutesLeft = Math.max(0, Duration.between(clock.instant(), session.getExpiresAt()).toMinutes());

        return new SessionView(true, items, counts, totalAtk, totalHp, craftable,
                session.getExpiresAt(), minutesLeft);
    }

    /**
     * 刪除所有已過期的工作階段（排程清理用）。
     *
     * @return 刪除數量
     */
    @Transactional
    public int purgeExpired() {
        List<CraftingSession> expired = sessionRepo.findByExpiresAtBefore(clock.instant());
        sessionRepo.deleteAll(expired);
        return expired.size();
    }

    private void requireEnabled(CraftingSettings settings) {
        if (!settings.enabled()) {
            throw new CraftingException(CraftFailureReason.FEATURE_DISABLED, "合成功能目前已關閉");
        }
    }
}
