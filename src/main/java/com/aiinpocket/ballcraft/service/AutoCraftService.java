package com.aiinpocket.ballcraft.service;

import com.aiinpocket.ballcraft.config.CraftingProperties;
import com.aiinpocket.ballcraft.model.dto.AutoCraftSummary;
import com.aiinpocket.ballcraft.model.dto.CraftOutcome;
import com.aiinpocket.ballcraft.model.entity.CraftingRecipe;
import com.aiinpocket.ballcraft.model.enums.AutoCraftStopReason;
import com.aiinpocket.ballcraft.model.enums.CraftFailureReason;
import com.aiinpocket.ballcraft.service.catalog.RecipeCatalog;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 自動合成迴圈。
 *
 * <p>對同一個（玩家, 配方）反覆執行完整的合成交易，直到達到次數上限或第一次失敗。
 * 每次迭代之間至少等待 {@code crafting.auto.iteration-delay}；
 * 冷卻中不算失敗，等待剩餘冷卻後重試。等待可被取消，取消只發生在兩次交易之間，
 * 因此不會留下做到一半的合成。
 *
 * <p>每位玩家同時只有一個迴圈，開始新迴圈會先停止舊的。
 * 配方的 autoEnabled 旗標在迴圈開始時設為 true，結束時（不論原因）一律清回 false。
 */
@Service
@Slf4j
public class AutoCraftService {

    private static final Duration DEFAULT_ITERATION_DELAY = Duration.ofMillis(500);

    private final CraftingService craftingService;
    private final RecipeCatalog catalog;
    private final CooldownTracker cooldownTracker;
    private final TaskExecutor autoCraftExecutor;
    private final Duration iterationDelay;
    private final Integer defaultLoopBound;

    /** playerId → 進行中的迴圈 */
    private final Map<Long, AutoCraftLoop> activeLoops = new ConcurrentHashMap<>();

    /** playerId → 開始與停止迴圈時使用的監視器 */
    private final Map<Long, Object> playerLocks = new ConcurrentHashMap<>();

    public AutoCraftService(
            CraftingService craftingService,
            RecipeCatalog catalog,
            CooldownTracker cooldownTracker,
            CraftingProperties properties,
            @Qualifier("autoCraftExecutor") TaskExecutor autoCraftExecutor) {
        this.craftingService = craftingService;
        this.catalog = catalog;
        this.cooldownTracker = cooldownTracker;
        this.autoCraftExecutor = autoCraftExecutor;
        CraftingProperties.AutoParams auto = properties.auto();
        this.iterationDelay = auto != null && auto.iterationDelay() != null
                ? auto.iterationDelay() : DEFAULT_ITERATION_DELAY;
        this.defaultLoopBound = auto != null ? auto.defaultLoopBound() : null;
    }

    /**
     * 開始或停止玩家的自動合成。
     *
     * @param recipeName 配方名稱；null、空白或 "off" 表示停止
     * @param loopBound  成功合成次數上限；null 使用預設值（未設定時不限次數）
     * @return 迴圈結束時完成的摘要。儲存層錯誤會使 future 以例外完成
     * @throws org.springframework.core.task.TaskRejectedException 執行緒池已滿
     */
    public CompletableFuture<AutoCraftSummary> setAutoCraft(Long playerId, String recipeName, Integer loopBound) {
        if (recipeName == null || recipeName.isBlank() || "off".equalsIgnoreCase(recipeName.trim())) {
            return stop(playerId);
        }
        int bound = resolveBound(loopBound);

        Optional<CraftingRecipe> found = catalog.getRecipeByName(recipeName);
        if (found.isEmpty()) {
            // 交給合成服務產生 RECIPE_NOT_FOUND 結果與稽核紀錄
            CraftOutcome outcome = craftingService.craftAuto(playerId, recipeName);
            return CompletableFuture.completedFuture(new AutoCraftSummary(
                    recipeName, 0, 1, List.of(), AutoCraftStopReason.FAILED, outcome));
        }
        CraftingRecipe recipe = found.get();

        AutoCraftLoop loop = new AutoCraftLoop(playerId, recipe, bound);
        // 同一玩家的停舊、登記新與送出執行整段互斥
        synchronized (lockFor(playerId)) {
            AutoCraftLoop previous = activeLoops.remove(playerId);
            if (previous != null) {
                log.info("[自動合成] 玩家 {} 開始新的自動合成，停止原本的「{}」", playerId, previous.recipe.getName());
                previous.cancel();
                previous.awaitExit();
            }

            activeLoops.put(playerId, loop);
            cooldownTracker.setAutoEnabled(playerId, recipe, true);
            try {
                autoCraftExecutor.execute(loop);
            } catch (RuntimeException e) {
                log.warn("[自動合成] 執行緒池已滿，玩家 {} 的自動合成無法開始: {}", playerId, e.getMessage());
                activeLoops.remove(playerId, loop);
                cooldownTracker.setAutoEnabled(playerId, recipe, false);
                throw e;
            }
        }
        log.info("[自動合成] 玩家 {} 開始自動合成「{}」，上限 {} 次",
                playerId, recipe.getName(), bound == Integer.MAX_VALUE ? "不限" : bound);
        return loop.future;
    }

    /**
     * 停止玩家的自動合成。
     *
     * @return 被停止迴圈的摘要 future；沒有進行中的迴圈時回傳已完成的 CANCELLED 摘要
     */
    public CompletableFuture<AutoCraftSummary> stop(Long playerId) {
        AutoCraftLoop loop;
        synchronized (lockFor(playerId)) {
            loop = activeLoops.remove(playerId);
        }
        if (loop == null) {
            return CompletableFuture.completedFuture(new AutoCraftSummary(
                    null, 0, 0, List.of(), AutoCraftStopReason.CANCELLED, null));
        }
        log.info("[自動合成] 玩家 {} 停止自動合成「{}」", playerId, loop.recipe.getName());
        loop.cancel();
        return loop.future;
    }

    public boolean isRunning(Long playerId) {
        return activeLoops.containsKey(playerId);
    }

    @PreDestroy
    void shutdown() {
        if (!activeLoops.isEmpty()) {
            log.info("[自動合成] 應用程式關閉，停止 {} 個自動合成迴圈", activeLoops.size());
        }
        activeLoops.values().forEach(AutoCraftLoop::cancel);
    }

    private Object lockFor(Long playerId) {
        return playerLocks.computeIfAbsent(playerId, k -> new Object());
    }

    private int resolveBound(Integer loopBound) {
        Integer bound = loopBound != null ? loopBound : defaultLoopBound;
        if (bound == null) {
            return Integer.MAX_VALUE;
        }
        if (bound < 1) {
            throw new IllegalArgumentException("自動合成次數上限必須大於 0");
        }
        return bound;
    }

    /**
     * 單一玩家的自動合成迴圈。
     */
    private final class AutoCraftLoop implements Runnable {

        private final Long playerId;
        private final CraftingRecipe recipe;
        private final int bound;
        private final CompletableFuture<AutoCraftSummary> future = new CompletableFuture<>();
        private final CompletableFuture<Void> cancelSignal = new CompletableFuture<>();

        private AutoCraftLoop(Long playerId, CraftingRecipe recipe, int bound) {
            this.playerId = playerId;
            this.recipe = recipe;
            this.bound = bound;
        }

        void cancel() {
            cancelSignal.complete(null);
        }

        void awaitExit() {
            future.handle((summary, error) -> null).join();
        }

        @Override
        public void run() {
            AutoCraftSummary summary = null;
            RuntimeException failure = null;
            try {
                summary = loop();
            } catch (RuntimeException e) {
                log.error("[自動合成] 玩家 {} 的自動合成「{}」因系統錯誤中止", playerId, recipe.getName(), e);
                failure = e;
            } finally {
                activeLoops.remove(playerId, this);
                try {
                    cooldownTracker.setAutoEnabled(playerId, recipe, false);
                } catch (RuntimeException e) {
                    log.warn("[自動合成] 玩家 {} 配方「{}」的自動合成旗標清除失敗: {}",
                            playerId, recipe.getName(), e.getMessage());
                }
            }
            if (failure != null) {
                future.completeExceptionally(failure);
            } else {
                future.complete(summary);
            }
        }

        private AutoCraftSummary loop() {
            int crafted = 0;
            int attempts = 0;
            List<Long> mintedIds = new ArrayList<>();
            CraftOutcome last = null;
            AutoCraftStopReason stopReason;

            while (true) {
                if (cancelSignal.isDone()) {
                    stopReason = AutoCraftStopReason.CANCELLED;
                    break;
                }
                attempts++;
                last = craftingService.craftAuto(playerId, recipe.getName());

                Duration pause;
                if (last.success()) {
                    crafted++;
                    mintedIds.addAll(last.result().mintedIds());
                    if (crafted >= bound) {
                        stopReason = AutoCraftStopReason.BOUND_REACHED;
                        break;
                    }
                    pause = iterationDelay;
                } else if (last.reason() == CraftFailureReason.ON_COOLDOWN) {
                    Duration remaining = Duration.ofMillis((long) Math.ceil(last.remainingCooldownSeconds() * 1000));
                    pause = remaining.compareTo(iterationDelay) > 0 ? remaining : iterationDelay;
                } else {
                    stopReason = AutoCraftStopReason.FAILED;
                    break;
                }

                if (!pause(pause)) {
                    stopReason = AutoCraftStopReason.CANCELLED;
                    break;
                }
            }

            log.info("[自動合成] 玩家 {} 的自動合成「{}」結束：成功 {} 次，嘗試 {} 次，原因 {}",
                    playerId, recipe.getName(), crafted, attempts, stopReason);
            return new AutoCraftSummary(recipe.getName(), crafted, attempts,
                    List.copyOf(mintedIds), stopReason, last);
        }

        /**
         * 等待指定時間；期間被取消則回傳 false。
         */
        private boolean pause(Duration duration) {
            try {
                cancelSignal.get(duration.toMillis(), TimeUnit.MILLISECONDS);
                return false;
            } catch (TimeoutException e) {
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (ExecutionException e) {
                return false;
            }
        }
    }
}
