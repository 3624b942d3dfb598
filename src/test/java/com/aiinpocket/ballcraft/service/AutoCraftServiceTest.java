package com.aiinpocket.ballcraft.service;

import com.aiinpocket.ballcraft.config.CraftingSettings;
import com.aiinpocket.ballcraft.model.dto.AutoCraftSummary;
import com.aiinpocket.ballcraft.model.entity.Ball;
import com.aiinpocket.ballcraft.model.entity.CraftingRecipe;
import com.aiinpocket.ballcraft.model.enums.AutoCraftStopReason;
import com.aiinpocket.ballcraft.model.enums.CraftFailureReason;
import com.aiinpocket.ballcraft.model.enums.CraftMode;
import com.aiinpocket.ballcraft.support.CraftingIntegrationTestBase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AutoCraftServiceTest extends CraftingIntegrationTestBase {

    @Autowired
    private AutoCraftService autoCraftService;

    @Autowired
    private CooldownTracker cooldownTracker;

    private Ball eagle;
    private Ball phoenix;

    @BeforeEach
    void setUpCatalog() {
        eagle = ball("Eagle");
        phoenix = ball("Phoenix");
    }

    @AfterEach
    void stopLoops() throws Exception {
        autoCraftService.stop(PLAYER).get(5, TimeUnit.SECONDS);
    }

    @Test
    void loopStopsAtFirstShortageAndClearsFlag() throws Exception {
        CraftingRecipe fusion = recipe("Fusion", phoenix, 1, eagle, 2);
        give(PLAYER, eagle, 4);

        AutoCraftSummary summary = autoCraftService.setAutoCraft(PLAYER, "Fusion", 3).get(10, TimeUnit.SECONDS);

        assertThat(summary.crafted()).isEqualTo(2);
        assertThat(summary.attempts()).isEqualTo(3);
        assertThat(summary.mintedIds()).hasSize(2);
        assertThat(summary.stopReason()).isEqualTo(AutoCraftStopReason.FAILED);
        assertThat(summary.lastOutcome().reason()).isEqualTo(CraftFailureReason.INSUFFICIENT_INGREDIENTS);
        assertThat(owned(PLAYER, eagle)).isZero();
        assertThat(owned(PLAYER, phoenix)).isEqualTo(2);
        assertThat(cooldownTracker.isAutoEnabled(PLAYER, fusion.getId())).isFalse();
        assertThat(autoCraftService.isRunning(PLAYER)).isFalse();
        assertThat(logsOf(PLAYER))
                .allSatisfy(log -> assertThat(log.getMode()).isEqualTo(CraftMode.AUTO));
    }

    @Test
    void loopStopsWhenBoundReached() throws Exception {
        CraftingRecipe fusion = recipe("Fusion", phoenix, 1, eagle, 1);
        give(PLAYER, eagle, 10);

        AutoCraftSummary summary = autoCraftService.setAutoCraft(PLAYER, "Fusion", 3).get(10, TimeUnit.SECONDS);

        assertThat(summary.crafted()).isEqualTo(3);
        assertThat(summary.stopReason()).isEqualTo(AutoCraftStopReason.BOUND_REACHED);
        assertThat(summary.lastOutcome().success()).isTrue();
        assertThat(owned(PLAYER, eagle)).isEqualTo(7);
        assertThat(cooldownTracker.isAutoEnabled(PLAYER, fusion.getId())).isFalse();
    }

    @Test
    void off_cancelsLoopWaitingOnCooldown() throws Exception {
        CraftingRecipe slow = CraftingRecipe.builder().name("Slow").resultBall(phoenix).cooldownSeconds(60).build();
        slow.addIngredient(eagle, 1);
        save(slow);
        give(PLAYER, eagle, 5);

        CompletableFuture<AutoCraftSummary> future = autoCraftService.setAutoCraft(PLAYER, "Slow", null);
        waitUntil(() -> countLogs(PLAYER, false) >= 1, Duration.ofSeconds(10));

        assertThat(autoCraftService.isRunning(PLAYER)).isTrue();
        assertThat(cooldownTracker.isAutoEnabled(PLAYER, slow.getId())).isTrue();

        AutoCraftSummary summary = autoCraftService.setAutoCraft(PLAYER, "off", null).get(5, TimeUnit.SECONDS);

        assertThat(future).isCompleted();
        assertThat(summary.stopReason()).isEqualTo(AutoCraftStopReason.CANCELLED);
        assertThat(summary.crafted()).isEqualTo(1);
        assertThat(summary.lastOutcome().reason()).isEqualTo(CraftFailureReason.ON_COOLDOWN);
        assertThat(owned(PLAYER, eagle)).isEqualTo(4);
        assertThat(cooldownTracker.isAutoEnabled(PLAYER, slow.getId())).isFalse();
    }

    @Test
    void startingNewLoop_cancelsThePreviousOne() throws Exception {
        CraftingRecipe slow = CraftingRecipe.builder().name("Slow").resultBall(phoenix).cooldownSeconds(60).build();
        slow.addIngredient(eagle, 1);
        save(slow);
        CraftingRecipe rebirth = recipe("Rebirth", eagle, 1, phoenix, 1);
        give(PLAYER, eagle, 2);

        CompletableFuture<AutoCraftSummary> first = autoCraftService.setAutoCraft(PLAYER, "Slow", null);
        waitUntil(() -> owned(PLAYER, phoenix) == 1, Duration.ofSeconds(10));

        AutoCraftSummary second = autoCraftService.setAutoCraft(PLAYER, "Rebirth", 1).get(10, TimeUnit.SECONDS);

        assertThat(first.get(5, TimeUnit.SECONDS).stopReason()).isEqualTo(AutoCraftStopReason.CANCELLED);
        assertThat(second.stopReason()).isEqualTo(AutoCraftStopReason.BOUND_REACHED);
        assertThat(cooldownTracker.isAutoEnabled(PLAYER, slow.getId())).isFalse();
        assertThat(cooldownTracker.isAutoEnabled(PLAYER, rebirth.getId())).isFalse();
    }

    @Test
    void concurrentStarts_leaveOnlyOneStoppableLoop() throws Exception {
        CraftingRecipe slow = CraftingRecipe.builder().name("Slow").resultBall(phoenix).cooldownSeconds(60).build();
        slow.addIngredient(eagle, 1);
        save(slow);
        give(PLAYER, eagle, 5);

        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 5; round++) {
                CyclicBarrier barrier = new CyclicBarrier(2);
                Callable<CompletableFuture<AutoCraftSummary>> start = () -> {
                    barrier.await(5, TimeUnit.SECONDS);
                    return autoCraftService.setAutoCraft(PLAYER, "Slow", null);
                };
                Future<CompletableFuture<AutoCraftSummary>> a = callers.submit(start);
                Future<CompletableFuture<AutoCraftSummary>> b = callers.submit(start);
                CompletableFuture<AutoCraftSummary> first = a.get(10, TimeUnit.SECONDS);
                CompletableFuture<AutoCraftSummary> second = b.get(10, TimeUnit.SECONDS);

                autoCraftService.stop(PLAYER);

                assertThat(first.get(5, TimeUnit.SECONDS).stopReason()).isEqualTo(AutoCraftStopReason.CANCELLED);
                assertThat(second.get(5, TimeUnit.SECONDS).stopReason()).isEqualTo(AutoCraftStopReason.CANCELLED);
                assertThat(autoCraftService.isRunning(PLAYER)).isFalse();
                assertThat(cooldownTracker.isAutoEnabled(PLAYER, slow.getId())).isFalse();
            }
        } finally {
            callers.shutdownNow();
        }
        assertThat(owned(PLAYER, phoenix)).isEqualTo(1);
    }

    @Test
    void autoCraftingSwitchedOff_failsImmediately() throws Exception {
        CraftingRecipe fusion = recipe("Fusion", phoenix, 1, eagle, 1);
        give(PLAYER, eagle, 3);
        settings.set(new CraftingSettings(true, 0, false, 10));

        AutoCraftSummary summary = autoCraftService.setAutoCraft(PLAYER, "Fusion", 3).get(10, TimeUnit.SECONDS);

        assertThat(summary.crafted()).isZero();
        assertThat(summary.stopReason()).isEqualTo(AutoCraftStopReason.FAILED);
        assertThat(summary.lastOutcome().reason()).isEqualTo(CraftFailureReason.FEATURE_DISABLED);
        assertThat(owned(PLAYER, eagle)).isEqualTo(3);
        assertThat(cooldownTracker.isAutoEnabled(PLAYER, fusion.getId())).isFalse();
    }

    @Test
    void unknownRecipe_returnsCompletedFailure() {
        CompletableFuture<AutoCraftSummary> future = autoCraftService.setAutoCraft(PLAYER, "Nope", 3);

        assertThat(future).isCompleted();
        AutoCraftSummary summary = future.join();
        assertThat(summary.stopReason()).isEqualTo(AutoCraftStopReason.FAILED);
        assertThat(summary.lastOutcome().reason()).isEqualTo(CraftFailureReason.RECIPE_NOT_FOUND);
        assertThat(autoCraftService.isRunning(PLAYER)).isFalse();
    }

    @Test
    void off_withoutRunningLoopIsCancelledSummary() {
        AutoCraftSummary summary = autoCraftService.setAutoCraft(PLAYER, "OFF", null).join();

        assertThat(summary.stopReason()).isEqualTo(AutoCraftStopReason.CANCELLED);
        assertThat(summary.crafted()).isZero();
        assertThat(summary.attempts()).isZero();
    }

    @Test
    void nonPositiveBound_isRejected() {
        recipe("Fusion", phoenix, 1, eagle, 1);

        assertThatThrownBy(() -> autoCraftService.setAutoCraft(PLAYER, "Fusion", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static void waitUntil(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within " + timeout);
            }
            Thread.sleep(20);
        }
    }
}
