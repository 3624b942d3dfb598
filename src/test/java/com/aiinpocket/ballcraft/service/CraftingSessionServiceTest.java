package com.aiinpocket.ballcraft.service;

import com.aiinpocket.ballcraft.config.CraftingSettings;
import com.aiinpocket.ballcraft.model.dto.CraftOutcome;
import com.aiinpocket.ballcraft.model.dto.SessionView;
import com.aiinpocket.ballcraft.model.entity.Ball;
import com.aiinpocket.ballcraft.model.entity.BallInstance;
import com.aiinpocket.ballcraft.model.entity.CraftingLog;
import com.aiinpocket.ballcraft.model.entity.CraftingSession;
import com.aiinpocket.ballcraft.model.enums.CraftFailureReason;
import com.aiinpocket.ballcraft.model.enums.CraftMode;
import com.aiinpocket.ballcraft.support.CraftingIntegrationTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.List;

import static com.aiinpocket.ballcraft.support.CraftingTestConfig.T0;
import static org.assertj.core.api.Assertions.assertThat;

class CraftingSessionServiceTest extends CraftingIntegrationTestBase {

    @Autowired
    private CraftingService craftingService;

    @Autowired
    private CraftingSessionService sessionService;

    private Ball eagle;
    private Ball wolf;
    private Ball phoenix;

    @BeforeEach
    void setUpCatalog() {
        eagle = ball("Eagle", 100, 80);
        wolf = ball("Wolf", 60, 120);
        phoenix = ball("Phoenix", 300, 200);
    }

    @Test
    void stageAdd_createsSessionWithTimeout() {
        BallInstance e = give(PLAYER, eagle, 1).get(0);

        CraftOutcome outcome = craftingService.stageAdd(PLAYER, e.getId());

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.message()).contains(e.getDisplayId());
        CraftingSession session = sessionRepo.findByPlayerId(PLAYER).orElseThrow();
        assertThat(session.getCreatedAt()).isEqualTo(T0);
        assertThat(session.getExpiresAt()).isEqualTo(T0.plus(Duration.ofMinutes(10)));
        assertThat(sessionItemRepo.countBySessionId(session.getId())).isEqualTo(1);
    }

    @Test
    void stageAdd_sameItemTwiceIsAlreadyStaged() {
        BallInstance e = give(PLAYER, eagle, 1).get(0);
        craftingService.stageAdd(PLAYER, e.getId());

        CraftOutcome again = craftingService.stageAdd(PLAYER, e.getId());

        assertThat(again.success()).isFalse();
        assertThat(again.reason()).isEqualTo(CraftFailureReason.ALREADY_STAGED);
        assertThat(sessionItemRepo.count()).isEqualTo(1);
    }

    @Test
    void stageAdd_rejectsItemsThePlayerDoesNotHold() {
        BallInstance foreign = give(OTHER_PLAYER, eagle, 1).get(0);
        BallInstance spent = give(PLAYER, eagle, 1).get(0);
        spent.setDeleted(true);
        instanceRepo.save(spent);

        assertThat(craftingService.stageAdd(PLAYER, foreign.getId()).reason())
                .isEqualTo(CraftFailureReason.ITEM_NOT_FOUND);
        assertThat(craftingService.stageAdd(PLAYER, spent.getId()).reason())
                .isEqualTo(CraftFailureReason.ITEM_NOT_FOUND);
        assertThat(craftingService.stageAdd(PLAYER, 999_999L).reason())
                .isEqualTo(CraftFailureReason.ITEM_NOT_FOUND);
    }

    @Test
    void stageRemove_signalsWhenNothingToRemove() {
        BallInstance e = give(PLAYER, eagle, 2).get(0);

        assertThat(craftingService.stageRemove(PLAYER, e.getId()).reason())
                .isEqualTo(CraftFailureReason.NO_SESSION_ACTIVE);

        craftingService.stageAdd(PLAYER, e.getId());
        assertThat(craftingService.stageRemove(PLAYER, e.getId()).success()).isTrue();
        assertThat(craftingService.stageRemove(PLAYER, e.getId()).reason())
                .isEqualTo(CraftFailureReason.NOT_STAGED);
    }

    @Test
    void stageClear_removesSession() {
        for (BallInstance e : give(PLAYER, eagle, 2)) {
            craftingService.stageAdd(PLAYER, e.getId());
        }

        CraftOutcome cleared = craftingService.stageClear(PLAYER);

        assertThat(cleared.success()).isTrue();
        assertThat(cleared.message()).contains("2");
        assertThat(sessionRepo.findByPlayerId(PLAYER)).isEmpty();
        assertThat(sessionItemRepo.count()).isZero();
        assertThat(craftingService.stageClear(PLAYER).reason()).isEqualTo(CraftFailureReason.NO_SESSION_ACTIVE);
        assertThat(owned(PLAYER, eagle)).isEqualTo(2);
    }

    @Test
    void expiredSession_isReplacedByAFreshEmptyOne() {
        List<BallInstance> eagles = give(PLAYER, eagle, 2);
        craftingService.stageAdd(PLAYER, eagles.get(0).getId());
        Long oldSessionId = sessionRepo.findByPlayerId(PLAYER).orElseThrow().getId();

        clock.advance(Duration.ofMinutes(11));
        assertThat(craftingService.viewSession(PLAYER).active()).isFalse();

        craftingService.stageAdd(PLAYER, eagles.get(1).getId());

        CraftingSession fresh = sessionRepo.findByPlayerId(PLAYER).orElseThrow();
        assertThat(fresh.getId()).isNotEqualTo(oldSessionId);
        assertThat(fresh.getExpiresAt()).isEqualTo(T0.plus(Duration.ofMinutes(21)));
        SessionView view = craftingService.viewSession(PLAYER);
        assertThat(view.items()).extracting(SessionView.StagedItem::id).containsExactly(eagles.get(1).getId());
    }

    @Test
    void stagedCraft_consumesOnlyStagedItems() {
        recipe("Fusion", phoenix, 1, eagle, 2);
        List<BallInstance> eagles = give(PLAYER, eagle, 3);
        // 暫存較新的兩顆，最舊的一顆留在背包
        craftingService.stageAdd(PLAYER, eagles.get(1).getId());
        craftingService.stageAdd(PLAYER, eagles.get(2).getId());

        CraftOutcome outcome = craftingService.stageCraft(PLAYER);

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.recipeName()).isEqualTo("Fusion");
        assertThat(isConsumed(eagles.get(0))).isFalse();
        assertThat(isConsumed(eagles.get(1))).isTrue();
        assertThat(isConsumed(eagles.get(2))).isTrue();
        assertThat(owned(PLAYER, phoenix)).isEqualTo(1);
        assertThat(sessionRepo.findByPlayerId(PLAYER)).isEmpty();

        List<CraftingLog> logs = logsOf(PLAYER);
        assertThat(logs).singleElement().satisfies(log -> {
            assertThat(log.isSuccess()).isTrue();
            assertThat(log.getMode()).isEqualTo(CraftMode.STAGED);
        });
    }

    @Test
    void stagedCraft_keepsUnconsumedExtrasStaged() {
        recipe("Fusion", phoenix, 1, eagle, 2);
        List<BallInstance> eagles = give(PLAYER, eagle, 3);
        BallInstance w = give(PLAYER, wolf, 1).get(0);
        eagles.forEach(e -> craftingService.stageAdd(PLAYER, e.getId()));
        craftingService.stageAdd(PLAYER, w.getId());

        assertThat(craftingService.stageCraft(PLAYER).success()).isTrue();

        SessionView view = craftingService.viewSession(PLAYER);
        assertThat(view.active()).isTrue();
        assertThat(view.items()).extracting(SessionView.StagedItem::id)
                .containsExactly(eagles.get(2).getId(), w.getId());
        assertThat(view.craftableRecipes()).isEmpty();
    }

    @Test
    void stagedCraft_picksFirstCraftableRecipeInCatalogOrder() {
        recipe("Beta", phoenix, 1, eagle, 1);
        recipe("Alpha", wolf, 1, eagle, 2);
        for (BallInstance e : give(PLAYER, eagle, 2)) {
            craftingService.stageAdd(PLAYER, e.getId());
        }

        assertThat(craftingService.viewSession(PLAYER).craftableRecipes()).containsExactly("Alpha", "Beta");

        CraftOutcome outcome = craftingService.stageCraft(PLAYER);

        assertThat(outcome.recipeName()).isEqualTo("Alpha");
        assertThat(owned(PLAYER, wolf)).isEqualTo(1);
        assertThat(owned(PLAYER, phoenix)).isZero();
    }

    @Test
    void stagedItemSpentElsewhere_isNoLongerCounted() {
        recipe("Fusion", phoenix, 1, eagle, 2);
        recipe("Single", wolf, 1, eagle, 1);
        List<BallInstance> eagles = give(PLAYER, eagle, 2);
        eagles.forEach(e -> craftingService.stageAdd(PLAYER, e.getId()));

        // 直接合成依 FIFO 取走最舊的一顆，也就是暫存中的第一顆
        assertThat(craftingService.craftDirect(PLAYER, "Single").success()).isTrue();

        SessionView view = craftingService.viewSession(PLAYER);
        assertThat(view.items()).extracting(SessionView.StagedItem::available).containsExactly(false, true);
        assertThat(view.craftableRecipes()).containsExactly("Single");

        CraftOutcome outcome = craftingService.stageCraft(PLAYER);
        assertThat(outcome.success()).isTrue();
        assertThat(outcome.recipeName()).isEqualTo("Single");
        assertThat(owned(PLAYER, eagle)).isZero();
    }

    @Test
    void stagedItemSpentElsewhere_reportsShortageAtCraft() {
        recipe("Fusion", phoenix, 1, eagle, 2);
        List<BallInstance> eagles = give(PLAYER, eagle, 2);
        eagles.forEach(e -> craftingService.stageAdd(PLAYER, e.getId()));

        BallInstance spent = eagles.get(0);
        spent.setDeleted(true);
        instanceRepo.save(spent);

        CraftOutcome outcome = craftingService.stageCraft(PLAYER);

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.reason()).isEqualTo(CraftFailureReason.INSUFFICIENT_INGREDIENTS);
        assertThat(outcome.recipeName()).isEqualTo("Fusion");
        assertThat(outcome.shortage().kind()).isEqualTo("Eagle");
        assertThat(outcome.shortage().required()).isEqualTo(2);
        assertThat(outcome.shortage().owned()).isEqualTo(1);
        assertThat(isConsumed(eagles.get(1))).isFalse();
        assertThat(owned(PLAYER, phoenix)).isZero();
        assertThat(sessionItemRepo.count()).isEqualTo(2);
    }

    @Test
    void stagedCraft_onExpiredSessionDeletesIt() {
        recipe("Fusion", phoenix, 1, eagle, 1);
        BallInstance e = give(PLAYER, eagle, 1).get(0);
        craftingService.stageAdd(PLAYER, e.getId());

        clock.advance(Duration.ofMinutes(11));
        CraftOutcome outcome = craftingService.stageCraft(PLAYER);

        assertThat(outcome.reason()).isEqualTo(CraftFailureReason.NO_SESSION_ACTIVE);
        assertThat(sessionRepo.findByPlayerId(PLAYER)).isEmpty();
        assertThat(sessionItemRepo.count()).isZero();
        assertThat(owned(PLAYER, eagle)).isEqualTo(1);
    }

    @Test
    void stagedCraft_withoutMatchOrSession() {
        recipe("Fusion", phoenix, 1, eagle, 2);

        assertThat(craftingService.stageCraft(PLAYER).reason()).isEqualTo(CraftFailureReason.NO_SESSION_ACTIVE);

        BallInstance e = give(PLAYER, eagle, 1).get(0);
        craftingService.stageAdd(PLAYER, e.getId());
        CraftOutcome outcome = craftingService.stageCraft(PLAYER);

        assertThat(outcome.reason()).isEqualTo(CraftFailureReason.NO_CRAFTABLE_RECIPE);
        assertThat(sessionItemRepo.count()).isEqualTo(1);
        List<CraftingLog> logs = logsOf(PLAYER);
        assertThat(logs).hasSize(2);
        assertThat(logs.get(1).getMode()).isEqualTo(CraftMode.STAGED);
        assertThat(logs.get(1).getRecipe()).isNull();
    }

    @Test
    void stagedCraft_onCooldownKeepsStagedItems() {
        recipe("Fusion", phoenix, 1, eagle, 1);
        settings.set(new CraftingSettings(true, 30, true, 10));
        List<BallInstance> eagles = give(PLAYER, eagle, 2);
        craftingService.craftDirect(PLAYER, "Fusion");

        craftingService.stageAdd(PLAYER, eagles.get(1).getId());
        CraftOutcome outcome = craftingService.stageCraft(PLAYER);

        assertThat(outcome.reason()).isEqualTo(CraftFailureReason.ON_COOLDOWN);
        assertThat(isConsumed(eagles.get(1))).isFalse();
        assertThat(sessionItemRepo.count()).isEqualTo(1);
    }

    @Test
    void view_reportsCountsTotalsAndTimeLeft() {
        BallInstance boosted = instanceRepo.save(BallInstance.builder()
                .playerId(PLAYER).ball(eagle).catchDate(T0).attackBonus(50).healthBonus(25).build());
        BallInstance plain = give(PLAYER, wolf, 1).get(0);
        craftingService.stageAdd(PLAYER, boosted.getId());
        craftingService.stageAdd(PLAYER, plain.getId());

        clock.advance(Duration.ofMinutes(3));
        SessionView view = craftingService.viewSession(PLAYER);

        assertThat(view.active()).isTrue();
        assertThat(view.countsByKind()).containsEntry("Eagle", 1).containsEntry("Wolf", 1);
        assertThat(view.totalAttack()).isEqualTo(150 + 60);
        assertThat(view.totalHealth()).isEqualTo(100 + 120);
        assertThat(view.minutesLeft()).isEqualTo(7);
        assertThat(view.items().get(0).displayId()).isEqualTo(boosted.getDisplayId());
    }

    @Test
    void purgeExpired_deletesOnlyExpiredSessions() {
        BallInstance a = give(PLAYER, eagle, 1).get(0);
        craftingService.stageAdd(PLAYER, a.getId());

        clock.advance(Duration.ofMinutes(6));
        BallInstance b = give(OTHER_PLAYER, eagle, 1).get(0);
        craftingService.stageAdd(OTHER_PLAYER, b.getId());

        clock.advance(Duration.ofMinutes(5));
        assertThat(sessionService.purgeExpired()).isEqualTo(1);
        assertThat(sessionRepo.findByPlayerId(PLAYER)).isEmpty();
        assertThat(sessionRepo.findByPlayerId(OTHER_PLAYER)).isPresent();
        assertThat(sessionItemRepo.count()).isEqualTo(1);
    }
}
