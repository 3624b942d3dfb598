package com.aiinpocket.ballcraft.service;

import com.aiinpocket.ballcraft.model.dto.CooldownStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CooldownTrackerTest {

    private static final Instant T = Instant.parse("2025-01-01T00:00:00Z");

    @Test
    void neverCrafted_hasNoCooldown() {
        assertThat(CooldownTracker.remainingSeconds(null, 30, T)).isZero();
    }

    @Test
    void zeroCooldown_isAlwaysReady() {
        assertThat(CooldownTracker.remainingSeconds(T, 0, T)).isZero();
    }

    @Test
    void remaining_countsDownWithMillisecondPrecision() {
        assertThat(CooldownTracker.remainingSeconds(T, 10, T.plusMillis(2500)))
                .isCloseTo(7.5, within(1e-9));
    }

    @Test
    void remaining_isClampedAtZero() {
        assertThat(CooldownTracker.remainingSeconds(T, 10, T.plusSeconds(60))).isZero();
    }

    @Test
    void status_reportsTheLongerScope() {
        CooldownStatus status = CooldownStatus.of(3.0, 8.0);

        assertThat(status.ready()).isFalse();
        assertThat(status.remainingSeconds()).isEqualTo(8.0);
        assertThat(status.globalRemainingSeconds()).isEqualTo(3.0);
        assertThat(status.recipeRemainingSeconds()).isEqualTo(8.0);
    }

    @Test
    void status_readyOnlyWhenBothScopesElapsed() {
        assertThat(CooldownStatus.of(0, 0).ready()).isTrue();
        assertThat(CooldownStatus.of(0, 0.001).ready()).isFalse();
    }
}
