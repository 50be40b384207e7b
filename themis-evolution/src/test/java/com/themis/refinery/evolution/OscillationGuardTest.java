package com.themis.refinery.evolution;

import com.themis.refinery.api.Telemetry;
import com.themis.refinery.api.model.AlertSeverity;
import com.themis.refinery.api.model.RuleType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class OscillationGuardTest {

    private static final String AREA = "noise_removal";

    private MutableClock clock;
    private Telemetry telemetry;
    private OscillationGuard guard;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T09:00:00Z"));
        telemetry = mock(Telemetry.class);
        guard = new OscillationGuard(OscillationGuard.DEFAULT_WINDOW, OscillationGuard.DEFAULT_COOLDOWN,
                clock, telemetry);
    }

    @Test
    void untouchedAreaIsFree() {
        assertThat(guard.checkOscillation(AREA)).isFalse();
        assertThat(guard.isFrozen(AREA)).isFalse();
    }

    @Test
    void singleChangeDoesNotFreeze() {
        guard.trackChange(AREA);

        assertThat(guard.checkOscillation(AREA)).isFalse();
    }

    @Test
    @DisplayName("Two changes within an hour freeze the area and raise one alert")
    void twoChangesWithinWindowFreeze() {
        guard.trackChange(AREA);
        clock.advance(Duration.ofMinutes(20));
        guard.trackChange(AREA);

        assertThat(guard.checkOscillation(AREA)).isTrue();
        assertThat(guard.checkOscillation(AREA)).isTrue();
        assertThat(guard.frozenAreas()).containsExactly(AREA);
        verify(telemetry, times(1)).recordAlert(eq("oscillation:" + AREA), eq(AlertSeverity.WARNING), anyString());
    }

    @Test
    void changesOutsideWindowAreForgotten() {
        guard.trackChange(AREA);
        clock.advance(Duration.ofMinutes(61));
        guard.trackChange(AREA);

        assertThat(guard.checkOscillation(AREA)).isFalse();
        verify(telemetry, never()).recordAlert(anyString(), eq(AlertSeverity.WARNING), anyString());
    }

    @Test
    void freezeLastsForTheCooldown() {
        guard.trackChange(AREA);
        guard.trackChange(AREA);
        assertThat(guard.checkOscillation(AREA)).isTrue();

        clock.advance(Duration.ofHours(23));
        assertThat(guard.checkOscillation(AREA)).isTrue();

        clock.advance(Duration.ofHours(1));
        assertThat(guard.isFrozen(AREA)).isFalse();
        assertThat(guard.checkOscillation(AREA)).isFalse();
    }

    @Test
    void areasAreIndependent() {
        guard.trackChange(RuleType.NOISE_REMOVAL);
        guard.trackChange(RuleType.NOISE_REMOVAL);

        assertThat(guard.checkOscillation(RuleType.NOISE_REMOVAL)).isTrue();
        assertThat(guard.checkOscillation(RuleType.POST_NORMALIZE)).isFalse();
    }

    @Test
    void unfreezeClearsHistory() {
        guard.trackChange(AREA);
        guard.trackChange(AREA);
        guard.checkOscillation(AREA);

        guard.unfreeze(AREA);

        assertThat(guard.checkOscillation(AREA)).isFalse();
        assertThat(guard.frozenAreas()).isEmpty();
    }

    @Test
    void rejectsNonPositiveWindow() {
        assertThatThrownBy(() -> new OscillationGuard(Duration.ZERO, Duration.ofHours(1), clock, telemetry))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
