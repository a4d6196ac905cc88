package org.brighted.runtime.missions;

import org.brighted.junit.extensions.logging.LogWatchExtension;
import org.brighted.runtime.model.CooldownWindow;
import org.brighted.runtime.model.MissionCooldownState;
import org.brighted.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CooldownLimiterTest {

    private static final String TODAY = "2026-03-01";
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private final CooldownLimiter limiter = new CooldownLimiter(CooldownSettings.defaults());
    private IRandomProvider random;

    @BeforeEach
    void setUp() {
        random = mock(IRandomProvider.class);
        when(random.nextInt(anyInt())).thenReturn(2);
    }

    @Test
    void fifthDistinctMissionOpensTheWindow() {
        MissionCooldownState state = completeDistinct(4);
        assertThat(limiter.currentCooldown(state, TODAY, T0)).isEmpty();

        MissionRegistration fifth = limiter.register(state, "m5", TODAY, T0, random, null);

        assertThat(fifth.dailyCount()).isEqualTo(5);
        assertThat(fifth.opened()).isTrue();
        CooldownWindow window = fifth.cooldown().orElseThrow();
        assertThat(window.until()).isEqualTo(T0.plus(Duration.ofMinutes(7)));
        assertThat(window.reason()).isEqualTo("Daily mission limit reached (5). Cooldown active.");
        verify(random).nextInt(6);
    }

    @Test
    void repeatedMissionDoesNotCount() {
        MissionCooldownState state = limiter.register(null, "m1", TODAY, T0, random, null).state();

        MissionRegistration again = limiter.register(state, "m1", TODAY, T0, random, null);

        assertThat(again.dailyCount()).isEqualTo(1);
    }

    @Test
    void activeWindowIsNeverExtended() {
        MissionCooldownState opened = limiter.register(completeDistinct(4), "m5", TODAY, T0, random, null).state();
        Instant until = opened.cooldown().until();

        MissionRegistration sixth = limiter.register(opened, "m6", TODAY, T0.plusSeconds(60), random, null);

        assertThat(sixth.opened()).isFalse();
        assertThat(sixth.dailyCount()).isEqualTo(6);
        assertThat(sixth.cooldown()).map(CooldownWindow::until).contains(until);
    }

    @Test
    void noSecondWindowOpensAfterTheFirstExpired() {
        MissionCooldownState opened = limiter.register(completeDistinct(4), "m5", TODAY, T0, random, null).state();
        Instant until = opened.cooldown().until();

        MissionRegistration sixth = limiter.register(opened, "m6", TODAY, until.plusSeconds(1), random, null);
        MissionRegistration seventh = limiter.register(sixth.state(), "m7", TODAY, until.plusSeconds(2), random, null);

        assertThat(sixth.dailyCount()).isEqualTo(6);
        assertThat(sixth.opened()).isFalse();
        assertThat(sixth.cooldown()).isEmpty();
        assertThat(seventh.opened()).isFalse();
        assertThat(seventh.cooldown()).isEmpty();
    }

    @Test
    void repeatingAMissionAtTheThresholdDoesNotReopen() {
        MissionCooldownState opened = limiter.register(completeDistinct(4), "m5", TODAY, T0, random, null).state();
        Instant until = opened.cooldown().until();

        MissionRegistration repeat = limiter.register(opened, "m5", TODAY, until, random, null);

        assertThat(repeat.dailyCount()).isEqualTo(5);
        assertThat(repeat.opened()).isFalse();
        assertThat(repeat.cooldown()).isEmpty();
    }

    @Test
    void windowExpiresAtItsEnd() {
        MissionCooldownState opened = limiter.register(completeDistinct(4), "m5", TODAY, T0, random, null).state();
        Instant until = opened.cooldown().until();

        assertThat(limiter.currentCooldown(opened, TODAY, until.minusMillis(1))).isPresent();
        assertThat(limiter.currentCooldown(opened, TODAY, until)).isEmpty();
        assertThat(limiter.normalize(opened, TODAY, until).completedCount()).isEqualTo(5);
    }

    @Test
    void newDayResetsEverything() {
        MissionCooldownState opened = limiter.register(completeDistinct(4), "m5", TODAY, T0, random, null).state();

        MissionCooldownState tomorrow = limiter.normalize(opened, "2026-03-02", T0.plusSeconds(60));

        assertThat(tomorrow.completedMissionIds()).isEmpty();
        assertThat(tomorrow.cooldown()).isNull();
        assertThat(tomorrow.dayKey()).isEqualTo("2026-03-02");
    }

    @Test
    void windowBelowThresholdIsDropped() {
        MissionCooldownState inconsistent = new MissionCooldownState(TODAY, Set.of("m1"),
                new CooldownWindow(T0.plusSeconds(600), "stale"));

        assertThat(limiter.currentCooldown(inconsistent, TODAY, T0)).isEmpty();
    }

    @Test
    void overrideIsClampedAndSkipsTheDraw() {
        MissionRegistration longOverride = limiter.register(completeDistinct(4), "m5", TODAY, T0, random, 60);
        MissionRegistration shortOverride = limiter.register(completeDistinct(4), "m5", TODAY, T0, random, 1);

        assertThat(longOverride.cooldown().orElseThrow().until()).isEqualTo(T0.plus(Duration.ofMinutes(10)));
        assertThat(shortOverride.cooldown().orElseThrow().until()).isEqualTo(T0.plus(Duration.ofMinutes(5)));
        verify(random, never()).nextInt(anyInt());
    }

    private MissionCooldownState completeDistinct(int n) {
        MissionCooldownState state = null;
        for (int i = 1; i <= n; i++) {
            state = limiter.register(state, "m" + i, TODAY, T0, random, null).state();
        }
        return state;
    }
}
