package org.brighted.config;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.brighted.junit.extensions.logging.LogWatchExtension;
import org.brighted.runtime.model.ResourceBundle;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class EngineSettingsTest {

    @Test
    void defaultsMatchReferenceConfiguration() {
        EngineSettings settings = EngineSettings.defaults();

        assertThat(settings.getMaxEnergy()).isEqualTo(100);
        assertThat(settings.getStartingResources()).isEqualTo(ResourceBundle.of(100, 100, 100));
        assertThat(settings.getBusiness().processingWindow()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.getBusiness().initialCash()).isEqualTo(500);
        assertThat(settings.getBusiness().loanTerm()).isEqualTo(Duration.ofDays(7));
        assertThat(settings.getProgression().dailyCap()).isEqualTo(200);
        assertThat(settings.getProgression().rewardModifier()).isEqualTo(1.0);
        assertThat(settings.getProgression().zone()).isEqualTo(ZoneId.of("UTC"));
        assertThat(settings.getMissions().threshold()).isEqualTo(5);
        assertThat(settings.getMissions().minMinutes()).isEqualTo(5);
        assertThat(settings.getMissions().maxMinutes()).isEqualTo(10);
        assertThat(settings.getPracticalXpReward()).isEqualTo(150);
        assertThat(settings.getMissionXpReward()).isEqualTo(300);
        assertThat(settings.getRetry().maxAttempts()).isEqualTo(3);
        assertThat(settings.getStoreConfig().getString("className"))
                .isEqualTo("org.brighted.store.InMemoryGameStateStore");
    }

    @Test
    void partialOverridesKeepOtherDefaults() {
        EngineSettings settings = EngineSettings.from(ConfigFactory.parseString(
                "brighted.engine.business.processing-window = 2m\n"
                        + "brighted.engine.progression.zone = \"Europe/Berlin\"\n"
                        + "brighted.engine.random-seed = 99\n"));

        assertThat(settings.getBusiness().processingWindow()).isEqualTo(Duration.ofMinutes(2));
        assertThat(settings.getBusiness().initialCash()).isEqualTo(500);
        assertThat(settings.getProgression().zone()).isEqualTo(ZoneId.of("Europe/Berlin"));
        assertThat(settings.getRandomSeed()).isEqualTo(99L);
    }

    @Test
    void startingEnergyIsCappedAtMaximum() {
        EngineSettings settings = EngineSettings.from(ConfigFactory.parseString(
                "brighted.engine.ledger.max-energy = 50\nbrighted.engine.player.starting-energy = 80\n"));

        assertThat(settings.getStartingResources().energy()).isEqualTo(50);
    }

    @Test
    void wrongTypeIsReported() {
        assertThatThrownBy(() -> EngineSettings.from(ConfigFactory.parseString(
                "brighted.engine.progression.daily-cap = lots\n")))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void invalidCooldownRangeIsRejected() {
        assertThatThrownBy(() -> EngineSettings.from(ConfigFactory.parseString(
                "brighted.engine.missions.cooldown-min-minutes = 20\n")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
