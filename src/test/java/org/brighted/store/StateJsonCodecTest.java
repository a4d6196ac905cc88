package org.brighted.store;

import org.brighted.junit.extensions.logging.LogWatchExtension;
import org.brighted.runtime.model.BusinessSimState;
import org.brighted.runtime.model.Loan;
import org.brighted.runtime.model.RegistrationStatus;
import org.brighted.runtime.model.ResourceBundle;
import org.brighted.runtime.model.ResourceEffect;
import org.brighted.runtime.model.SessionSnapshot;
import org.brighted.store.api.StoreException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class StateJsonCodecTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private final StateJsonCodec codec = new StateJsonCodec();

    @Test
    void effectsUseWireNames() {
        String json = codec.effectsToJson(List.of(ResourceEffect.inventory("stock", -2), ResourceEffect.timeUnits(3)));

        assertThat(json).isEqualTo("[{\"kind\":\"inventory\",\"itemId\":\"stock\",\"amount\":-2},"
                + "{\"kind\":\"timeUnits\",\"amount\":3}]");
    }

    @Test
    void effectsAreReadBackAsTheirCase() {
        List<ResourceEffect> effects = codec.effectsFromJson(
                "[{\"kind\":\"reputation\",\"actorId\":\"regulator\",\"amount\":-20},{\"kind\":\"currency\",\"amount\":5}]");

        assertThat(effects).containsExactly(ResourceEffect.reputation("regulator", -20), ResourceEffect.currency(5));
    }

    @Test
    void snapshotWithBusinessSurvivesStorage() {
        BusinessSimState business = BusinessSimState.initial(500, T0)
                .withRegistration(RegistrationStatus.PENDING, T0, "Acme")
                .withLoan(new Loan("loan-1", 200, 0.05, T0.plusSeconds(604_800), 0));
        SessionSnapshot snapshot = new SessionSnapshot(new ResourceBundle(100, 90, 80, Map.of("stock", 3)),
                Map.of("regulator", -20), business);

        SessionSnapshot read = codec.fromJson(codec.toJson(snapshot), SessionSnapshot.class);

        assertThat(read).isEqualTo(snapshot);
    }

    @Test
    void payloadNumbersKeepTheirKind() {
        Map<String, Object> payload = codec.fromJson("{\"principal\":750,\"rate\":0.5}", StateJsonCodec.PAYLOAD);

        assertThat(payload.get("principal")).isEqualTo(750L);
        assertThat(payload.get("rate")).isEqualTo(0.5);
    }

    @Test
    void unknownKindIsReportedAsCorruptDocument() {
        assertThatThrownBy(() -> codec.effectsFromJson("[{\"kind\":\"gold\",\"amount\":1}]"))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("gold");
    }
}
