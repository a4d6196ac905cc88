package org.brighted.runtime.internal.services;

import org.brighted.junit.extensions.logging.LogWatchExtension;
import org.brighted.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class SeededRandomProviderTest {

    @Test
    void sameSeedGivesSameSequence() {
        SeededRandomProvider a = new SeededRandomProvider(42L);
        SeededRandomProvider b = new SeededRandomProvider(42L);

        for (int i = 0; i < 20; i++) {
            assertThat(a.nextInt(1000)).isEqualTo(b.nextInt(1000));
            assertThat(a.nextDouble()).isEqualTo(b.nextDouble());
        }
    }

    @Test
    void valuesStayInRange() {
        SeededRandomProvider random = new SeededRandomProvider(7L);

        for (int i = 0; i < 500; i++) {
            assertThat(random.nextInt(6)).isBetween(0, 5);
            assertThat(random.nextDouble()).isGreaterThanOrEqualTo(0.0).isLessThan(1.0);
        }
    }

    @Test
    void derivedProvidersAreStableAndIndependentOfDraws() {
        SeededRandomProvider parent = new SeededRandomProvider(42L);
        IRandomProvider first = parent.deriveFor("market", "session-1");
        parent.nextDouble();
        IRandomProvider second = parent.deriveFor("market", "session-1");
        IRandomProvider other = parent.deriveFor("market", "session-2");

        double expected = first.nextDouble();
        assertThat(second.nextDouble()).isEqualTo(expected);
        assertThat(other.nextDouble()).isNotEqualTo(expected);
    }

    @Test
    void nonPositiveBoundIsRejected() {
        assertThatThrownBy(() -> new SeededRandomProvider(1L).nextInt(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
