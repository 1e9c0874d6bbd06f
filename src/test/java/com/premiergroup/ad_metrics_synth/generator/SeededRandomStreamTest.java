package com.premiergroup.ad_metrics_synth.generator;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SeededRandomStreamTest {

    @Test
    void sameSeedGivesSameSequence() {
        SeededRandomStream first = new SeededRandomStream(42L);
        SeededRandomStream second = new SeededRandomStream(42L);

        for (int i = 0; i < 500; i++) {
            assertThat(first.uniform(0.1, 0.9)).isEqualTo(second.uniform(0.1, 0.9));
            assertThat(first.uniformInt(1000, 10000)).isEqualTo(second.uniformInt(1000, 10000));
        }
        assertThat(first.seed()).isEqualTo(42L);
    }

    @Test
    void differentSeedsDiverge() {
        SeededRandomStream first = new SeededRandomStream(1L);
        SeededRandomStream second = new SeededRandomStream(2L);

        boolean anyDifferent = false;
        for (int i = 0; i < 10; i++) {
            anyDifferent |= first.uniform(0.0, 1.0) != second.uniform(0.0, 1.0);
        }
        assertThat(anyDifferent).isTrue();
    }

    @Test
    void drawsStayWithinBounds() {
        SeededRandomStream rng = new SeededRandomStream(7L);
        Set<Integer> seen = new HashSet<>();

        for (int i = 0; i < 5_000; i++) {
            assertThat(rng.uniform(0.90, 0.99)).isGreaterThanOrEqualTo(0.90).isLessThanOrEqualTo(0.99);
            int value = rng.uniformInt(1, 4);
            assertThat(value).isBetween(1, 4);
            seen.add(value);
        }
        // both ends of the integer range are reachable
        assertThat(seen).containsExactlyInAnyOrder(1, 2, 3, 4);
    }
}
