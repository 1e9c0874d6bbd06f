package com.premiergroup.ad_metrics_synth.generator;

import com.premiergroup.ad_metrics_synth.config.GeneratorProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;

import static com.premiergroup.ad_metrics_synth.generator.RawMetricsAssertions.assertFunnelConsistent;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class FunnelMetricGeneratorTest {

    private static final LocalDateTime HOUR = LocalDateTime.of(2024, 1, 2, 13, 0);

    private final FunnelMetricGenerator generator = new FunnelMetricGenerator(new GeneratorProperties());

    @Test
    @DisplayName("Rows are funnel-consistent across many seeds and factors")
    void invariantsHoldAcrossSeeds() {
        double[] factors = {0.6, 0.85, 1.0, 1.2, 1.5, 2.0};
        for (long seed = 0; seed < 200; seed++) {
            SeededRandomStream rng = new SeededRandomStream(seed);
            for (double factor : factors) {
                assertFunnelConsistent(generator.generateHour(7, HOUR, factor, rng));
            }
        }
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -3.0, 1e-9, 50.0, 1e6, Double.NaN, Double.POSITIVE_INFINITY})
    @DisplayName("Extreme factors are clamped, never rejected")
    void extremeFactorsAreClamped(double factor) {
        SeededRandomStream rng = new SeededRandomStream(99L);

        assertThatCode(() -> assertFunnelConsistent(generator.generateHour(7, HOUR, factor, rng)))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Same seed, hour and factor give an identical row")
    void deterministic() {
        RawHourlyMetrics first = generator.generateHour(3, HOUR, 1.1, new SeededRandomStream(42L));
        RawHourlyMetrics second = generator.generateHour(3, HOUR, 1.1, new SeededRandomStream(42L));

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Different seeds give different rows")
    void seedSensitive() {
        RawHourlyMetrics first = generator.generateHour(3, HOUR, 1.0, new SeededRandomStream(1L));
        RawHourlyMetrics second = generator.generateHour(3, HOUR, 1.0, new SeededRandomStream(2L));

        assertThat(second).isNotEqualTo(first);
    }

    @Test
    @DisplayName("Impressions scale with the temporal factor")
    void impressionsFollowFactor() {
        RawHourlyMetrics low = generator.generateHour(3, HOUR, 0.5, new SeededRandomStream(5L));
        RawHourlyMetrics high = generator.generateHour(3, HOUR, 2.0, new SeededRandomStream(5L));

        // same first draw, so only the factor differs
        assertThat(high.impressions()).isGreaterThan(low.impressions());
        assertThat(low.impressions()).isBetween(500, 5000);
        assertThat(high.impressions()).isBetween(2000, 20000);
    }

    @Test
    @DisplayName("Spend and effective CPM are consistent with impressions")
    void spendMatchesEffectiveCpm() {
        for (long seed = 0; seed < 50; seed++) {
            RawHourlyMetrics raw = generator.generateHour(3, HOUR, 1.0, new SeededRandomStream(seed));

            assertThat(raw.effectiveCpm()).isEqualTo((int) ((long) raw.spend() * 1000 / raw.impressions()));
            // base CPM 12.00 to 45.00, +/-10% variance and a 5% uplift at factor 1.0
            assertThat(raw.effectiveCpm()).isBetween(1000, 5200);
        }
    }

    @Test
    @DisplayName("Average watch time is the floored midpoint estimate")
    void avgWatchTimeIsFloored() {
        RawHourlyMetrics raw = generator.generateHour(3, HOUR, 1.0, new SeededRandomStream(11L));

        double estimate = DerivedMetricsCalculator.avgWatchTimeSeconds(raw.videoStarts(), raw.videoQ25(),
                raw.videoQ50(), raw.videoQ75(), raw.videoQ100(), 30);

        assertThat(raw.avgWatchTimeSeconds()).isEqualTo((int) Math.floor(estimate));
        assertThat(raw.avgWatchTimeSeconds()).isBetween(0, 30);
    }

    @Test
    @DisplayName("Row carries campaign, hour, calendar breakdown and audience mix")
    void carriesContext() {
        RawHourlyMetrics raw = generator.generateHour(3, HOUR, 1.0, new SeededRandomStream(11L));

        assertThat(raw.campaignId()).isEqualTo(3);
        assertThat(raw.hourTs()).isEqualTo(HOUR);
        assertThat(raw.temporal()).isEqualTo(TemporalBreakdown.of(HOUR));
        assertThat(raw.audience()).isEqualTo(AudienceMix.forHour(HOUR));
    }
}
