package com.premiergroup.ad_metrics_synth.generator;

import com.premiergroup.ad_metrics_synth.config.GeneratorProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static com.premiergroup.ad_metrics_synth.generator.RawMetricsAssertions.assertFunnelConsistent;
import static org.assertj.core.api.Assertions.assertThat;

class HourlySeriesGeneratorTest {

    private static final LocalDateTime DAY_START = LocalDateTime.of(2024, 1, 1, 0, 0);
    private static final LocalDateTime DAY_END = LocalDateTime.of(2024, 1, 1, 23, 0);

    private final HourlySeriesGenerator generator = newSeriesGenerator();

    static HourlySeriesGenerator newSeriesGenerator() {
        return new HourlySeriesGenerator(new TemporalFactorEngine(),
                new FunnelMetricGenerator(new GeneratorProperties()));
    }

    @Test
    @DisplayName("A one-day flight yields 24 rows, one per hour in order")
    void oneDayFlight() {
        List<RawHourlyMetrics> rows = generator.generate(5, DAY_START, DAY_END, 42L);

        assertThat(rows).hasSize(24);
        for (int h = 0; h < 24; h++) {
            assertThat(rows.get(h).hourTs()).isEqualTo(DAY_START.plusHours(h));
            assertThat(rows.get(h).campaignId()).isEqualTo(5);
            assertFunnelConsistent(rows.get(h));
        }
    }

    @Test
    @DisplayName("Same seed and window give identical rows; another seed does not")
    void reproducible() {
        List<RawHourlyMetrics> first = generator.generate(5, DAY_START, DAY_END, 42L);
        List<RawHourlyMetrics> second = newSeriesGenerator().generate(5, DAY_START, DAY_END, 42L);
        List<RawHourlyMetrics> other = generator.generate(5, DAY_START, DAY_END, 43L);

        assertThat(second).isEqualTo(first);
        assertThat(other).isNotEqualTo(first);
    }

    @Test
    @DisplayName("Window bounds are floored to the hour")
    void windowIsFloored() {
        LocalDateTime start = LocalDateTime.of(2024, 2, 1, 10, 30);
        LocalDateTime end = LocalDateTime.of(2024, 2, 1, 12, 59);

        List<RawHourlyMetrics> rows = generator.generate(5, start, end, 1L);

        assertThat(rows).extracting(RawHourlyMetrics::hourTs).containsExactly(
                LocalDateTime.of(2024, 2, 1, 10, 0),
                LocalDateTime.of(2024, 2, 1, 11, 0),
                LocalDateTime.of(2024, 2, 1, 12, 0));
        assertThat(HourlySeriesGenerator.hoursInWindow(start, end)).isEqualTo(3);
    }

    @Test
    @DisplayName("End before start yields no rows")
    void emptyWindow() {
        assertThat(generator.generate(5, DAY_END, DAY_START, 1L)).isEmpty();
        assertThat(HourlySeriesGenerator.hoursInWindow(DAY_END, DAY_START)).isZero();
    }

    @Test
    @DisplayName("Multi-week flight covers every hour")
    void multiWeekFlight() {
        LocalDateTime start = LocalDateTime.of(2024, 3, 4, 0, 0);
        LocalDateTime end = LocalDateTime.of(2024, 3, 31, 23, 0);

        List<RawHourlyMetrics> rows = generator.generate(5, start, end, 7L);

        assertThat(rows).hasSize(28 * 24);
        assertThat(rows.get(0).hourTs()).isEqualTo(start);
        assertThat(rows.get(rows.size() - 1).hourTs()).isEqualTo(end);
        rows.forEach(RawMetricsAssertions::assertFunnelConsistent);
    }

    @Test
    @DisplayName("Generated rates stay in realistic ranges")
    void realisticRanges() {
        for (RawHourlyMetrics raw : generator.generate(5, DAY_START, DAY_END, 42L)) {
            DerivedHourlyMetrics d = DerivedMetricsCalculator.compute(raw);
            // rates come from rounded counts, allow half a unit per impression
            double slack = 0.5 / raw.impressions();

            assertThat(d.ctr()).isBetween(0.0001 - slack, 0.05 + slack);
            assertThat(d.viewabilityRate()).isBetween(0.90 - slack, 0.99 + slack);
            assertThat(d.videoStartRate()).isBetween(0.70 - slack, 0.99 + slack);
            assertThat(raw.frequency()).isBetween(1, 5);
            assertThat(raw.impressions()).isBetween(500, 20000);
        }
    }

    @Test
    @DisplayName("Business-hour rows carry the temporal uplift on average")
    void businessHoursOutperformNight() {
        LocalDateTime start = LocalDateTime.of(2024, 3, 4, 0, 0);
        List<RawHourlyMetrics> rows = generator.generate(5, start, start.plusDays(13).withHour(23), 3L);

        double business = rows.stream().filter(r -> r.temporal().businessHour())
                .mapToInt(RawHourlyMetrics::impressions).average().orElseThrow();
        double night = rows.stream().filter(r -> r.temporal().hourOfDay() < 6)
                .mapToInt(RawHourlyMetrics::impressions).average().orElseThrow();

        assertThat(business).isGreaterThan(night);
    }
}
