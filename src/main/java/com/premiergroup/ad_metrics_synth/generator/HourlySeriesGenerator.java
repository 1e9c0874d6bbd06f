package com.premiergroup.ad_metrics_synth.generator;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks a flight window hour by hour and samples one row per hour from a single seeded stream.
 */
@Component
@RequiredArgsConstructor
public class HourlySeriesGenerator {

    private final TemporalFactorEngine temporalFactorEngine;
    private final FunnelMetricGenerator funnelMetricGenerator;

    /**
     * Rows for every UTC hour from {@code floor(flightStart)} to {@code floor(flightEnd)} inclusive, in time order.
     * An end before the start yields no rows.
     */
    public List<RawHourlyMetrics> generate(Integer campaignId, LocalDateTime flightStart, LocalDateTime flightEnd, long seed) {
        LocalDateTime start = flightStart.truncatedTo(ChronoUnit.HOURS);
        LocalDateTime end = flightEnd.truncatedTo(ChronoUnit.HOURS);
        SeededRandomStream rng = new SeededRandomStream(seed);

        List<RawHourlyMetrics> rows = new ArrayList<>();
        for (LocalDateTime hour = start; !hour.isAfter(end); hour = hour.plusHours(1)) {
            double factor = temporalFactorEngine.factor(start, hour, end);
            rows.add(funnelMetricGenerator.generateHour(campaignId, hour, factor, rng));
        }
        return rows;
    }

    public static long hoursInWindow(LocalDateTime flightStart, LocalDateTime flightEnd) {
        long hours = ChronoUnit.HOURS.between(
                flightStart.truncatedTo(ChronoUnit.HOURS),
                flightEnd.truncatedTo(ChronoUnit.HOURS)) + 1;
        return Math.max(0, hours);
    }
}
