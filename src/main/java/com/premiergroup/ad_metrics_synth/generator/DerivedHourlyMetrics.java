package com.premiergroup.ad_metrics_synth.generator;

/**
 * Ratios over a {@link RawHourlyMetrics} row. Every rate is in {@code [0, 1]} for rows that satisfy the funnel
 * invariants; {@code viewabilityRate} doubles as the render rate.
 */
public record DerivedHourlyMetrics(
        double ctr,
        double viewabilityRate,
        double fillRate,
        double responseRate,
        double auctionWinRate,
        double audibilityRate,
        double videoStartRate,
        double videoCompletionRate,
        double videoSkipRate,
        double qrScanRate,
        double interactiveRate,
        double errorRate,
        double timeoutRate,
        double supplyFunnelEfficiency,
        double avgWatchTimeSeconds
) {}
