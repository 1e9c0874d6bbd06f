package com.premiergroup.ad_metrics_synth.generator;

/**
 * Rates and averages computed from raw hourly counts. Pure; results depend only on the raw fields, so computing
 * them at generation time or after reading a row back gives the same values.
 */
public final class DerivedMetricsCalculator {

    public static final int REFERENCE_ASSET_SECONDS = 30;

    // segment midpoints as a share of asset length: 0-25%, 25-50%, 50-75%, 75-100%, completed
    private static final double[] SEGMENT_MIDPOINTS = {0.125, 0.375, 0.625, 0.875, 1.0};

    private DerivedMetricsCalculator() {
    }

    public static double safeDiv(double numerator, double denominator) {
        return safeDiv(numerator, denominator, 0.0);
    }

    public static double safeDiv(double numerator, double denominator, double defaultValue) {
        return denominator > 0 ? numerator / denominator : defaultValue;
    }

    public static DerivedHourlyMetrics compute(RawHourlyMetrics raw) {
        return compute(raw, REFERENCE_ASSET_SECONDS);
    }

    public static DerivedHourlyMetrics compute(RawHourlyMetrics raw, int assetSeconds) {
        return new DerivedHourlyMetrics(
                safeDiv(raw.clicks(), raw.impressions()),
                safeDiv(raw.viewableImpressions(), raw.impressions()),
                safeDiv(raw.eligibleImpressions(), raw.requests()),
                safeDiv(raw.responses(), raw.requests()),
                safeDiv(raw.auctionsWon(), raw.eligibleImpressions()),
                safeDiv(raw.audibleImpressions(), raw.impressions()),
                safeDiv(raw.videoStarts(), raw.impressions()),
                safeDiv(raw.videoQ100(), raw.videoStarts()),
                safeDiv(raw.skips(), raw.videoStarts()),
                safeDiv(raw.qrScans(), raw.impressions()),
                safeDiv(raw.interactiveEngagements(), raw.impressions()),
                safeDiv(raw.errorCount(), raw.requests()),
                safeDiv(raw.timeoutCount(), raw.requests()),
                safeDiv(raw.eligibleImpressions(), raw.requests()),
                avgWatchTimeSeconds(raw.videoStarts(), raw.videoQ25(), raw.videoQ50(), raw.videoQ75(),
                        raw.videoQ100(), assetSeconds)
        );
    }

    /**
     * Weighted midpoint estimate of seconds watched per start. Viewers are bucketed by the last quartile they
     * reached: a segment's population is the drop between successive quartile counts and each viewer is credited
     * with the segment midpoint.
     *
     * @return 0 when there were no starts
     */
    public static double avgWatchTimeSeconds(int videoStarts, int q25, int q50, int q75, int q100, int assetSeconds) {
        if (videoStarts <= 0 || assetSeconds <= 0) {
            return 0.0;
        }
        int[] segments = {
                Math.max(0, videoStarts - q25),
                Math.max(0, q25 - q50),
                Math.max(0, q50 - q75),
                Math.max(0, q75 - q100),
                Math.max(0, q100)
        };
        double watched = 0.0;
        for (int i = 0; i < segments.length; i++) {
            watched += segments[i] * SEGMENT_MIDPOINTS[i] * assetSeconds;
        }
        return watched / videoStarts;
    }
}
