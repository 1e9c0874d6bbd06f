package com.premiergroup.ad_metrics_synth.generator;

/**
 * Post-sampling pass that makes a row funnel-consistent. Each count is capped by the stage that feeds it, the
 * video quartiles are forced non-increasing, and frequency and reach are brought into range.
 * <p>
 * Applying it to a row that already satisfies the invariants returns an equal row.
 */
public final class FunnelInvariants {

    public static final int MIN_FREQUENCY = 1;
    public static final int MAX_FREQUENCY = 5;

    private FunnelInvariants() {
    }

    public static RawHourlyMetrics enforce(RawHourlyMetrics raw) {
        int impressions = Math.max(1, raw.impressions());

        int requests = Math.max(0, raw.requests());
        int responses = cap(raw.responses(), requests);
        int eligible = cap(raw.eligibleImpressions(), responses);
        int auctionsWon = cap(raw.auctionsWon(), eligible);

        int videoStarts = cap(raw.videoStarts(), impressions);
        int q25 = cap(raw.videoQ25(), videoStarts);
        int q50 = cap(raw.videoQ50(), q25);
        int q75 = cap(raw.videoQ75(), q50);
        int q100 = cap(raw.videoQ100(), q75);

        int frequency = Math.min(MAX_FREQUENCY, Math.max(MIN_FREQUENCY, raw.frequency()));

        return raw.toBuilder()
                .requests(requests)
                .responses(responses)
                .eligibleImpressions(eligible)
                .auctionsWon(auctionsWon)
                .impressions(impressions)
                .viewableImpressions(cap(raw.viewableImpressions(), impressions))
                .audibleImpressions(cap(raw.audibleImpressions(), impressions))
                .videoStarts(videoStarts)
                .videoQ25(q25)
                .videoQ50(q50)
                .videoQ75(q75)
                .videoQ100(q100)
                .skips(cap(raw.skips(), videoStarts))
                .avgWatchTimeSeconds(Math.max(0, raw.avgWatchTimeSeconds()))
                .clicks(cap(raw.clicks(), impressions))
                .qrScans(cap(raw.qrScans(), impressions))
                .interactiveEngagements(cap(raw.interactiveEngagements(), impressions))
                .frequency(frequency)
                .reach(Math.max(1, impressions / frequency))
                .spend(Math.max(0, raw.spend()))
                .effectiveCpm(Math.max(0, raw.effectiveCpm()))
                .errorCount(cap(raw.errorCount(), requests))
                .timeoutCount(cap(raw.timeoutCount(), requests))
                .build();
    }

    private static int cap(int value, int ceiling) {
        return Math.min(ceiling, Math.max(0, value));
    }
}
