package com.premiergroup.ad_metrics_synth.generator;

import com.premiergroup.ad_metrics_synth.config.GeneratorProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Samples the raw counts of one campaign-hour from a seeded stream, scaled by the hour's temporal factor.
 * <p>
 * Draws are taken in a fixed order (impressions, clicks, video starts, quartiles, supply, quality, engagement,
 * spend, reliability, frequency); changing that order changes every value generated for a seed. Out-of-range
 * intermediate values are clamped, never rejected.
 */
@Component
@RequiredArgsConstructor
public class FunnelMetricGenerator {

    private final GeneratorProperties generatorProperties;

    public RawHourlyMetrics generateHour(Integer campaignId, LocalDateTime hour, double factor, SeededRandomStream rng) {
        double cappedFactor = Math.min(1.5, factor);

        // 1. impressions
        int impressions = Math.max(1, round(rng.uniformInt(1000, 10000) * factor));

        // 2. clicks
        double baseCtr = rng.uniform(0.001, 0.02);
        double ctrVariance = rng.uniform(0.8, 1.2);
        double clickRate = clamp(baseCtr * ctrVariance * factor, 0.0001, 0.05);
        int clicks = round(impressions * clickRate);

        // 3. video starts
        double startRate = clamp(rng.uniform(0.80, 0.95) * factor, 0.70, 0.99);
        int videoStarts = round(impressions * startRate);

        // 4. quartiles, each rate bounded by the previous one
        double q25Rate = clamp(rng.uniform(0.70, 0.95), 0.60, 0.98);
        double q50Rate = Math.max(0.40, Math.min(q25Rate, rng.uniform(0.55, 0.90)));
        double q75Rate = Math.max(0.25, Math.min(q50Rate, rng.uniform(0.40, 0.80)));
        double q100Rate = Math.max(0.10, Math.min(q75Rate, rng.uniform(0.25, 0.70)));

        // 5. supply funnel
        int requests = round(impressions * rng.uniform(1.1, 1.8));
        int responses = Math.max(floor(0.9 * requests + 1), round(impressions * rng.uniform(0.92, 1.04)));
        int eligible = Math.max(floor(0.8 * responses + 1), round(impressions * rng.uniform(0.90, 0.99)));
        int auctionsWon = Math.min(eligible,
                Math.max(floor(0.8 * eligible + 1), round(impressions * rng.uniform(0.90, 0.99))));

        // 6. quality
        int viewable = round(impressions * rng.uniform(0.90, 0.99));
        double audibility = clamp(rng.uniform(0.35, 0.80) * (isEvening(hour) ? 1.05 : 0.95), 0.20, 0.95);
        int audible = round(impressions * audibility);

        // 7. engagement
        double skipRate = clamp(rng.uniform(0.10, 0.40) * (2.0 - cappedFactor), 0.05, 0.60);
        int skips = round(videoStarts * skipRate);
        int qrScans = round(impressions * rng.uniform(0.0003, 0.006));
        int interactive = round(impressions * rng.uniform(0.001, 0.02));

        // 8. spend, in cents
        int baseCpm = rng.uniformInt(1200, 4500);
        int cpmCents = round(baseCpm * rng.uniform(0.9, 1.1) * (0.95 + 0.1 * cappedFactor));
        int spend = saturate((long) impressions * cpmCents / 1000);
        int effectiveCpm = saturate((long) spend * 1000 / impressions);

        // 9. reliability
        int errorCount = round(requests * rng.uniform(0.0005, 0.004));
        int timeoutCount = round(requests * rng.uniform(0.0005, 0.003));

        // 10. audience
        int baseFrequency = rng.uniformInt(1, 4);
        int frequency = Math.min(FunnelInvariants.MAX_FREQUENCY, Math.max(FunnelInvariants.MIN_FREQUENCY,
                round(baseFrequency * (1.0 + 0.15 * Math.max(0.0, factor - 1.0)))));
        int reach = Math.max(1, impressions / frequency);

        RawHourlyMetrics sampled = RawHourlyMetrics.builder()
                .campaignId(campaignId)
                .hourTs(hour)
                .requests(requests)
                .responses(responses)
                .eligibleImpressions(eligible)
                .auctionsWon(auctionsWon)
                .impressions(impressions)
                .viewableImpressions(viewable)
                .audibleImpressions(audible)
                .videoStarts(videoStarts)
                .videoQ25(round(videoStarts * q25Rate))
                .videoQ50(round(videoStarts * q50Rate))
                .videoQ75(round(videoStarts * q75Rate))
                .videoQ100(round(videoStarts * q100Rate))
                .skips(skips)
                .clicks(clicks)
                .qrScans(qrScans)
                .interactiveEngagements(interactive)
                .reach(reach)
                .frequency(frequency)
                .spend(spend)
                .effectiveCpm(effectiveCpm)
                .errorCount(errorCount)
                .timeoutCount(timeoutCount)
                .temporal(TemporalBreakdown.of(hour))
                // 11. audience mix, no draws
                .audience(AudienceMix.forHour(hour))
                .build();

        RawHourlyMetrics consistent = FunnelInvariants.enforce(sampled);
        double avgWatchTime = DerivedMetricsCalculator.avgWatchTimeSeconds(
                consistent.videoStarts(), consistent.videoQ25(), consistent.videoQ50(),
                consistent.videoQ75(), consistent.videoQ100(), generatorProperties.getAssetSeconds());

        return consistent.toBuilder()
                .avgWatchTimeSeconds(floor(avgWatchTime))
                .build();
    }

    private static boolean isEvening(LocalDateTime hour) {
        return hour.getHour() >= 18 && hour.getHour() <= 22;
    }

    private static double clamp(double value, double min, double max) {
        return Math.min(max, Math.max(min, value));
    }

    private static int round(double value) {
        return saturate(Math.round(value));
    }

    private static int floor(double value) {
        return saturate((long) Math.floor(value));
    }

    private static int saturate(long value) {
        return (int) Math.min(Integer.MAX_VALUE, Math.max(0L, value));
    }
}
