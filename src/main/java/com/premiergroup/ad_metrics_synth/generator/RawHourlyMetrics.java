package com.premiergroup.ad_metrics_synth.generator;

import lombok.Builder;

import java.time.LocalDateTime;

/**
 * Raw counts for one campaign-hour, ordered along the delivery funnel.
 * <p>
 * Spend and effective CPM are in account currency cents. {@code hourTs} is the UTC hour boundary.
 */
@Builder(toBuilder = true)
public record RawHourlyMetrics(
        Integer campaignId,
        LocalDateTime hourTs,
        // supply
        int requests,
        int responses,
        int eligibleImpressions,
        int auctionsWon,
        int impressions,
        // quality
        int viewableImpressions,
        int audibleImpressions,
        // video
        int videoStarts,
        int videoQ25,
        int videoQ50,
        int videoQ75,
        int videoQ100,
        int skips,
        int avgWatchTimeSeconds,
        // interaction
        int clicks,
        int qrScans,
        int interactiveEngagements,
        // audience
        int reach,
        int frequency,
        // spend
        int spend,
        int effectiveCpm,
        // reliability
        int errorCount,
        int timeoutCount,
        TemporalBreakdown temporal,
        AudienceMix audience
) {}
