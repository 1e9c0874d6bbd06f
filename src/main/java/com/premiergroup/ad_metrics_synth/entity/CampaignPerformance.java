package com.premiergroup.ad_metrics_synth.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.premiergroup.ad_metrics_synth.generator.AudienceMix;
import com.premiergroup.ad_metrics_synth.generator.RawHourlyMetrics;
import com.premiergroup.ad_metrics_synth.generator.TemporalBreakdown;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One generated hour of raw campaign metrics. Rows are written in bulk per campaign and replaced wholesale.
 */
@Entity
@Table(
        name = "campaign_performance_hourly",
        uniqueConstraints = @UniqueConstraint(
                name = "ux_campaign_performance_campaign_hour",
                columnNames = {"campaign_id", "hour_ts"}
        )
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties({"hibernateLazyInitializer", "handler"})
@EqualsAndHashCode(exclude = "campaign")
@ToString(exclude = "campaign")
public class CampaignPerformance {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "campaign_performance_seq")
    @SequenceGenerator(name = "campaign_performance_seq", sequenceName = "campaign_performance_seq", allocationSize = 500)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "campaign_id", nullable = false)
    private Campaign campaign;

    // UTC hour boundary
    @Column(name = "hour_ts", nullable = false)
    private LocalDateTime hourTs;

    private int requests;
    private int responses;
    @Column(name = "eligible_impressions")
    private int eligibleImpressions;
    @Column(name = "auctions_won")
    private int auctionsWon;
    private int impressions;

    @Column(name = "viewable_impressions")
    private int viewableImpressions;
    @Column(name = "audible_impressions")
    private int audibleImpressions;

    @Column(name = "video_starts")
    private int videoStarts;
    @Column(name = "video_q25")
    private int videoQ25;
    @Column(name = "video_q50")
    private int videoQ50;
    @Column(name = "video_q75")
    private int videoQ75;
    @Column(name = "video_q100")
    private int videoQ100;
    private int skips;
    @Column(name = "avg_watch_time_seconds")
    private int avgWatchTimeSeconds;

    private int clicks;
    @Column(name = "qr_scans")
    private int qrScans;
    @Column(name = "interactive_engagements")
    private int interactiveEngagements;

    private int reach;
    private int frequency;

    // cents
    private int spend;
    @Column(name = "effective_cpm")
    private int effectiveCpm;

    @Column(name = "error_count")
    private int errorCount;
    @Column(name = "timeout_count")
    private int timeoutCount;

    @Column(name = "hour_of_day", nullable = false)
    private int hourOfDay;
    // 0 = Monday
    @Column(name = "day_of_week", nullable = false)
    private int dayOfWeek;
    @Column(name = "is_business_hour", nullable = false)
    private boolean businessHour;
    @Column(name = "human_readable", nullable = false)
    private String humanReadable;
    @Column(name = "daily_day_date", nullable = false)
    private LocalDate dailyDayDate;
    @Column(name = "weekly_start_day_date", nullable = false)
    private LocalDate weeklyStartDayDate;
    @Column(name = "monthly_start_day_date", nullable = false)
    private LocalDate monthlyStartDayDate;

    @Convert(converter = AudienceMixConverter.class)
    @Column(name = "audience_json", length = 2000)
    private AudienceMix audience;

    public static CampaignPerformance from(Campaign campaign, RawHourlyMetrics raw) {
        TemporalBreakdown temporal = raw.temporal() != null ? raw.temporal() : TemporalBreakdown.of(raw.hourTs());
        return CampaignPerformance.builder()
                .campaign(campaign)
                .hourTs(raw.hourTs())
                .requests(raw.requests())
                .responses(raw.responses())
                .eligibleImpressions(raw.eligibleImpressions())
                .auctionsWon(raw.auctionsWon())
                .impressions(raw.impressions())
                .viewableImpressions(raw.viewableImpressions())
                .audibleImpressions(raw.audibleImpressions())
                .videoStarts(raw.videoStarts())
                .videoQ25(raw.videoQ25())
                .videoQ50(raw.videoQ50())
                .videoQ75(raw.videoQ75())
                .videoQ100(raw.videoQ100())
                .skips(raw.skips())
                .avgWatchTimeSeconds(raw.avgWatchTimeSeconds())
                .clicks(raw.clicks())
                .qrScans(raw.qrScans())
                .interactiveEngagements(raw.interactiveEngagements())
                .reach(raw.reach())
                .frequency(raw.frequency())
                .spend(raw.spend())
                .effectiveCpm(raw.effectiveCpm())
                .errorCount(raw.errorCount())
                .timeoutCount(raw.timeoutCount())
                .hourOfDay(temporal.hourOfDay())
                .dayOfWeek(temporal.dayOfWeek())
                .businessHour(temporal.businessHour())
                .humanReadable(temporal.humanReadable())
                .dailyDayDate(temporal.dailyDayDate())
                .weeklyStartDayDate(temporal.weeklyStartDayDate())
                .monthlyStartDayDate(temporal.monthlyStartDayDate())
                .audience(raw.audience())
                .build();
    }

    public RawHourlyMetrics toRaw() {
        return RawHourlyMetrics.builder()
                .campaignId(campaign != null ? campaign.getId() : null)
                .hourTs(hourTs)
                .requests(requests)
                .responses(responses)
                .eligibleImpressions(eligibleImpressions)
                .auctionsWon(auctionsWon)
                .impressions(impressions)
                .viewableImpressions(viewableImpressions)
                .audibleImpressions(audibleImpressions)
                .videoStarts(videoStarts)
                .videoQ25(videoQ25)
                .videoQ50(videoQ50)
                .videoQ75(videoQ75)
                .videoQ100(videoQ100)
                .skips(skips)
                .avgWatchTimeSeconds(avgWatchTimeSeconds)
                .clicks(clicks)
                .qrScans(qrScans)
                .interactiveEngagements(interactiveEngagements)
                .reach(reach)
                .frequency(frequency)
                .spend(spend)
                .effectiveCpm(effectiveCpm)
                .errorCount(errorCount)
                .timeoutCount(timeoutCount)
                .temporal(new TemporalBreakdown(hourOfDay, dayOfWeek, businessHour, humanReadable,
                        dailyDayDate, weeklyStartDayDate, monthlyStartDayDate))
                .audience(audience)
                .build();
    }
}
