package com.premiergroup.ad_metrics_synth.service;

import com.premiergroup.ad_metrics_synth.config.GeneratorProperties;
import com.premiergroup.ad_metrics_synth.dto.HourlyPerformanceView;
import com.premiergroup.ad_metrics_synth.entity.CampaignPerformance;
import com.premiergroup.ad_metrics_synth.generator.DerivedMetricsCalculator;
import com.premiergroup.ad_metrics_synth.generator.RawHourlyMetrics;
import com.premiergroup.ad_metrics_synth.repository.CampaignPerformanceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Reads persisted hourly rows back and recomputes their derived rates.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class PerformanceQueryService {

    private final CampaignPerformanceRepository performanceRepository;
    private final GeneratorProperties generatorProperties;

    @Transactional(readOnly = true)
    public List<HourlyPerformanceView> getHourlyPerformance(Integer campaignId) {
        List<CampaignPerformance> rows = performanceRepository.findByCampaign_IdOrderByHourTsAsc(campaignId);
        log.debug("Loaded {} hourly rows for campaign {}", rows.size(), campaignId);

        return rows.stream()
                .map(CampaignPerformance::toRaw)
                .map(this::toView)
                .toList();
    }

    private HourlyPerformanceView toView(RawHourlyMetrics raw) {
        return new HourlyPerformanceView(raw,
                DerivedMetricsCalculator.compute(raw, generatorProperties.getAssetSeconds()));
    }
}
