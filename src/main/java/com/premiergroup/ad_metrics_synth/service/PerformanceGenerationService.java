package com.premiergroup.ad_metrics_synth.service;

import com.premiergroup.ad_metrics_synth.config.GeneratorProperties;
import com.premiergroup.ad_metrics_synth.dto.GenerationResult;
import com.premiergroup.ad_metrics_synth.entity.Campaign;
import com.premiergroup.ad_metrics_synth.entity.CampaignPerformance;
import com.premiergroup.ad_metrics_synth.entity.Flight;
import com.premiergroup.ad_metrics_synth.generator.HourlySeriesGenerator;
import com.premiergroup.ad_metrics_synth.generator.RawHourlyMetrics;
import com.premiergroup.ad_metrics_synth.repository.CampaignPerformanceRepository;
import com.premiergroup.ad_metrics_synth.repository.CampaignRepository;
import com.premiergroup.ad_metrics_synth.repository.FlightRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

@Service
@Log4j2
@RequiredArgsConstructor
public class PerformanceGenerationService {

    private final CampaignRepository campaignRepository;
    private final FlightRepository flightRepository;
    private final CampaignPerformanceRepository performanceRepository;
    private final HourlySeriesGenerator hourlySeriesGenerator;
    private final GeneratorProperties generatorProperties;

    /**
     * Generates one row per UTC hour across the campaign's flight and writes them in a single transaction.
     * <p>
     * With {@code replace}, every existing row of the campaign is deleted first, so repeated runs leave exactly
     * one row per hour. A missing campaign or flight writes nothing and reports 0 rows. Storage errors roll back
     * the whole batch and are rethrown unchanged.
     */
    @Transactional
    public GenerationResult regenerate(Integer campaignId, Long seed, boolean replace) {
        long resolvedSeed = resolveSeed(seed);

        Optional<Campaign> campaignOpt = campaignRepository.findByIdForUpdate(campaignId);
        if (campaignOpt.isEmpty()) {
            log.warn("Campaign {} not found, nothing generated", campaignId);
            return new GenerationResult(campaignId, resolvedSeed, replace, 0);
        }
        Optional<Flight> flightOpt = flightRepository.findByCampaign_Id(campaignId);
        if (flightOpt.isEmpty()) {
            log.warn("Campaign {} has no flight, nothing generated", campaignId);
            return new GenerationResult(campaignId, resolvedSeed, replace, 0);
        }

        Campaign campaign = campaignOpt.get();
        Flight flight = flightOpt.get();
        LocalDateTime start = flight.firstHour();
        LocalDateTime end = flight.lastHour();

        log.info("Generating hourly performance for campaign {} from {} to {} ({} hours, seed={}, replace={})",
                campaignId, start, end, HourlySeriesGenerator.hoursInWindow(start, end), resolvedSeed, replace);

        List<RawHourlyMetrics> series = hourlySeriesGenerator.generate(campaignId, start, end, resolvedSeed);
        List<CampaignPerformance> rows = series.stream()
                .map(raw -> CampaignPerformance.from(campaign, raw))
                .toList();

        try {
            if (replace) {
                int deleted = performanceRepository.deleteByCampaignId(campaignId);
                log.debug("Deleted {} existing rows for campaign {}", deleted, campaignId);
            }
            performanceRepository.saveAll(rows);
            performanceRepository.flush();
        } catch (DataAccessException e) {
            log.error("Failed to write hourly performance for campaign {}", campaignId, e);
            throw e;
        }

        log.info("Wrote {} hourly rows for campaign {}", rows.size(), campaignId);
        return new GenerationResult(campaignId, resolvedSeed, replace, rows.size());
    }

    private long resolveSeed(Long seed) {
        if (seed != null) {
            return seed;
        }
        if (generatorProperties.getDefaultSeed() != null) {
            return generatorProperties.getDefaultSeed();
        }
        long drawn = ThreadLocalRandom.current().nextLong();
        log.info("No seed supplied, drew seed {}", drawn);
        return drawn;
    }
}
