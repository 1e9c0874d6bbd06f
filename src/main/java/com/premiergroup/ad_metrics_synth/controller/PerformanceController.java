package com.premiergroup.ad_metrics_synth.controller;

import com.premiergroup.ad_metrics_synth.dto.GenerationResult;
import com.premiergroup.ad_metrics_synth.dto.HourlyPerformanceView;
import com.premiergroup.ad_metrics_synth.service.PerformanceGenerationService;
import com.premiergroup.ad_metrics_synth.service.PerformanceQueryService;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/performance")
@RequiredArgsConstructor
@Validated
@Log4j2
public class PerformanceController {

    private final PerformanceGenerationService performanceGenerationService;
    private final PerformanceQueryService performanceQueryService;

    /**
     * (Re)generate synthetic hourly performance for a campaign's whole flight.
     * <p>
     * Example: POST api/performance/generate?campaignId=12&seed=42
     */
    @PostMapping("/generate")
    public ResponseEntity<GenerationResult> generate(
            @RequestParam("campaignId")
            @Positive(message = "campaignId must be positive")
            Integer campaignId,
            @RequestParam(value = "seed", required = false) Long seed,
            @RequestParam(value = "replace", defaultValue = "true") boolean replace
    ) {
        log.info("Generation requested for campaign {} (seed={}, replace={})", campaignId, seed, replace);
        return ResponseEntity.ok(performanceGenerationService.regenerate(campaignId, seed, replace));
    }

    @GetMapping("/{campaignId}/hourly")
    public ResponseEntity<List<HourlyPerformanceView>> getHourlyPerformance(
            @PathVariable("campaignId")
            @Positive(message = "campaignId must be positive")
            Integer campaignId
    ) {
        List<HourlyPerformanceView> rows = performanceQueryService.getHourlyPerformance(campaignId);
        if (rows.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(rows);
    }
}
