package com.premiergroup.ad_metrics_synth.dto;

public record GenerationResult(
        Integer campaignId,
        long seed,
        boolean replace,
        int rowsWritten
) {}
